package com.asciify.glyph;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@AllArgsConstructor
@Getter
@EqualsAndHashCode
public final class Rgb {
    private final int red, green, blue;

    public String toCss() {
        return "rgb(" + red + "," + green + "," + blue + ")";
    }

    @Override
    public String toString() {
        return toCss();
    }
}

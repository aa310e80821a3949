package com.asciify.glyph;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One output cell: a character and, in color mode only, the RGB of the pixel it stands for.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public final class Glyph {
    /** Emitted for fully transparent samples. */
    public static final Glyph BLANK = new Glyph(' ', null);

    private final char character;
    private final Rgb color; // null when color mode is off

    public static Glyph of(char character) {
        return new Glyph(character, null);
    }

    public boolean hasColor() {
        return color != null;
    }

    @Override
    public String toString() {
        return hasColor() ? "'" + character + "' " + color : "'" + character + "'";
    }
}

package com.asciify.glyph;

/**
 * Built-in character palettes, densest glyph first.
 */
public final class Palettes {

    public static final String DEFAULT = "@%#*+=-:. ";

    /** 70 glyphs for finer tonal steps. */
    public static final String DETAILED =
            "$@B%8&WM#*oahkbdpqwmZO0QLCJUYXzcvunxrjft/\\|()1{}[]?-_+~<>i!lI;:,\"^`'. ";

    private Palettes() {
    }
}

package com.asciify.glyph;

import com.asciify.pipeline.ConfigurationException;

public final class GlyphMapper {

    private GlyphMapper() {
    }

    /**
     * Picks the palette entry for an adjusted luminance.
     * <p>
     * Without inversion the index is {@code floor((255 - L) / 256 * n)}, with inversion {@code floor(L / 256 * n)},
     * clamped to {@code [0, n - 1]}.
     *
     * @param luminance adjusted luminance, 0..255 (may be fractional)
     * @param palette   non-empty ordered glyphs
     * @param invert    flip the mapping direction
     * @throws ConfigurationException if the palette is empty
     */
    public static char charFor(double luminance, String palette, boolean invert) {
        if (palette == null || palette.isEmpty()) {
            throw new ConfigurationException("Character palette must not be empty");
        }
        return palette.charAt(indexFor(luminance, palette.length(), invert));
    }

    public static int indexFor(double luminance, int paletteLength, boolean invert) {
        double scaled = invert ? luminance / 256 * paletteLength : (255 - luminance) / 256 * paletteLength;
        int idx = (int) Math.floor(scaled);
        return Math.max(0, Math.min(idx, paletteLength - 1));
    }
}

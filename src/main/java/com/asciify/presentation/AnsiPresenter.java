package com.asciify.presentation;

import com.asciify.glyph.Glyph;
import com.asciify.glyph.GlyphGrid;
import com.asciify.glyph.Rgb;

import java.util.List;

/**
 * Terminal output with 24-bit foreground colors. Escapes are only emitted when the color changes, and every row
 * that used one ends with a reset.
 */
public class AnsiPresenter implements GlyphGridPresenter {
    public static final String RESET = "\u001b[0m";

    @Override
    public String present(GlyphGrid grid) {
        StringBuilder sb = new StringBuilder();
        for (List<Glyph> row : grid.getRows()) {
            Rgb current = null;
            for (Glyph glyph : row) {
                Rgb color = glyph.getColor();
                if (color == null) {
                    if (current != null) {
                        sb.append(RESET);
                        current = null;
                    }
                } else if (!color.equals(current)) {
                    sb.append(foreground(color));
                    current = color;
                }
                sb.append(glyph.getCharacter());
            }
            if (current != null) {
                sb.append(RESET);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String foreground(Rgb color) {
        return "\u001b[38;2;" + color.getRed() + ";" + color.getGreen() + ";" + color.getBlue() + "m";
    }
}

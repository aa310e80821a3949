package com.asciify.presentation;

import com.asciify.glyph.GlyphGrid;

/**
 * Characters only, every row terminated by {@code \n}. Color is dropped.
 */
public class PlainTextPresenter implements GlyphGridPresenter {

    @Override
    public String present(GlyphGrid grid) {
        StringBuilder sb = new StringBuilder((grid.getWidth() + 1) * grid.getHeight());
        for (int y = 0; y < grid.getHeight(); y++) {
            sb.append(grid.rowText(y)).append('\n');
        }
        return sb.toString();
    }
}

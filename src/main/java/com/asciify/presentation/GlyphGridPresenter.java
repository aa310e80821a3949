package com.asciify.presentation;

import com.asciify.glyph.GlyphGrid;

/**
 * Renders a glyph grid for some output medium. Presenters only decide how color is shown; characters and their
 * positions are written as they are.
 */
public interface GlyphGridPresenter {

    String present(GlyphGrid grid);
}

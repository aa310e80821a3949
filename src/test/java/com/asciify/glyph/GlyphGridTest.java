package com.asciify.glyph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlyphGridTest {

    @Test
    void exposesRowsAndCells() {
        GlyphGrid grid = new GlyphGrid(Arrays.asList(
                Arrays.asList(Glyph.of('a'), Glyph.of('b')),
                Arrays.asList(new Glyph('c', new Rgb(1, 2, 3)), Glyph.BLANK)));

        assertEquals(2, grid.getWidth());
        assertEquals(2, grid.getHeight());
        assertEquals("ab", grid.rowText(0));
        assertEquals("c ", grid.rowText(1));
        assertEquals(new Rgb(1, 2, 3), grid.get(0, 1).getColor());
        assertTrue(grid.hasColor());
    }

    @Test
    void isNotAffectedByLaterChangesToTheSourceLists() {
        List<Glyph> row = new ArrayList<>(Collections.singletonList(Glyph.of('x')));
        GlyphGrid grid = new GlyphGrid(Collections.singletonList(row));
        row.set(0, Glyph.of('y'));

        assertEquals('x', grid.get(0, 0).getCharacter());
        assertThrows(UnsupportedOperationException.class, () -> grid.row(0).add(Glyph.BLANK));
    }

    @Test
    void rejectsRaggedOrEmptyGrids() {
        assertThrows(IllegalArgumentException.class, () -> new GlyphGrid(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> new GlyphGrid(Arrays.asList(
                Arrays.asList(Glyph.of('a'), Glyph.of('b')),
                Collections.singletonList(Glyph.of('c')))));
    }

    @Test
    void blankGlyphHasNoColor() {
        assertEquals(' ', Glyph.BLANK.getCharacter());
        assertFalse(Glyph.BLANK.hasColor());
        assertEquals("rgb(10,20,30)", new Rgb(10, 20, 30).toCss());
    }
}

package com.asciify.glyph;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows of glyphs with the same width x height as the sampled buffer they were rendered from.
 */
@Getter
public final class GlyphGrid {
    private final int width;
    private final int height;
    private final List<List<Glyph>> rows;

    public GlyphGrid(List<List<Glyph>> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("A glyph grid needs at least one row");
        }
        int w = rows.get(0).size();
        List<List<Glyph>> copy = new ArrayList<>(rows.size());
        for (List<Glyph> row : rows) {
            if (row.size() != w) {
                throw new IllegalArgumentException("Ragged glyph grid: expected rows of " + w + " but got " + row.size());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.width = w;
        this.height = rows.size();
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<Glyph> row(int y) {
        return rows.get(y);
    }

    public Glyph get(int x, int y) {
        return rows.get(y).get(x);
    }

    /**
     * Characters of one row, without a line terminator.
     */
    public String rowText(int y) {
        List<Glyph> row = rows.get(y);
        StringBuilder sb = new StringBuilder(row.size());
        for (Glyph glyph : row) {
            sb.append(glyph.getCharacter());
        }
        return sb.toString();
    }

    public boolean hasColor() {
        for (List<Glyph> row : rows) {
            for (Glyph glyph : row) {
                if (glyph.hasColor()) return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "GlyphGrid[" + width + "x" + height + "]";
    }
}

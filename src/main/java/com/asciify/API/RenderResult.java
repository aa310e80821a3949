package com.asciify.API;

import com.asciify.glyph.GlyphGrid;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public class RenderResult {
    private final GlyphGrid grid;
    private final String text;
    private final String html; // null unless color mode was requested
}

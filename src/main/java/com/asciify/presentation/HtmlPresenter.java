package com.asciify.presentation;

import com.asciify.glyph.Glyph;
import com.asciify.glyph.GlyphGrid;
import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * A monospace {@code <div>} with one child {@code <div>} per row. Colored glyphs become
 * {@code <span style="color:rgb(r,g,b)">}, uncolored ones are written as escaped text.
 */
public class HtmlPresenter implements GlyphGridPresenter {
    public static final String CONTAINER_STYLE = "font-family:monospace;line-height:0.8;white-space:pre";

    @Override
    public String present(GlyphGrid grid) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div style=\"").append(CONTAINER_STYLE).append("\">");
        for (List<Glyph> row : grid.getRows()) {
            sb.append("<div>");
            for (Glyph glyph : row) {
                String text = HtmlUtils.htmlEscape(String.valueOf(glyph.getCharacter()));
                if (glyph.hasColor()) {
                    sb.append("<span style=\"color:").append(glyph.getColor().toCss()).append("\">")
                            .append(text)
                            .append("</span>");
                } else {
                    sb.append(text);
                }
            }
            sb.append("</div>");
        }
        sb.append("</div>");
        return sb.toString();
    }
}

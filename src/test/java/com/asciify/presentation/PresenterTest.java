package com.asciify.presentation;

import com.asciify.glyph.Glyph;
import com.asciify.glyph.GlyphGrid;
import com.asciify.glyph.Rgb;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class PresenterTest {

    private static GlyphGrid plainGrid() {
        return new GlyphGrid(Arrays.asList(
                Arrays.asList(Glyph.of('@'), Glyph.of(' ')),
                Arrays.asList(Glyph.of('<'), Glyph.of('&'))));
    }

    private static GlyphGrid coloredGrid() {
        Rgb red = new Rgb(255, 0, 0);
        return new GlyphGrid(Arrays.asList(
                Arrays.asList(new Glyph('#', red), new Glyph('#', red), Glyph.BLANK),
                Arrays.asList(new Glyph('"', new Rgb(0, 128, 255)), Glyph.BLANK, Glyph.BLANK)));
    }

    @Test
    void plainTextTerminatesEveryRow() {
        assertEquals("@ \n<&\n", new PlainTextPresenter().present(plainGrid()));
    }

    @Test
    void plainTextIgnoresColor() {
        assertEquals("## \n\"  \n", new PlainTextPresenter().present(coloredGrid()));
    }

    @Test
    void htmlEscapesGlyphs() {
        String html = new HtmlPresenter().present(plainGrid());

        assertTrue(html.startsWith("<div style=\"" + HtmlPresenter.CONTAINER_STYLE + "\">"));
        assertTrue(html.contains("<div>@ </div>"));
        assertTrue(html.contains("<div>&lt;&amp;</div>"));
        assertFalse(html.contains("<span"));
    }

    @Test
    void htmlWrapsColoredGlyphsInSpans() {
        String html = new HtmlPresenter().present(coloredGrid());

        assertTrue(html.contains("<span style=\"color:rgb(255,0,0)\">#</span><span style=\"color:rgb(255,0,0)\">#</span> </div>"));
        assertTrue(html.contains("<span style=\"color:rgb(0,128,255)\">&quot;</span>  </div>"));
    }

    @Test
    void ansiEmitsEscapeOnlyOnColorChange() {
        String ansi = new AnsiPresenter().present(coloredGrid());
        String red = "\u001b[38;2;255;0;0m";
        String blue = "\u001b[38;2;0;128;255m";

        assertEquals(red + "##" + AnsiPresenter.RESET + " \n"
                + blue + "\"" + AnsiPresenter.RESET + "  \n", ansi);
    }

    @Test
    void ansiWithoutColorIsPlainText() {
        assertEquals(new PlainTextPresenter().present(plainGrid()), new AnsiPresenter().present(plainGrid()));
    }
}

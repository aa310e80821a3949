package com.asciify.cli;

import com.asciify.glyph.GlyphGrid;
import com.asciify.pipeline.PixelBuffer;
import com.asciify.pipeline.RenderException;
import com.asciify.pipeline.RenderPipeline;
import com.asciify.presentation.AnsiPresenter;
import com.asciify.presentation.GlyphGridPresenter;
import com.asciify.presentation.PlainTextPresenter;
import com.asciify.sampler.ImageLoadException;
import com.asciify.sampler.PictureImageSampler;
import lombok.extern.slf4j.Slf4j;

/**
 * Prints an image from a path or URL as text. Colored output uses ANSI escapes.
 */
@Slf4j
public class AsciiMain {

    public static void main(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (RenderException e) {
            System.err.println(e.getMessage());
            System.err.println(CliArguments.USAGE);
            System.exit(1);
            return;
        }

        try {
            System.out.print(run(arguments));
        } catch (ImageLoadException | RenderException e) {
            log.debug("Conversion failed", e);
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }

    static String run(CliArguments arguments) throws ImageLoadException {
        PixelBuffer sampled = new PictureImageSampler().sample(arguments.getSource(), arguments.getConfig().getWidth());
        GlyphGrid grid = new RenderPipeline().render(sampled, arguments.getConfig());
        GlyphGridPresenter presenter = arguments.getConfig().isColorMode() ? new AnsiPresenter() : new PlainTextPresenter();
        return presenter.present(grid);
    }
}

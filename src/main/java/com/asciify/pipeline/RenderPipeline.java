package com.asciify.pipeline;

import com.asciify.dithering.Ditherer;
import com.asciify.filter_convolution_gauss.Sharpener;
import com.asciify.glyph.Glyph;
import com.asciify.glyph.GlyphGrid;
import com.asciify.glyph.GlyphMapper;
import com.asciify.glyph.Rgb;
import com.asciify.imageOperator.ToneMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a sampled pixel buffer into a glyph grid.
 * <p>
 * Order of work:
 * <ol>
 *     <li>unsharp mask, if {@code applySharpening}</li>
 *     <li>Floyd-Steinberg dithering, if {@code applyDithering}</li>
 *     <li>per pixel, in raster order: luminance, contrast / brightness, palette lookup</li>
 * </ol>
 * Transparent samples become {@link Glyph#BLANK}. In color mode each glyph carries the RGB of its pixel after the
 * filters ran (the input RGB when none did).
 * <p>
 * Stateless; every call works on its own buffers, so one instance can serve concurrent callers.
 */
@Slf4j
public class RenderPipeline {

    /**
     * @param rgba   samples already resampled to {@code width x height}
     * @throws DimensionMismatchException if {@code rgba.length != width * height * 4}
     */
    public GlyphGrid render(byte[] rgba, int width, int height, RenderConfig config) {
        checkConfig(config);
        return render(new PixelBuffer(width, height, rgba), config);
    }

    public GlyphGrid render(PixelBuffer buffer, RenderConfig config) {
        checkConfig(config);
        if (buffer == null) {
            throw new DimensionMismatchException("No pixel buffer given");
        }
        long start = System.nanoTime();

        PixelBuffer working = buffer;
        if (config.isApplySharpening()) {
            working = Sharpener.sharpen(working);
        }
        if (config.isApplyDithering()) {
            working = Ditherer.dither(working, config.getDitherAmount());
        }

        String palette = config.activePalette();
        int width = working.getWidth();
        int height = working.getHeight();
        List<List<Glyph>> rows = new ArrayList<>(height);

        for (int y = 0; y < height; y++) {
            List<Glyph> row = new ArrayList<>(width);
            for (int x = 0; x < width; x++) {
                if (working.isTransparent(x, y)) {
                    row.add(Glyph.BLANK);
                    continue;
                }
                int r = working.red(x, y);
                int g = working.green(x, y);
                int b = working.blue(x, y);

                int luminance = ToneMapper.luminance(r, g, b);
                double adjusted = ToneMapper.adjust(luminance, config.getContrastFactor(), config.getBrightnessFactor());
                char ch = GlyphMapper.charFor(adjusted, palette, config.isInvertBrightness());

                row.add(new Glyph(ch, config.isColorMode() ? new Rgb(r, g, b) : null));
            }
            rows.add(row);
        }

        if (log.isDebugEnabled()) {
            log.debug("Rendered {}x{} cells (sharpen={}, dither={}, color={}) in {} ms",
                    width, height, config.isApplySharpening(), config.isApplyDithering(), config.isColorMode(),
                    (System.nanoTime() - start) / 1_000_000);
        }
        return new GlyphGrid(rows);
    }

    private static void checkConfig(RenderConfig config) {
        if (config == null) {
            throw new ConfigurationException("No render configuration given");
        }
    }
}

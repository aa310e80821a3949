package com.asciify.sampler;

import com.asciify.pipeline.ConfigurationException;
import com.asciify.pipeline.PixelBuffer;

/**
 * Loads an image and resamples it to the cell grid the renderer works on.
 *
 * @param <S> what the image is loaded from
 */
public interface ImageSampler<S> {

    /**
     * Glyph cells are roughly twice as tall as they are wide.
     */
    double DEFAULT_CHAR_ASPECT = 0.5;

    /**
     * @param width target columns
     * @return an RGBA buffer of {@code width x rowsFor(...)} samples
     */
    PixelBuffer sample(S source, int width) throws ImageLoadException;

    /**
     * {@code floor(width * srcHeight / srcWidth * charAspect)}, at least one row.
     */
    static int rowsFor(int srcWidth, int srcHeight, int width, double charAspect) {
        if (width <= 0) {
            throw new ConfigurationException("Width must be a positive number of cells: " + width);
        }
        double ratio = (double) srcHeight / srcWidth;
        return Math.max(1, (int) Math.floor(width * ratio * charAspect));
    }

    /**
     * Largest sampled grid; keeps {@code width * height * 4} within an array's reach.
     */
    long MAX_CELLS = Integer.MAX_VALUE / PixelBuffer.CHANNELS;

    /**
     * @throws ConfigurationException if a {@code width x height} RGBA buffer would not fit in an array
     */
    static void checkCellCount(int width, int height) {
        if ((long) width * height > MAX_CELLS) {
            throw new ConfigurationException("Sampled grid " + width + "x" + height + " is too large");
        }
    }
}

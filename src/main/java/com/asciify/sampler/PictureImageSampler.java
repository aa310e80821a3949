package com.asciify.sampler;

import com.asciify.pipeline.PixelBuffer;
import edu.princeton.cs.introcs.Picture;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.awt.Color;

/**
 * Loads an image from a file path or URL through {@link Picture} and box-averages it down to the cell grid.
 * {@code Picture} has no alpha, so every sample comes out opaque.
 */
@Slf4j
@Getter
public class PictureImageSampler implements ImageSampler<String> {
    private final double charAspect;

    public PictureImageSampler() {
        this(DEFAULT_CHAR_ASPECT);
    }

    public PictureImageSampler(double charAspect) {
        this.charAspect = charAspect;
    }

    @Override
    public PixelBuffer sample(String source, int width) throws ImageLoadException {
        if (source == null || source.isBlank()) {
            throw new ImageLoadException("No image location given");
        }
        Picture picture;
        try {
            picture = new Picture(source);
            log.debug("Loaded {}x{} picture from {}", picture.width(), picture.height(), source);
        } catch (RuntimeException e) {
            // Picture reports unreadable files and URLs as runtime errors (or an NPE for unknown formats)
            throw new ImageLoadException("Could not load image from " + source, e);
        }
        return sample(picture, width);
    }

    /**
     * Averages each cell's block of source pixels. Blocks are at least one pixel, so upscaling repeats pixels.
     */
    public PixelBuffer sample(Picture picture, int width) {
        int srcW = picture.width();
        int srcH = picture.height();
        int height = ImageSampler.rowsFor(srcW, srcH, width, charAspect);
        ImageSampler.checkCellCount(width, height);
        int[] out = new int[width * height * PixelBuffer.CHANNELS];

        for (int cy = 0; cy < height; cy++) {
            int y0 = (int) ((long) cy * srcH / height);
            int y1 = Math.max(y0 + 1, (int) ((long) (cy + 1) * srcH / height));
            for (int cx = 0; cx < width; cx++) {
                int x0 = (int) ((long) cx * srcW / width);
                int x1 = Math.max(x0 + 1, (int) ((long) (cx + 1) * srcW / width));

                long sumR = 0, sumG = 0, sumB = 0;
                int count = 0;
                for (int y = y0; y < y1 && y < srcH; y++) {
                    for (int x = x0; x < x1 && x < srcW; x++) {
                        Color c = picture.get(x, y);
                        sumR += c.getRed();
                        sumG += c.getGreen();
                        sumB += c.getBlue();
                        count++;
                    }
                }
                int idx = (cy * width + cx) * PixelBuffer.CHANNELS;
                out[idx] = (int) Math.round((double) sumR / count);
                out[idx + 1] = (int) Math.round((double) sumG / count);
                out[idx + 2] = (int) Math.round((double) sumB / count);
                out[idx + 3] = 255;
            }
        }
        return PixelBuffer.fromUnsigned(width, height, out);
    }
}

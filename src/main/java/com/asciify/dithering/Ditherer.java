package com.asciify.dithering;

import com.asciify.pipeline.ConfigurationException;
import com.asciify.pipeline.PixelBuffer;

/**
 * Floyd-Steinberg error diffusion onto an 8-level gray ramp (multiples of 32).
 * <p>
 * Pixels are visited strictly in raster order and each write is seen by later pixels, so the loop cannot be split
 * across threads without changing the output.
 */
public final class Ditherer {
    public static final int GRAY_STEP = 32;

    // Error shares for east, south-west, south and south-east neighbours
    public static final double WEIGHT_EAST = 7 / 16.0;
    public static final double WEIGHT_SOUTH_WEST = 3 / 16.0;
    public static final double WEIGHT_SOUTH = 5 / 16.0;
    public static final double WEIGHT_SOUTH_EAST = 1 / 16.0;

    private Ditherer() {
    }

    /**
     * Quantizes every opaque pixel to gray and carries {@code (original - gray) * strength} to the unvisited
     * neighbours. Transparent pixels are neither quantized nor given error, and do not stop error reaching the
     * pixels past them.
     *
     * @param strength share of the residual error that is diffused, 0.0..1.0
     * @return a new buffer; the input is not modified
     */
    public static PixelBuffer dither(PixelBuffer buffer, double strength) {
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new ConfigurationException("Dither strength must be within [0, 1]: " + strength);
        }
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        int[] data = buffer.toUnsignedArray();
        int rowStride = width * PixelBuffer.CHANNELS;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int idx = (y * width + x) * PixelBuffer.CHANNELS;
                if (data[idx + PixelBuffer.ALPHA] == 0) continue;

                int oldR = data[idx];
                int oldG = data[idx + 1];
                int oldB = data[idx + 2];

                // may reach 256 for near-white input; stored clamped but the error uses the unclamped level
                int gray = quantize(oldR, oldG, oldB);
                int stored = Math.min(gray, 255);
                data[idx] = stored;
                data[idx + 1] = stored;
                data[idx + 2] = stored;

                double errR = (oldR - gray) * strength;
                double errG = (oldG - gray) * strength;
                double errB = (oldB - gray) * strength;

                if (x + 1 < width) {
                    addError(data, idx + PixelBuffer.CHANNELS, errR, errG, errB, WEIGHT_EAST);
                }
                if (y + 1 < height) {
                    if (x > 0) {
                        addError(data, idx - PixelBuffer.CHANNELS + rowStride, errR, errG, errB, WEIGHT_SOUTH_WEST);
                    }
                    addError(data, idx + rowStride, errR, errG, errB, WEIGHT_SOUTH);
                    if (x + 1 < width) {
                        addError(data, idx + PixelBuffer.CHANNELS + rowStride, errR, errG, errB, WEIGHT_SOUTH_EAST);
                    }
                }
            }
        }
        return PixelBuffer.fromUnsigned(width, height, data);
    }

    /**
     * {@code round(((r + g + b) / 3) / 32) * 32}, rounding half up.
     */
    public static int quantize(int r, int g, int b) {
        return (int) Math.round((r + g + b) / 3.0 / GRAY_STEP) * GRAY_STEP;
    }

    private static void addError(int[] data, int idx, double errR, double errG, double errB, double weight) {
        if (data[idx + PixelBuffer.ALPHA] == 0) return;
        data[idx] = PixelBuffer.clampToByte(data[idx] + errR * weight);
        data[idx + 1] = PixelBuffer.clampToByte(data[idx + 1] + errG * weight);
        data[idx + 2] = PixelBuffer.clampToByte(data[idx + 2] + errB * weight);
    }
}

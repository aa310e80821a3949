package com.asciify.filter_convolution_gauss;

import com.asciify.pipeline.PixelBuffer;

public final class Convolver {
    public static final int KERNEL_SIZE = 3;

    // Gaussian blur approximation used by the unsharp mask
    public static final int[][] GAUSSIAN_KERNEL = {
            {1, 2, 1},
            {2, 4, 2},
            {1, 2, 1}
    };
    public static final int GAUSSIAN_NORMALIZER = 16;

    private Convolver() {
    }

    /**
     * Applies a 3x3 kernel to the R, G and B channels of every interior pixel.
     * <p>
     * Border pixels (first/last row and column) are copied through unchanged, as is the alpha channel everywhere.
     * Each output sample is {@code sum / normalizer}, clamped to 0..255 and rounded half to even.
     * Only the input is read while summing, so rows are independent of each other.
     *
     * @return a new buffer of the same dimensions; the input is never modified
     */
    public static PixelBuffer convolve(PixelBuffer buffer, int[][] kernel, int normalizer) {
        checkKernel(kernel, normalizer);
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        int[] src = buffer.toUnsignedArray();
        int[] out = src.clone();

        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int idx = (y * width + x) * PixelBuffer.CHANNELS;
                for (int c = 0; c < 3; c++) {
                    int sum = 0;
                    for (int ky = -1; ky <= 1; ky++) {
                        for (int kx = -1; kx <= 1; kx++) {
                            int n = ((y + ky) * width + (x + kx)) * PixelBuffer.CHANNELS + c;
                            sum += src[n] * kernel[ky + 1][kx + 1];
                        }
                    }
                    out[idx + c] = PixelBuffer.clampToByte((double) sum / normalizer);
                }
            }
        }
        return PixelBuffer.fromUnsigned(width, height, out);
    }

    public static PixelBuffer gaussianBlur(PixelBuffer buffer) {
        return convolve(buffer, GAUSSIAN_KERNEL, GAUSSIAN_NORMALIZER);
    }

    private static void checkKernel(int[][] kernel, int normalizer) {
        if (kernel == null || kernel.length != KERNEL_SIZE) {
            throw new IllegalArgumentException("Kernel must be " + KERNEL_SIZE + "x" + KERNEL_SIZE);
        }
        for (int[] row : kernel) {
            if (row == null || row.length != KERNEL_SIZE) {
                throw new IllegalArgumentException("Kernel must be " + KERNEL_SIZE + "x" + KERNEL_SIZE);
            }
        }
        if (normalizer == 0) {
            throw new IllegalArgumentException("Kernel normalizer must not be 0");
        }
    }
}

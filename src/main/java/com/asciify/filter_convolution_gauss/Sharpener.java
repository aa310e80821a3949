package com.asciify.filter_convolution_gauss;

import com.asciify.pipeline.PixelBuffer;

/**
 * Unsharp mask: {@code out = original + (original - blurred) * 0.8} per RGB channel.
 */
public final class Sharpener {
    public static final double SHARP_AMOUNT = 0.8;

    private Sharpener() {
    }

    /**
     * @return a new sharpened buffer; alpha is passed through, and border pixels stay as they are
     *         because the blur copies them through
     */
    public static PixelBuffer sharpen(PixelBuffer buffer) {
        int[] original = buffer.toUnsignedArray();
        int[] blurred = Convolver.gaussianBlur(buffer).toUnsignedArray();
        int[] out = original.clone();

        for (int i = 0; i < original.length; i += PixelBuffer.CHANNELS) {
            for (int c = 0; c < 3; c++) {
                int diff = original[i + c] - blurred[i + c];
                out[i + c] = PixelBuffer.clampToByte(original[i + c] + diff * SHARP_AMOUNT);
            }
        }
        return PixelBuffer.fromUnsigned(buffer.getWidth(), buffer.getHeight(), out);
    }
}

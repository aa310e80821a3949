package com.asciify.pipeline;

public class DimensionMismatchException extends RenderException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    public static DimensionMismatchException forLength(int width, int height, int length) {
        return new DimensionMismatchException(String.format(
                "Buffer length %d does not match %dx%d RGBA (expected %d)",
                length, width, height, (long) width * height * PixelBuffer.CHANNELS));
    }
}

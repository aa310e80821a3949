package com.asciify.pipeline;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;

/**
 * A width x height grid of RGBA samples, 8 bits unsigned per channel, stored row by row.
 * <p>
 * The sample array is copied on the way in and on the way out, so a buffer never changes once built.
 * Filters that alter pixels hand back a new buffer.
 */
@Getter
public final class PixelBuffer {
    public static final int CHANNELS = 4;
    public static final int RED = 0, GREEN = 1, BLUE = 2, ALPHA = 3;

    private final int width;
    private final int height;
    @Getter(AccessLevel.NONE)
    private final byte[] data;

    /**
     * @param width  columns, &gt; 0
     * @param height rows, &gt; 0
     * @param rgba   samples in raster order, length {@code width * height * 4}
     * @throws DimensionMismatchException if the dimensions are not positive or the length does not match them
     */
    public PixelBuffer(int width, int height, byte[] rgba) {
        if (width <= 0 || height <= 0) {
            throw new DimensionMismatchException("Buffer dimensions must be positive: " + width + "x" + height);
        }
        if (rgba == null || (long) rgba.length != (long) width * height * CHANNELS) {
            throw DimensionMismatchException.forLength(width, height, rgba == null ? 0 : rgba.length);
        }
        this.width = width;
        this.height = height;
        this.data = rgba.clone();
    }

    /**
     * Builds a buffer from channel values in the range 0..255.
     */
    public static PixelBuffer fromUnsigned(int width, int height, int[] rgba) {
        if (rgba == null) {
            throw DimensionMismatchException.forLength(width, height, 0);
        }
        byte[] bytes = new byte[rgba.length];
        for (int i = 0; i < rgba.length; i++) {
            bytes[i] = (byte) rgba[i];
        }
        return new PixelBuffer(width, height, bytes);
    }

    public static PixelBuffer filled(int width, int height, int r, int g, int b, int a) {
        int[] rgba = new int[Math.max(0, width * height * CHANNELS)];
        for (int i = 0; i < rgba.length; i += CHANNELS) {
            rgba[i + RED] = r;
            rgba[i + GREEN] = g;
            rgba[i + BLUE] = b;
            rgba[i + ALPHA] = a;
        }
        return fromUnsigned(width, height, rgba);
    }

    public int index(int x, int y) {
        return (y * width + x) * CHANNELS;
    }

    public int channel(int x, int y, int channel) {
        return data[index(x, y) + channel] & 0xFF;
    }

    public int red(int x, int y) {
        return channel(x, y, RED);
    }

    public int green(int x, int y) {
        return channel(x, y, GREEN);
    }

    public int blue(int x, int y) {
        return channel(x, y, BLUE);
    }

    public int alpha(int x, int y) {
        return channel(x, y, ALPHA);
    }

    public boolean isTransparent(int x, int y) {
        return alpha(x, y) == 0;
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Copy of the samples widened to ints (0..255), the working form used by the filters.
     */
    public int[] toUnsignedArray() {
        int[] out = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] & 0xFF;
        }
        return out;
    }

    /**
     * Clamps to 0..255 and rounds half to even, the way 8-bit canvas buffers store fractional writes.
     */
    public static int clampToByte(double value) {
        if (Double.isNaN(value) || value <= 0) return 0;
        if (value >= 255) return 255;
        return (int) Math.rint(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer)) return false;
        PixelBuffer that = (PixelBuffer) o;
        return width == that.width && height == that.height && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("PixelBuffer[%dx%d]", width, height);
    }
}

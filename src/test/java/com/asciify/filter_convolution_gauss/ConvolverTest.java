package com.asciify.filter_convolution_gauss;

import com.asciify.pipeline.PixelBuffer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConvolverTest {

    /** 3x3 black image with one colored pixel in the middle. */
    private static PixelBuffer centreDot(int r, int g, int b) {
        int[] rgba = new int[3 * 3 * 4];
        for (int i = 0; i < rgba.length; i += 4) {
            rgba[i + 3] = 255;
        }
        int centre = (1 * 3 + 1) * 4;
        rgba[centre] = r;
        rgba[centre + 1] = g;
        rgba[centre + 2] = b;
        rgba[centre + 3] = 77;
        return PixelBuffer.fromUnsigned(3, 3, rgba);
    }

    @Test
    void blurWeighsCentreByFourSixteenths() {
        PixelBuffer blurred = Convolver.gaussianBlur(centreDot(160, 80, 16));

        assertEquals(40, blurred.red(1, 1));
        assertEquals(20, blurred.green(1, 1));
        assertEquals(4, blurred.blue(1, 1));
        assertEquals(77, blurred.alpha(1, 1));
    }

    @Test
    void borderPixelsAreCopiedThrough() {
        PixelBuffer source = centreDot(160, 80, 16);
        PixelBuffer blurred = Convolver.gaussianBlur(source);

        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                if (x == 1 && y == 1) continue;
                for (int c = 0; c < 4; c++) {
                    assertEquals(source.channel(x, y, c), blurred.channel(x, y, c));
                }
            }
        }
    }

    @Test
    void inputIsNotModified() {
        PixelBuffer source = centreDot(160, 80, 16);
        PixelBuffer copy = new PixelBuffer(3, 3, source.toByteArray());

        PixelBuffer blurred = Convolver.gaussianBlur(source);

        assertEquals(copy, source);
        assertNotSame(source, blurred);
    }

    @Test
    void uniformImageIsUnchanged() {
        PixelBuffer gray = PixelBuffer.filled(6, 5, 90, 120, 200, 255);
        assertEquals(gray, Convolver.gaussianBlur(gray));
    }

    @Test
    void imagesWithoutInteriorAreReturnedAsIs() {
        PixelBuffer thin = PixelBuffer.filled(2, 7, 1, 2, 3, 4);
        assertEquals(thin, Convolver.gaussianBlur(thin));
    }

    @Test
    void fractionalResultsRoundHalfToEven() {
        // 2 * 4 / 16 = 0.5 -> 0, 6 * 4 / 16 = 1.5 -> 2
        PixelBuffer blurred = Convolver.gaussianBlur(centreDot(2, 6, 0));
        assertEquals(0, blurred.red(1, 1));
        assertEquals(2, blurred.green(1, 1));
    }

    @Test
    void negativeSumsClampToZero() {
        int[][] edge = {{0, -1, 0}, {-1, 4, -1}, {0, -1, 0}};
        PixelBuffer source = PixelBuffer.filled(3, 3, 200, 200, 200, 255);
        int[] rgba = source.toUnsignedArray();
        rgba[(1 * 3 + 1) * 4] = 0;
        PixelBuffer result = Convolver.convolve(PixelBuffer.fromUnsigned(3, 3, rgba), edge, 1);

        assertEquals(0, result.red(1, 1));
        assertEquals(0, result.green(1, 1));
    }

    @Test
    void rejectsMalformedKernels() {
        PixelBuffer buffer = PixelBuffer.filled(3, 3, 0, 0, 0, 255);
        assertThrows(IllegalArgumentException.class,
                () -> Convolver.convolve(buffer, new int[][]{{1, 1}, {1, 1}}, 4));
        assertThrows(IllegalArgumentException.class,
                () -> Convolver.convolve(buffer, Convolver.GAUSSIAN_KERNEL, 0));
    }
}

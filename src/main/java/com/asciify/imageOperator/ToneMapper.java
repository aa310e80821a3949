package com.asciify.imageOperator;

/**
 * Perceptual luminance of a pixel and the contrast / brightness curve applied to it.
 */
public final class ToneMapper {
    public static final double MIDPOINT = 128;

    private ToneMapper() {
    }

    /**
     * Rec. 601 weighted luminance, rounded half up and clamped to [0, 255].
     * Green dominates since the eye is most sensitive to it, blue contributes least.
     */
    public static int luminance(int r, int g, int b) {
        long gray = Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        return (int) Math.max(0, Math.min(255, gray));
    }

    /**
     * {@code clamp(0, 255, (L - 128) * contrast + 128 + brightness * 255)}.
     * <p>
     * Contrast scales around the midpoint, so 128 stays fixed when brightness is 0.
     * The result is not rounded; the glyph lookup floors it.
     */
    public static double adjust(double luminance, double contrast, double brightness) {
        double adjusted = (luminance - MIDPOINT) * contrast + MIDPOINT;
        adjusted += brightness * 255;
        return Math.max(0, Math.min(255, adjusted));
    }
}

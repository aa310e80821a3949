package com.asciify.pipeline;

import com.asciify.glyph.Palettes;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Settings for one conversion. Immutable and validated when built, so a render never starts with bad settings.
 * <p>
 * Build with {@code RenderConfig.builder()}; unset fields keep their defaults. Use {@link #toBuilder()} to derive a
 * variant.
 */
@Getter
@ToString
public final class RenderConfig {
    public static final int DEFAULT_WIDTH = 100;
    public static final double DEFAULT_CONTRAST = 1.0;
    public static final double DEFAULT_BRIGHTNESS = 0.0;
    public static final double DEFAULT_DITHER_AMOUNT = 0.5;

    public static final double MIN_CONTRAST = 0.0, MAX_CONTRAST = 4.0;
    public static final double MIN_BRIGHTNESS = -1.0, MAX_BRIGHTNESS = 1.0;

    private final int width;
    private final String charSet;
    private final boolean useDetailedCharSet;
    private final boolean invertBrightness;
    private final boolean colorMode;
    private final double contrastFactor;
    private final double brightnessFactor;
    private final boolean applySharpening;
    private final boolean applyDithering;
    private final double ditherAmount;

    @Builder(toBuilder = true)
    private RenderConfig(int width, String charSet, boolean useDetailedCharSet, boolean invertBrightness,
                         boolean colorMode, double contrastFactor, double brightnessFactor,
                         boolean applySharpening, boolean applyDithering, double ditherAmount) {
        if (width <= 0) {
            throw new ConfigurationException("Width must be a positive number of cells: " + width);
        }
        if (charSet == null || charSet.isEmpty()) {
            throw new ConfigurationException("Character set must not be empty");
        }
        checkRange("Contrast factor", contrastFactor, MIN_CONTRAST, MAX_CONTRAST);
        checkRange("Brightness factor", brightnessFactor, MIN_BRIGHTNESS, MAX_BRIGHTNESS);
        checkRange("Dither amount", ditherAmount, 0.0, 1.0);

        this.width = width;
        this.charSet = charSet;
        this.useDetailedCharSet = useDetailedCharSet;
        this.invertBrightness = invertBrightness;
        this.colorMode = colorMode;
        this.contrastFactor = contrastFactor;
        this.brightnessFactor = brightnessFactor;
        this.applySharpening = applySharpening;
        this.applyDithering = applyDithering;
        this.ditherAmount = ditherAmount;
    }

    public static RenderConfig defaults() {
        return builder().build();
    }

    /**
     * The detailed palette when {@code useDetailedCharSet} is set, otherwise {@code charSet}.
     */
    public String activePalette() {
        return useDetailedCharSet ? Palettes.DETAILED : charSet;
    }

    private static void checkRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new ConfigurationException(name + " must be within [" + min + ", " + max + "]: " + value);
        }
    }

    // Lombok fills in the rest of the builder; these initializers are the documented defaults
    public static class RenderConfigBuilder {
        private int width = DEFAULT_WIDTH;
        private String charSet = Palettes.DEFAULT;
        private double contrastFactor = DEFAULT_CONTRAST;
        private double brightnessFactor = DEFAULT_BRIGHTNESS;
        private double ditherAmount = DEFAULT_DITHER_AMOUNT;
    }
}

package com.asciify.API;

import com.asciify.pipeline.ConfigurationException;
import com.asciify.pipeline.RenderConfig;
import lombok.Getter;
import lombok.Setter;

/**
 * Render options as sent by a client. Unset fields fall back to the configured defaults.
 */
@Getter
@Setter
public class RenderOptions {
    private Integer width;
    private String charSet;
    private boolean useDetailedCharSet;
    private boolean invertBrightness;
    private boolean colorMode;
    private Double contrastFactor;
    private Double brightnessFactor;
    private boolean applySharpening;
    private boolean applyDithering;
    private Double ditherAmount;

    /**
     * @throws ConfigurationException if a value is out of range or the width exceeds {@code asciify.max-width}
     */
    public RenderConfig toConfig(AsciifyProperties properties) {
        int w = width == null ? properties.getDefaultWidth() : width;
        if (w > properties.getMaxWidth()) {
            throw new ConfigurationException("Width " + w + " exceeds the maximum of " + properties.getMaxWidth());
        }
        RenderConfig.RenderConfigBuilder builder = RenderConfig.builder()
                .width(w)
                // an empty field means "not set", same as a missing one
                .charSet(charSet == null || charSet.isEmpty() ? properties.getDefaultCharSet() : charSet)
                .useDetailedCharSet(useDetailedCharSet)
                .invertBrightness(invertBrightness)
                .colorMode(colorMode)
                .applySharpening(applySharpening)
                .applyDithering(applyDithering);
        if (contrastFactor != null) builder.contrastFactor(contrastFactor);
        if (brightnessFactor != null) builder.brightnessFactor(brightnessFactor);
        if (ditherAmount != null) builder.ditherAmount(ditherAmount);
        return builder.build();
    }
}

package com.asciify.API;

import com.asciify.glyph.Palettes;
import com.asciify.pipeline.RenderConfig;
import com.asciify.sampler.ImageSampler;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code asciify.*} settings from application.properties.
 */
@ConfigurationProperties(prefix = "asciify")
@Getter
@Setter
public class AsciifyProperties {
    // Columns used when a request does not ask for a width
    private int defaultWidth = RenderConfig.DEFAULT_WIDTH;
    // Requests asking for more columns are rejected
    private int maxWidth = 400;
    private double charAspect = ImageSampler.DEFAULT_CHAR_ASPECT;
    private String defaultCharSet = Palettes.DEFAULT;
}

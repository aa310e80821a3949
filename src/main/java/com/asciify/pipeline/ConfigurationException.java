package com.asciify.pipeline;

/**
 * Invalid render settings: empty palette, non-positive width, or a contrast / brightness / dither value out of range.
 */
public class ConfigurationException extends RenderException {

    public ConfigurationException(String message) {
        super(message);
    }
}

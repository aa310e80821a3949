package com.asciify.pipeline;

/**
 * Base of the errors raised by the rendering core. A render either returns a complete grid or fails with one of these.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }
}

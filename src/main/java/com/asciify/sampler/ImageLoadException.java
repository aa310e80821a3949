package com.asciify.sampler;

import java.io.IOException;

/**
 * The source image could not be read or decoded.
 */
public class ImageLoadException extends IOException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.texturecritter.image;

import java.io.IOException;

/**
 * An image could not be decoded or encoded.
 */
public class ImageCodecException extends IOException {

    public ImageCodecException(String message) {
        super(message);
    }

    public ImageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

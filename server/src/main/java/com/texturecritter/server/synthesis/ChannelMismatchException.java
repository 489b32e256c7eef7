package com.texturecritter.server.synthesis;

/**
 * Thrown when a pixel tuple does not have the channel count it is used with.
 */
public class ChannelMismatchException extends IllegalArgumentException {

    public ChannelMismatchException(int expected, int actual) {
        super("Expected " + expected + " channels but got " + actual);
    }
}

package com.texturecritter.server.service;

/**
 * An encoded synthesis result, ready to hand back to a client.
 */
public class SynthesisOutcome {
    private final byte[] imageBytes;
    private final String format;
    private final int width;
    private final int height;
    private final boolean complete;
    private final long elapsedMillis;

    public SynthesisOutcome(byte[] imageBytes, String format, int width, int height, boolean complete,
            long elapsedMillis) {
        this.imageBytes = imageBytes;
        this.format = format;
        this.width = width;
        this.height = height;
        this.complete = complete;
        this.elapsedMillis = elapsedMillis;
    }

    public byte[] getImageBytes() {
        return imageBytes;
    }

    public String getFormat() {
        return format;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isComplete() {
        return complete;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }
}

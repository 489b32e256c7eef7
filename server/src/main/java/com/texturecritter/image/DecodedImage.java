package com.texturecritter.image;

/**
 * Raw decoded image: dimensions, channel layout and a row-major byte buffer
 * holding {@code width * height * channelMode.bytesPerPixel()} bytes.
 *
 * Immutable. The buffer is copied on the way in and on the way out.
 */
public class DecodedImage {
    private final int width;
    private final int height;
    private final ChannelMode channelMode;
    private final byte[] rawBytes;

    public DecodedImage(int width, int height, ChannelMode channelMode, byte[] rawBytes) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (channelMode == null) {
            throw new IllegalArgumentException("channelMode cannot be null");
        }
        long expected = (long) width * height * channelMode.bytesPerPixel();
        if (rawBytes == null || rawBytes.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " bytes for " + width + "x" + height
                    + " " + channelMode + " image, got " + (rawBytes == null ? "null" : rawBytes.length));
        }
        this.width = width;
        this.height = height;
        this.channelMode = channelMode;
        this.rawBytes = rawBytes.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public ChannelMode getChannelMode() {
        return channelMode;
    }

    public byte[] getRawBytes() {
        return rawBytes.clone();
    }
}

package com.texturecritter.image;

/**
 * Pixel layout of a decoded image buffer.
 */
public enum ChannelMode {
    GRAY(1, false),
    GRAY_ALPHA(2, true),
    RGB(3, false),
    RGBA(4, true),
    // Palette images are expanded to RGBA on decode; palette alpha cannot be
    // queried up front, so they always count as alpha-capable.
    INDEXED(4, true);

    private final int bytesPerPixel;
    private final boolean alphaCapable;

    ChannelMode(int bytesPerPixel, boolean alphaCapable) {
        this.bytesPerPixel = bytesPerPixel;
        this.alphaCapable = alphaCapable;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    public boolean isAlphaCapable() {
        return alphaCapable;
    }
}

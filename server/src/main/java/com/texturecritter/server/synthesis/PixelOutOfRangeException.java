package com.texturecritter.server.synthesis;

/**
 * Thrown when a coordinate (or coordinate plus offset) falls outside a grid.
 */
public class PixelOutOfRangeException extends IndexOutOfBoundsException {

    public PixelOutOfRangeException(int x, int y, int width, int height) {
        super("Pixel (" + x + "," + y + ") outside " + width + "x" + height + " grid");
    }
}

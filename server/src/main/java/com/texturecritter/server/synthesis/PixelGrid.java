package com.texturecritter.server.synthesis;

import com.texturecritter.image.ChannelMode;
import com.texturecritter.image.DecodedImage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A width x height grid of RGB or RGBA pixels with a per-pixel validity flag.
 *
 * Pixels live in one flat byte arena, row-major; {@link #index(int, int)} is
 * the only place a coordinate is turned into a position. Writing a value and
 * raising its validity flag are separate steps, so a value may be written
 * provisionally and committed later with {@link #markValid(int, int)}.
 */
public class PixelGrid {
    private final int width;
    private final int height;
    private final int channelCount;
    // data[index * channelCount + c], unsigned
    private final byte[] data;
    private final boolean[] valid;

    private PixelGrid(int width, int height, int channelCount, byte[] data, boolean[] valid) {
        this.width = width;
        this.height = height;
        this.channelCount = channelCount;
        this.data = data;
        this.valid = valid;
    }

    /**
     * Builds a fully valid grid from a decoded image. Alpha-capable modes
     * (palette images included) become RGBA, everything else RGB.
     */
    public static PixelGrid fromImage(DecodedImage image) {
        ChannelMode mode = image.getChannelMode();
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = mode.isAlphaCapable() ? 4 : 3;
        int pixelCount = width * height;
        byte[] src = image.getRawBytes();
        byte[] data = new byte[arenaSize(width, height, channels)];

        switch (mode) {
            case RGB:
            case RGBA:
            case INDEXED:
                System.arraycopy(src, 0, data, 0, data.length);
                break;
            case GRAY:
            case GRAY_ALPHA:
                int srcBpp = mode.bytesPerPixel();
                for (int p = 0; p < pixelCount; p++) {
                    byte grey = src[p * srcBpp];
                    int base = p * channels;
                    data[base] = grey;
                    data[base + 1] = grey;
                    data[base + 2] = grey;
                    if (channels == 4) {
                        data[base + 3] = src[p * srcBpp + 1];
                    }
                }
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel mode: " + mode);
        }

        boolean[] valid = new boolean[pixelCount];
        Arrays.fill(valid, true);
        return new PixelGrid(width, height, channels, data, valid);
    }

    /**
     * Allocates a canvas of zero pixels, none of them valid.
     */
    public static PixelGrid blank(int width, int height, boolean alphaCapable) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        int channels = alphaCapable ? 4 : 3;
        int size = arenaSize(width, height, channels);
        return new PixelGrid(width, height, channels, new byte[size], new boolean[width * height]);
    }

    // Byte length of a width x height arena; fails rather than wrapping past Integer.MAX_VALUE
    static int arenaSize(int width, int height, int channels) {
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), channels);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid too large: " + width + "x" + height + " with "
                    + channels + " channels", e);
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannelCount() {
        return channelCount;
    }

    public boolean hasAlpha() {
        return channelCount == 4;
    }

    public int pixelCount() {
        return width * height;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    private int index(int x, int y) {
        if (!inBounds(x, y)) {
            throw new PixelOutOfRangeException(x, y, width, height);
        }
        return y * width + x;
    }

    public int[] get(int x, int y) {
        int base = index(x, y) * channelCount;
        int[] pixel = new int[channelCount];
        for (int c = 0; c < channelCount; c++) {
            pixel[c] = data[base + c] & 0xff;
        }
        return pixel;
    }

    public int channel(int x, int y, int c) {
        if (c < 0 || c >= channelCount) {
            throw new IndexOutOfBoundsException("Channel " + c + " outside [0," + channelCount + ")");
        }
        return data[index(x, y) * channelCount + c] & 0xff;
    }

    public void set(int x, int y, int[] pixel) {
        int base = index(x, y) * channelCount;
        if (pixel.length != channelCount) {
            throw new ChannelMismatchException(channelCount, pixel.length);
        }
        for (int c = 0; c < channelCount; c++) {
            if (pixel[c] < 0 || pixel[c] > 255) {
                throw new IllegalArgumentException("Channel value " + pixel[c] + " outside [0,255]");
            }
        }
        for (int c = 0; c < channelCount; c++) {
            data[base + c] = (byte) pixel[c];
        }
    }

    public boolean isValid(int x, int y) {
        return valid[index(x, y)];
    }

    public void markValid(int x, int y) {
        valid[index(x, y)] = true;
    }

    public int validCount() {
        int count = 0;
        for (boolean v : valid) {
            if (v)
                count++;
        }
        return count;
    }

    public boolean isComplete() {
        for (boolean v : valid) {
            if (!v)
                return false;
        }
        return true;
    }

    public List<Offset> filterNeighbourhood(int centreX, int centreY, NeighbourhoodShape shape) {
        return filterNeighbourhood(centreX, centreY, shape.getOffsets());
    }

    /**
     * Keeps, in their given order, the offsets that land inside this grid on a
     * valid pixel when added to the centre.
     */
    public List<Offset> filterNeighbourhood(int centreX, int centreY, List<Offset> offsets) {
        List<Offset> good = new ArrayList<>(offsets.size());
        for (Offset o : offsets) {
            int x = centreX + o.dx;
            int y = centreY + o.dy;
            if (inBounds(x, y) && valid[index(x, y)]) {
                good.add(o);
            }
        }
        return good;
    }

    /**
     * Returns a copy with the requested channel count. Going from 3 to 4
     * channels adds an opaque alpha; going from 4 to 3 drops it. Validity is
     * carried over unchanged.
     */
    public PixelGrid convertTo(int newChannelCount) {
        if (newChannelCount != 3 && newChannelCount != 4) {
            throw new IllegalArgumentException("Channel count must be 3 or 4, got " + newChannelCount);
        }
        if (newChannelCount == channelCount) {
            return copy();
        }
        int pixelCount = width * height;
        byte[] converted = new byte[arenaSize(width, height, newChannelCount)];
        for (int p = 0; p < pixelCount; p++) {
            int from = p * channelCount;
            int to = p * newChannelCount;
            converted[to] = data[from];
            converted[to + 1] = data[from + 1];
            converted[to + 2] = data[from + 2];
            if (newChannelCount == 4) {
                converted[to + 3] = (byte) 0xff;
            }
        }
        return new PixelGrid(width, height, newChannelCount, converted, valid.clone());
    }

    public PixelGrid copy() {
        return new PixelGrid(width, height, channelCount, data.clone(), valid.clone());
    }

    public DecodedImage toImage() {
        return new DecodedImage(width, height, hasAlpha() ? ChannelMode.RGBA : ChannelMode.RGB, data);
    }
}

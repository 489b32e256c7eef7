package com.texturecritter.server.synthesis;

import java.util.List;

public class PixelDistance {

    /**
     * Squared Euclidean distance between two pixels in colour space.
     * Left squared: only the ordering between candidates matters.
     */
    public static int pixelDistance(int[] a, int[] b) {
        if (a.length != b.length) {
            throw new ChannelMismatchException(a.length, b.length);
        }
        int sum = 0;
        for (int i = 0; i < a.length; i++) {
            int d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Mean pixel distance between the source region around
     * (sourceX, sourceY) and the target region around (targetX, targetY),
     * taken over the given offsets. An empty offset list scores
     * {@link Double#POSITIVE_INFINITY}, so a candidate without any
     * comparable context never beats one that has some.
     */
    public static double regionDistance(PixelGrid source, PixelGrid target, int sourceX, int sourceY,
            int targetX, int targetY, List<Offset> offsets) {
        if (offsets.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        if (source.getChannelCount() != target.getChannelCount()) {
            throw new ChannelMismatchException(source.getChannelCount(), target.getChannelCount());
        }
        int channels = source.getChannelCount();
        long total = 0;
        for (Offset o : offsets) {
            int sx = sourceX + o.dx;
            int sy = sourceY + o.dy;
            int tx = targetX + o.dx;
            int ty = targetY + o.dy;
            for (int c = 0; c < channels; c++) {
                int d = source.channel(sx, sy, c) - target.channel(tx, ty, c);
                total += d * d;
            }
        }
        return (double) total / offsets.size();
    }
}

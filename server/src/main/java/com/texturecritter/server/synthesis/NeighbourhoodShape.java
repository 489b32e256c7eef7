package com.texturecritter.server.synthesis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The pattern of relative offsets compared around a centre pixel.
 *
 * Offsets are kept in row-major order (dy outer, dx inner), which is also the
 * order {@link PixelGrid#filterNeighbourhood} returns them in.
 */
public final class NeighbourhoodShape {

    public enum Kind {
        /** Every offset in the (2r+1) x (2r+1) block, origin included. */
        SQUARE,
        /** Rows above the origin plus the columns left of it on its own row. */
        CAUSAL_ELL
    }

    private final Kind kind;
    private final int radius;
    private final List<Offset> offsets;

    private NeighbourhoodShape(Kind kind, int radius, List<Offset> offsets) {
        this.kind = kind;
        this.radius = radius;
        this.offsets = Collections.unmodifiableList(offsets);
    }

    /**
     * Full square used for targeted synthesis, where unvisited target pixels
     * already hold approximate values.
     */
    public static NeighbourhoodShape square(int radius) {
        checkRadius(radius);
        List<Offset> offsets = new ArrayList<>((2 * radius + 1) * (2 * radius + 1));
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                offsets.add(new Offset(dx, dy));
            }
        }
        return new NeighbourhoodShape(Kind.SQUARE, radius, offsets);
    }

    /**
     * Half square used when growing a blank canvas in scan order: only the
     * offsets that precede the origin in row-major order.
     */
    public static NeighbourhoodShape causalEll(int radius) {
        checkRadius(radius);
        List<Offset> offsets = new ArrayList<>(radius * (2 * radius + 1) + radius);
        for (int dy = -radius; dy <= 0; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                // prior row, or same row prior column
                if (dy < 0 || dx < 0) {
                    offsets.add(new Offset(dx, dy));
                }
            }
        }
        return new NeighbourhoodShape(Kind.CAUSAL_ELL, radius, offsets);
    }

    public static NeighbourhoodShape of(Kind kind, int radius) {
        switch (kind) {
            case SQUARE:
                return square(radius);
            case CAUSAL_ELL:
                return causalEll(radius);
            default:
                throw new IllegalArgumentException("Unknown shape kind: " + kind);
        }
    }

    private static void checkRadius(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative, got " + radius);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public int getRadius() {
        return radius;
    }

    public List<Offset> getOffsets() {
        return offsets;
    }

    public int size() {
        return offsets.size();
    }

    public boolean isEmpty() {
        return offsets.isEmpty();
    }

    @Override
    public String toString() {
        return kind + "(radius=" + radius + ", offsets=" + offsets.size() + ")";
    }
}

package com.texturecritter.server.synthesis;

/**
 * A relative (dx, dy) shift from a centre pixel.
 */
public final class Offset {
    public final int dx;
    public final int dy;

    public Offset(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Offset))
            return false;
        Offset other = (Offset) o;
        return dx == other.dx && dy == other.dy;
    }

    @Override
    public int hashCode() {
        return 31 * dx + dy;
    }

    @Override
    public String toString() {
        return "(" + dx + "," + dy + ")";
    }
}

package com.texturecritter.server.synthesis;

/**
 * Outcome of one expansion. When the run was cancelled the grid is partial:
 * the pixels committed so far are valid and form a scan-order prefix, the
 * rest are still marked invalid.
 */
public class SynthesisResult {
    private final PixelGrid grid;
    private final boolean complete;
    private final int committedPixels;
    private final long elapsedMillis;

    public SynthesisResult(PixelGrid grid, boolean complete, int committedPixels, long elapsedMillis) {
        this.grid = grid;
        this.complete = complete;
        this.committedPixels = committedPixels;
        this.elapsedMillis = elapsedMillis;
    }

    public PixelGrid getGrid() {
        return grid;
    }

    public boolean isComplete() {
        return complete;
    }

    public int getCommittedPixels() {
        return committedPixels;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }
}

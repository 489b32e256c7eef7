package com.texturecritter.server.synthesis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

/**
 * Greedy per-pixel texture synthesis.
 *
 * Target pixels are visited in row-major order. Each one is compared against
 * every source pixel over the offsets that are valid around both centres, and
 * takes the value of the closest source pixel. Among equal scores the source
 * pixel met first in row-major order wins, in the parallel scan as well.
 */
public class TextureSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(TextureSynthesizer.class);

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final int parallelism;
    private final int logEveryNRows;

    public TextureSynthesizer() {
        this(1, 0);
    }

    /**
     * @param parallelism   worker threads for the source scan; 1 keeps it on the calling thread
     * @param logEveryNRows progress logging interval in target rows, 0 to disable
     */
    public TextureSynthesizer(int parallelism, int logEveryNRows) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.logEveryNRows = logEveryNRows;
    }

    /**
     * Refines an existing target using the full square neighbourhood.
     */
    public SynthesisResult expandTargeted(PixelGrid source, PixelGrid target, int radius) {
        return expandTargeted(source, target, radius, NEVER_CANCELLED);
    }

    public SynthesisResult expandTargeted(PixelGrid source, PixelGrid target, int radius,
            BooleanSupplier cancelled) {
        return expand(source, target, NeighbourhoodShape.square(radius), cancelled);
    }

    /**
     * Grows a blank canvas of {@code scaleFactor} times the source size, in the
     * source's channel mode, using the causal neighbourhood.
     */
    public SynthesisResult expandUntargeted(PixelGrid source, int scaleFactor, int radius) {
        return expandUntargeted(source, scaleFactor, radius, NEVER_CANCELLED);
    }

    public SynthesisResult expandUntargeted(PixelGrid source, int scaleFactor, int radius,
            BooleanSupplier cancelled) {
        if (scaleFactor < 1) {
            throw new IllegalArgumentException("scaleFactor must be at least 1, got " + scaleFactor);
        }
        int width;
        int height;
        try {
            width = Math.multiplyExact(source.getWidth(), scaleFactor);
            height = Math.multiplyExact(source.getHeight(), scaleFactor);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("scaleFactor " + scaleFactor + " overflows the canvas size for a "
                    + source.getWidth() + "x" + source.getHeight() + " source", e);
        }
        PixelGrid canvas = PixelGrid.blank(width, height, source.hasAlpha());
        return expand(source, canvas, NeighbourhoodShape.causalEll(radius), cancelled);
    }

    public SynthesisResult expand(PixelGrid source, PixelGrid target, NeighbourhoodShape shape) {
        return expand(source, target, shape, NEVER_CANCELLED);
    }

    /**
     * Runs the fill loop. The cancellation signal (and thread interruption) is
     * checked between pixels; a cancelled run returns the partially filled grid.
     *
     * When the target's channel count differs from the source's, the target is
     * converted first and the returned grid is the converted copy.
     */
    public SynthesisResult expand(PixelGrid source, PixelGrid target, NeighbourhoodShape shape,
            BooleanSupplier cancelled) {
        long start = System.currentTimeMillis();

        PixelGrid working = target;
        if (target.getChannelCount() != source.getChannelCount()) {
            logger.info("Converting target from {} to {} channels to match source", target.getChannelCount(),
                    source.getChannelCount());
            working = target.convertTo(source.getChannelCount());
        }

        logger.info("Expanding {}x{} source into {}x{} target with {}, parallelism={}", source.getWidth(),
                source.getHeight(), working.getWidth(), working.getHeight(), shape, parallelism);

        ForkJoinPool pool = parallelism > 1 ? new ForkJoinPool(parallelism) : null;
        int committed = 0;
        boolean stopped = false;
        try {
            rows: for (int y = 0; y < working.getHeight(); y++) {
                for (int x = 0; x < working.getWidth(); x++) {
                    if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                        stopped = true;
                        break rows;
                    }

                    List<Offset> targetContext = working.filterNeighbourhood(x, y, shape);
                    Candidate best;
                    if (pool == null) {
                        best = bestMatch(source, working, x, y, targetContext);
                    } else {
                        best = bestMatchParallel(pool, source, working, x, y, targetContext);
                        if (best == null) {
                            stopped = true;
                            break rows;
                        }
                    }

                    working.set(x, y, source.get(best.x, best.y));
                    working.markValid(x, y);
                    committed++;
                }
                if (logEveryNRows > 0 && (y + 1) % logEveryNRows == 0) {
                    logger.debug("Synthesized {}/{} rows", y + 1, working.getHeight());
                }
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        if (stopped) {
            logger.warn("Synthesis cancelled after {}/{} pixels ({} ms)", committed, working.pixelCount(), elapsed);
        } else {
            logger.info("Synthesis complete: {} pixels in {} ms", committed, elapsed);
        }
        return new SynthesisResult(working, !stopped && working.isComplete(), committed, elapsed);
    }

    static Candidate bestMatch(PixelGrid source, PixelGrid target, int targetX, int targetY,
            List<Offset> targetContext) {
        Candidate best = null;
        for (int sy = 0; sy < source.getHeight(); sy++) {
            Candidate rowBest = bestInRow(source, target, targetX, targetY, targetContext, sy);
            if (best == null || rowBest.score < best.score) {
                best = rowBest;
            }
        }
        return best;
    }

    /**
     * Scores source rows on the pool and reduces by (score, scan position).
     * Returns null if the calling thread was interrupted while waiting.
     */
    private static Candidate bestMatchParallel(ForkJoinPool pool, PixelGrid source, PixelGrid target,
            int targetX, int targetY, List<Offset> targetContext) {
        try {
            Optional<Candidate> best = pool.submit(() -> IntStream.range(0, source.getHeight())
                    .parallel()
                    .mapToObj(sy -> bestInRow(source, target, targetX, targetY, targetContext, sy))
                    .reduce(Candidate::better))
                    .get();
            return best.orElseThrow(() -> new IllegalStateException("Source grid has no pixels"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Source scan failed", cause);
        }
    }

    private static Candidate bestInRow(PixelGrid source, PixelGrid target, int targetX, int targetY,
            List<Offset> targetContext, int sy) {
        Candidate best = null;
        for (int sx = 0; sx < source.getWidth(); sx++) {
            // an offset is usable only if valid around both centres
            List<Offset> finalContext = source.filterNeighbourhood(sx, sy, targetContext);
            double score = PixelDistance.regionDistance(source, target, sx, sy, targetX, targetY, finalContext);
            if (best == null || score < best.score) {
                best = new Candidate(sx, sy, score);
            }
        }
        return best;
    }

    static final class Candidate {
        final int x;
        final int y;
        final double score;

        Candidate(int x, int y, double score) {
            this.x = x;
            this.y = y;
            this.score = score;
        }

        /** Lower score wins; on a tie the candidate earlier in row-major order. */
        static Candidate better(Candidate a, Candidate b) {
            int cmp = Double.compare(a.score, b.score);
            if (cmp != 0) {
                return cmp < 0 ? a : b;
            }
            if (a.y != b.y) {
                return a.y < b.y ? a : b;
            }
            return a.x <= b.x ? a : b;
        }
    }
}

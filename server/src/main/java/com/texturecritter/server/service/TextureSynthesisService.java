package com.texturecritter.server.service;

import com.texturecritter.image.DecodedImage;
import com.texturecritter.image.ImageCodec;
import com.texturecritter.image.ImageCodecException;
import com.texturecritter.server.config.SynthesisConfig;
import com.texturecritter.server.config.SynthesisConfigLoader;
import com.texturecritter.server.synthesis.PixelGrid;
import com.texturecritter.server.synthesis.SynthesisResult;
import com.texturecritter.server.synthesis.TextureSynthesizer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs synthesis jobs end to end: decode, pick the mode, expand, encode.
 *
 * Jobs are independent and run on a bounded pool. A job that exceeds the
 * configured timeout is cancelled between pixels and its partial grid is
 * returned.
 */
@Service
public class TextureSynthesisService {

    private static final Logger logger = LoggerFactory.getLogger(TextureSynthesisService.class);

    private final SynthesisConfig config;
    private final ExecutorService jobPool;
    private final AtomicInteger jobCounter = new AtomicInteger();

    public TextureSynthesisService() {
        this(SynthesisConfigLoader.load());
    }

    public TextureSynthesisService(SynthesisConfig config) {
        config.validate();
        this.config = config;
        AtomicInteger threadCounter = new AtomicInteger();
        this.jobPool = Executors.newFixedThreadPool(config.maxConcurrentJobs, r -> {
            Thread t = new Thread(r, "synthesis-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Texture synthesis service ready: radius={}, scale={}, parallelism={}, maxJobs={}, timeout={}s",
                config.neighbourhoodRadius, config.scaleFactor, config.parallelism, config.maxConcurrentJobs,
                config.timeoutSeconds);
    }

    public SynthesisConfig getConfig() {
        return config;
    }

    /**
     * Synthesizes from uploaded image bytes. A null target selects generative
     * mode. Null radius or scale fall back to the configured values.
     */
    public SynthesisOutcome synthesize(byte[] sourceData, byte[] targetData, Integer radius, Integer scaleFactor)
            throws ImageCodecException {
        PixelGrid source = PixelGrid.fromImage(ImageCodec.decode(sourceData));
        PixelGrid target = targetData == null ? null : PixelGrid.fromImage(ImageCodec.decode(targetData));

        int scale = resolveScale(scaleFactor, source, target);
        SynthesisResult result = run(source, target, resolveRadius(radius), scale);
        DecodedImage image = result.getGrid().toImage();
        byte[] bytes = ImageCodec.encode(image, config.outputFormat);
        return new SynthesisOutcome(bytes, config.outputFormat, image.getWidth(), image.getHeight(),
                result.isComplete(), result.getElapsedMillis());
    }

    /**
     * Synthesizes from image files and writes the result. The output format
     * follows the output file's extension.
     */
    public SynthesisResult synthesizeFile(Path sourcePath, Path targetPath, Path outputPath, Integer radius,
            Integer scaleFactor) throws ImageCodecException {
        PixelGrid source = PixelGrid.fromImage(ImageCodec.decode(sourcePath));
        PixelGrid target = targetPath == null ? null : PixelGrid.fromImage(ImageCodec.decode(targetPath));

        int scale = resolveScale(scaleFactor, source, target);
        SynthesisResult result = run(source, target, resolveRadius(radius), scale);
        ImageCodec.encode(result.getGrid().toImage(), outputPath);
        logger.info("Wrote {}x{} result to {}", result.getGrid().getWidth(), result.getGrid().getHeight(),
                outputPath);
        return result;
    }

    /**
     * Runs one expansion on the job pool and waits for it, cancelling it once
     * the configured timeout has elapsed.
     */
    public SynthesisResult run(PixelGrid source, PixelGrid target, int radius, int scaleFactor) {
        int jobId = jobCounter.incrementAndGet();
        AtomicBoolean cancel = new AtomicBoolean(false);
        TextureSynthesizer synthesizer = new TextureSynthesizer(config.parallelism, config.logEveryNRows);

        Future<SynthesisResult> future = jobPool.submit(() -> {
            if (target == null) {
                logger.info("Job {}: generative synthesis, scale={}, radius={}", jobId, scaleFactor, radius);
                return synthesizer.expandUntargeted(source, scaleFactor, radius, cancel::get);
            }
            logger.info("Job {}: targeted synthesis, radius={}", jobId, radius);
            return synthesizer.expandTargeted(source, target, radius, cancel::get);
        });

        try {
            if (config.timeoutSeconds > 0) {
                try {
                    return future.get(config.timeoutSeconds, TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    logger.warn("Job {} exceeded {}s, cancelling", jobId, config.timeoutSeconds);
                    cancel.set(true);
                }
            }
            return future.get();
        } catch (InterruptedException e) {
            cancel.set(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for synthesis job " + jobId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            logger.error("Synthesis job {} failed", jobId, cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Synthesis job " + jobId + " failed", cause);
        }
    }

    private int resolveRadius(Integer radius) {
        int r = radius != null ? radius : config.neighbourhoodRadius;
        if (r < 0) {
            throw new IllegalArgumentException("radius must be non-negative, got " + r);
        }
        return r;
    }

    /**
     * Resolves the scale factor for a generative run and checks the canvas it
     * would grow against maxCanvasPixels. A targeted run ignores the scale, so
     * only the target's own size is checked.
     */
    private int resolveScale(Integer scaleFactor, PixelGrid source, PixelGrid target) {
        if (target != null) {
            checkCanvas(target.getWidth(), target.getHeight(), "target");
            return config.scaleFactor;
        }
        int s = scaleFactor != null ? scaleFactor : config.scaleFactor;
        if (s < 1) {
            throw new IllegalArgumentException("scale must be at least 1, got " + s);
        }
        checkCanvas((long) source.getWidth() * s, (long) source.getHeight() * s, "scale " + s + " canvas");
        return s;
    }

    private void checkCanvas(long width, long height, String what) {
        long pixels;
        try {
            pixels = Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            pixels = Long.MAX_VALUE;
        }
        if (pixels > config.maxCanvasPixels) {
            throw new IllegalArgumentException(what + " of " + width + "x" + height
                    + " exceeds the limit of " + config.maxCanvasPixels + " pixels");
        }
    }

    @PreDestroy
    public void shutdown() {
        jobPool.shutdownNow();
    }
}

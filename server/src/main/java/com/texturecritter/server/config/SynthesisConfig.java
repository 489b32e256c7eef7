package com.texturecritter.server.config;

/**
 * Synthesis settings, bound from synthesis_config.json.
 */
public class SynthesisConfig {
    public int neighbourhoodRadius = 2;
    // generative mode only: canvas is scaleFactor x the source size
    public int scaleFactor = 2;
    // upper bound on width x height of any canvas a job may fill
    public long maxCanvasPixels = 16_777_216L;
    public int parallelism = 1;
    public int maxConcurrentJobs = 2;
    // 0 disables the timeout
    public long timeoutSeconds = 0;
    public int logEveryNRows = 16;
    public String outputFormat = "png";

    public SynthesisConfig() {
    }

    public SynthesisConfig copy() {
        SynthesisConfig c = new SynthesisConfig();
        c.neighbourhoodRadius = this.neighbourhoodRadius;
        c.scaleFactor = this.scaleFactor;
        c.maxCanvasPixels = this.maxCanvasPixels;
        c.parallelism = this.parallelism;
        c.maxConcurrentJobs = this.maxConcurrentJobs;
        c.timeoutSeconds = this.timeoutSeconds;
        c.logEveryNRows = this.logEveryNRows;
        c.outputFormat = this.outputFormat;
        return c;
    }

    public void validate() {
        if (neighbourhoodRadius < 0) {
            throw new IllegalArgumentException("neighbourhoodRadius must be non-negative, got " + neighbourhoodRadius);
        }
        if (scaleFactor < 1) {
            throw new IllegalArgumentException("scaleFactor must be at least 1, got " + scaleFactor);
        }
        if (maxCanvasPixels < 1) {
            throw new IllegalArgumentException("maxCanvasPixels must be at least 1, got " + maxCanvasPixels);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be at least 1, got " + maxConcurrentJobs);
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must be non-negative, got " + timeoutSeconds);
        }
        if (outputFormat == null || outputFormat.trim().isEmpty()) {
            throw new IllegalArgumentException("outputFormat must be set");
        }
    }
}

package com.texturecritter.server.tools;

import com.texturecritter.image.ImageCodecException;
import com.texturecritter.server.config.SynthesisConfig;
import com.texturecritter.server.config.SynthesisConfigLoader;
import com.texturecritter.server.service.TextureSynthesisService;
import com.texturecritter.server.synthesis.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Offline tool to expand a texture from the command line.
 * Usage: TextureExpand <input> <output> [--target file] [--radius N] [--scale N]
 * [--threads N] [--timeout SECONDS]
 */
public class TextureExpand {

    private static final Logger logger = LoggerFactory.getLogger(TextureExpand.class);

    static final String USAGE = "Usage: TextureExpand <input> <output> [--target <file>] [--radius N] [--scale N]"
            + " [--threads N] [--timeout SECONDS]";

    static class Options {
        Path input;
        Path output;
        Path target;
        Integer radius;
        Integer scale;
        Integer threads;
        Long timeoutSeconds;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 1;
        }

        if (!Files.isRegularFile(options.input)) {
            System.err.println("Could not open input image file " + options.input);
            return 1;
        }
        if (options.target != null && !Files.isRegularFile(options.target)) {
            System.err.println("Could not open target image file " + options.target);
            return 1;
        }

        SynthesisConfig config = SynthesisConfigLoader.load().copy();
        if (options.threads != null) {
            config.parallelism = options.threads;
        }
        if (options.timeoutSeconds != null) {
            config.timeoutSeconds = options.timeoutSeconds;
        }
        config.maxConcurrentJobs = 1;

        TextureSynthesisService service;
        try {
            service = new TextureSynthesisService(config);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 1;
        }

        try {
            logger.info("Expanding {} into {}{}", options.input, options.output,
                    options.target != null ? " guided by " + options.target : "");
            SynthesisResult result = service.synthesizeFile(options.input, options.target, options.output,
                    options.radius, options.scale);
            if (!result.isComplete()) {
                logger.warn("Synthesis stopped early; {} of {} pixels filled", result.getCommittedPixels(),
                        result.getGrid().pixelCount());
            }
            return 0;
        } catch (ImageCodecException e) {
            logger.error("Image I/O failed: {}", e.getMessage());
            System.err.println(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 1;
        } finally {
            service.shutdown();
        }
    }

    static Options parse(String[] args) {
        Options options = new Options();
        int positional = 0;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                String value = args[++i];
                switch (arg) {
                    case "--target":
                        options.target = Paths.get(value);
                        break;
                    case "--radius":
                        options.radius = parseInt(arg, value, 0);
                        break;
                    case "--scale":
                        options.scale = parseInt(arg, value, 1);
                        break;
                    case "--threads":
                        options.threads = parseInt(arg, value, 1);
                        break;
                    case "--timeout":
                        options.timeoutSeconds = (long) parseInt(arg, value, 0);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option " + arg);
                }
            } else if (positional == 0) {
                options.input = Paths.get(arg);
                positional++;
            } else if (positional == 1) {
                options.output = Paths.get(arg);
                positional++;
            } else {
                throw new IllegalArgumentException("Unexpected argument " + arg);
            }
        }
        if (positional < 2) {
            throw new IllegalArgumentException("Input and output files are required");
        }
        return options;
    }

    private static int parseInt(String option, String value, int min) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'");
        }
        if (n < min) {
            throw new IllegalArgumentException(option + " must be at least " + min + ", got " + n);
        }
        return n;
    }
}

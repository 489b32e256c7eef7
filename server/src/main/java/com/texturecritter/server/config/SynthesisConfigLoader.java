package com.texturecritter.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class SynthesisConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisConfigLoader.class);

    public static final String CONFIG_PROPERTY = "texture.config";
    public static final String CONFIG_RESOURCE = "/synthesis_config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Resolves the configuration: the file named by the texture.config system
     * property, then the classpath resource, then built-in defaults. A source
     * that cannot be read or holds invalid values is skipped with a warning.
     */
    public static SynthesisConfig load() {
        boolean found = false;

        // 1. Check System Property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            found = true;
            try {
                SynthesisConfig config = MAPPER.readValue(new File(sysProp), SynthesisConfig.class);
                config.validate();
                logger.info("Loaded synthesis config from {}", sysProp);
                return config;
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Ignoring synthesis config {}: {}", sysProp, e.getMessage());
            }
        }

        // 2. Check classpath resource
        try (InputStream is = SynthesisConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                found = true;
                SynthesisConfig config = read(is);
                logger.info("Loaded synthesis config from classpath {}", CONFIG_RESOURCE);
                return config;
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Ignoring classpath {}: {}", CONFIG_RESOURCE, e.getMessage());
        }

        // 3. Default
        if (found) {
            logger.warn("No usable synthesis config, using defaults");
        } else {
            logger.info("No synthesis config found, using defaults");
        }
        return new SynthesisConfig();
    }

    public static SynthesisConfig read(InputStream is) throws IOException {
        SynthesisConfig config = MAPPER.readValue(is, SynthesisConfig.class);
        config.validate();
        return config;
    }
}

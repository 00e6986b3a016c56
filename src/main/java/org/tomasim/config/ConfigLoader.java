package org.tomasim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the simulator configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "tomasim.conf";

    private ConfigLoader() {
        // static utility
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dtomasim.machine.rob-capacity=8)
     * 3. Configuration file (the given one, else tomasim.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or null to look for tomasim.conf.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicit file does not exist.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();
        final Config fileConfig = loadFile(configFile);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertyConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    private static Config loadFile(final File configFile) {
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        final File cwdFile = new File(CONFIG_FILE_NAME);
        if (cwdFile.isFile()) {
            LOG.info("Loading configuration from file: {}", cwdFile.getAbsolutePath());
            return ConfigFactory.parseFile(cwdFile);
        }
        LOG.debug("No '{}' in working directory, using defaults.", CONFIG_FILE_NAME);
        return ConfigFactory.empty();
    }
}

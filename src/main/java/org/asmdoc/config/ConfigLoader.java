package org.asmdoc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Loads the asmdoc configuration from its sources, highest precedence first:
 * <ol>
 *     <li>Java system properties (e.g. {@code -Dasmdoc.parser-threads=8})</li>
 *     <li>Environment overrides ({@code CONFIG_FORCE_asmdoc_parser__threads=8})</li>
 *     <li>The configuration file given with {@code --config}, or {@code asmdoc.conf} in the working directory</li>
 *     <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "asmdoc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, looking for {@code asmdoc.conf} in the working directory.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile A configuration file named on the command line, or null.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the explicit file is missing or a file cannot be parsed.
     */
    public static Config load(final Path explicitFile) {
        final Config propertiesConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config fileConfig = loadFile(explicitFile);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return propertiesConfig
                .withFallback(envConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }

    private static Config loadFile(final Path explicitFile) {
        if (explicitFile != null) {
            LOG.debug("Loading configuration from file: {}", explicitFile.toAbsolutePath());
            return ConfigFactory.parseFile(explicitFile.toFile(), ConfigParseOptions.defaults().setAllowMissing(false));
        }
        final File configFile = new File(CONFIG_FILE_NAME);
        if (configFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
        return ConfigFactory.empty();
    }
}

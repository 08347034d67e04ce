package org.duplex.host.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "duplex.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, looking for {@code duplex.conf} in the working directory.
     *
     * @return The resolved configuration.
     * @see #load(File)
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. Configuration file: the explicit file if given, else the file named by -Dconfig.file,
     *    else duplex.conf in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file chosen by the caller, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicitly requested file does not exist.
     */
    public static Config load(final File explicitFile) {
        // Typesafe maps env vars like 'DUPLEX_HOST_PORT' only through explicit ${?VAR} substitutions,
        // so reference.conf declares the overridable ones.
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config fileConfig = loadFile(explicitFile);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }

    private static Config loadFile(final File explicitFile) {
        File configFile = explicitFile;
        if (configFile == null) {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                configFile = new File(systemConfigPath).getAbsoluteFile();
            }
        }

        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists() && !cwdConfigFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
            return ConfigFactory.parseFile(cwdConfigFile);
        }
        LOG.info("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", cwdConfigFile.getPath());
        return ConfigFactory.empty();
    }
}

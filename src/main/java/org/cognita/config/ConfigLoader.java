package org.cognita.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "cognita.conf";
    public static final String ROOT_PATH = "cognita";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. Configuration file ({@code cognita.conf} in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit file in place of {@code cognita.conf}.
     *
     * @param configFile The file layered between system properties and defaults; skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        // Env vars like 'COGNITA_RUNTIME_WORKERTHREADS' are not mapped automatically;
        // use ${?VAR} substitutions in cognita.conf for those.
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * @return The {@code cognita} block of a loaded configuration, or an empty config.
     */
    public static Config cognita(final Config root) {
        return root.hasPath(ROOT_PATH) ? root.getConfig(ROOT_PATH) : ConfigFactory.empty();
    }
}

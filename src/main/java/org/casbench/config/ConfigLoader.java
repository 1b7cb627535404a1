package org.casbench.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for loading the library configuration.
 * JVM system properties ({@code -Dkey=value}) take precedence over the defaults in
 * {@code reference.conf} on the classpath.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String REFERENCE_RESOURCE = "reference.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads and resolves the configuration.
     *
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load() {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources(REFERENCE_RESOURCE);
        if (defaultConfig.isEmpty()) {
            LOG.warn("No '{}' found on the classpath, using built-in defaults only.", REFERENCE_RESOURCE);
        }

        return cliConfig
            .withFallback(defaultConfig)
            .resolve();
    }
}

package org.irdump.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Assembles the configuration of the IR dump from its layers, highest precedence first:
 * <ol>
 *   <li>Environment overrides using the {@code CONFIG_FORCE_} convention of Typesafe Config,
 *       e.g. {@code CONFIG_FORCE_irdump_writer_fingerprint__algorithm=SHA-256}
 *       ({@code _} separates path segments, {@code __} stands for {@code -}).</li>
 *   <li>Java system properties, e.g. {@code -Dirdump.writer.fingerprint-algorithm=SHA-256}.</li>
 *   <li>An optional HOCON file, {@value #CONFIG_FILE_NAME} in the working directory by default.</li>
 *   <li>{@code reference.conf} on the classpath.</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "irdump.conf";
    private static final String REFERENCE_RESOURCE = "reference.conf";

    private ConfigLoader() {
    }

    /**
     * @return The resolved configuration, reading {@value #CONFIG_FILE_NAME} from the working directory.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile The optional HOCON file; ignored when missing or a directory.
     * @return The resolved configuration.
     */
    public static Config load(File configFile) {
        return load(configFile, ConfigFactory.systemEnvironmentOverrides());
    }

    static Config load(File configFile, Config environmentOverrides) {
        return environmentOverrides
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileLayer(configFile))
                .withFallback(ConfigFactory.parseResources(REFERENCE_RESOURCE))
                .resolve();
    }

    private static Config fileLayer(File configFile) {
        if (!configFile.isFile()) {
            LOG.debug("No configuration file at {}, using defaults", configFile.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Loading configuration from {}", configFile.getAbsolutePath());
        return ConfigFactory.parseFile(configFile);
    }
}

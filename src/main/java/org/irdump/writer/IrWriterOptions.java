package org.irdump.writer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.irdump.config.ConfigLoader;

import java.util.List;
import java.util.Objects;

/**
 * Immutable settings of the IR writer.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * irdump.writer {
 *   fingerprint-algorithm = "MD5"
 *   trusted-packages = ["org.irdump.ir"]
 * }
 * </pre>
 *
 * @param fingerprintAlgorithm The digest used for diagnostic message fingerprints.
 * @param trustedPackages Packages whose unregistered extension nodes are rendered without content.
 * @throws IllegalArgumentException if the fingerprint algorithm is not available.
 */
public record IrWriterOptions(String fingerprintAlgorithm, List<String> trustedPackages) {

    /** Path of the writer settings inside the application configuration. */
    public static final String CONFIG_PATH = "irdump.writer";
    private static final String FINGERPRINT_ALGORITHM_KEY = "fingerprint-algorithm";
    private static final String TRUSTED_PACKAGES_KEY = "trusted-packages";

    public IrWriterOptions {
        Objects.requireNonNull(fingerprintAlgorithm, "fingerprintAlgorithm");
        MessageFingerprint.checkAvailable(fingerprintAlgorithm);
        trustedPackages = List.copyOf(trustedPackages);
    }

    /**
     * Reads the writer settings from {@code irdump.writer}. Missing keys are an error, defaults
     * come from {@code reference.conf}.
     *
     * @param config The application configuration.
     * @return The writer options.
     */
    public static IrWriterOptions fromConfig(Config config) {
        Config writer = config.getConfig(CONFIG_PATH);
        return new IrWriterOptions(
                writer.getString(FINGERPRINT_ALGORITHM_KEY),
                writer.getStringList(TRUSTED_PACKAGES_KEY));
    }

    /**
     * Reads the options from the layered application configuration.
     *
     * @return The effective options.
     * @see ConfigLoader#load()
     */
    public static IrWriterOptions load() {
        return fromConfig(ConfigLoader.load());
    }

    /**
     * @return The options defined by {@code reference.conf} on the classpath.
     */
    public static IrWriterOptions defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }
}

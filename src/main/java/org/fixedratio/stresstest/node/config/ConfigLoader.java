package org.fixedratio.stresstest.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the harness configuration from four layers, highest precedence first:
 * <ol>
 *   <li>environment overrides such as {@code CONFIG_FORCE_stress__test_workers_delay__min=100ms}
 *       ({@code _} separates path elements, {@code __} stands for a dash)</li>
 *   <li>system properties such as {@code -Dstress-test.workers.delay-min=100ms}</li>
 *   <li>a HOCON file, by default {@code stress-test.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The result always carries a {@code stress-test} and a {@code logging} section.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "stress-test.conf";
    static final String ROOT_PATH = "stress-test";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code stress-test.conf} from the working directory, which may be absent.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME), false);
    }

    /**
     * Loads the configuration with an optional file layer.
     *
     * @param configFile The file to layer over the defaults; skipped when it does not exist.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        return load(configFile, false);
    }

    /**
     * Loads the configuration with a file that was named explicitly, as by {@code --config}.
     *
     * @param configFile The file to layer over the defaults.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file does not exist or is a directory.
     */
    public static Config loadRequired(final File configFile) {
        return load(configFile, true);
    }

    private static Config load(final File configFile, final boolean required) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else if (required) {
            throw new IllegalArgumentException("Configuration file specified via --config was not found: "
                + (configFile == null ? "<none>" : configFile.getAbsolutePath()));
        } else {
            LOG.info("No configuration file at '{}', using built-in defaults",
                configFile == null ? CONFIG_FILE_NAME : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config resolved = ConfigFactory.systemEnvironmentOverrides()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();

        if (!resolved.hasPath(ROOT_PATH)) {
            throw new IllegalStateException("No '" + ROOT_PATH + "' section found, is reference.conf on the classpath?");
        }
        LOG.debug("Configured chain client {} and state store {}",
            resolved.getString(ROOT_PATH + ".chain.className"), resolved.getString(ROOT_PATH + ".storage.className"));
        return resolved;
    }
}

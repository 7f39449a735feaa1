package org.outbreak.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.outbreak.runtime.api.ConfigurationException;
import org.outbreak.runtime.model.SimulationParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the merged HOCON configuration of the command line tool and extracts the simulation
 * parameters from it.
 * <p>
 * Sources, highest precedence first: environment variables, {@code -Dkey=value} system properties,
 * the configuration file ({@value #CONFIG_FILE_NAME} in the working directory unless given
 * explicitly), and {@code reference.conf} on the classpath.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * The configuration file looked up in the working directory when none is given explicitly.
     */
    public static final String CONFIG_FILE_NAME = "outbreak.conf";

    /** Block holding the {@link SimulationParameters} keys and the seed. */
    public static final String SIMULATION_PATH = "simulation";

    /** Block holding the settings of a headless run. */
    public static final String RUN_PATH = "run";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @return The merged configuration using {@value #CONFIG_FILE_NAME} from the working directory.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile The configuration file; skipped if it does not exist.
     * @return The merged and resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No configuration file at '{}', using defaults",
                    configFile == null ? CONFIG_FILE_NAME : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    /**
     * Reads the {@value #SIMULATION_PATH} block. Keys missing from the block keep their defaults.
     *
     * @param config A configuration produced by {@link #load}.
     * @return The simulation parameters, not yet validated.
     * @throws ConfigurationException if a key has the wrong type.
     */
    public static SimulationParameters simulationParameters(final Config config) throws ConfigurationException {
        if (!config.hasPath(SIMULATION_PATH)) {
            return SimulationParameters.defaults();
        }
        return SimulationParameters.fromConfig(config.getConfig(SIMULATION_PATH));
    }
}

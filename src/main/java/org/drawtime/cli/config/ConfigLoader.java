package org.drawtime.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file picked up from the working directory. */
    public static final String CONFIG_FILE_NAME = "drawtime.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Ddrawtime.render.line-width=3)
     * 2. Environment Variables
     * 3. Configuration file (the explicit one, else drawtime.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file given on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws FileNotFoundException if {@code explicitFile} is given but does not exist.
     */
    public static Config load(final File explicitFile) throws FileNotFoundException {
        return load(explicitFile, new File(CONFIG_FILE_NAME));
    }

    static Config load(final File explicitFile, final File workingDirectoryFile) throws FileNotFoundException {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new FileNotFoundException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else if (workingDirectoryFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", workingDirectoryFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(workingDirectoryFile);
        } else {
            LOG.debug("No '{}' found, using classpath defaults.", workingDirectoryFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}

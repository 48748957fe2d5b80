package org.drawtime.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.drawtime.cli.commands.CheckCommand;
import org.drawtime.cli.commands.FormatCommand;
import org.drawtime.cli.commands.RenderCommand;
import org.drawtime.cli.config.ConfigLoader;
import org.drawtime.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.concurrent.Callable;

@Command(
    name = "drawtime",
    mixinStandardHelpOptions = true,
    version = "DrawTime 1.0",
    description = "DrawTime - renders timing diagrams from plain-text descriptions",
    subcommands = {
        RenderCommand.class,
        CheckCommand.class,
        FormatCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The command completed. */
    public static final int EXIT_OK = 0;
    /** The diagram source is invalid. */
    public static final int EXIT_DIAGRAM_ERROR = 1;
    /** A file could not be read or written. */
    public static final int EXIT_IO_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged application configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (FileNotFoundException | ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}

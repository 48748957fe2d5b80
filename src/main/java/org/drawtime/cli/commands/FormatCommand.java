package org.drawtime.cli.commands;

import org.drawtime.cli.CommandLineInterface;
import org.drawtime.compiler.DiagramCompiler;
import org.drawtime.compiler.DiagramWriter;
import org.drawtime.compiler.api.DiagramException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "format",
    description = "Prints a diagram source file in canonical form, with every setting spelled out."
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The diagram source file.")
    private Path source;

    @Option(names = {"-o", "--output"}, description = "Write to this file instead of standard output.")
    private Path output;

    @Override
    public Integer call() {
        parent.getConfig();
        final String formatted;
        try {
            formatted = DiagramWriter.write(new DiagramCompiler().compile(source));
        } catch (DiagramException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_DIAGRAM_ERROR;
        }

        if (output == null) {
            spec.commandLine().getOut().print(formatted);
            spec.commandLine().getOut().flush();
            return CommandLineInterface.EXIT_OK;
        }
        try {
            Files.writeString(output, formatted, StandardCharsets.UTF_8);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: cannot write " + output + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        LOGGER.info("Wrote {}", output);
        return CommandLineInterface.EXIT_OK;
    }
}

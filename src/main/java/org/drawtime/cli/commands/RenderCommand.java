package org.drawtime.cli.commands;

import org.drawtime.DrawTime;
import org.drawtime.cli.CommandLineInterface;
import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.render.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "render",
    description = "Renders a diagram source file to an image (png, jpg, jpeg, bmp, gif or svg)."
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RenderCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The diagram source file.")
    private Path source;

    @Option(names = {"-o", "--output"}, description = "Output image file. Default: the source name with .png")
    private Path output;

    @Override
    public Integer call() {
        final RenderOptions options = RenderOptions.fromConfig(parent.getConfig());
        final Path target = output != null ? output : DrawTime.defaultOutput(source);
        try {
            new DrawTime(options).render(source, target);
        } catch (DiagramException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return e.getKind() == ErrorKind.IO_FAILURE
                    ? CommandLineInterface.EXIT_IO_ERROR
                    : CommandLineInterface.EXIT_DIAGRAM_ERROR;
        }
        LOGGER.info("Wrote {}", target);
        return CommandLineInterface.EXIT_OK;
    }
}

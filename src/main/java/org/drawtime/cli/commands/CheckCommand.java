package org.drawtime.cli.commands;

import org.drawtime.cli.CommandLineInterface;
import org.drawtime.compiler.DiagramCompiler;
import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.diagnostics.Diagnostic;
import org.drawtime.model.Diagram;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Parses a diagram source file and reports errors and warnings without rendering."
)
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The diagram source file.")
    private Path source;

    @Override
    public Integer call() {
        parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final DiagramCompiler compiler = new DiagramCompiler();
        final Diagram diagram;
        try {
            diagram = compiler.compile(source);
        } catch (DiagramException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_DIAGRAM_ERROR;
        }
        for (Diagnostic diagnostic : compiler.getDiagnostics()) {
            out.println(diagnostic);
        }
        out.printf("%s: OK, %d signal(s), %d warning(s)%n",
                source, diagram.signals().size(), compiler.getDiagnostics().size());
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}

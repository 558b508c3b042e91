package com.textdiagram.cli;

import com.textdiagram.core.engine.DiagramEngine;
import com.textdiagram.core.engine.DiagramRenderService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the available diagram engines.
 *
 * <p>Discovers engines via Java Service Provider Interface (SPI) and shows which diagram
 * header each one handles.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * textdiagram list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available diagram engines",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Engines:");
        out.println();

        List<DiagramEngine> engines = DiagramRenderService.discoverEngines();
        for (DiagramEngine engine : engines) {
            out.printf("  • %s (ID: %s)%n", engine.getDisplayName(), engine.getId());
            out.printf("    Header: %s%n", engine.getDiagramType().keyword());
            out.println();
        }

        if (engines.isEmpty()) {
            out.println("  No engines found.");
        }
        out.flush();
        return 0;
    }
}

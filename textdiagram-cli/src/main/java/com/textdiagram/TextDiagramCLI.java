package com.textdiagram;

import ch.qos.logback.classic.Level;
import com.textdiagram.cli.ListCommand;
import com.textdiagram.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for TextDiagram.
 *
 * <p>TextDiagram draws sequence diagrams, flowcharts and ER diagrams written in a
 * Mermaid-style syntax as box-drawing text for terminals, commit messages and code comments.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a diagram file or standard input</li>
 *   <li>{@code list} - List available diagram engines</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render a file at its natural width
 * textdiagram render login.mmd
 *
 * # Render standard input into 60 columns
 * cat login.mmd | textdiagram render -w 60
 *
 * # List engines
 * textdiagram list
 * }</pre>
 */
@Command(
    name = "textdiagram",
    mixinStandardHelpOptions = true,
    version = "TextDiagram 1.0.0-SNAPSHOT",
    description = "Renders Mermaid-style diagrams as box-drawing text",
    subcommands = {
        RenderCommand.class,
        ListCommand.class
    }
)
public class TextDiagramCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TextDiagramCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("TextDiagram - Box-drawing renderer for diagram source");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'textdiagram --help' to see available commands");
        out.println("Use 'textdiagram <command> --help' for command-specific help");
        out.flush();
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TextDiagramCLI cli = new TextDiagramCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

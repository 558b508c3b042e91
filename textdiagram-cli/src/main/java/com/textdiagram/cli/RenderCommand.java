package com.textdiagram.cli;

import com.textdiagram.core.DiagramException;
import com.textdiagram.core.config.ConfigLoader;
import com.textdiagram.core.config.TextDiagramConfig;
import com.textdiagram.core.engine.DiagramRenderService;
import com.textdiagram.core.engine.RenderedDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to render one diagram.
 *
 * <p>Reads the diagram from a file, or from standard input when no file (or {@code -}) is
 * given, and prints the drawing to standard output or to the {@code --output} file.
 * An explicit {@code --width} wins over {@code render.maxWidth} from the configuration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * textdiagram render flow.mmd -w 80
 * textdiagram render -c textdiagram.yaml -o flow.txt flow.mmd
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a diagram as box-drawing text",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    private static final String STDIN = "-";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
        description = "Diagram source file, '-' or omitted for standard input")
    private String input;

    @Option(names = {"-w", "--width"}, paramLabel = "COLUMNS",
        description = "Maximum output width in columns")
    private Integer width;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./textdiagram.yaml if present)")
    private Path configPath;

    @Option(names = {"-o", "--output"}, description = "Write the diagram to this file instead of standard output")
    private Path output;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (width != null && width < 1) {
            return fail(err, "width must be positive, got " + width);
        }

        TextDiagramConfig config = loadConfig();
        Integer maxWidth = width != null ? width : config.render().maxWidth();

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            log.error("Failed to read diagram source {}", describeInput(), e);
            return fail(err, "cannot read " + describeInput() + ": " + e.getMessage());
        }

        RenderedDiagram rendered;
        try {
            rendered = new DiagramRenderService().render(source, maxWidth);
        } catch (DiagramException e) {
            log.debug("Rendering {} failed", describeInput(), e);
            return fail(err, e.getMessage());
        }
        log.debug("Rendered {} diagram from {} ({}x{})",
            rendered.type(), describeInput(), rendered.width(), rendered.height());

        String text = config.output().trailingNewline() ? rendered.content() + "\n" : rendered.content();
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(text);
            out.flush();
            return 0;
        }

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text, StandardCharsets.UTF_8);
            log.info("Wrote diagram to {}", output);
            return 0;
        } catch (IOException e) {
            log.error("Failed to write {}", output, e);
            return fail(err, "cannot write " + output + ": " + e.getMessage());
        }
    }

    private TextDiagramConfig loadConfig() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path implicit = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(implicit) ? ConfigLoader.load(implicit) : TextDiagramConfig.defaults();
    }

    private String readSource() throws IOException {
        if (input == null || STDIN.equals(input)) {
            InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Paths.get(input), StandardCharsets.UTF_8);
    }

    private String describeInput() {
        return input == null || STDIN.equals(input) ? "standard input" : input;
    }

    private static int fail(PrintWriter err, String message) {
        err.println("ERROR: " + message);
        err.flush();
        return 1;
    }
}

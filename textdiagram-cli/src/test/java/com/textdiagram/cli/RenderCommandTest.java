package com.textdiagram.cli;

import com.textdiagram.TextDiagramCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RenderCommand}.
 */
class RenderCommandTest {

    private static final String SEQUENCE = """
        sequenceDiagram
            Alice->>Bob: Hello
            Bob-->>Alice: Hi!
        """;

    private static final String SEQUENCE_OUTPUT = """
        ┌───────┐  ┌─────┐
        │ Alice │  │ Bob │
        └───┬───┘  └──┬──┘
            │ Hello   │
            │────────>│
            │         │
            │ Hi!     │
            │< ─ ─ ─ ─│
            │         │
        ┌───┴───┐  ┌──┴──┐
        │ Alice │  │ Bob │
        └───────┘  └─────┘
        """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = TextDiagramCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void render_file_printsDiagramWithTrailingNewline() throws IOException {
        Path source = write("hello.mmd", SEQUENCE);

        int exitCode = execute("render", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(SEQUENCE_OUTPUT);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void render_width_shrinksDiagram() throws IOException {
        Path source = write("hello.mmd", SEQUENCE);

        int exitCode = execute("render", "-w", "14", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("A…", "B…").doesNotContain("Alice");
    }

    @Test
    void render_widthTooSmall_reportsError() throws IOException {
        Path source = write("hello.mmd", "sequenceDiagram\nAlice->>Bob: Hello\n");

        int exitCode = execute("render", "--width", "13", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("ERROR: diagram too wide: needs at least 14 columns, max is 13");
    }

    @Test
    void render_nonPositiveWidth_isRejected() throws IOException {
        Path source = write("hello.mmd", SEQUENCE);

        int exitCode = execute("render", "-w", "0", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("ERROR: width must be positive, got 0");
    }

    @Test
    void render_syntaxError_reportsLine() throws IOException {
        Path source = write("broken.mmd", "graph TD\nA -->\n");

        int exitCode = execute("render", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("ERROR: syntax error at line 2");
    }

    @Test
    void render_missingFile_reportsError() {
        int exitCode = execute("render", tempDir.resolve("missing.mmd").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("ERROR: cannot read");
    }

    @Test
    void render_configWidth_appliesWhenNoExplicitWidth() throws IOException {
        Path source = write("hello.mmd", SEQUENCE);
        Path config = write("textdiagram.yaml", """
            render:
              maxWidth: 14
            output:
              trailingNewline: false
            """);

        int exitCode = execute("render", "-c", config.toString(), source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("A…").doesNotEndWith("\n");
    }

    @Test
    void render_explicitWidth_winsOverConfig() throws IOException {
        Path source = write("hello.mmd", SEQUENCE);
        Path config = write("textdiagram.yaml", """
            render:
              maxWidth: 14
            """);

        int exitCode = execute("render", "-c", config.toString(), "-w", "80", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(SEQUENCE_OUTPUT);
    }

    @Test
    void render_output_writesFileAndCreatesDirectories() throws IOException {
        Path source = write("flow.mmd", "graph LR\n    A --- B\n");
        Path target = tempDir.resolve("out/nested/flow.txt");

        int exitCode = execute("render", "-o", target.toString(), source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("""
            ┌───┐     ┌───┐
            │ A │─────│ B │
            └───┘     └───┘
            """);
    }

    @Test
    void render_standardInput_readsDash() {
        InputStream original = System.in;
        System.setIn(new ByteArrayInputStream(
            "erDiagram\n    CUSTOMER ||--o{ ORDER : places\n".getBytes(StandardCharsets.UTF_8)));
        try {
            int exitCode = execute("render", "-");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("│ CUSTOMER │||──places──o{│ ORDER │");
        } finally {
            System.setIn(original);
        }
    }
}

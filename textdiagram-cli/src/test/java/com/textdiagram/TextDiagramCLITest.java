package com.textdiagram;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextDiagramCLI}.
 */
class TextDiagramCLITest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = TextDiagramCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void noCommand_printsBanner() {
        int exitCode = execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("TextDiagram", "textdiagram --help");
    }

    @Test
    void quiet_suppressesBanner() {
        int exitCode = execute("-q");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void version_printsVersion() {
        int exitCode = execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("TextDiagram 1.0.0-SNAPSHOT");
    }

    @Test
    void help_listsSubcommands() {
        int exitCode = execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("render", "list");
    }

    @Test
    void unknownOption_failsWithUsage() {
        int exitCode = execute("--bogus");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown option");
    }
}

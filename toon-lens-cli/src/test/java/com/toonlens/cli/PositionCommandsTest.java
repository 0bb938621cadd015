package com.toonlens.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HoverCommand} and {@link DefinitionCommand}.
 */
class PositionCommandsTest extends CommandTestSupport {

    private Path file;

    @BeforeEach
    void writeSample() throws IOException {
        file = writeFile("hikes.toon", "hikes[2]{id,name}:\n  1,Trail\n  2,Path,extra\n");
    }

    @Test
    void hover_onField_printsMarkdown() {
        int exitCode = run("hover", file.toString(), "0", "13");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("**Field:** name\n\n**Position:** 2 of 2");
    }

    @Test
    void hover_nothingAtPosition_exitsOne() {
        assertThat(run("hover", file.toString(), "2", "10")).isEqualTo(1);
        assertThat(err.toString()).contains("No hover information");
    }

    @Test
    void definition_onDataCell_printsFieldLocation() {
        int exitCode = run("definition", file.toString(), "1", "5");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo(file + ":1:13");
    }

    @Test
    void definition_onExtraCell_exitsOne() {
        assertThat(run("definition", file.toString(), "2", "10")).isEqualTo(1);
    }

    @Test
    void hover_negativePosition_exitsTwo() {
        assertThat(run("hover", file.toString(), "-1", "0")).isEqualTo(2);
    }
}

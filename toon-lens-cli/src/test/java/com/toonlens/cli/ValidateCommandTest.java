package com.toonlens.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestSupport {

    @Test
    void validate_cleanFile_exitsZeroWithoutOutput() throws IOException {
        Path file = writeFile("clean.toon", "user:\n  name: Ada\ntags[2]: a,b\n");

        int exitCode = run("validate", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void validate_fileWithErrors_printsOneBasedLocationsAndExitsOne() throws IOException {
        Path file = writeFile("broken.toon", "name: Ada\nfriends[2]: ana,luis,sam\n");

        int exitCode = run("validate", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().trim()).isEqualTo(
            file + ":2:1: error: 配列の要素数が超過しています（宣言: 2, 実際: 3）");
    }

    @Test
    void validate_severalFiles_reportsEachFile() throws IOException {
        Path first = writeFile("first.toon", "k:\n");
        Path second = writeFile("second.toon", "oops\n");

        int exitCode = run("validate", first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().lines()).containsExactly(
            first + ":1:3: error: 値が指定されていません",
            second + ":1:1: error: コロンが見つかりません");
    }

    @Test
    void validate_missingFile_exitsTwo() {
        int exitCode = run("validate", tempDir.resolve("missing.toon").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("cannot read file");
    }

    @Test
    void validate_validatorDisabledInConfig_isSkipped() throws IOException {
        Files.writeString(configFile, "validators:\n  disabled:\n    - line-syntax\n");
        Path file = writeFile("loose.toon", "oops\n");

        int exitCode = run("validate", file.toString());

        assertThat(exitCode).isZero();
    }
}

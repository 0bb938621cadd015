package com.toonlens.cli;

import com.toonlens.ToonLensCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for command tests: runs the CLI in-process with captured output and a
 * configuration path that does not exist unless a test writes it.
 */
abstract class CommandTestSupport {

    @TempDir
    Path tempDir;

    protected StringWriter out;
    protected StringWriter err;
    protected Path configFile;

    @BeforeEach
    void setUpStreams() {
        out = new StringWriter();
        err = new StringWriter();
        configFile = tempDir.resolve(".toonlens.yaml");
    }

    protected int run(String... args) {
        CommandLine commandLine = ToonLensCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        List<String> fullArgs = new ArrayList<>(List.of("-q", "--config", configFile.toString()));
        fullArgs.addAll(List.of(args));
        return commandLine.execute(fullArgs.toArray(new String[0]));
    }

    protected Path writeFile(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}

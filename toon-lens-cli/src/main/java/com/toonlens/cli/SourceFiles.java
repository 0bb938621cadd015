package com.toonlens.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File helpers shared by the commands.
 */
final class SourceFiles {

    private SourceFiles() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    static void write(Path file, String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }

    /**
     * Returns the document URI used as the language service key and in locations.
     *
     * @param file file path
     * @return absolute {@code file:} URI
     */
    static String uri(Path file) {
        return file.toAbsolutePath().normalize().toUri().toString();
    }
}

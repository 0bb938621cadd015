package com.toonlens.cli;

import com.toonlens.ToonLensCLI;
import com.toonlens.core.ast.Position;
import com.toonlens.core.query.Location;
import com.toonlens.core.service.ToonLanguageService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to locate the field declaration of a structured-array cell.
 *
 * <p>Takes a 0-based position and prints {@code file:line:column} of the field, 1-based
 * like {@code validate} output. Exits with 1 when the position has no definition.
 */
@Command(
    name = "definition",
    description = "Locate the field a data cell at a 0-based position belongs to",
    mixinStandardHelpOptions = true
)
public class DefinitionCommand implements Callable<Integer> {

    @ParentCommand
    private ToonLensCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Toon file")
    private Path file;

    @Parameters(index = "1", paramLabel = "LINE", description = "0-based line")
    private int line;

    @Parameters(index = "2", paramLabel = "CHARACTER", description = "0-based character")
    private int character;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (line < 0 || character < 0) {
            err.println("Position must not be negative");
            return 2;
        }

        String text;
        try {
            text = SourceFiles.read(file);
        } catch (IOException e) {
            err.println(file + ": cannot read file: " + e.getMessage());
            return 2;
        }

        ToonLanguageService service = parent.createService();
        String uri = SourceFiles.uri(file);
        service.update(uri, text);
        Optional<Location> definition = service.definition(uri, new Position(line, character));
        if (definition.isEmpty()) {
            err.println("No definition at " + line + ":" + character);
            return 1;
        }

        Position start = definition.get().range().start();
        out.printf("%s:%d:%d%n", file, start.line() + 1, start.character() + 1);
        out.flush();
        return 0;
    }
}

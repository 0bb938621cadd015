package com.toonlens.cli;

import com.toonlens.ToonLensCLI;
import com.toonlens.core.ast.Position;
import com.toonlens.core.query.Hover;
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
 * Command to print the hover text for a position.
 *
 * <p>Positions are 0-based, as in editor protocols. Exits with 1 when there is nothing to
 * describe at the position.
 */
@Command(
    name = "hover",
    description = "Describe the token at a 0-based position",
    mixinStandardHelpOptions = true
)
public class HoverCommand implements Callable<Integer> {

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
        Optional<Hover> hover = service.hover(uri, new Position(line, character));
        if (hover.isEmpty()) {
            err.println("No hover information at " + line + ":" + character);
            return 1;
        }

        out.println(hover.get().contents());
        out.flush();
        return 0;
    }
}

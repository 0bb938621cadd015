package com.toonlens.cli;

import com.toonlens.ToonLensCLI;
import com.toonlens.core.ast.DocumentNode;
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
 * Command to print the syntax tree of a Toon file as JSON.
 */
@Command(
    name = "inspect",
    description = "Print the syntax tree of a Toon file as JSON",
    mixinStandardHelpOptions = true
)
public class InspectCommand implements Callable<Integer> {

    @ParentCommand
    private ToonLensCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "File to inspect")
    private Path file;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

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
        Optional<DocumentNode> document = service.document(uri);
        if (document.isEmpty()) {
            err.println(file + ": cannot be parsed");
            return 2;
        }

        out.println(new AstJsonWriter().write(document.get()));
        out.flush();
        return 0;
    }
}

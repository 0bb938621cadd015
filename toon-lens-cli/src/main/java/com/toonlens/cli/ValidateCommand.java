package com.toonlens.cli;

import com.toonlens.ToonLensCLI;
import com.toonlens.core.ast.Position;
import com.toonlens.core.diagnostic.Diagnostic;
import com.toonlens.core.service.ToonLanguageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to report diagnostics for Toon files.
 *
 * <p>Prints one line per diagnostic in the form {@code file:line:column: severity: message}
 * with 1-based line and column. Exits with 1 when any error was reported, 2 when a file
 * could not be read, 0 otherwise. Warnings alone do not fail the command.
 */
@Command(
    name = "validate",
    description = "Report diagnostics for Toon files",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private ToonLensCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to validate")
    private List<Path> files;

    @Override
    public Integer call() {
        ToonLanguageService service = parent.createService();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        int errors = 0;
        int warnings = 0;
        boolean unreadable = false;
        for (Path file : files) {
            String text;
            try {
                text = SourceFiles.read(file);
            } catch (IOException e) {
                err.println(file + ": cannot read file: " + e.getMessage());
                log.debug("Failed to read {}", file, e);
                unreadable = true;
                continue;
            }

            String uri = SourceFiles.uri(file);
            List<Diagnostic> diagnostics = service.update(uri, text);
            service.close(uri);
            for (Diagnostic diagnostic : diagnostics) {
                Position start = diagnostic.range().start();
                out.printf("%s:%d:%d: %s: %s%n", file, start.line() + 1, start.character() + 1,
                    diagnostic.severity().id(), diagnostic.message());
                if (diagnostic.isError()) {
                    errors++;
                } else {
                    warnings++;
                }
            }
        }
        out.flush();

        log.info("Checked {} files: {} errors, {} warnings", files.size(), errors, warnings);
        if (unreadable) {
            return 2;
        }
        return errors > 0 ? 1 : 0;
    }
}

package com.toonlens.cli;

import com.toonlens.ToonLensCLI;
import com.toonlens.core.ast.DocumentNode;
import com.toonlens.core.ast.EmptyNode;
import com.toonlens.core.parser.LinePatterns;
import com.toonlens.core.service.ToonLanguageService;
import com.toonlens.core.visitor.AstVisitor;
import com.toonlens.core.visitor.AstWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to render a Toon file in canonical form.
 *
 * <p>By default prints the canonical text. With {@code --check} prints nothing and exits
 * with 1 when the file differs from its canonical form. With {@code --write} rewrites the
 * file in place.
 *
 * <p>Files containing lines the parser does not recognize are refused (exit 2): the
 * formatter would drop their text.
 */
@Command(
    name = "format",
    description = "Print, check or rewrite a Toon file in canonical form",
    mixinStandardHelpOptions = true
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @ParentCommand
    private ToonLensCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "File to format")
    private Path file;

    @Option(names = {"-w", "--write"}, description = "Rewrite the file in place")
    private boolean write;

    @Option(names = {"-c", "--check"}, description = "Exit with 1 if the file is not formatted")
    private boolean check;

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
        int unrecognized = countUnrecognizedLines(document.get(), text);
        if (unrecognized > 0) {
            err.println(file + ": " + unrecognized + " unrecognized line(s); run 'toonlens validate' first");
            return 2;
        }

        String formatted = service.format(uri).orElseThrow();
        service.close(uri);

        if (check) {
            if (!formatted.equals(text)) {
                err.println(file + ": not formatted");
                return 1;
            }
            return 0;
        }

        if (write) {
            if (formatted.equals(text)) {
                log.info("{} is already formatted", file);
                return 0;
            }
            try {
                SourceFiles.write(file, formatted);
            } catch (IOException e) {
                err.println(file + ": cannot write file: " + e.getMessage());
                return 2;
            }
            log.info("Formatted {}", file);
            return 0;
        }

        out.print(formatted);
        out.flush();
        return 0;
    }

    private static int countUnrecognizedLines(DocumentNode document, String text) {
        String[] lines = LinePatterns.splitLines(text);
        int[] count = {0};
        new AstWalker().walk(document, new AstVisitor() {
            @Override
            public void visitEmpty(EmptyNode node) {
                if (!LinePatterns.isBlank(lines[node.range().start().line()])) {
                    count[0]++;
                }
            }
        });
        return count[0];
    }
}

package com.erbformat.tools;

import com.erbformat.ErbFormat;
import com.erbformat.Version;
import com.erbformat.parser.ErbParseException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parses every {@code .erb} template below a directory and lists the ones that fail, so a code base
 * can be checked before the formatter is run over it.
 */
public final class ParseCheckCli {
    private static final Logger LOGGER = Logger.getLogger(ParseCheckCli.class.getName());

    public record Failure(Path file, String message) {}

    private ParseCheckCli() {}

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: ParseCheckCli <template-directory>");
            System.err.println("erb-format " + Version.RUNTIME);
            System.exit(1);
        }
        Path root = Path.of(args[0]).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("Template directory not found: " + root);
        }
        List<Failure> failures = check(root, System.out);
        for (Failure failure : failures) {
            System.out.println(failure.file() + ": " + failure.message());
        }
        System.out.println(failures.isEmpty() ? "All templates parsed" : failures.size() + " template(s) failed to parse");
        if (!failures.isEmpty()) {
            System.exit(2);
        }
    }

    static List<Failure> check(Path root, PrintStream progress) throws IOException {
        List<Path> templates;
        try (Stream<Path> files = Files.walk(root)) {
            templates =
                    files.filter(Files::isRegularFile)
                            .filter(file -> file.getFileName().toString().endsWith(".erb"))
                            .sorted()
                            .collect(Collectors.toList());
        }
        List<Failure> failures = new ArrayList<>();
        for (Path template : templates) {
            progress.println("Processing " + root.relativize(template));
            try {
                ErbFormat.parse(ErbFormat.read(template));
            } catch (ErbParseException e) {
                LOGGER.log(Level.FINE, "Parse failure in {0} ({1})", new Object[] {template, e.getMessage()});
                failures.add(new Failure(root.relativize(template), e.getMessage()));
            }
        }
        return failures;
    }
}

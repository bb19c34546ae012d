package com.erbformat;

import com.erbformat.format.ErbFormatter;
import com.erbformat.format.FormatOptions;
import com.erbformat.format.TreePrinter;
import com.erbformat.parser.ErbParseException;
import com.erbformat.parser.ErbParser;
import com.erbformat.parser.ast.Document;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Entry points for parsing and formatting ERB templates. */
public final class ErbFormat {

    private ErbFormat() {}

    public static Document parse(String source) throws ErbParseException {
        return new ErbParser().parse(source);
    }

    /** Formats with the settings from {@link FormatOptions#fromEnvironment()}. */
    public static String format(String source) throws ErbParseException {
        return format(source, FormatOptions.fromEnvironment());
    }

    public static String format(String source, int printWidth) throws ErbParseException {
        return format(source, FormatOptions.fromEnvironment().withPrintWidth(printWidth));
    }

    public static String format(String source, FormatOptions options) throws ErbParseException {
        Objects.requireNonNull(options, "options");
        return new ErbFormatter(options).format(parse(source));
    }

    public static String read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public static String prettyPrint(Document document) {
        return new TreePrinter().print(document);
    }
}

package com.erbformat.parser;

import com.erbformat.parser.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "erbformat.debugTokens";
    private static final String PARSER_PROPERTY = "erbformat.debugParser";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "ERBFORMAT_DEBUG_TOKENS";
    private static final String PARSER_ENV = "ERBFORMAT_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    /** When enabled, the parser reports every backtrack it performs. */
    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    public static void logTokens(List<Token> tokens) {
        System.err.println("[erb-format] Token dump for debugging:");
        for (Token token : tokens) {
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-22s @ %4d:%-5d -> %s",
                            token.getKind().name(),
                            token.getLocation().getStartLine(),
                            token.getLocation().getStartOffset(),
                            token.getText().replace("\n", "\\n"));
            System.err.printf(Locale.ROOT, "  %s%n", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static void captureDiagnostic(String message) {
        System.err.printf(Locale.ROOT, "[erb-format] %s%n", message);
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}

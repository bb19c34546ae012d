package com.erbformat.format;

import java.util.Objects;
import java.util.function.UnaryOperator;

/** Layout settings for {@link ErbFormatter}. */
public final class FormatOptions {
    public static final int DEFAULT_PRINT_WIDTH = 80;
    public static final int DEFAULT_INDENT_WIDTH = 2;

    static final String PRINT_WIDTH_PROPERTY = "erbformat.printWidth";
    static final String INDENT_WIDTH_PROPERTY = "erbformat.indentWidth";
    /** Environment fallbacks kept for convenience; prefer using system properties. */
    static final String PRINT_WIDTH_ENV = "ERBFORMAT_PRINT_WIDTH";
    static final String INDENT_WIDTH_ENV = "ERBFORMAT_INDENT_WIDTH";

    private static final FormatOptions DEFAULTS = new FormatOptions(DEFAULT_PRINT_WIDTH, DEFAULT_INDENT_WIDTH);

    private final int printWidth;
    private final int indentWidth;

    public FormatOptions(int printWidth, int indentWidth) {
        if (printWidth <= 0) {
            throw new IllegalArgumentException("printWidth must be positive: " + printWidth);
        }
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        }
        this.printWidth = printWidth;
        this.indentWidth = indentWidth;
    }

    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads {@code erbformat.printWidth} and {@code erbformat.indentWidth}, falling back to the
     * {@code ERBFORMAT_PRINT_WIDTH} and {@code ERBFORMAT_INDENT_WIDTH} environment variables and then
     * to the defaults.
     */
    public static FormatOptions fromEnvironment() {
        return fromSources(System::getProperty, System::getenv);
    }

    static FormatOptions fromSources(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        int printWidth = read(properties, environment, PRINT_WIDTH_PROPERTY, PRINT_WIDTH_ENV, DEFAULT_PRINT_WIDTH);
        int indentWidth = read(properties, environment, INDENT_WIDTH_PROPERTY, INDENT_WIDTH_ENV, DEFAULT_INDENT_WIDTH);
        return new FormatOptions(printWidth, indentWidth);
    }

    private static int read(
            UnaryOperator<String> properties,
            UnaryOperator<String> environment,
            String property,
            String env,
            int fallback) {
        String value = properties.apply(property);
        String source = property;
        if (value == null) {
            value = environment.apply(env);
            source = env;
        }
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + source + ": " + value, e);
        }
    }

    public int getPrintWidth() {
        return printWidth;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public FormatOptions withPrintWidth(int width) {
        return new FormatOptions(width, indentWidth);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FormatOptions)) {
            return false;
        }
        FormatOptions other = (FormatOptions) obj;
        return printWidth == other.printWidth && indentWidth == other.indentWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(printWidth, indentWidth);
    }

    @Override
    public String toString() {
        return "FormatOptions{printWidth=" + printWidth + ", indentWidth=" + indentWidth + "}";
    }
}

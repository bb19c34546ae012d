package com.erbformat.parser.ast;

import java.util.Objects;

/**
 * The code fragment between an ERB opener (and keyword) and its closing delimiter, kept as the raw
 * source text. Whether it parses as code is decided at formatting time.
 */
public final class ErbContent {
    private final String value;

    public ErbContent(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    public String getTrimmed() {
        return value.strip();
    }

    public boolean isBlank() {
        return value.isBlank();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ErbContent && value.equals(((ErbContent) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

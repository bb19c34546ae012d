package com.erbformat.code.ruby;

import java.util.Objects;

final class RubyToken {
    enum Type {
        WORD,
        LABEL,
        STRING,
        SYMBOL,
        REGEXP,
        COMMENT,
        OPEN,
        CLOSE,
        COMMA,
        SEMICOLON,
        OPERATOR,
        SPACE,
        NEWLINE
    }

    private final Type type;
    private final String text;

    RubyToken(Type type, String text) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
    }

    Type type() {
        return type;
    }

    String text() {
        return text;
    }

    boolean isLayout() {
        return type == Type.SPACE || type == Type.NEWLINE;
    }

    /** Whether an expression can end with this token, which decides how a following '/' or '%' reads. */
    boolean endsValue() {
        switch (type) {
            case WORD:
            case STRING:
            case SYMBOL:
            case REGEXP:
            case CLOSE:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}

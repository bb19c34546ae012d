package com.erbformat.parser;

import com.erbformat.parser.ast.Location;

/** Raised when the lexer finds input that no rule of its current mode accepts. */
public final class ErbLexicalException extends ErbParseException {
    private final int offendingCodePoint;
    private final int column;

    public ErbLexicalException(
            String message, Location location, int offendingCodePoint, int column, Throwable cause) {
        super(message, location, cause);
        this.offendingCodePoint = offendingCodePoint;
        this.column = column;
    }

    public int getOffendingCodePoint() {
        return offendingCodePoint;
    }

    public int getOffset() {
        return getLocation().getStartOffset();
    }

    public int getLine() {
        return getLocation().getStartLine();
    }

    /** 1-based column of the offending character. */
    public int getColumn() {
        return column;
    }
}

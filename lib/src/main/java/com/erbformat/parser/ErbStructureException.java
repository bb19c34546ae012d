package com.erbformat.parser;

import com.erbformat.parser.ast.Location;

/**
 * Raised when the token stream is well formed but violates the template structure: unclosed or
 * mismatched elements, unterminated control chains and blocks, a second doctype, invalid element
 * names. {@link #getLocation()} is the construct that failed; {@link #getUnexpectedLocation()} is the
 * token that triggered the failure, when there is one.
 */
public final class ErbStructureException extends ErbParseException {
    private final Location unexpectedLocation;

    public ErbStructureException(String message, Location location) {
        this(message, location, null);
    }

    public ErbStructureException(String message, Location location, Location unexpectedLocation) {
        super(message, location);
        this.unexpectedLocation = unexpectedLocation;
    }

    public Location getUnexpectedLocation() {
        return unexpectedLocation;
    }
}

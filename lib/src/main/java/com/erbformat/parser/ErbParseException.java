package com.erbformat.parser;

import com.erbformat.parser.ast.Location;

/**
 * Checked exception signalling that a template could not be parsed. Every instance points at the
 * source span that caused the failure.
 */
public class ErbParseException extends Exception {
    private final Location location;

    public ErbParseException(String message, Location location) {
        super(message);
        this.location = location;
    }

    public ErbParseException(String message, Location location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public Location getLocation() {
        return location;
    }
}

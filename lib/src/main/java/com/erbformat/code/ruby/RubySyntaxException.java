package com.erbformat.code.ruby;

/** Raised while reading a fragment the formatter does not understand well enough to rewrite. */
final class RubySyntaxException extends Exception {
    RubySyntaxException(String message) {
        super(message);
    }
}

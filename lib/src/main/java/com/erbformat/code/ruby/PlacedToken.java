package com.erbformat.code.ruby;

/**
 * A token together with its nesting depth (open brackets plus open block keywords before it) and,
 * for line breaks, whether the break separates statements inside a nested body and must be kept.
 */
final class PlacedToken {
    private final RubyToken token;
    private final int depth;
    private final boolean hardBreak;
    private final boolean keyword;

    PlacedToken(RubyToken token, int depth, boolean hardBreak, boolean keyword) {
        this.token = token;
        this.depth = depth;
        this.hardBreak = hardBreak;
        this.keyword = keyword;
    }

    RubyToken token() {
        return token;
    }

    RubyToken.Type type() {
        return token.type();
    }

    String text() {
        return token.text();
    }

    int depth() {
        return depth;
    }

    boolean isHardBreak() {
        return hardBreak;
    }

    /** Whether this word acts as a Ruby keyword here rather than as a method or label name. */
    boolean isKeyword() {
        return keyword;
    }
}

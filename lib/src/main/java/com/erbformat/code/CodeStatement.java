package com.erbformat.code;

import java.util.List;

/** One top-level statement of a parsed fragment. */
public interface CodeStatement {

    /** Canonical single-line text, or the first line for statements that must span lines. */
    String text();

    boolean containsConditional();

    /**
     * Lay the statement out in rows no wider than {@code maxWidth} where possible. Rows after the
     * first carry their indentation relative to the first.
     */
    List<String> render(int maxWidth);
}

package com.erbformat.format.doc;

import java.util.Objects;

/** Adds one indentation level to the line breaks inside it. */
public final class Indent implements Doc {
    private final Doc contents;

    Indent(Doc contents) {
        this.contents = Objects.requireNonNull(contents, "contents");
    }

    public Doc getContents() {
        return contents;
    }

    @Override
    public boolean propagatesBreak() {
        return contents.propagatesBreak();
    }
}

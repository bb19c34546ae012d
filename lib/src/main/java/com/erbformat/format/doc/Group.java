package com.erbformat.format.doc;

import java.util.Objects;

/**
 * Unit of layout decisions: the breakables directly inside a group are either all printed flat or
 * all printed as line breaks. A group containing a forced break is always broken.
 */
public final class Group implements Doc {
    private final Doc contents;
    private final boolean broken;

    Group(Doc contents) {
        this.contents = Objects.requireNonNull(contents, "contents");
        this.broken = contents.propagatesBreak();
    }

    public Doc getContents() {
        return contents;
    }

    public boolean isBroken() {
        return broken;
    }

    @Override
    public boolean propagatesBreak() {
        return broken;
    }
}

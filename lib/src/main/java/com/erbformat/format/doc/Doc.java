package com.erbformat.format.doc;

/** Immutable layout document consumed by {@link DocRenderer}. */
public sealed interface Doc permits Text, Concat, Group, Indent, Breakable {

    /** Whether a forced break somewhere inside makes every enclosing group break. */
    boolean propagatesBreak();
}

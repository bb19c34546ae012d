package com.erbformat.format.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for {@link Doc} values, plus an accumulator for assembling a sequence of parts.
 *
 * <pre>{@code
 * DocBuilder parts = new DocBuilder();
 * parts.text("<div").add(DocBuilder.indent(attributes)).text(">");
 * Doc doc = DocBuilder.group(parts.build());
 * }</pre>
 */
public final class DocBuilder {
    private static final Text EMPTY = new Text("");

    private final List<Doc> parts = new ArrayList<>();

    public DocBuilder text(String value) {
        if (!value.isEmpty()) {
            parts.add(new Text(value));
        }
        return this;
    }

    public DocBuilder add(Doc doc) {
        parts.add(doc);
        return this;
    }

    public Doc build() {
        if (parts.isEmpty()) {
            return EMPTY;
        }
        return parts.size() == 1 ? parts.get(0) : new Concat(parts);
    }

    public static Doc empty() {
        return EMPTY;
    }

    public static Doc textOf(String value) {
        return value.isEmpty() ? EMPTY : new Text(value);
    }

    public static Doc concat(Doc... docs) {
        return new Concat(Arrays.asList(docs));
    }

    public static Doc concat(List<? extends Doc> docs) {
        return new Concat(new ArrayList<>(docs));
    }

    public static Doc group(Doc... docs) {
        return new Group(docs.length == 1 ? docs[0] : concat(docs));
    }

    public static Doc indent(Doc... docs) {
        return new Indent(docs.length == 1 ? docs[0] : concat(docs));
    }

    public static Doc breakable(String separator) {
        return new Breakable(separator, Breakable.Force.NONE);
    }

    /** A line break that also breaks every enclosing group. */
    public static Doc forced() {
        return new Breakable(" ", Breakable.Force.BREAK);
    }

    /** A line break that leaves enclosing groups free to stay flat. */
    public static Doc localBreak() {
        return new Breakable(" ", Breakable.Force.LOCAL);
    }

    /** A line break that starts the next line at column zero, for text that must keep its layout. */
    public static Doc literalBreak() {
        return new Breakable(" ", Breakable.Force.LITERAL);
    }

    /** Joins {@code docs} with {@code separator} between consecutive elements. */
    public static Doc seplist(List<? extends Doc> docs, Doc separator) {
        List<Doc> joined = new ArrayList<>();
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) {
                joined.add(separator);
            }
            joined.add(docs.get(i));
        }
        return new Concat(joined);
    }
}

package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A document type declaration: {@code <!DOCTYPE}, its parts (names, bare words and quoted
 * identifiers) and the closing {@code >}.
 */
public final class Doctype implements Node {
    private final Token opening;
    private final List<Node> parts;
    private final Token closing;
    private final int newLine;

    public Doctype(Token opening, List<Node> parts, Token closing, int newLine) {
        this.opening = Objects.requireNonNull(opening, "opening");
        this.parts = List.copyOf(parts);
        this.closing = Objects.requireNonNull(closing, "closing");
        this.newLine = newLine;
    }

    public Token getOpening() {
        return opening;
    }

    public List<Node> getParts() {
        return parts;
    }

    public Token getClosing() {
        return closing;
    }

    @Override
    public int getNewLine() {
        return newLine;
    }

    @Override
    public Doctype withoutNewLine() {
        return newLine == 0 ? this : new Doctype(opening, parts, closing, 0);
    }

    @Override
    public Location getLocation() {
        return opening.getLocation().to(closing.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(opening);
        children.addAll(parts);
        children.add(closing);
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDoctype(this);
    }
}

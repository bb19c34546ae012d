package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A tag closed by {@code do ... %>}, its body, and the {@code end} that closes the block. */
public final class ErbBlock implements Node {
    private final ErbTag head;
    private final List<Node> elements;
    private final ErbEnd end;

    public ErbBlock(ErbTag head, List<Node> elements, ErbEnd end) {
        this.head = Objects.requireNonNull(head, "head");
        this.elements = List.copyOf(elements);
        this.end = Objects.requireNonNull(end, "end");
    }

    public ErbTag getHead() {
        return head;
    }

    public List<Node> getElements() {
        return elements;
    }

    public ErbEnd getEnd() {
        return end;
    }

    @Override
    public int getNewLine() {
        return end.getNewLine();
    }

    @Override
    public ErbBlock withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbBlock(head, elements, end.withoutNewLine());
    }

    @Override
    public Location getLocation() {
        return head.getLocation().to(end.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(head);
        children.addAll(elements);
        children.add(end);
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbBlock(this);
    }
}

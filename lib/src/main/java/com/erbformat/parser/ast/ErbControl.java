package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A link of a control chain ({@code if/elsif/else/end}, {@code unless/else/end},
 * {@code case/when/else/end}): the head tag, the body up to the next link and the next link itself.
 * The chain's trailing line-break marker is the one of its final {@code end}.
 */
public abstract sealed class ErbControl implements Node
        permits ErbIf, ErbUnless, ErbElsif, ErbElse, ErbCase, ErbCaseWhen {

    private final ErbTag head;
    private final List<Node> elements;

    protected ErbControl(ErbTag head, List<Node> elements) {
        this.head = Objects.requireNonNull(head, "head");
        this.elements = List.copyOf(elements);
    }

    public ErbTag getHead() {
        return head;
    }

    public List<Node> getElements() {
        return elements;
    }

    public abstract Node getConsequent();

    @Override
    public int getNewLine() {
        return getConsequent().getNewLine();
    }

    @Override
    public abstract ErbControl withoutNewLine();

    @Override
    public Location getLocation() {
        return head.getLocation().to(getConsequent().getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(head);
        children.addAll(elements);
        children.add(getConsequent());
        return children;
    }
}

package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ErbUnless extends ErbControl {
    private final UnlessTerminator consequent;

    public ErbUnless(ErbTag head, List<Node> elements, UnlessTerminator consequent) {
        super(head, elements);
        this.consequent = Objects.requireNonNull(consequent, "consequent");
    }

    @Override
    public UnlessTerminator getConsequent() {
        return consequent;
    }

    @Override
    public ErbUnless withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbUnless(getHead(), getElements(), consequent.withoutNewLine());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbUnless(this);
    }
}

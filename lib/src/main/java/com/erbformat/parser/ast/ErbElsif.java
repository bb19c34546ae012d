package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ErbElsif extends ErbControl implements IfTerminator {
    private final IfTerminator consequent;

    public ErbElsif(ErbTag head, List<Node> elements, IfTerminator consequent) {
        super(head, elements);
        this.consequent = Objects.requireNonNull(consequent, "consequent");
    }

    @Override
    public IfTerminator getConsequent() {
        return consequent;
    }

    @Override
    public ErbElsif withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbElsif(getHead(), getElements(), consequent.withoutNewLine());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbElsif(this);
    }
}

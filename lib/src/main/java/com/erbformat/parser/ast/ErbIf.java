package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ErbIf extends ErbControl {
    private final IfTerminator consequent;

    public ErbIf(ErbTag head, List<Node> elements, IfTerminator consequent) {
        super(head, elements);
        this.consequent = Objects.requireNonNull(consequent, "consequent");
    }

    @Override
    public IfTerminator getConsequent() {
        return consequent;
    }

    @Override
    public ErbIf withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbIf(getHead(), getElements(), consequent.withoutNewLine());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbIf(this);
    }
}

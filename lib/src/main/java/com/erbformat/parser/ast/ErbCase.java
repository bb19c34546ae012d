package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ErbCase extends ErbControl {
    private final CaseTerminator consequent;

    public ErbCase(ErbTag head, List<Node> elements, CaseTerminator consequent) {
        super(head, elements);
        this.consequent = Objects.requireNonNull(consequent, "consequent");
    }

    @Override
    public CaseTerminator getConsequent() {
        return consequent;
    }

    @Override
    public ErbCase withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbCase(getHead(), getElements(), consequent.withoutNewLine());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbCase(this);
    }
}

package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ErbCaseWhen extends ErbControl implements CaseTerminator {
    private final CaseTerminator consequent;

    public ErbCaseWhen(ErbTag head, List<Node> elements, CaseTerminator consequent) {
        super(head, elements);
        this.consequent = Objects.requireNonNull(consequent, "consequent");
    }

    @Override
    public CaseTerminator getConsequent() {
        return consequent;
    }

    @Override
    public ErbCaseWhen withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbCaseWhen(getHead(), getElements(), consequent.withoutNewLine());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbCaseWhen(this);
    }
}

package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** The {@code else} link of an if, unless or case chain; always closed by {@code end}. */
public final class ErbElse extends ErbControl implements IfTerminator, UnlessTerminator, CaseTerminator {
    private final ErbEnd consequent;

    public ErbElse(ErbTag head, List<Node> elements, ErbEnd consequent) {
        super(head, elements);
        this.consequent = Objects.requireNonNull(consequent, "consequent");
    }

    @Override
    public ErbEnd getConsequent() {
        return consequent;
    }

    @Override
    public ErbElse withoutNewLine() {
        return getNewLine() == 0 ? this : new ErbElse(getHead(), getElements(), consequent.withoutNewLine());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbElse(this);
    }
}

package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** The {@code <% end %>} tag that terminates a chain or a block. */
public final class ErbEnd implements IfTerminator, UnlessTerminator, CaseTerminator {
    private final ErbTag tag;

    public ErbEnd(ErbTag tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public ErbTag getTag() {
        return tag;
    }

    @Override
    public int getNewLine() {
        return tag.getNewLine();
    }

    @Override
    public ErbEnd withoutNewLine() {
        return tag.getNewLine() == 0 ? this : new ErbEnd(tag.withoutNewLine());
    }

    @Override
    public Location getLocation() {
        return tag.getLocation();
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbEnd(this);
    }
}

package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ClosingTag implements Node {
    private final Token opening;
    private final Token name;
    private final Token closing;

    public ClosingTag(Token opening, Token name, Token closing) {
        this.opening = Objects.requireNonNull(opening, "opening");
        this.name = Objects.requireNonNull(name, "name");
        this.closing = Objects.requireNonNull(closing, "closing");
    }

    public Token getOpening() {
        return opening;
    }

    public Token getName() {
        return name;
    }

    public Token getClosing() {
        return closing;
    }

    @Override
    public Location getLocation() {
        return opening.getLocation().to(closing.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        return List.of(opening, name, closing);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitClosingTag(this);
    }
}

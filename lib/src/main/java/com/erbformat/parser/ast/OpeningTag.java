package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The opening tag of an element: {@code <}, the element name, its attributes (plain attributes or
 * bare ERB tags) and either {@code >} or {@code />}.
 */
public final class OpeningTag implements Node {
    private final Token opening;
    private final Token name;
    private final List<Node> attributes;
    private final Token closing;
    private final int newLine;

    public OpeningTag(Token opening, Token name, List<Node> attributes, Token closing, int newLine) {
        this.opening = Objects.requireNonNull(opening, "opening");
        this.name = Objects.requireNonNull(name, "name");
        this.attributes = List.copyOf(attributes);
        this.closing = Objects.requireNonNull(closing, "closing");
        this.newLine = newLine;
    }

    public Token getOpening() {
        return opening;
    }

    public Token getName() {
        return name;
    }

    public List<Node> getAttributes() {
        return attributes;
    }

    public Token getClosing() {
        return closing;
    }

    public boolean isSelfClosing() {
        return closing.getKind() == TokenKind.ELEMENT_SELF_CLOSE;
    }

    @Override
    public int getNewLine() {
        return newLine;
    }

    @Override
    public OpeningTag withoutNewLine() {
        return newLine == 0 ? this : new OpeningTag(opening, name, attributes, closing, 0);
    }

    @Override
    public Location getLocation() {
        return opening.getLocation().to(closing.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(opening);
        children.add(name);
        children.addAll(attributes);
        children.add(closing);
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOpeningTag(this);
    }
}

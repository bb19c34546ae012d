package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A {@code key} or {@code key=value} pair inside an opening tag. */
public final class HtmlAttribute implements Node {
    private final Token key;
    private final Token equals;
    private final HtmlString value;

    public HtmlAttribute(Token key, Token equals, HtmlString value) {
        this.key = Objects.requireNonNull(key, "key");
        if ((equals == null) != (value == null)) {
            throw new IllegalArgumentException("equals and value must be given together");
        }
        this.equals = equals;
        this.value = value;
    }

    public Token getKey() {
        return key;
    }

    public Token getEquals() {
        return equals;
    }

    public HtmlString getValue() {
        return value;
    }

    @Override
    public Location getLocation() {
        return value == null ? key.getLocation() : key.getLocation().to(value.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(key);
        if (value != null) {
            children.add(equals);
            children.add(value);
        }
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}

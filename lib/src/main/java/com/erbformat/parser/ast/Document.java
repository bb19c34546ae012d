package com.erbformat.parser.ast;

import java.util.List;

/** Root of the syntax tree: the top-level nodes of a template in source order. */
public final class Document implements Node {
    private static final Location EMPTY = new Location(0, 0, 1, 1);

    private final List<Node> elements;
    private final Location location;

    public Document(List<Node> elements) {
        this.elements = List.copyOf(elements);
        this.location =
                this.elements.isEmpty()
                        ? EMPTY
                        : this.elements.get(0).getLocation().to(this.elements.get(this.elements.size() - 1).getLocation());
    }

    public List<Node> getElements() {
        return elements;
    }

    @Override
    public Location getLocation() {
        return location;
    }

    @Override
    public List<Node> childNodes() {
        return elements;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDocument(this);
    }
}

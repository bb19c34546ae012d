package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** Line breaks that no preceding node could carry, e.g. at the very start of a template. */
public final class NewLine implements Node {
    private final Location location;
    private final int count;

    public NewLine(Location location, int count) {
        this.location = Objects.requireNonNull(location, "location");
        this.count = count;
    }

    public int getCount() {
        return count;
    }

    @Override
    public Location getLocation() {
        return location;
    }

    @Override
    public List<Node> childNodes() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNewLine(this);
    }
}

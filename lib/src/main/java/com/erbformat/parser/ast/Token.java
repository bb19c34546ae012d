package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** A lexical token: its kind, the raw source text it covers and where it sits. */
public final class Token implements Node {
    private final TokenKind kind;
    private final String text;
    private final Location location;

    public Token(TokenKind kind, String text, Location location) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.location = Objects.requireNonNull(location, "location");
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
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
        return visitor.visitToken(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Token)) {
            return false;
        }
        Token other = (Token) obj;
        return kind == other.kind && text.equals(other.text) && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, location);
    }

    @Override
    public String toString() {
        return kind + " " + text + " @ " + location;
    }
}

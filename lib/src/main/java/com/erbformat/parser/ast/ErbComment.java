package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** An ERB comment tag ({@code <%# ... %>}). */
public final class ErbComment implements Node {
    private final Token token;
    private final int newLine;

    public ErbComment(Token token, int newLine) {
        this.token = Objects.requireNonNull(token, "token");
        this.newLine = newLine;
    }

    public Token getToken() {
        return token;
    }

    @Override
    public int getNewLine() {
        return newLine;
    }

    @Override
    public ErbComment withoutNewLine() {
        return newLine == 0 ? this : new ErbComment(token, 0);
    }

    @Override
    public Location getLocation() {
        return token.getLocation();
    }

    @Override
    public List<Node> childNodes() {
        return List.of(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbComment(this);
    }
}

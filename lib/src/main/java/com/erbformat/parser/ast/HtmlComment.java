package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** An HTML comment, kept verbatim. */
public final class HtmlComment implements Node {
    private final Token token;
    private final int newLine;

    public HtmlComment(Token token, int newLine) {
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
    public HtmlComment withoutNewLine() {
        return newLine == 0 ? this : new HtmlComment(token, 0);
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
        return visitor.visitHtmlComment(this);
    }
}

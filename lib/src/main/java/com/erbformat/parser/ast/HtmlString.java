package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An attribute value. Quoted values hold literal text tokens interleaved with nested ERB tags; a
 * bare value has no quotes and a single token.
 */
public final class HtmlString implements Node {
    private final Token openQuote;
    private final List<Node> contents;
    private final Token closeQuote;
    private final Location location;

    public HtmlString(Token openQuote, List<Node> contents, Token closeQuote) {
        this.openQuote = Objects.requireNonNull(openQuote, "openQuote");
        this.contents = List.copyOf(contents);
        this.closeQuote = Objects.requireNonNull(closeQuote, "closeQuote");
        this.location = openQuote.getLocation().to(closeQuote.getLocation());
        for (Node content : this.contents) {
            if (!(content instanceof Token) && !(content instanceof ErbTag)) {
                throw new IllegalArgumentException("Unexpected attribute content " + content);
            }
        }
    }

    private HtmlString(Token bareValue) {
        this.openQuote = null;
        this.contents = List.of(bareValue);
        this.closeQuote = null;
        this.location = bareValue.getLocation();
    }

    public static HtmlString bare(Token value) {
        return new HtmlString(Objects.requireNonNull(value, "value"));
    }

    public boolean isQuoted() {
        return openQuote != null;
    }

    public Token getOpenQuote() {
        return openQuote;
    }

    public List<Node> getContents() {
        return contents;
    }

    public Token getCloseQuote() {
        return closeQuote;
    }

    @Override
    public Location getLocation() {
        return location;
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        if (openQuote != null) {
            children.add(openQuote);
        }
        children.addAll(contents);
        if (closeQuote != null) {
            children.add(closeQuote);
        }
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHtmlString(this);
    }
}

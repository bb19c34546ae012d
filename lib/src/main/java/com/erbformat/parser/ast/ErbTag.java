package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A single ERB tag: opener ({@code <%}, {@code <%=}, {@code <%==}, {@code <%-}), optional control
 * keyword, code fragment and closing delimiter ({@code %>}, {@code -%>} or a block-opening
 * {@code do ... %>}).
 */
public final class ErbTag implements Node {
    private final Token opening;
    private final Token keyword;
    private final ErbContent content;
    private final Token closing;
    private final int newLine;

    public ErbTag(Token opening, Token keyword, ErbContent content, Token closing, int newLine) {
        this.opening = Objects.requireNonNull(opening, "opening");
        this.keyword = keyword;
        this.content = Objects.requireNonNull(content, "content");
        this.closing = Objects.requireNonNull(closing, "closing");
        this.newLine = newLine;
    }

    public Token getOpening() {
        return opening;
    }

    public Token getKeyword() {
        return keyword;
    }

    /** The keyword without surrounding whitespace, or {@code null} for a plain tag. */
    public String getKeywordText() {
        return keyword == null ? null : keyword.getText().strip().toLowerCase(Locale.ROOT);
    }

    public ErbContent getContent() {
        return content;
    }

    public Token getClosing() {
        return closing;
    }

    public boolean opensBlock() {
        return closing.getKind() == TokenKind.ERB_DO_CLOSE;
    }

    @Override
    public int getNewLine() {
        return newLine;
    }

    @Override
    public ErbTag withoutNewLine() {
        return newLine == 0 ? this : new ErbTag(opening, keyword, content, closing, 0);
    }

    @Override
    public Location getLocation() {
        return opening.getLocation().to(closing.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(opening);
        if (keyword != null) {
            children.add(keyword);
        }
        children.add(closing);
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitErbTag(this);
    }
}

package com.erbformat.parser.ast;

import java.util.List;
import java.util.Objects;

/** A run of markup text and inline whitespace on a single source line. */
public final class CharData implements Node {
    private final Token value;
    private final int newLine;

    public CharData(Token value, int newLine) {
        this.value = Objects.requireNonNull(value, "value");
        this.newLine = newLine;
    }

    public Token getValue() {
        return value;
    }

    public String getText() {
        return value.getText();
    }

    public boolean isBlank() {
        return value.getText().isBlank();
    }

    public boolean hasLeadingWhitespace() {
        String text = value.getText();
        return !text.isEmpty() && Character.isWhitespace(text.charAt(0));
    }

    public boolean hasTrailingWhitespace() {
        String text = value.getText();
        return !text.isEmpty() && Character.isWhitespace(text.charAt(text.length() - 1));
    }

    @Override
    public int getNewLine() {
        return newLine;
    }

    @Override
    public CharData withoutNewLine() {
        return newLine == 0 ? this : new CharData(value, 0);
    }

    @Override
    public Location getLocation() {
        return value.getLocation();
    }

    @Override
    public List<Node> childNodes() {
        return List.of(value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCharData(this);
    }
}

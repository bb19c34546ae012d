package com.erbformat.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A markup element. Self-closing and void elements carry only their opening tag; every other
 * element has a (possibly empty) list of children and a closing tag with the same name.
 */
public final class HtmlElement implements Node {
    private static final Set<String> VOID_ELEMENTS =
            Set.of(
                    "area", "base", "br", "col", "command", "embed", "hr", "img", "input", "keygen",
                    "link", "meta", "param", "source", "track", "wbr");

    private final OpeningTag openingTag;
    private final List<Node> elements;
    private final ClosingTag closingTag;
    private final int newLine;

    private HtmlElement(OpeningTag openingTag, List<Node> elements, ClosingTag closingTag, int newLine) {
        this.openingTag = Objects.requireNonNull(openingTag, "openingTag");
        this.elements = elements == null ? null : List.copyOf(elements);
        this.closingTag = closingTag;
        this.newLine = newLine;
    }

    public static HtmlElement withBody(
            OpeningTag openingTag, List<Node> elements, ClosingTag closingTag, int newLine) {
        Objects.requireNonNull(elements, "elements");
        Objects.requireNonNull(closingTag, "closingTag");
        return new HtmlElement(openingTag, elements, closingTag, newLine);
    }

    public static HtmlElement withoutBody(OpeningTag openingTag) {
        return new HtmlElement(openingTag.withoutNewLine(), null, null, openingTag.getNewLine());
    }

    public static boolean isVoidElement(String name) {
        return VOID_ELEMENTS.contains(name.toLowerCase(Locale.ROOT));
    }

    public OpeningTag getOpeningTag() {
        return openingTag;
    }

    /** Children of the element, or {@code null} for self-closing and void elements. */
    public List<Node> getElements() {
        return elements;
    }

    public ClosingTag getClosingTag() {
        return closingTag;
    }

    public String getName() {
        return openingTag.getName().getText();
    }

    public boolean hasBody() {
        return elements != null;
    }

    public boolean isVoid() {
        return isVoidElement(getName());
    }

    @Override
    public int getNewLine() {
        return newLine;
    }

    @Override
    public HtmlElement withoutNewLine() {
        return newLine == 0 ? this : new HtmlElement(openingTag, elements, closingTag, 0);
    }

    @Override
    public Location getLocation() {
        return closingTag == null
                ? openingTag.getLocation()
                : openingTag.getLocation().to(closingTag.getLocation());
    }

    @Override
    public List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        children.add(openingTag);
        if (elements != null) {
            children.addAll(elements);
        }
        if (closingTag != null) {
            children.add(closingTag);
        }
        return children;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHtmlElement(this);
    }
}

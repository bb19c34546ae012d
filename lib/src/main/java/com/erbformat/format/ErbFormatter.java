package com.erbformat.format;

import static com.erbformat.format.doc.DocBuilder.breakable;
import static com.erbformat.format.doc.DocBuilder.concat;
import static com.erbformat.format.doc.DocBuilder.forced;
import static com.erbformat.format.doc.DocBuilder.group;
import static com.erbformat.format.doc.DocBuilder.indent;
import static com.erbformat.format.doc.DocBuilder.literalBreak;
import static com.erbformat.format.doc.DocBuilder.localBreak;
import static com.erbformat.format.doc.DocBuilder.seplist;
import static com.erbformat.format.doc.DocBuilder.textOf;

import com.erbformat.code.CodeFormatter;
import com.erbformat.code.CodeFragment;
import com.erbformat.code.CodeStatement;
import com.erbformat.code.ruby.RubyCodeFormatter;
import com.erbformat.format.doc.Doc;
import com.erbformat.format.doc.DocBuilder;
import com.erbformat.format.doc.DocRenderer;
import com.erbformat.parser.ast.CharData;
import com.erbformat.parser.ast.ClosingTag;
import com.erbformat.parser.ast.Doctype;
import com.erbformat.parser.ast.Document;
import com.erbformat.parser.ast.ErbBlock;
import com.erbformat.parser.ast.ErbCase;
import com.erbformat.parser.ast.ErbCaseWhen;
import com.erbformat.parser.ast.ErbComment;
import com.erbformat.parser.ast.ErbControl;
import com.erbformat.parser.ast.ErbElse;
import com.erbformat.parser.ast.ErbElsif;
import com.erbformat.parser.ast.ErbEnd;
import com.erbformat.parser.ast.ErbIf;
import com.erbformat.parser.ast.ErbTag;
import com.erbformat.parser.ast.ErbUnless;
import com.erbformat.parser.ast.HtmlAttribute;
import com.erbformat.parser.ast.HtmlComment;
import com.erbformat.parser.ast.HtmlElement;
import com.erbformat.parser.ast.HtmlString;
import com.erbformat.parser.ast.NewLine;
import com.erbformat.parser.ast.Node;
import com.erbformat.parser.ast.NodeVisitor;
import com.erbformat.parser.ast.OpeningTag;
import com.erbformat.parser.ast.Token;
import com.erbformat.parser.ast.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites a parsed template into its canonical layout. Formatting the output again yields the same
 * text.
 */
public final class ErbFormatter implements NodeVisitor<Doc> {
    private static final Logger LOGGER = Logger.getLogger(ErbFormatter.class.getName());

    /** How two neighbouring siblings were separated in the source. */
    private enum Gap {
        NONE,
        SPACE,
        NEWLINE,
        BLANK
    }

    private final CodeFormatter codeFormatter;
    private final FormatOptions options;

    public ErbFormatter() {
        this(new RubyCodeFormatter(), FormatOptions.defaults());
    }

    public ErbFormatter(FormatOptions options) {
        this(new RubyCodeFormatter(), options);
    }

    public ErbFormatter(CodeFormatter codeFormatter, FormatOptions options) {
        this.codeFormatter = Objects.requireNonNull(codeFormatter, "codeFormatter");
        this.options = Objects.requireNonNull(options, "options");
    }

    public String format(Document document) {
        Doc doc = document.accept(this);
        return new DocRenderer(options.getPrintWidth(), options.getIndentWidth()).render(doc);
    }

    @Override
    public Doc visitDocument(Document node) {
        List<Node> children = meaningful(node.getElements());
        if (children.isEmpty()) {
            return DocBuilder.empty();
        }
        return concat(layoutChildren(node.getElements()), forced());
    }

    // Sibling layout.

    private static List<Node> meaningful(List<Node> nodes) {
        List<Node> kept = new ArrayList<>();
        for (Node node : nodes) {
            if (!(node instanceof NewLine) && !(node instanceof CharData && ((CharData) node).isBlank())) {
                kept.add(node);
            }
        }
        return kept;
    }

    /**
     * Lays out a sequence of siblings. Line breaks and blank-text nodes between siblings are folded
     * into the gap between the nodes around them; text and single-tag runs are grouped so they stay
     * on one line where they fit, and a blank line splits a run.
     */
    private Doc layoutChildren(List<Node> nodes) {
        List<Node> kept = new ArrayList<>();
        List<Gap> gaps = new ArrayList<>();
        int pendingNewLines = 0;
        boolean pendingSpace = false;
        for (Node node : nodes) {
            if (node instanceof NewLine) {
                pendingNewLines += ((NewLine) node).getCount();
                continue;
            }
            if (node instanceof CharData && ((CharData) node).isBlank()) {
                pendingSpace |= !((CharData) node).getText().isEmpty();
                pendingNewLines += node.getNewLine();
                continue;
            }
            if (!kept.isEmpty()) {
                boolean space = pendingSpace || (node instanceof CharData && ((CharData) node).hasLeadingWhitespace());
                gaps.add(classify(pendingNewLines, space));
            }
            kept.add(node);
            pendingNewLines = node.getNewLine();
            pendingSpace = node instanceof CharData && ((CharData) node).hasTrailingWhitespace();
        }
        if (!kept.isEmpty()) {
            kept.set(kept.size() - 1, kept.get(kept.size() - 1).withoutNewLine());
        }

        DocBuilder out = new DocBuilder();
        List<Doc> run = new ArrayList<>();
        for (int i = 0; i < kept.size(); i++) {
            Node node = kept.get(i);
            Doc doc = node.accept(this);
            if (i > 0) {
                Node previous = kept.get(i - 1);
                Gap gap = gaps.get(i - 1);
                if (isInline(previous) && isInline(node) && (gap == Gap.SPACE || gap == Gap.NONE)) {
                    run.add(gapDoc(gap, previous, node));
                    run.add(doc);
                    continue;
                }
                flushRun(out, run);
                out.add(gapDoc(gap, previous, node));
            }
            if (isInline(node)) {
                run.add(doc);
            } else {
                out.add(doc);
            }
        }
        flushRun(out, run);
        return out.build();
    }

    private static Gap classify(int newLines, boolean space) {
        if (newLines >= 2) {
            return Gap.BLANK;
        }
        if (newLines == 1) {
            return Gap.NEWLINE;
        }
        return space ? Gap.SPACE : Gap.NONE;
    }

    private static boolean isInline(Node node) {
        return node instanceof CharData || node instanceof ErbTag;
    }

    private static Doc gapDoc(Gap gap, Node previous, Node next) {
        switch (gap) {
            case BLANK:
                return concat(forced(), localBreak());
            case NEWLINE:
                return isInline(previous) && isInline(next) ? forced() : breakable(" ");
            case SPACE:
                return breakable(" ");
            default:
                if (previous instanceof CharData || next instanceof CharData) {
                    return DocBuilder.empty();
                }
                // Adjacent ERB tags may break apart but never gain a space.
                return isInline(previous) && isInline(next) ? breakable("") : breakable(" ");
        }
    }

    private static void flushRun(DocBuilder out, List<Doc> run) {
        if (run.size() > 1) {
            out.add(group(concat(run)));
        } else if (run.size() == 1) {
            out.add(run.get(0));
        }
        run.clear();
    }

    // Markup.

    @Override
    public Doc visitHtmlElement(HtmlElement node) {
        Doc opening = openingTag(node.getOpeningTag(), !node.hasBody());
        if (!node.hasBody()) {
            return opening;
        }
        Doc closing = node.getClosingTag().accept(this);
        List<Node> children = meaningful(node.getElements());
        if (children.isEmpty()) {
            return concat(opening, closing);
        }
        Doc body = layoutChildren(node.getElements());

        boolean hasText = children.stream().anyMatch(child -> child instanceof CharData);
        boolean singleTag = children.size() == 1 && children.get(0) instanceof ErbTag;
        if (hasText || singleTag) {
            boolean withBreak = !(children.get(0) instanceof CharData) || node.getOpeningTag().getNewLine() > 0;
            Doc edge = withBreak ? breakable("") : DocBuilder.empty();
            return group(opening, indent(edge, body), edge, closing);
        }
        return concat(opening, indent(forced(), body), forced(), closing);
    }

    @Override
    public Doc visitOpeningTag(OpeningTag node) {
        return openingTag(node, node.isSelfClosing());
    }

    private Doc openingTag(OpeningTag node, boolean selfClosing) {
        DocBuilder parts = new DocBuilder();
        parts.text("<" + node.getName().getText());
        if (!node.getAttributes().isEmpty()) {
            List<Doc> attributes = new ArrayList<>();
            for (Node attribute : node.getAttributes()) {
                attributes.add(attribute.accept(this));
            }
            parts.add(indent(breakable(" "), seplist(attributes, breakable(" "))));
            parts.add(breakable(selfClosing ? " " : ""));
        } else if (selfClosing) {
            parts.text(" ");
        }
        parts.text(selfClosing ? "/>" : ">");
        return group(parts.build());
    }

    @Override
    public Doc visitClosingTag(ClosingTag node) {
        return textOf("</" + node.getName().getText() + ">");
    }

    @Override
    public Doc visitAttribute(HtmlAttribute node) {
        if (node.getValue() == null) {
            return textOf(node.getKey().getText());
        }
        return concat(textOf(node.getKey().getText() + "="), node.getValue().accept(this));
    }

    @Override
    public Doc visitHtmlString(HtmlString node) {
        if (!node.isQuoted()) {
            return textOf("\"" + ((Token) node.getContents().get(0)).getText() + "\"");
        }
        DocBuilder parts = new DocBuilder();
        parts.text(node.getOpenQuote().getText());
        for (Node content : node.getContents()) {
            if (content instanceof ErbTag) {
                parts.text(inlineErbTag((ErbTag) content));
            } else {
                parts.text(((Token) content).getText());
            }
        }
        parts.text(node.getCloseQuote().getText());
        return parts.build();
    }

    @Override
    public Doc visitCharData(CharData node) {
        return textOf(node.getText().strip());
    }

    @Override
    public Doc visitNewLine(NewLine node) {
        return node.getCount() > 1 ? concat(localBreak(), localBreak()) : localBreak();
    }

    @Override
    public Doc visitHtmlComment(HtmlComment node) {
        return textOf(node.getToken().getText());
    }

    @Override
    public Doc visitErbComment(ErbComment node) {
        List<Doc> lines = new ArrayList<>();
        for (String line : node.getToken().getText().split("\r?\n", -1)) {
            lines.add(textOf(line.strip()));
        }
        return seplist(lines, forced());
    }

    @Override
    public Doc visitDoctype(Doctype node) {
        StringBuilder text = new StringBuilder(node.getOpening().getText());
        for (Node part : node.getParts()) {
            text.append(' ');
            if (part instanceof HtmlString) {
                HtmlString string = (HtmlString) part;
                text.append(string.getOpenQuote().getText());
                for (Node content : string.getContents()) {
                    text.append(content instanceof Token ? ((Token) content).getText() : inlineErbTag((ErbTag) content));
                }
                text.append(string.getCloseQuote().getText());
            } else {
                text.append(((Token) part).getText());
            }
        }
        return textOf(text.append('>').toString());
    }

    @Override
    public Doc visitToken(Token node) {
        return textOf(node.getText());
    }

    // ERB.

    @Override
    public Doc visitErbTag(ErbTag node) {
        DocBuilder parts = new DocBuilder();
        parts.text(node.getOpening().getText().strip());
        if (node.getKeyword() != null) {
            parts.text(" " + node.getKeyword().getText().strip());
        }

        Token closing = node.getClosing();
        boolean opensBlock = closing.getKind() == TokenKind.ERB_DO_CLOSE;
        String padding = opensBlock ? "" : " ";
        boolean closerOnOwnLine = false;

        Optional<List<List<String>>> statements = statements(node);
        if (statements.isEmpty()) {
            // Unread code keeps its rows byte for byte; heredoc bodies depend on it.
            String value = node.getContent().getValue();
            List<Doc> lines = new ArrayList<>();
            for (String line : value.strip().split("\r?\n")) {
                lines.add(textOf(line));
            }
            parts.text(" ").add(seplist(lines, literalBreak()));
            if (value.substring(value.stripTrailing().length()).indexOf('\n') >= 0) {
                parts.add(forced());
                closerOnOwnLine = true;
            } else {
                parts.text(padding);
            }
        } else if (statements.get().isEmpty()) {
            parts.text(padding);
        } else if (statements.get().size() == 1) {
            parts.text(" ").add(rows(statements.get().get(0))).text(padding);
        } else {
            List<Doc> rendered = new ArrayList<>();
            for (List<String> statement : statements.get()) {
                rendered.add(rows(statement));
            }
            parts.add(indent(forced(), seplist(rendered, forced()))).add(forced());
            closerOnOwnLine = true;
        }

        if (opensBlock) {
            String text = closing.getText();
            String closer = text.endsWith("-%>") ? "-%>" : "%>";
            String head = text.substring(0, text.length() - closer.length()).strip().replaceAll("\\s+", " ");
            parts.text((closerOnOwnLine ? "" : " ") + head + " " + closer);
        } else {
            parts.text(closing.getText().strip());
        }
        return parts.build();
    }

    /** Rendered rows per statement, or empty when the fragment is not understood. */
    private Optional<List<List<String>>> statements(ErbTag node) {
        if (node.getContent().isBlank()) {
            return Optional.of(List.of());
        }
        Optional<CodeFragment> fragment = codeFormatter.parse(node.getContent().getValue());
        if (fragment.isEmpty()) {
            LOGGER.log(
                    Level.FINE,
                    "Keeping unparsable code at {0} as written",
                    node.getLocation());
            return Optional.empty();
        }
        int width = fragment.get().containsConditional() ? Integer.MAX_VALUE : options.getPrintWidth();
        List<List<String>> statements = new ArrayList<>();
        for (CodeStatement statement : fragment.get().statements()) {
            statements.add(statement.render(width));
        }
        return Optional.of(statements);
    }

    private static Doc rows(List<String> rows) {
        List<Doc> docs = new ArrayList<>(rows.size());
        for (String row : rows) {
            docs.add(textOf(row));
        }
        return docs.size() == 1 ? docs.get(0) : seplist(docs, forced());
    }

    /**
     * Single-line rendering for tags inside attribute values, where a line break would change the
     * value.
     */
    private String inlineErbTag(ErbTag node) {
        StringBuilder text = new StringBuilder(node.getOpening().getText().strip());
        if (node.getKeyword() != null) {
            text.append(' ').append(node.getKeyword().getText().strip());
        }
        String content = node.getContent().getTrimmed();
        if (!content.isEmpty()) {
            Optional<CodeFragment> fragment = codeFormatter.parse(node.getContent().getValue());
            if (fragment.isPresent()) {
                List<String> statements = new ArrayList<>();
                for (CodeStatement statement : fragment.get().statements()) {
                    List<String> rows = statement.render(Integer.MAX_VALUE);
                    if (rows.size() != 1) {
                        statements = null;
                        break;
                    }
                    statements.add(rows.get(0));
                }
                if (statements != null) {
                    content = String.join("; ", statements);
                }
            }
        }
        if (!content.isEmpty()) {
            text.append(' ').append(content);
        }
        String closing = node.getClosing().getText();
        if (node.getClosing().getKind() == TokenKind.ERB_DO_CLOSE) {
            closing = closing.strip().replaceAll("\\s+", " ");
        } else {
            closing = closing.strip();
        }
        return text.append(' ').append(closing).toString();
    }

    @Override
    public Doc visitErbBlock(ErbBlock node) {
        return concat(node.getHead().accept(this), body(node.getHead(), node.getElements()), node.getEnd().accept(this));
    }

    @Override
    public Doc visitErbIf(ErbIf node) {
        return control(node);
    }

    @Override
    public Doc visitErbUnless(ErbUnless node) {
        return control(node);
    }

    @Override
    public Doc visitErbElsif(ErbElsif node) {
        return control(node);
    }

    @Override
    public Doc visitErbElse(ErbElse node) {
        return control(node);
    }

    @Override
    public Doc visitErbCase(ErbCase node) {
        return control(node);
    }

    @Override
    public Doc visitErbCaseWhen(ErbCaseWhen node) {
        return control(node);
    }

    private Doc control(ErbControl node) {
        return concat(node.getHead().accept(this), body(node.getHead(), node.getElements()), node.getConsequent().accept(this));
    }

    /** An empty body keeps the head and the next tag apart only if the source did. */
    private Doc body(ErbTag head, List<Node> elements) {
        if (meaningful(elements).isEmpty()) {
            return head.getNewLine() > 0 ? forced() : DocBuilder.empty();
        }
        return concat(indent(forced(), layoutChildren(elements)), forced());
    }

    @Override
    public Doc visitErbEnd(ErbEnd node) {
        ErbTag tag = node.getTag();
        StringBuilder text = new StringBuilder(tag.getOpening().getText().strip()).append(" end");
        String content = tag.getContent().getValue();
        if (!content.isBlank()) {
            text.append(Character.isWhitespace(content.charAt(0)) ? " " : "").append(content.strip());
        }
        return textOf(text.append(' ').append(tag.getClosing().getText().strip()).toString());
    }
}

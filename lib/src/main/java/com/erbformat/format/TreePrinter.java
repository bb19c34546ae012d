package com.erbformat.format;

import static com.erbformat.format.doc.DocBuilder.breakable;
import static com.erbformat.format.doc.DocBuilder.group;
import static com.erbformat.format.doc.DocBuilder.indent;
import static com.erbformat.format.doc.DocBuilder.seplist;
import static com.erbformat.format.doc.DocBuilder.textOf;

import com.erbformat.format.doc.Doc;
import com.erbformat.format.doc.DocRenderer;
import com.erbformat.parser.ast.CharData;
import com.erbformat.parser.ast.ClosingTag;
import com.erbformat.parser.ast.Doctype;
import com.erbformat.parser.ast.Document;
import com.erbformat.parser.ast.ErbBlock;
import com.erbformat.parser.ast.ErbCase;
import com.erbformat.parser.ast.ErbCaseWhen;
import com.erbformat.parser.ast.ErbComment;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Debugging dump of a syntax tree as nested s-expressions, for example
 * {@code (document (html (opening_tag "<" "br" "/>")))}.
 */
public final class TreePrinter implements NodeVisitor<Doc> {
    private final int width;

    public TreePrinter() {
        this(FormatOptions.DEFAULT_PRINT_WIDTH);
    }

    public TreePrinter(int width) {
        this.width = width;
    }

    public String print(Node node) {
        return new DocRenderer(width, 2).render(node.accept(this));
    }

    private Doc sexp(String type, List<? extends Node> children) {
        List<Doc> docs = new ArrayList<>();
        for (Node child : children) {
            docs.add(child.accept(this));
        }
        if (docs.isEmpty()) {
            return textOf("(" + type + ")");
        }
        return group(textOf("(" + type), indent(breakable(" "), seplist(docs, breakable(" "))), textOf(")"));
    }

    private Doc sexp(String type, Node node) {
        return sexp(type, node.childNodes());
    }

    static String quote(String value) {
        StringBuilder out = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.append('"').toString();
    }

    @Override
    public Doc visitToken(Token node) {
        return textOf(quote(node.getText()));
    }

    @Override
    public Doc visitDocument(Document node) {
        return sexp("document", node);
    }

    @Override
    public Doc visitHtmlElement(HtmlElement node) {
        return sexp("html", node);
    }

    @Override
    public Doc visitOpeningTag(OpeningTag node) {
        return sexp("opening_tag", node);
    }

    @Override
    public Doc visitClosingTag(ClosingTag node) {
        return sexp("closing_tag", node);
    }

    @Override
    public Doc visitAttribute(HtmlAttribute node) {
        return sexp("attribute", node);
    }

    @Override
    public Doc visitHtmlString(HtmlString node) {
        return sexp("html_string", node);
    }

    @Override
    public Doc visitErbTag(ErbTag node) {
        List<Doc> parts = new ArrayList<>();
        parts.add(node.getOpening().accept(this));
        if (node.getKeyword() != null) {
            parts.add(node.getKeyword().accept(this));
        }
        parts.add(textOf("(content " + quote(node.getContent().getValue()) + ")"));
        parts.add(node.getClosing().accept(this));
        return group(textOf("(erb"), indent(breakable(" "), seplist(parts, breakable(" "))), textOf(")"));
    }

    @Override
    public Doc visitErbBlock(ErbBlock node) {
        return sexp("erb_block", node);
    }

    @Override
    public Doc visitErbIf(ErbIf node) {
        return sexp("erb_if", node);
    }

    @Override
    public Doc visitErbUnless(ErbUnless node) {
        return sexp("erb_unless", node);
    }

    @Override
    public Doc visitErbElsif(ErbElsif node) {
        return sexp("erb_elsif", node);
    }

    @Override
    public Doc visitErbElse(ErbElse node) {
        return sexp("erb_else", node);
    }

    @Override
    public Doc visitErbCase(ErbCase node) {
        return sexp("erb_case", node);
    }

    @Override
    public Doc visitErbCaseWhen(ErbCaseWhen node) {
        return sexp("erb_case_when", node);
    }

    @Override
    public Doc visitErbEnd(ErbEnd node) {
        return textOf("erb_end");
    }

    @Override
    public Doc visitCharData(CharData node) {
        return sexp("char_data", node);
    }

    @Override
    public Doc visitNewLine(NewLine node) {
        return textOf("(new_line " + node.getCount() + ")");
    }

    @Override
    public Doc visitHtmlComment(HtmlComment node) {
        return sexp("html_comment", node);
    }

    @Override
    public Doc visitErbComment(ErbComment node) {
        return sexp("erb_comment", node);
    }

    @Override
    public Doc visitDoctype(Doctype node) {
        return sexp("doctype", node);
    }
}

package com.erbformat.parser.ast;

import java.util.List;

/**
 * A node of the ERB syntax tree. Nodes are built once by the parser and never mutated; variants
 * that differ only in their trailing line-break marker are derived with {@link #withoutNewLine()}.
 */
public sealed interface Node
        permits Token,
                Document,
                HtmlElement,
                OpeningTag,
                ClosingTag,
                HtmlAttribute,
                HtmlString,
                ErbTag,
                ErbBlock,
                ErbControl,
                CharData,
                NewLine,
                HtmlComment,
                ErbComment,
                Doctype,
                IfTerminator,
                UnlessTerminator,
                CaseTerminator {

    Location getLocation();

    List<Node> childNodes();

    <R> R accept(NodeVisitor<R> visitor);

    /** Number of source newlines that followed this node: 0, 1, or 2 for a blank line or more. */
    default int getNewLine() {
        return 0;
    }

    default Node withoutNewLine() {
        return this;
    }
}

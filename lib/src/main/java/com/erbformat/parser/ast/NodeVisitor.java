package com.erbformat.parser.ast;

public interface NodeVisitor<R> {

    R visitToken(Token node);

    R visitDocument(Document node);

    R visitHtmlElement(HtmlElement node);

    R visitOpeningTag(OpeningTag node);

    R visitClosingTag(ClosingTag node);

    R visitAttribute(HtmlAttribute node);

    R visitHtmlString(HtmlString node);

    R visitErbTag(ErbTag node);

    R visitErbBlock(ErbBlock node);

    R visitErbIf(ErbIf node);

    R visitErbUnless(ErbUnless node);

    R visitErbElsif(ErbElsif node);

    R visitErbElse(ErbElse node);

    R visitErbCase(ErbCase node);

    R visitErbCaseWhen(ErbCaseWhen node);

    R visitErbEnd(ErbEnd node);

    R visitCharData(CharData node);

    R visitNewLine(NewLine node);

    R visitHtmlComment(HtmlComment node);

    R visitErbComment(ErbComment node);

    R visitDoctype(Doctype node);
}

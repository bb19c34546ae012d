package com.erbformat.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.erbformat.parser.ast.CharData;
import com.erbformat.parser.ast.Doctype;
import com.erbformat.parser.ast.Document;
import com.erbformat.parser.ast.ErbBlock;
import com.erbformat.parser.ast.ErbCase;
import com.erbformat.parser.ast.ErbCaseWhen;
import com.erbformat.parser.ast.ErbElse;
import com.erbformat.parser.ast.ErbElsif;
import com.erbformat.parser.ast.ErbEnd;
import com.erbformat.parser.ast.ErbIf;
import com.erbformat.parser.ast.ErbTag;
import com.erbformat.parser.ast.ErbUnless;
import com.erbformat.parser.ast.HtmlAttribute;
import com.erbformat.parser.ast.HtmlElement;
import com.erbformat.parser.ast.HtmlString;
import com.erbformat.parser.ast.NewLine;
import com.erbformat.parser.ast.Node;
import com.erbformat.parser.ast.Token;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ErbParserTest {

    private static Document parse(String template) throws ErbParseException {
        return new ErbParser().parse(template);
    }

    private static void assertChildrenInside(Node node) {
        for (Node child : node.childNodes()) {
            assertTrue(
                    node.getLocation().contains(child.getLocation()),
                    child.getClass().getSimpleName() + " at " + child.getLocation() + " escapes " + node.getLocation());
            assertChildrenInside(child);
        }
    }

    @Test
    void parsesElementWithAttributesAndMixedContent() throws Exception {
        Document document = parse("<div class=\"a\" id=b disabled>Hi <%= name %></div>");

        assertEquals(1, document.getElements().size());
        HtmlElement div = assertInstanceOf(HtmlElement.class, document.getElements().get(0));
        assertEquals("div", div.getName());
        assertTrue(div.hasBody());

        List<Node> attributes = div.getOpeningTag().getAttributes();
        assertEquals(3, attributes.size());
        HtmlAttribute quoted = assertInstanceOf(HtmlAttribute.class, attributes.get(0));
        assertEquals("class", quoted.getKey().getText());
        assertTrue(quoted.getValue().isQuoted());
        HtmlAttribute bare = assertInstanceOf(HtmlAttribute.class, attributes.get(1));
        assertFalse(bare.getValue().isQuoted());
        HtmlAttribute flag = assertInstanceOf(HtmlAttribute.class, attributes.get(2));
        assertNull(flag.getValue(), "attribute without a value");

        assertEquals(2, div.getElements().size());
        CharData text = assertInstanceOf(CharData.class, div.getElements().get(0));
        assertEquals("Hi ", text.getText());
        ErbTag tag = assertInstanceOf(ErbTag.class, div.getElements().get(1));
        assertEquals("<%=", tag.getOpening().getText());
        assertEquals(" name ", tag.getContent().getValue());
    }

    @Test
    void erbTagsInsideAttributesAndAttributeLists() throws Exception {
        Document document = parse("<a href=\"/u/<%= user.id %>/edit\" <%= extra %>>x</a>");

        HtmlElement link = assertInstanceOf(HtmlElement.class, document.getElements().get(0));
        List<Node> attributes = link.getOpeningTag().getAttributes();
        assertEquals(2, attributes.size());

        HtmlString href = assertInstanceOf(HtmlAttribute.class, attributes.get(0)).getValue();
        assertEquals(3, href.getContents().size());
        assertEquals("/u/", assertInstanceOf(Token.class, href.getContents().get(0)).getText());
        assertInstanceOf(ErbTag.class, href.getContents().get(1));
        assertEquals("/edit", assertInstanceOf(Token.class, href.getContents().get(2)).getText());

        assertInstanceOf(ErbTag.class, attributes.get(1));
    }

    @Test
    void voidAndSelfClosingElementsHaveNoBody() throws Exception {
        Document document = parse("<br/><link rel=\"x\"><div />");

        assertEquals(3, document.getElements().size());
        for (Node node : document.getElements()) {
            assertFalse(assertInstanceOf(HtmlElement.class, node).hasBody());
        }
        assertTrue(((HtmlElement) document.getElements().get(0)).isVoid());
    }

    @Test
    void newLineMarkersRecordBlankLines() throws Exception {
        Document document = parse("<p>a</p>\n\n\n<p>b</p>\n<p>c</p>");

        assertEquals(2, document.getElements().get(0).getNewLine());
        assertEquals(1, document.getElements().get(1).getNewLine());
        assertEquals(0, document.getElements().get(2).getNewLine());
    }

    @Test
    void leadingNewLinesBecomeNewLineNodes() throws Exception {
        Document document = parse("\n\n<p>a</p>");

        NewLine newLine = assertInstanceOf(NewLine.class, document.getElements().get(0));
        assertEquals(2, newLine.getCount());
    }

    @Test
    void childLocationsNestInsideParents() throws Exception {
        Document document =
                parse(
                        String.join(
                                "\n",
                                "<!DOCTYPE html>",
                                "<ul class=\"<%= css %>\">",
                                "  <% items.each do |item| %>",
                                "    <li><%= item %></li>",
                                "  <% end %>",
                                "</ul>",
                                "<% if a %>x<% elsif b %>y<% else %>z<% end %>"));

        assertChildrenInside(document);
    }

    @Test
    void ifElsifElseChain() throws Exception {
        Document document = parse("<% if a %>x<% elsif b %>y<% else %>z<% end %>");

        ErbIf chain = assertInstanceOf(ErbIf.class, document.getElements().get(0));
        assertEquals("if", chain.getHead().getKeywordText());
        ErbElsif elsif = assertInstanceOf(ErbElsif.class, chain.getConsequent());
        ErbElse otherwise = assertInstanceOf(ErbElse.class, elsif.getConsequent());
        assertInstanceOf(ErbEnd.class, otherwise.getConsequent());
        assertEquals(1, otherwise.getElements().size());
    }

    @Test
    void caseWhenChain() throws Exception {
        Document document = parse("<% case x %><% when 1 %>a<% when 2 %>b<% else %>c<% end %>");

        ErbCase chain = assertInstanceOf(ErbCase.class, document.getElements().get(0));
        assertTrue(chain.getElements().isEmpty());
        ErbCaseWhen first = assertInstanceOf(ErbCaseWhen.class, chain.getConsequent());
        ErbCaseWhen second = assertInstanceOf(ErbCaseWhen.class, first.getConsequent());
        ErbElse otherwise = assertInstanceOf(ErbElse.class, second.getConsequent());
        assertInstanceOf(ErbEnd.class, otherwise.getConsequent());
    }

    @Test
    void unlessWithElse() throws Exception {
        Document document = parse("<% unless a %>x<% else %>y<% end %>");

        ErbUnless chain = assertInstanceOf(ErbUnless.class, document.getElements().get(0));
        assertInstanceOf(ErbElse.class, chain.getConsequent());
    }

    @Test
    void unlessRejectsElsif() {
        ErbStructureException error =
                assertThrows(
                        ErbStructureException.class, () -> parse("<% unless a %>x<% elsif b %>y<% end %>"));

        assertTrue(error.getMessage().contains("Unexpected <% elsif %>"), error.getMessage());
        assertEquals(0, error.getLocation().getStartOffset());
        assertEquals(15, error.getUnexpectedLocation().getStartOffset());
        assertEquals(28, error.getUnexpectedLocation().getEndOffset());
    }

    @Test
    void whenRejectsElsif() {
        assertThrows(
                ErbStructureException.class,
                () -> parse("<% case x %><% when 1 %>a<% elsif y %>b<% end %>"));
    }

    @Test
    void doBlockWithParameters() throws Exception {
        Document document = parse("<% items.each do |item| %><li><%= item %></li><% end %>");

        ErbBlock block = assertInstanceOf(ErbBlock.class, document.getElements().get(0));
        assertTrue(block.getHead().opensBlock());
        assertEquals(" items.each ", block.getHead().getContent().getValue());
        assertEquals(1, block.getElements().size());
        assertInstanceOf(HtmlElement.class, block.getElements().get(0));
    }

    @Test
    void chainsNestInsideBlocksAndElements() throws Exception {
        Document document =
                parse("<div><% list.each do |x| %><% if x %><b><%= x %></b><% end %><% end %></div>");

        HtmlElement div = assertInstanceOf(HtmlElement.class, document.getElements().get(0));
        ErbBlock block = assertInstanceOf(ErbBlock.class, div.getElements().get(0));
        assertInstanceOf(ErbIf.class, block.getElements().get(0));
    }

    @Test
    void selfTerminatedConditionalIsPlainTag() throws Exception {
        Document document = parse("<%= if a then b end %>");

        ErbTag tag = assertInstanceOf(ErbTag.class, document.getElements().get(0));
        assertNull(tag.getKeyword());
        assertTrue(tag.getContent().getValue().contains("if a then b end"));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "<% if params[\"end\"] %>\n<p>x</p>\n<% end %>",
                "<% if ends_with?(\"end\") %>x<% end %>",
                "<% if a # the end %>x<% end %>",
                "<% if mode == :end %>x<% end %>",
                "<% if range.end > 3 %>x<% end %>"
            })
    void endInsideHeadCodeDoesNotCloseTheChain(String template) throws Exception {
        Document document = parse(template);

        assertEquals(1, document.getElements().size());
        ErbIf chain = assertInstanceOf(ErbIf.class, document.getElements().get(0));
        assertInstanceOf(ErbEnd.class, chain.getConsequent());
    }

    @Test
    void selfTerminatedCaseIsPlainTag() throws Exception {
        Document document = parse("<%= case x when 1 then \"one\" end %>");

        ErbTag tag = assertInstanceOf(ErbTag.class, document.getElements().get(0));
        assertNull(tag.getKeyword());
    }

    @Test
    void trimMarkersArePreserved() throws Exception {
        ErbTag tag = assertInstanceOf(ErbTag.class, parse("<%- x -%>").getElements().get(0));

        assertEquals("<%-", tag.getOpening().getText());
        assertEquals("-%>", tag.getClosing().getText());
    }

    @Test
    void singleDoctypeAnywhereIsAccepted() throws Exception {
        Document document = parse("<div></div><!DOCTYPE html>");

        assertInstanceOf(Doctype.class, document.getElements().get(1));
    }

    @Test
    void duplicateDoctypeIsRejected() {
        ErbStructureException error =
                assertThrows(ErbStructureException.class, () -> parse("<!DOCTYPE html>\n<!doctype html>"));

        assertEquals(16, error.getLocation().getStartOffset());
        assertEquals(0, error.getUnexpectedLocation().getStartOffset());
    }

    @Test
    void mismatchedClosingTag() {
        ErbStructureException error =
                assertThrows(ErbStructureException.class, () -> parse("<h1>Hello</h2>"));

        assertTrue(error.getMessage().contains("</h2>"), error.getMessage());
        assertEquals(0, error.getLocation().getStartOffset());
        assertEquals(9, error.getUnexpectedLocation().getStartOffset());
    }

    @Test
    void missingClosingTag() {
        ErbStructureException error =
                assertThrows(ErbStructureException.class, () -> parse("<div><p>Hi</p>"));

        assertTrue(error.getMessage().startsWith("Missing closing tag for <div>"), error.getMessage());
        assertEquals(14, error.getUnexpectedLocation().getStartOffset());
    }

    @Test
    void strayClosingTag() {
        ErbStructureException error = assertThrows(ErbStructureException.class, () -> parse("<p>a</p></h2>"));

        assertTrue(error.getMessage().contains("closing tag"), error.getMessage());
        assertEquals(8, error.getLocation().getStartOffset());
    }

    @Test
    void unterminatedChain() {
        ErbStructureException error = assertThrows(ErbStructureException.class, () -> parse("<% if a %>x"));

        assertTrue(error.getMessage().startsWith("No matching <% end %>"), error.getMessage());
        assertEquals(0, error.getLocation().getStartOffset());
    }

    @Test
    void strayEnd() {
        ErbStructureException error = assertThrows(ErbStructureException.class, () -> parse("a<% end %>"));

        assertTrue(error.getMessage().contains("<% end %>"), error.getMessage());
        assertEquals(1, error.getLocation().getStartOffset());
        assertEquals(10, error.getLocation().getEndOffset());
    }

    @Test
    void endCannotOpenBlock() {
        assertThrows(ErbStructureException.class, () -> parse("<% list.each do %>x<% end do %>"));
    }

    @Test
    void elementCrossingChainBoundary() {
        assertThrows(ErbStructureException.class, () -> parse("<% if a %><div><% end %></div>"));
    }

    @Test
    void invalidElementNames() {
        assertThrows(ErbStructureException.class, () -> parse("<@br />"));
        assertThrows(ErbStructureException.class, () -> parse("<:br />"));
        assertThrows(ErbStructureException.class, () -> parse("<#br />"));
    }

    @Test
    void unterminatedQuotedString() {
        ErbStructureException error =
                assertThrows(ErbStructureException.class, () -> parse("<div class=\"foo>x</div>"));

        assertTrue(error.getMessage().startsWith("Unterminated quoted string"), error.getMessage());
        assertEquals(11, error.getLocation().getStartOffset());
    }

    @Test
    void unterminatedErbTag() {
        assertThrows(ErbStructureException.class, () -> parse("<p><%= name</p>"));
    }

    @Test
    void lexicalErrorsSurfaceAsParseExceptions() {
        ErbParseException error = assertThrows(ErbParseException.class, () -> parse("<div <p>"));

        assertInstanceOf(ErbLexicalException.class, error);
    }

    @Test
    void parserTraceReportsBacktracks() throws Exception {
        DebugFlags.drainCapturedDiagnostics();
        System.setProperty("erbformat.debugParser", "true");
        try {
            parse("<% if a %><%= b %><% end %>");
        } finally {
            System.clearProperty("erbformat.debugParser");
        }

        assertFalse(DebugFlags.drainCapturedDiagnostics().isEmpty());
    }
}

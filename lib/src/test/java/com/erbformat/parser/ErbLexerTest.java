package com.erbformat.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.erbformat.parser.ast.Location;
import com.erbformat.parser.ast.Token;
import com.erbformat.parser.ast.TokenKind;
import com.erbformat.parser.grammar.ErbLexer;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.junit.jupiter.api.Test;

class ErbLexerTest {

    private static List<String> symbolicNames(String template) {
        ErbLexer lexer = new ErbLexer(CharStreams.fromString(template, "test"));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<String> symbolic = new ArrayList<>();
        for (org.antlr.v4.runtime.Token token : tokens.getTokens()) {
            if (token.getType() == org.antlr.v4.runtime.Token.EOF) {
                symbolic.add("EOF");
            } else {
                symbolic.add(lexer.getVocabulary().getSymbolicName(token.getType()));
            }
        }
        return symbolic;
    }

    @Test
    void elementWithQuotedAttributeAndText() {
        assertEquals(
                List.of(
                        "ELEMENT_OPEN", "NAME", "NAME", "EQUALS", "DOUBLE_QUOTE", "STRING_TEXT", "DOUBLE_QUOTE",
                        "ELEMENT_CLOSE", "TEXT", "CLOSING_ELEMENT_OPEN", "NAME", "ELEMENT_CLOSE", "NEW_LINE", "EOF"),
                symbolicNames("<div class=\"a\">Hi</div>\n"));
    }

    @Test
    void keywordTagsAndBlankLines() {
        assertEquals(
                List.of(
                        "ERB_OPEN", "KEYWORD_IF", "CODE", "CODE", "CODE", "ERB_CLOSE", "BLANK_LINE",
                        "ERB_OPEN", "CODE", "CODE", "ERB_TRIM_CLOSE", "EOF"),
                symbolicNames("<% if user %>\n\n<%= name -%>"));
    }

    @Test
    void keywordNeedsWordBoundary() {
        assertEquals(List.of("ERB_OPEN", "CODE", "CODE", "ERB_CLOSE", "EOF"), symbolicNames("<% ending %>"));
    }

    @Test
    void doWithBlockParametersClosesTag() {
        assertEquals(
                List.of("ERB_OPEN", "CODE", "CODE", "CODE", "CODE", "ERB_DO_CLOSE", "EOF"),
                symbolicNames("<% items.each do |item| %>"));
    }

    @Test
    void erbTagsInsideAttributeValues() {
        assertEquals(
                List.of(
                        "ELEMENT_OPEN", "NAME", "NAME", "EQUALS", "DOUBLE_QUOTE", "STRING_TEXT", "ERB_OPEN", "CODE",
                        "CODE", "ERB_CLOSE", "DOUBLE_QUOTE", "ERB_OPEN", "CODE", "CODE", "ERB_CLOSE",
                        "ELEMENT_CLOSE", "EOF"),
                symbolicNames("<a href=\"/u/<%= id %>\" <%= extra %>>"));
    }

    @Test
    void commentsAndDoctypeAreSingleTokens() {
        assertEquals(
                List.of("DOCTYPE_OPEN", "NAME", "ELEMENT_CLOSE", "HTML_COMMENT", "ERB_COMMENT", "EOF"),
                symbolicNames("<!DOCTYPE html><!-- <p> --><%# <% note %>"));
    }

    @Test
    void tokenizerReportsOffsetsAndLines() throws Exception {
        List<Token> tokens = new ErbTokenizer().tokenize("a\n<b>");

        assertEquals(TokenKind.TEXT, tokens.get(0).getKind());
        assertEquals(new Location(0, 1, 1, 1), tokens.get(0).getLocation());
        assertEquals(TokenKind.NEW_LINE, tokens.get(1).getKind());
        assertEquals(new Location(1, 2, 1, 2), tokens.get(1).getLocation());
        assertEquals(TokenKind.ELEMENT_OPEN, tokens.get(2).getKind());
        assertEquals(2, tokens.get(2).getLocation().getStartLine());

        Token eof = tokens.get(tokens.size() - 1);
        assertEquals(TokenKind.EOF, eof.getKind());
        assertEquals(5, eof.getLocation().getStartOffset());
    }

    @Test
    void offsetsCountCodePoints() throws Exception {
        List<Token> tokens = new ErbTokenizer().tokenize("😀 <p>");

        assertEquals(new Location(0, 1, 1, 1), tokens.get(0).getLocation(), "emoji counts as one position");
        assertEquals(2, tokens.get(2).getLocation().getStartOffset());
    }

    @Test
    void unexpectedCharacterInsideTagIsLexicalError() {
        ErbLexicalException error =
                assertThrows(ErbLexicalException.class, () -> new ErbTokenizer().tokenize("<div <p>"));

        assertEquals('<', error.getOffendingCodePoint());
        assertEquals(5, error.getOffset());
        assertEquals(1, error.getLine());
        assertEquals(6, error.getColumn());
        assertTrue(error.getMessage().contains("line 1, column 6"), error.getMessage());
    }

    @Test
    void tokenDumpIsCapturedWhenEnabled() throws Exception {
        DebugFlags.drainCapturedTokens();
        System.setProperty("erbformat.debugTokens", "true");
        try {
            new ErbTokenizer().tokenize("<br>");
        } finally {
            System.clearProperty("erbformat.debugTokens");
        }

        List<String> captured = DebugFlags.drainCapturedTokens();
        assertEquals(4, captured.size(), "one line per token including EOF");
        assertTrue(captured.get(0).startsWith("ELEMENT_OPEN"), captured.get(0));
        assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
    }

    @Test
    void tokenDumpIsOffWhenDisabled() throws Exception {
        DebugFlags.drainCapturedTokens();
        System.setProperty("erbformat.debugTokens", "false");
        try {
            new ErbTokenizer().tokenize("<br>");
        } finally {
            System.clearProperty("erbformat.debugTokens");
        }

        assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
    }
}

package com.erbformat.parser.ast;

public enum TokenKind {
    TEXT,
    WHITESPACE,
    NEW_LINE,
    BLANK_LINE,
    HTML_COMMENT,
    DOCTYPE_OPEN,
    ERB_COMMENT,
    ERB_OPEN,
    KEYWORD_IF,
    KEYWORD_UNLESS,
    KEYWORD_ELSIF,
    KEYWORD_ELSE,
    KEYWORD_CASE,
    KEYWORD_WHEN,
    KEYWORD_END,
    CODE,
    ERB_CLOSE,
    ERB_TRIM_CLOSE,
    ERB_DO_CLOSE,
    ELEMENT_OPEN,
    CLOSING_ELEMENT_OPEN,
    ELEMENT_CLOSE,
    ELEMENT_SELF_CLOSE,
    NAME,
    EQUALS,
    UNQUOTED_VALUE,
    DOUBLE_QUOTE,
    SINGLE_QUOTE,
    STRING_TEXT,
    EOF;

    public boolean isKeyword() {
        switch (this) {
            case KEYWORD_IF:
            case KEYWORD_UNLESS:
            case KEYWORD_ELSIF:
            case KEYWORD_ELSE:
            case KEYWORD_CASE:
            case KEYWORD_WHEN:
            case KEYWORD_END:
                return true;
            default:
                return false;
        }
    }

    public boolean isErbClose() {
        return this == ERB_CLOSE || this == ERB_TRIM_CLOSE || this == ERB_DO_CLOSE;
    }
}

package com.erbformat.code.ruby;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a Ruby fragment into coarse tokens. Literals (strings, symbols, regular expressions,
 * percent literals, comments) are kept whole so that later whitespace rewriting never touches their
 * contents.
 */
final class RubyTokenizer {
    private static final String OPERATOR_CHARS = "+-*/%=<>!&|^~?:.\\";
    private static final String PERCENT_TYPES = "qQwWiIrsx";

    private final String source;
    private final List<RubyToken> tokens = new ArrayList<>();
    private int pos;

    private RubyTokenizer(String source) {
        this.source = source;
    }

    static List<RubyToken> tokenize(String source) throws RubySyntaxException {
        RubyTokenizer tokenizer = new RubyTokenizer(source);
        tokenizer.run();
        return tokenizer.tokens;
    }

    private void run() throws RubySyntaxException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            int start = pos;
            if (c == '\n') {
                pos++;
                add(RubyToken.Type.NEWLINE, start);
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                skipSpace();
                add(RubyToken.Type.SPACE, start);
            } else if (c == '\\' && peek(1) == '\n') {
                pos += 2;
                add(RubyToken.Type.SPACE, start);
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
                add(RubyToken.Type.COMMENT, start);
            } else if (c == '"' || c == '`') {
                pos = skipQuoted(pos + 1, c, c, true);
                add(RubyToken.Type.STRING, start);
            } else if (c == '\'') {
                pos = skipQuoted(pos + 1, c, c, false);
                add(RubyToken.Type.STRING, start);
            } else if (c == '%' && startsPercentLiteral()) {
                scanPercentLiteral();
                add(RubyToken.Type.STRING, start);
            } else if (c == '/' && !previousEndsValue()) {
                pos = skipQuoted(pos + 1, '/', '/', true);
                while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
                    pos++;
                }
                add(RubyToken.Type.REGEXP, start);
            } else if (c == '<' && startsHeredoc()) {
                throw new RubySyntaxException("heredocs are not supported");
            } else if (c == ':' && peek(1) == '"') {
                pos = skipQuoted(pos + 2, '"', '"', true);
                add(RubyToken.Type.SYMBOL, start);
            } else if (c == ':' && peek(1) != ':' && isIdentifierStart(peek(1))) {
                pos++;
                scanIdentifier();
                if (pos < source.length() && "?!=".indexOf(source.charAt(pos)) >= 0 && peek(1) != '=' && peek(1) != '>') {
                    pos++;
                }
                add(RubyToken.Type.SYMBOL, start);
            } else if (isWordChar(c) || c == '@' || c == '$') {
                scanWord();
            } else if (c == '(' || c == '[' || c == '{') {
                pos++;
                add(RubyToken.Type.OPEN, start);
            } else if (c == ')' || c == ']' || c == '}') {
                pos++;
                add(RubyToken.Type.CLOSE, start);
            } else if (c == ',') {
                pos++;
                add(RubyToken.Type.COMMA, start);
            } else if (c == ';') {
                pos++;
                add(RubyToken.Type.SEMICOLON, start);
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                while (pos < source.length() && OPERATOR_CHARS.indexOf(source.charAt(pos)) >= 0) {
                    if (pos > start && source.charAt(pos) == ':' && peek(1) != ':' && source.charAt(pos - 1) != ':') {
                        break;
                    }
                    pos++;
                }
                add(RubyToken.Type.OPERATOR, start);
            } else {
                pos++;
                add(RubyToken.Type.OPERATOR, start);
            }
        }
    }

    private void add(RubyToken.Type type, int start) {
        tokens.add(new RubyToken(type, source.substring(start, pos)));
    }

    private char peek(int distance) {
        int index = pos + distance;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void skipSpace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\f') {
                return;
            }
            pos++;
        }
    }

    private RubyToken previousSignificant() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            RubyToken token = tokens.get(i);
            if (!token.isLayout()) {
                return token;
            }
        }
        return null;
    }

    private boolean previousEndsValue() {
        RubyToken previous = previousSignificant();
        if (previous == null || !previous.endsValue()) {
            return false;
        }
        // "foo /x/" passes a regexp argument; "foo / x" divides.
        boolean spaceBefore = !tokens.isEmpty() && tokens.get(tokens.size() - 1).isLayout();
        char next = peek(1);
        return !(previous.type() == RubyToken.Type.WORD && spaceBefore && next != ' ' && next != '=');
    }

    private boolean startsPercentLiteral() {
        char next = peek(1);
        if (PERCENT_TYPES.indexOf(next) >= 0) {
            char delimiter = peek(2);
            return delimiter != '\0' && !Character.isLetterOrDigit(delimiter) && !Character.isWhitespace(delimiter);
        }
        return "([{<|!^".indexOf(next) >= 0 && next != '\0' && !previousEndsValue();
    }

    private void scanPercentLiteral() throws RubySyntaxException {
        pos++;
        char type = source.charAt(pos);
        if (PERCENT_TYPES.indexOf(type) >= 0) {
            pos++;
        } else {
            type = 'Q';
        }
        char open = source.charAt(pos);
        char close = closingDelimiter(open);
        boolean interpolates = Character.isUpperCase(type) || type == 'r' || type == 'x';
        pos = skipQuoted(pos + 1, open, close, interpolates);
        if (type == 'r') {
            while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
                pos++;
            }
        }
    }

    private static char closingDelimiter(char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            case '{':
                return '}';
            case '<':
                return '>';
            default:
                return open;
        }
    }

    private boolean startsHeredoc() {
        if (peek(1) != '<' || previousEndsValue()) {
            return false;
        }
        char marker = peek(2);
        if (marker == '~' || marker == '-') {
            marker = peek(3);
        }
        return Character.isUpperCase(marker) || marker == '"' || marker == '\'';
    }

    /**
     * Returns the index just past the closing delimiter of a literal whose body starts at
     * {@code index}. Paired delimiters nest; {@code #{...}} interpolations are skipped as code.
     */
    private int skipQuoted(int index, char open, char close, boolean interpolates) throws RubySyntaxException {
        int depth = 0;
        int i = index;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (interpolates && c == '#' && i + 1 < source.length() && source.charAt(i + 1) == '{') {
                i = skipInterpolation(i + 2);
                continue;
            }
            if (c == close && depth == 0) {
                return i + 1;
            }
            if (open != close && c == open) {
                depth++;
            } else if (open != close && c == close) {
                depth--;
            }
            i++;
        }
        throw new RubySyntaxException("unterminated literal opened with " + open);
    }

    private int skipInterpolation(int index) throws RubySyntaxException {
        int depth = 0;
        int i = index;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipQuoted(i + 1, c, c, c != '\'');
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i + 1;
                }
                depth--;
            }
            i++;
        }
        throw new RubySyntaxException("unterminated interpolation");
    }

    private void scanWord() {
        int start = pos;
        while (pos < source.length() && (source.charAt(pos) == '@' || source.charAt(pos) == '$')) {
            pos++;
        }
        if (pos > start && pos < source.length() && !isWordChar(source.charAt(pos))) {
            // Special globals such as $! or $~.
            pos++;
            add(RubyToken.Type.WORD, start);
            return;
        }
        scanIdentifier();
        char next = peek(0);
        if ((next == '?' || next == '!') && peek(1) != '=' && !isDigit(source.charAt(start))) {
            pos++;
        }
        boolean label =
                peek(0) == ':' && peek(1) != ':' && isIdentifierStart(source.charAt(start));
        if (label) {
            pos++;
            add(RubyToken.Type.LABEL, start);
        } else {
            add(RubyToken.Type.WORD, start);
        }
    }

    private void scanIdentifier() {
        while (pos < source.length() && isWordChar(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isWordChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }
}

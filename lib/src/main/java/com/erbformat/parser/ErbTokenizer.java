package com.erbformat.parser;

import com.erbformat.parser.ast.Location;
import com.erbformat.parser.ast.Token;
import com.erbformat.parser.ast.TokenKind;
import com.erbformat.parser.grammar.ErbLexer;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Runs the generated {@link ErbLexer} over a template and converts its output into syntax tree
 * tokens. Offsets count Unicode code points, the unit ANTLR character streams index by.
 */
public final class ErbTokenizer {

    public List<Token> tokenize(String source) throws ErbLexicalException {
        CharStream input = CharStreams.fromString(source);
        ErbLexer lexer = new ErbLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingLexerErrorListener.INSTANCE);
        CommonTokenStream stream = new CommonTokenStream(lexer);
        try {
            stream.fill();
        } catch (ThrowingLexerErrorListener.LexicalFailure failure) {
            throw toLexicalException(input, failure);
        }

        List<Token> tokens = new ArrayList<>(stream.getTokens().size());
        for (org.antlr.v4.runtime.Token token : stream.getTokens()) {
            tokens.add(convert(token, lexer, input.size()));
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(tokens);
        }
        return tokens;
    }

    private static Token convert(org.antlr.v4.runtime.Token token, ErbLexer lexer, int inputSize) {
        if (token.getType() == org.antlr.v4.runtime.Token.EOF) {
            return new Token(
                    TokenKind.EOF, "", new Location(inputSize, inputSize, token.getLine(), token.getLine()));
        }
        String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
        if (symbolic == null) {
            throw new IllegalStateException("Lexer produced unnamed token type " + token.getType());
        }
        String text = token.getText();
        int endLine = token.getLine() + countNewLines(text);
        Location location = new Location(token.getStartIndex(), token.getStopIndex() + 1, token.getLine(), endLine);
        return new Token(TokenKind.valueOf(symbolic), text, location);
    }

    private static int countNewLines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static ErbLexicalException toLexicalException(
            CharStream input, ThrowingLexerErrorListener.LexicalFailure failure) {
        int index = failure.getIndex() >= 0 ? failure.getIndex() : input.index();
        int codePoint = index < input.size() ? input.getText(Interval.of(index, index)).codePointAt(0) : -1;
        String shown = codePoint >= 0 ? new String(Character.toChars(codePoint)) : "<EOF>";
        Location location = new Location(index, Math.min(index + 1, input.size()), failure.getLine(), failure.getLine());
        return new ErbLexicalException(
                "Unexpected character '" + shown + "' at line " + failure.getLine() + ", column " + failure.getColumn(),
                location,
                codePoint,
                failure.getColumn(),
                failure);
    }
}

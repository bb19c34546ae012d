package com.erbformat.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ThrowingLexerErrorListener extends BaseErrorListener {
    static final ThrowingLexerErrorListener INSTANCE = new ThrowingLexerErrorListener();

    private ThrowingLexerErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        int index = e instanceof LexerNoViableAltException ? ((LexerNoViableAltException) e).getStartIndex() : -1;
        throw new LexicalFailure(
                "line " + line + ":" + (charPositionInLine + 1) + " " + msg, line, charPositionInLine + 1, index, e);
    }

    /** Carries the position of a lexer failure out of ANTLR's listener callback. */
    static final class LexicalFailure extends ParseCancellationException {
        private final int line;
        private final int column;
        private final int index;

        LexicalFailure(String message, int line, int column, int index, Throwable cause) {
            super(message, cause);
            this.line = line;
            this.column = column;
            this.index = index;
        }

        int getLine() {
            return line;
        }

        int getColumn() {
            return column;
        }

        int getIndex() {
            return index;
        }
    }
}

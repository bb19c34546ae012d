package com.erbformat.parser;

import com.erbformat.parser.ast.Token;
import com.erbformat.parser.ast.TokenKind;
import java.util.List;
import java.util.Optional;

/** Rewindable read position over a lexed token list that always ends with an EOF token. */
final class TokenCursor {
    private final List<Token> tokens;
    private int index;

    TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getKind() != TokenKind.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    Token peek() {
        return tokens.get(index);
    }

    /** Looks {@code distance} tokens ahead without moving; clamps to the EOF token. */
    Token peek(int distance) {
        return tokens.get(Math.min(index + distance, tokens.size() - 1));
    }

    boolean atEnd() {
        return peek().getKind() == TokenKind.EOF;
    }

    int mark() {
        return index;
    }

    void reset(int mark) {
        index = mark;
    }

    Optional<Token> consume(TokenKind kind) {
        Token next = peek();
        if (next.getKind() != kind || kind == TokenKind.EOF) {
            return Optional.empty();
        }
        index++;
        return Optional.of(next);
    }

    Optional<Token> consumeAny(TokenKind... kinds) {
        for (TokenKind kind : kinds) {
            Optional<Token> token = consume(kind);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }
}

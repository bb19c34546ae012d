package com.erbformat.code.ruby;

import com.erbformat.code.CodeFormatter;
import com.erbformat.code.CodeFragment;
import com.erbformat.code.CodeStatement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link CodeFormatter} for Ruby fragments. It does not build a Ruby syntax tree; it reads
 * the fragment's bracket and block-keyword structure, which is enough to split statements and to
 * rewrite whitespace without changing what the code means. Anything it cannot account for (an
 * unterminated literal, an unbalanced {@code end}, a trailing operator) makes the fragment
 * unparsable.
 */
public final class RubyCodeFormatter implements CodeFormatter {
    private static final Logger LOGGER = Logger.getLogger(RubyCodeFormatter.class.getName());

    private static final Set<String> KEYWORDS =
            Set.of(
                    "do", "if", "unless", "while", "until", "case", "begin", "def", "class", "module", "for",
                    "end", "then", "else", "elsif", "when", "in", "rescue", "ensure");
    private static final Set<String> ALWAYS_OPENS = Set.of("do", "case", "begin", "def", "class", "module", "for");
    private static final Set<String> MODIFIABLE = Set.of("if", "unless", "while", "until");
    private static final Set<String> LOOPS = Set.of("while", "until", "for");
    private static final Set<String> THEN_OWNERS = Set.of("if", "unless", "case", "begin", "def");
    private static final Set<String> EXPRESSION_PREFIXES =
            Set.of("then", "else", "do", "begin", "return", "and", "or", "not", "ensure");

    @Override
    public Optional<CodeFragment> parse(String source) {
        try {
            List<PlacedToken> placed = place(RubyTokenizer.tokenize(source));
            return Optional.of(new CodeFragment(split(placed)));
        } catch (RubySyntaxException e) {
            LOGGER.log(Level.FINE, "Fragment left as written: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Annotates every token with its nesting depth and checks that the structure is balanced. */
    private static List<PlacedToken> place(List<RubyToken> tokens) throws RubySyntaxException {
        List<PlacedToken> placed = new ArrayList<>(tokens.size());
        Deque<String> open = new ArrayDeque<>();
        boolean loopAwaitingDo = false;
        RubyToken lastSignificant = null;

        for (int i = 0; i < tokens.size(); i++) {
            RubyToken token = tokens.get(i);
            int depth = open.size();
            boolean keyword = isKeyword(tokens, i);
            boolean hardBreak = false;

            if (keyword) {
                String word = token.text();
                if (word.equals("end")) {
                    if (open.isEmpty() || !isWord(open.peek())) {
                        throw new RubySyntaxException("unexpected 'end'");
                    }
                    open.pop();
                } else if (word.equals("then")) {
                    if (open.isEmpty() || !THEN_OWNERS.contains(open.peek())) {
                        throw new RubySyntaxException("'then' outside a conditional");
                    }
                } else if (word.equals("do")) {
                    if (loopAwaitingDo) {
                        loopAwaitingDo = false;
                    } else {
                        open.push(word);
                    }
                } else if (ALWAYS_OPENS.contains(word) || (MODIFIABLE.contains(word) && startsExpression(tokens, i))) {
                    open.push(word);
                    loopAwaitingDo = LOOPS.contains(word);
                }
            } else if (token.type() == RubyToken.Type.OPEN) {
                open.push(token.text());
            } else if (token.type() == RubyToken.Type.CLOSE) {
                if (open.isEmpty() || !matches(open.peek(), token.text())) {
                    throw new RubySyntaxException("unbalanced '" + token.text() + "'");
                }
                open.pop();
            } else if (token.type() == RubyToken.Type.NEWLINE) {
                loopAwaitingDo = false;
                RubyToken before = i > 0 ? tokens.get(i - 1) : null;
                hardBreak =
                        open.stream().anyMatch(RubyCodeFormatter::isWord)
                                || "{".equals(open.peek())
                                || (before != null && before.type() == RubyToken.Type.COMMENT);
            } else if (token.type() == RubyToken.Type.SEMICOLON) {
                loopAwaitingDo = false;
            }

            if (!token.isLayout() && token.type() != RubyToken.Type.COMMENT) {
                lastSignificant = token;
            }
            placed.add(new PlacedToken(token, depth, hardBreak, keyword));
        }

        if (!open.isEmpty()) {
            throw new RubySyntaxException("'" + open.peek() + "' is never closed");
        }
        if (lastSignificant != null
                && (lastSignificant.type() == RubyToken.Type.OPERATOR || lastSignificant.type() == RubyToken.Type.COMMA)) {
            throw new RubySyntaxException("fragment ends with '" + lastSignificant.text() + "'");
        }
        return placed;
    }

    private static boolean isKeyword(List<RubyToken> tokens, int index) {
        RubyToken token = tokens.get(index);
        if (token.type() != RubyToken.Type.WORD || !KEYWORDS.contains(token.text())) {
            return false;
        }
        RubyToken previous = previousSignificant(tokens, index);
        return previous == null
                || previous.type() != RubyToken.Type.OPERATOR
                || !(previous.text().endsWith(".") || previous.text().endsWith("::"));
    }

    /** Whether {@code if}/{@code unless}/{@code while}/{@code until} at {@code index} starts an expression rather than modifying one. */
    private static boolean startsExpression(List<RubyToken> tokens, int index) {
        for (int i = index - 1; i >= 0; i--) {
            RubyToken previous = tokens.get(i);
            switch (previous.type()) {
                case SPACE:
                    continue;
                case NEWLINE:
                case SEMICOLON:
                case OPEN:
                case COMMA:
                case OPERATOR:
                case LABEL:
                    return true;
                case WORD:
                    return EXPRESSION_PREFIXES.contains(previous.text());
                default:
                    return false;
            }
        }
        return true;
    }

    private static RubyToken previousSignificant(List<RubyToken> tokens, int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (!tokens.get(i).isLayout()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private static boolean isWord(String opener) {
        return Character.isLetter(opener.charAt(0));
    }

    private static boolean matches(String opener, String closer) {
        switch (opener) {
            case "(":
                return closer.equals(")");
            case "[":
                return closer.equals("]");
            case "{":
                return closer.equals("}");
            default:
                return false;
        }
    }

    /**
     * Splits at top-level semicolons and line breaks. A line break does not end a statement when
     * the line ends with an operator or comma, or when the next line starts with a method call.
     */
    private static List<CodeStatement> split(List<PlacedToken> placed) {
        List<CodeStatement> statements = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < placed.size(); i++) {
            PlacedToken token = placed.get(i);
            if (token.depth() != 0) {
                continue;
            }
            boolean ends =
                    token.type() == RubyToken.Type.SEMICOLON
                            || (token.type() == RubyToken.Type.NEWLINE && !continues(placed, i));
            if (ends) {
                addStatement(statements, placed.subList(start, i));
                start = i + 1;
            }
        }
        addStatement(statements, placed.subList(start, placed.size()));
        return statements;
    }

    private static boolean continues(List<PlacedToken> placed, int newLine) {
        PlacedToken before = null;
        for (int i = newLine - 1; i >= 0; i--) {
            if (placed.get(i).type() != RubyToken.Type.SPACE) {
                before = placed.get(i);
                break;
            }
        }
        if (before != null
                && (before.type() == RubyToken.Type.OPERATOR || before.type() == RubyToken.Type.COMMA)) {
            return true;
        }
        if (before != null && before.type() == RubyToken.Type.COMMENT) {
            return false;
        }
        for (int i = newLine + 1; i < placed.size(); i++) {
            PlacedToken after = placed.get(i);
            if (!after.token().isLayout()) {
                return RubyStatement.isCallOperator(after);
            }
        }
        return false;
    }

    private static void addStatement(List<CodeStatement> statements, List<PlacedToken> slice) {
        int from = 0;
        int to = slice.size();
        while (from < to && slice.get(from).token().isLayout()) {
            from++;
        }
        while (to > from && slice.get(to - 1).token().isLayout()) {
            to--;
        }
        if (from < to) {
            statements.add(new RubyStatement(new ArrayList<>(slice.subList(from, to))));
        }
    }
}

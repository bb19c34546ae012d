package com.erbformat.code.ruby;

import com.erbformat.code.CodeStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class RubyStatement implements CodeStatement {
    private static final Set<String> DEDENTING_KEYWORDS = Set.of("end", "else", "elsif", "when", "in", "rescue", "ensure");

    private final List<PlacedToken> tokens;
    private final boolean multiLine;
    private final boolean conditional;
    private final boolean commented;

    RubyStatement(List<PlacedToken> tokens) {
        this.tokens = List.copyOf(tokens);
        boolean hard = false;
        boolean ternaryOrIf = false;
        boolean comment = false;
        for (PlacedToken token : this.tokens) {
            hard |= token.isHardBreak();
            comment |= token.type() == RubyToken.Type.COMMENT;
            ternaryOrIf |= token.type() == RubyToken.Type.OPERATOR && token.text().contains("?");
            ternaryOrIf |= token.isKeyword() && (token.text().equals("if") || token.text().equals("unless"));
        }
        this.multiLine = hard;
        this.conditional = ternaryOrIf;
        this.commented = comment;
    }

    @Override
    public String text() {
        return multiLine ? lines().get(0) : canonical(tokens);
    }

    @Override
    public boolean containsConditional() {
        return conditional;
    }

    @Override
    public List<String> render(int maxWidth) {
        if (multiLine) {
            return lines();
        }
        String flat = canonical(tokens);
        if (flat.length() <= maxWidth || conditional || commented) {
            return List.of(flat);
        }
        List<String> broken = breakArguments();
        return broken.isEmpty() ? List.of(flat) : broken;
    }

    /** One row per source line, indented by nesting depth. */
    private List<String> lines() {
        List<String> rows = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= tokens.size(); i++) {
            if (i == tokens.size() || tokens.get(i).type() == RubyToken.Type.NEWLINE) {
                addLine(rows, tokens.subList(start, i));
                start = i + 1;
            }
        }
        return rows;
    }

    private static void addLine(List<String> rows, List<PlacedToken> line) {
        String text = canonical(line);
        if (text.isEmpty()) {
            return;
        }
        PlacedToken first = line.stream().filter(token -> !token.token().isLayout()).findFirst().orElseThrow();
        int depth = first.depth();
        if (first.type() == RubyToken.Type.CLOSE || (first.isKeyword() && DEDENTING_KEYWORDS.contains(first.text()))) {
            depth--;
        }
        rows.add("  ".repeat(Math.max(0, depth)) + text);
    }

    /**
     * Breaks the first top-level parenthesised or bracketed list onto one row per element. Flattening
     * the rows again yields the single-line form.
     */
    private List<String> breakArguments() {
        for (int open = 0; open < tokens.size(); open++) {
            PlacedToken token = tokens.get(open);
            if (token.depth() != 0
                    || token.type() != RubyToken.Type.OPEN
                    || !(token.text().equals("(") || token.text().equals("["))) {
                continue;
            }
            int close = open + 1;
            List<Integer> commas = new ArrayList<>();
            while (tokens.get(close).depth() != 1 || tokens.get(close).type() != RubyToken.Type.CLOSE) {
                if (tokens.get(close).depth() == 1 && tokens.get(close).type() == RubyToken.Type.COMMA) {
                    commas.add(close);
                }
                close++;
            }
            if (commas.isEmpty()) {
                open = close;
                continue;
            }
            return arrange(open, commas, close);
        }
        return List.of();
    }

    private List<String> arrange(int open, List<Integer> commas, int close) {
        List<String> elements = new ArrayList<>();
        int from = open + 1;
        for (int comma : commas) {
            elements.add(canonical(tokens.subList(from, comma)));
            from = comma + 1;
        }
        String last = canonical(tokens.subList(from, close));
        boolean trailingComma = last.isEmpty();
        if (!trailingComma) {
            elements.add(last);
        }
        if (elements.stream().anyMatch(String::isEmpty)) {
            return List.of();
        }

        List<String> rows = new ArrayList<>();
        rows.add(canonical(tokens.subList(0, open + 1)));
        for (int i = 0; i < elements.size(); i++) {
            boolean comma = trailingComma || i < elements.size() - 1;
            rows.add("  " + elements.get(i) + (comma ? "," : ""));
        }
        rows.add(canonical(tokens.subList(close, tokens.size())));
        return rows;
    }

    static boolean isCallOperator(PlacedToken token) {
        return token.type() == RubyToken.Type.OPERATOR
                && (token.text().startsWith(".") || token.text().startsWith("&."))
                && !token.text().startsWith("..");
    }

    /**
     * Rewrites the whitespace between tokens: runs collapse to one space, a comma is followed by
     * exactly one space, nothing sits just inside parentheses or square brackets, and a line break
     * before a method call joins the call onto the receiver.
     */
    static String canonical(List<PlacedToken> slice) {
        StringBuilder out = new StringBuilder();
        PlacedToken previous = null;
        boolean pendingSpace = false;
        boolean joinCall = false;
        for (int i = 0; i < slice.size(); i++) {
            PlacedToken token = slice.get(i);
            if (token.token().isLayout()) {
                pendingSpace = true;
                if (token.type() == RubyToken.Type.NEWLINE && nextIsCall(slice, i)) {
                    joinCall = true;
                }
                continue;
            }
            if (previous != null) {
                boolean space;
                if (joinCall) {
                    space = false;
                } else if (previous.type() == RubyToken.Type.COMMA) {
                    space = token.type() != RubyToken.Type.CLOSE;
                } else {
                    space = pendingSpace
                            && !opensTight(previous)
                            && !closesTight(token)
                            && token.type() != RubyToken.Type.COMMA;
                }
                if (space) {
                    out.append(' ');
                }
            }
            out.append(token.text());
            previous = token;
            pendingSpace = false;
            joinCall = false;
        }
        return out.toString();
    }

    private static boolean nextIsCall(List<PlacedToken> slice, int index) {
        for (int i = index + 1; i < slice.size(); i++) {
            if (!slice.get(i).token().isLayout()) {
                return isCallOperator(slice.get(i));
            }
        }
        return false;
    }

    private static boolean opensTight(PlacedToken token) {
        return token.type() == RubyToken.Type.OPEN && !token.text().equals("{");
    }

    private static boolean closesTight(PlacedToken token) {
        return token.type() == RubyToken.Type.CLOSE && !token.text().equals("}");
    }
}

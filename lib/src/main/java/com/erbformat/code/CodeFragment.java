package com.erbformat.code;

import java.util.List;

public final class CodeFragment {
    private final List<CodeStatement> statements;

    public CodeFragment(List<CodeStatement> statements) {
        this.statements = List.copyOf(statements);
    }

    /** Statements in source order; statements with no content are not included. */
    public List<CodeStatement> statements() {
        return statements;
    }

    public boolean isBlank() {
        return statements.isEmpty();
    }

    public boolean containsConditional() {
        for (CodeStatement statement : statements) {
            if (statement.containsConditional()) {
                return true;
            }
        }
        return false;
    }
}

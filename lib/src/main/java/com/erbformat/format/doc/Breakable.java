package com.erbformat.format.doc;

import java.util.Objects;

/** A point where a line may break; printed as its separator when the enclosing group stays flat. */
public final class Breakable implements Doc {
    public enum Force {
        /** Decided by the enclosing group. */
        NONE,
        /** Always a line break; every enclosing group breaks too. */
        BREAK,
        /** Always a line break, without affecting enclosing groups. */
        LOCAL,
        /** Always a line break to column zero, ignoring indentation; enclosing groups break. */
        LITERAL
    }

    private final String separator;
    private final Force force;

    Breakable(String separator, Force force) {
        this.separator = Objects.requireNonNull(separator, "separator");
        this.force = Objects.requireNonNull(force, "force");
    }

    public String getSeparator() {
        return separator;
    }

    public Force getForce() {
        return force;
    }

    public boolean isForced() {
        return force != Force.NONE;
    }

    @Override
    public boolean propagatesBreak() {
        return force == Force.BREAK || force == Force.LITERAL;
    }
}

package com.erbformat.format.doc;

import java.util.Objects;

public final class Text implements Doc {
    private final String value;

    Text(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean propagatesBreak() {
        return false;
    }

    @Override
    public String toString() {
        return "Text[" + value + "]";
    }
}

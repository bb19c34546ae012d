package com.erbformat.format.doc;

import java.util.List;

public final class Concat implements Doc {
    private final List<Doc> parts;
    private final boolean propagatesBreak;

    Concat(List<Doc> parts) {
        this.parts = List.copyOf(parts);
        this.propagatesBreak = this.parts.stream().anyMatch(Doc::propagatesBreak);
    }

    public List<Doc> getParts() {
        return parts;
    }

    @Override
    public boolean propagatesBreak() {
        return propagatesBreak;
    }
}

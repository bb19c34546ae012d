package com.erbformat.format.doc;

import static com.erbformat.format.doc.DocBuilder.breakable;
import static com.erbformat.format.doc.DocBuilder.concat;
import static com.erbformat.format.doc.DocBuilder.forced;
import static com.erbformat.format.doc.DocBuilder.group;
import static com.erbformat.format.doc.DocBuilder.indent;
import static com.erbformat.format.doc.DocBuilder.literalBreak;
import static com.erbformat.format.doc.DocBuilder.localBreak;
import static com.erbformat.format.doc.DocBuilder.seplist;
import static com.erbformat.format.doc.DocBuilder.textOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocRendererTest {

    private static Doc list(String... items) {
        List<Doc> docs = new ArrayList<>();
        for (String item : items) {
            docs.add(textOf(item));
        }
        return group(textOf("["), indent(breakable(""), seplist(docs, concat(textOf(","), breakable(" ")))), breakable(""), textOf("]"));
    }

    @Test
    void groupStaysFlatWhenItFits() {
        assertEquals("[a, b, c]", new DocRenderer(20, 2).render(list("a", "b", "c")));
    }

    @Test
    void groupBreaksWhenTooWide() {
        assertEquals("[\n  alpha,\n  beta\n]", new DocRenderer(10, 2).render(list("alpha", "beta")));
    }

    @Test
    void widthCountsTextAfterTheGroup() {
        Doc doc = concat(list("a", "b"), textOf(" trailing text"));

        assertEquals("[\n  a,\n  b\n] trailing text", new DocRenderer(16, 2).render(doc));
    }

    @Test
    void forcedBreakBreaksEnclosingGroups() {
        Doc inner = group(textOf("x"), forced(), textOf("y"));
        Doc outer = group(textOf("a"), breakable(" "), inner);

        assertTrue(((Group) outer).isBroken());
        assertEquals("a\nx\ny", new DocRenderer(80, 2).render(outer));
    }

    @Test
    void localBreakLeavesEnclosingGroupFlat() {
        Doc outer = group(textOf("a"), breakable(" "), textOf("b"), localBreak(), textOf("c"));

        assertFalse(((Group) outer).isBroken());
        assertEquals("a b\nc", new DocRenderer(80, 2).render(outer));
    }

    @Test
    void rootIsInBreakMode() {
        assertEquals("a\nb", new DocRenderer(80, 2).render(concat(textOf("a"), breakable(" "), textOf("b"))));
    }

    @Test
    void trailingSpacesAreTrimmed() {
        Doc doc = concat(textOf("a  "), forced(), indent(forced(), textOf("b")), textOf("   "));

        assertEquals("a\n\n  b", new DocRenderer(80, 2).render(doc));
    }

    @Test
    void indentUsesConfiguredWidth() {
        Doc doc = concat(textOf("a"), indent(forced(), textOf("b"), indent(forced(), textOf("c"))));

        assertEquals("a\n   b\n      c", new DocRenderer(80, 3).render(doc));
    }

    @Test
    void literalBreakIgnoresIndentationAndBreaksGroups() {
        Doc body = group(textOf("x"), breakable(" "), textOf("<<-EOS"), literalBreak(), textOf("  body"), literalBreak(), textOf("EOS"));

        assertTrue(((Group) body).isBroken());
        assertEquals("a\n  x\n  <<-EOS\n  body\nEOS", new DocRenderer(80, 2).render(concat(textOf("a"), indent(forced(), body))));
    }

    @Test
    void multiLineTextMeasuresFromItsLastLine() {
        Doc doc = concat(textOf("<!-- a very long first line of a comment\nend -->"), list("a", "b"));

        assertEquals("<!-- a very long first line of a comment\nend -->[a, b]", new DocRenderer(20, 2).render(doc));
    }

    @Test
    void groupBeforeMultiLineTextOnlyMeasuresItsFirstLine() {
        Doc doc = concat(list("a", "b"), textOf(" x\nthis second line is far too wide"));

        assertEquals("[a, b] x\nthis second line is far too wide", new DocRenderer(12, 2).render(doc));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new DocRenderer(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new DocRenderer(80, -1));
    }
}

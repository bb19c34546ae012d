package com.erbformat.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.erbformat.parser.ErbParser;
import org.junit.jupiter.api.Test;

class TreePrinterTest {

    private static String print(String template, int width) throws Exception {
        return new TreePrinter(width).print(new ErbParser().parse(template));
    }

    @Test
    void selfClosingElement() throws Exception {
        assertEquals(
                "(document (html (opening_tag \"<\" \"br\" \"/>\")))", print("<br/>", 200));
    }

    @Test
    void erbTagShowsItsContent() throws Exception {
        assertEquals(
                "(document (erb \"<%=\" (content \" name \") \"%>\"))", print("<%= name %>", 200));
    }

    @Test
    void controlChainAndQuoting() throws Exception {
        String printed = print("<% if a %>\"x\"\n<% end %>", 200);

        assertTrue(printed.startsWith("(document (erb_if (erb \"<%\" \" if\""), printed);
        assertTrue(printed.contains("(char_data \"\\\"x\\\"\")"), printed);
        assertTrue(printed.contains("erb_end"), printed);
    }

    @Test
    void breaksNestedListsWhenNarrow() throws Exception {
        String printed = print("<p>a</p>", 20);

        assertEquals(
                String.join(
                        "\n",
                        "(document",
                        "  (html",
                        "    (opening_tag",
                        "      \"<\"",
                        "      \"p\"",
                        "      \">\")",
                        "    (char_data \"a\")",
                        "    (closing_tag",
                        "      \"</\"",
                        "      \"p\"",
                        "      \">\")))"),
                printed);
    }
}

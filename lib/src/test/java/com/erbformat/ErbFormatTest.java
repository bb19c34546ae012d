package com.erbformat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.erbformat.format.FormatOptions;
import com.erbformat.parser.ErbParseException;
import com.erbformat.parser.ast.Document;
import com.erbformat.parser.ast.HtmlElement;
import com.erbformat.testing.TestResources;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ErbFormatTest {

    @TempDir
    Path tempDir;

    @Test
    void parseReturnsDocument() throws Exception {
        Document document = ErbFormat.parse("<p>Hi</p>");

        assertInstanceOf(HtmlElement.class, document.getElements().get(0));
    }

    @Test
    void formatUsesSystemProperties() throws Exception {
        System.setProperty("erbformat.indentWidth", "4");
        try {
            assertEquals("<ul>\n    <li>a</li>\n</ul>\n", ErbFormat.format("<ul><li>a</li></ul>"));
        } finally {
            System.clearProperty("erbformat.indentWidth");
        }
    }

    @Test
    void formatWithExplicitWidth() throws Exception {
        String formatted = ErbFormat.format("<p>Hello <%= first_name %> and welcome back</p>", 20);

        assertTrue(formatted.contains("\n"), formatted);
        assertEquals(formatted, ErbFormat.format(formatted, new FormatOptions(20, 2)));
    }

    @Test
    void formatPropagatesParseErrors() {
        assertThrows(ErbParseException.class, () -> ErbFormat.format("<div>", FormatOptions.defaults()));
    }

    @Test
    void readDecodesUtf8() throws Exception {
        Path template = tempDir.resolve("greeting.html.erb");
        Files.write(template, "<p>Grüße 😀</p>".getBytes(StandardCharsets.UTF_8));

        assertEquals("<p>Grüße 😀</p>\n", ErbFormat.format(ErbFormat.read(template), FormatOptions.defaults()));
    }

    @Test
    void readsFixtureFromDisk() throws Exception {
        Path template = TestResources.copyFixture("list.html.erb", tempDir);

        assertEquals(
                TestResources.fixture("list.formatted.html.erb"),
                ErbFormat.format(ErbFormat.read(template), FormatOptions.defaults()));
    }

    @Test
    void prettyPrintDumpsTree() throws Exception {
        assertEquals("(document (html (opening_tag \"<\" \"hr\" \">\")))", ErbFormat.prettyPrint(ErbFormat.parse("<hr>")));
    }

    @Test
    void versionStringIncludesAntlr() {
        assertTrue(Version.RUNTIME.contains(Version.FULL));
        assertTrue(Version.RUNTIME.contains("ANTLR"), Version.RUNTIME);
    }
}

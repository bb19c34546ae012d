package com.erbformat.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class FormatOptionsTest {

    @Test
    void defaultsWhenNothingIsSet() {
        FormatOptions options = FormatOptions.fromSources(key -> null, key -> null);

        assertEquals(FormatOptions.defaults(), options);
        assertEquals(80, options.getPrintWidth());
        assertEquals(2, options.getIndentWidth());
    }

    @Test
    void propertiesWinOverEnvironment() {
        Map<String, String> properties = Map.of("erbformat.printWidth", "100");
        Map<String, String> environment = Map.of("ERBFORMAT_PRINT_WIDTH", "60", "ERBFORMAT_INDENT_WIDTH", "4");

        FormatOptions options = FormatOptions.fromSources(properties::get, environment::get);

        assertEquals(new FormatOptions(100, 4), options);
    }

    @Test
    void invalidNumberNamesItsSource() {
        Map<String, String> environment = Map.of("ERBFORMAT_INDENT_WIDTH", "two");

        IllegalArgumentException error =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> FormatOptions.fromSources(key -> null, environment::get));

        assertTrue(error.getMessage().contains("ERBFORMAT_INDENT_WIDTH"), error.getMessage());
    }

    @Test
    void rejectsNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> new FormatOptions(0, 2));
        assertThrows(IllegalArgumentException.class, () -> FormatOptions.defaults().withPrintWidth(-1));
    }
}

package com.erbformat.code;

import java.util.Optional;

/**
 * Reads and lays out the script fragments embedded in ERB tags. The formatter only ever rearranges
 * whitespace; a fragment it cannot read is reported as unparsable and left to the caller.
 */
public interface CodeFormatter {

    /**
     * Parse a fragment.
     *
     * @param source Raw fragment text between the tag delimiters.
     * @return The fragment split into statements, or empty when the fragment cannot be read.
     */
    Optional<CodeFragment> parse(String source);
}

package dev.spellkit.affix.table;

import java.util.Objects;

/**
 * One ICONV or OCONV mapping.
 */
public record ConversionEntry(String input, String output) {

    public ConversionEntry {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
    }
}

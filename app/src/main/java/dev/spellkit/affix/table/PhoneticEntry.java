package dev.spellkit.affix.table;

import java.util.Objects;

/**
 * A PHONE rule and its transformation.
 */
public record PhoneticEntry(String rule, String replacement) {

    public PhoneticEntry {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(replacement, "replacement");
    }
}

package dev.spellkit.affix.table;

import java.util.Objects;

/**
 * A typical-misspelling pair from the REP table, with anchors already removed from the pattern.
 */
public record ReplacementEntry(String pattern, String replacement, ReplacementPosition position) {

    public ReplacementEntry {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        Objects.requireNonNull(position, "position");
    }
}

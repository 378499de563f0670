package dev.spellkit.affix.table;

import java.util.List;

/**
 * Related characters or character sequences from one MAP line.
 */
public record MapEntry(List<String> units) {

    public MapEntry {
        units = List.copyOf(units);
    }
}

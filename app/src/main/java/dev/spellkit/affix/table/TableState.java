package dev.spellkit.affix.table;

/**
 * Initialization status of a table-valued directive.
 */
public enum TableState {
    /**
     * No line has been supplied for the table yet.
     */
    UNTOUCHED,
    /**
     * The first line was a bare count and only sized the table.
     */
    SIZE_HINTED,
    /**
     * At least one entry line has been seen.
     */
    POPULATED
}

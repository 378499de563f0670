package dev.spellkit.affix.table;

/**
 * Where a REP pattern is allowed to match inside a word.
 */
public enum ReplacementPosition {
    MEDIAL,
    INITIAL,
    FINAL,
    ISOLATED
}

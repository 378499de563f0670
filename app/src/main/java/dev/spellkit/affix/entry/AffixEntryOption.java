package dev.spellkit.affix.entry;

/**
 * Options recorded on an affix group header.
 */
public enum AffixEntryOption {
    CROSS_PRODUCT,
    ALIAS_F,
    ALIAS_M
}

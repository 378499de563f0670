package dev.spellkit.affix.condition;

/**
 * Outcome of comparing a condition with the literal text an entry strips.
 */
public enum Subsumption {
    /**
     * Every word carrying the literal satisfies the condition.
     */
    SUBSUMED,
    /**
     * The literal agrees with the condition but the condition also constrains characters beyond it.
     */
    CONDITION_LONGER,
    /**
     * The literal contradicts the condition; no word carrying the literal can satisfy it.
     */
    CONFLICT
}

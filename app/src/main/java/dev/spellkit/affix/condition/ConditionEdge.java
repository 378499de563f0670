package dev.spellkit.affix.condition;

/**
 * Edge of a word a condition is anchored to. Condition atoms are always stored edge-first, so the edge only
 * decides which end of the candidate text is read.
 */
public enum ConditionEdge {
    PREFIX {
        @Override
        public char charAt(CharSequence text, int offset) {
            return text.charAt(offset);
        }
    },
    SUFFIX {
        @Override
        public char charAt(CharSequence text, int offset) {
            return text.charAt(text.length() - 1 - offset);
        }
    };

    /**
     * Returns the character {@code offset} positions away from this edge.
     */
    public abstract char charAt(CharSequence text, int offset);
}

package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.ConditionEdge;

/**
 * Direction of an affix table.
 */
public enum AffixKind {
    PREFIX(ConditionEdge.PREFIX),
    SUFFIX(ConditionEdge.SUFFIX);

    private final ConditionEdge edge;

    AffixKind(ConditionEdge edge) {
        this.edge = edge;
    }

    public ConditionEdge edge() {
        return edge;
    }
}

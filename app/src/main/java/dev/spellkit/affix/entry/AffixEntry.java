package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.condition.ConditionEdge;
import dev.spellkit.affix.flag.FlagValue;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One prefix or suffix rule of an affix group.
 *
 * <p>The rule removes {@link #strip()} from the edge of a root, attaches {@link #affix()} in its place and is
 * only allowed when the root satisfies {@link #condition()}.
 */
public abstract class AffixEntry {

    private final String strip;
    private final String affix;
    private final CharacterConditionGroup condition;
    private final SortedSet<FlagValue> continuationClass;
    private final List<String> morphology;

    protected AffixEntry(String strip, String affix, CharacterConditionGroup condition,
                         SortedSet<FlagValue> continuationClass, List<String> morphology) {
        this.strip = Objects.requireNonNull(strip, "strip");
        this.affix = Objects.requireNonNull(affix, "affix");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.continuationClass = Collections.unmodifiableSortedSet(new TreeSet<>(continuationClass));
        this.morphology = List.copyOf(morphology);
    }

    public abstract AffixKind kind();

    /**
     * Attaches the affix to {@code root}, assuming {@link #canApplyTo(String)} holds.
     */
    public abstract String add(String root);

    /**
     * Undoes this rule on an affixed word, returning the root when the word carries the affix and the restored
     * root satisfies the condition.
     */
    public abstract Optional<String> remove(String word);

    public String strip() {
        return strip;
    }

    public String affix() {
        return affix;
    }

    public CharacterConditionGroup condition() {
        return condition;
    }

    public SortedSet<FlagValue> continuationClass() {
        return continuationClass;
    }

    public boolean hasContinuationFlag(FlagValue flag) {
        return continuationClass.contains(flag);
    }

    public List<String> morphology() {
        return morphology;
    }

    public ConditionEdge edge() {
        return kind().edge();
    }

    public boolean conditionMatches(String root) {
        return condition.matches(root, edge());
    }

    public boolean canApplyTo(String root) {
        return root.length() >= strip.length() && hasStripAtEdge(root) && conditionMatches(root);
    }

    protected abstract boolean hasStripAtEdge(String root);

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        AffixEntry entry = (AffixEntry) other;
        return strip.equals(entry.strip)
                && affix.equals(entry.affix)
                && condition.equals(entry.condition)
                && continuationClass.equals(entry.continuationClass)
                && morphology.equals(entry.morphology);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), strip, affix, condition, continuationClass, morphology);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[strip=" + strip + ", affix=" + affix + ", condition="
                + condition.toConditionText() + ", continuation=" + continuationClass + ", morphology=" + morphology + "]";
    }
}

package dev.spellkit.affix.entry;

import java.util.Objects;

/**
 * Shape of a PFX/SFX parameter line after tokenizing.
 */
public interface AffixLine {

    String flag();

    /**
     * {@code flag cross-product count}: opens an affix group.
     */
    record HeaderLine(String flag, boolean crossProduct, int expectedCount) implements AffixLine {

        public HeaderLine {
            Objects.requireNonNull(flag, "flag");
        }
    }

    /**
     * {@code flag strip affix[/continuation] condition [morphology...]}: one affix entry.
     */
    record BodyLine(String flag, String strip, String affix, String condition, String morphology) implements AffixLine {

        public BodyLine {
            Objects.requireNonNull(flag, "flag");
            Objects.requireNonNull(strip, "strip");
            Objects.requireNonNull(affix, "affix");
            Objects.requireNonNull(condition, "condition");
            morphology = morphology == null ? "" : morphology;
        }

        public boolean hasMorphology() {
            return !morphology.isEmpty();
        }
    }
}

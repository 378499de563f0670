package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.ConditionReverser;
import java.util.Locale;

/**
 * Maps directives to the tables they fill and mirrors entry text, depending on whether {@code COMPLEXPREFIXES}
 * is active. With complex prefixes the prefix and suffix roles are swapped and all entry text is reversed.
 */
public record Orientation(boolean complexPrefixes) {

    public static final Orientation STANDARD = new Orientation(false);
    public static final Orientation COMPLEX_PREFIXES = new Orientation(true);

    /**
     * Compound boundary named by COMPOUNDBEGIN / COMPOUNDEND.
     */
    public enum CompoundBoundary {
        BEGIN,
        END
    }

    public static Orientation of(boolean complexPrefixes) {
        return complexPrefixes ? COMPLEX_PREFIXES : STANDARD;
    }

    /**
     * Resolves {@code PFX} or {@code SFX} to the table it populates.
     */
    public AffixKind affixKind(String directive) {
        boolean prefix = switch (directive.toUpperCase(Locale.ROOT)) {
            case "PFX" -> true;
            case "SFX" -> false;
            default -> throw new IllegalArgumentException("not an affix directive: " + directive);
        };
        return prefix != complexPrefixes ? AffixKind.PREFIX : AffixKind.SUFFIX;
    }

    public CompoundBoundary compoundBoundary(CompoundBoundary requested) {
        if (!complexPrefixes) {
            return requested;
        }
        return requested == CompoundBoundary.BEGIN ? CompoundBoundary.END : CompoundBoundary.BEGIN;
    }

    /**
     * Reverses plain text (strip, affix, morphology) when complex prefixes are active.
     */
    public String mirror(String text) {
        return complexPrefixes ? new StringBuilder(text).reverse().toString() : text;
    }

    /**
     * Reverses condition text when complex prefixes are active, keeping its classes intact.
     */
    public String mirrorCondition(String conditionText) {
        return complexPrefixes ? ConditionReverser.reverse(conditionText) : conditionText;
    }
}

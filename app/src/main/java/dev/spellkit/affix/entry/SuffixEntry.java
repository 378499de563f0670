package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.flag.FlagValue;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Suffix rule. Its condition atoms are stored from the end of the word backwards.
 */
public final class SuffixEntry extends AffixEntry {

    public SuffixEntry(String strip, String affix, CharacterConditionGroup condition,
                       SortedSet<FlagValue> continuationClass, List<String> morphology) {
        super(strip, affix, condition, continuationClass, morphology);
    }

    @Override
    public AffixKind kind() {
        return AffixKind.SUFFIX;
    }

    @Override
    public String add(String root) {
        return root.substring(0, root.length() - strip().length()) + affix();
    }

    @Override
    public Optional<String> remove(String word) {
        if (!word.endsWith(affix()) || word.length() <= affix().length()) {
            return Optional.empty();
        }
        String root = word.substring(0, word.length() - affix().length()) + strip();
        return conditionMatches(root) ? Optional.of(root) : Optional.empty();
    }

    @Override
    protected boolean hasStripAtEdge(String root) {
        return root.endsWith(strip());
    }
}

package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.flag.FlagValue;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

public final class PrefixEntry extends AffixEntry {

    public PrefixEntry(String strip, String affix, CharacterConditionGroup condition,
                       SortedSet<FlagValue> continuationClass, List<String> morphology) {
        super(strip, affix, condition, continuationClass, morphology);
    }

    @Override
    public AffixKind kind() {
        return AffixKind.PREFIX;
    }

    @Override
    public String add(String root) {
        return affix() + root.substring(strip().length());
    }

    @Override
    public Optional<String> remove(String word) {
        if (!word.startsWith(affix()) || word.length() <= affix().length()) {
            return Optional.empty();
        }
        String root = strip() + word.substring(affix().length());
        return conditionMatches(root) ? Optional.of(root) : Optional.empty();
    }

    @Override
    protected boolean hasStripAtEdge(String root) {
        return root.startsWith(strip());
    }
}

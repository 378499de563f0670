package dev.spellkit.affix.entry;

import static org.assertj.core.api.Assertions.assertThat;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.condition.ConditionReverser;
import dev.spellkit.affix.flag.FlagValue;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class AffixEntryTest {

    private static SuffixEntry suffix(String strip, String affix, String condition) {
        return new SuffixEntry(strip, affix, CharacterConditionGroup.parse(ConditionReverser.reverse(condition)),
                Collections.emptySortedSet(), List.of());
    }

    private static PrefixEntry prefix(String strip, String affix, String condition) {
        return new PrefixEntry(strip, affix, CharacterConditionGroup.parse(condition), Collections.emptySortedSet(), List.of());
    }

    @Test
    void continuationFlagsAreLookedUpByValue() {
        SuffixEntry entry = new SuffixEntry("", "s", CharacterConditionGroup.ALLOW_ANY,
                new TreeSet<>(List.of(FlagValue.ofChar('A'), FlagValue.ofChar('B'))), List.of());

        assertThat(entry.hasContinuationFlag(FlagValue.ofChar('B'))).isTrue();
        assertThat(entry.hasContinuationFlag(FlagValue.ofChar('C'))).isFalse();
    }

    @Test
    void suffixReplacesTheStripAtTheEnd() {
        SuffixEntry entry = suffix("y", "ied", "[^aeiou]y");

        assertThat(entry.canApplyTo("carry")).isTrue();
        assertThat(entry.add("carry")).isEqualTo("carried");
        assertThat(entry.canApplyTo("play")).isFalse();
    }

    @Test
    void suffixRemovalRestoresTheRoot() {
        SuffixEntry entry = suffix("y", "ied", "[^aeiou]y");

        assertThat(entry.remove("carried")).contains("carry");
        assertThat(entry.remove("played")).isEmpty();
        assertThat(entry.remove("ied")).isEmpty();
    }

    @Test
    void prefixAttachesAtTheStart() {
        PrefixEntry entry = prefix("", "re", ".");

        assertThat(entry.canApplyTo("do")).isTrue();
        assertThat(entry.add("do")).isEqualTo("redo");
        assertThat(entry.remove("redo")).contains("do");
        assertThat(entry.remove("undo")).isEmpty();
    }

    @Test
    void prefixStripMustBePresent() {
        PrefixEntry entry = prefix("in", "un", "in");

        assertThat(entry.canApplyTo("insane")).isTrue();
        assertThat(entry.add("insane")).isEqualTo("unsane");
        assertThat(entry.canApplyTo("sane")).isFalse();
    }

    @Test
    void conditionIsCheckedAtTheEntryEdge() {
        assertThat(suffix("", "s", "[^s]").conditionMatches("cat")).isTrue();
        assertThat(suffix("", "s", "[^s]").conditionMatches("bus")).isFalse();
        assertThat(prefix("", "a", "[^s]").conditionMatches("bus")).isTrue();
    }
}

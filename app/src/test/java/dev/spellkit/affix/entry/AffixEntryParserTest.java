package dev.spellkit.affix.entry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.flag.FlagMode;
import dev.spellkit.affix.flag.FlagParser;
import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.model.AffixFormatException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class AffixEntryParserTest {

    private static final FlagParser CHAR_FLAGS = new FlagParser(FlagMode.CHAR, StandardCharsets.ISO_8859_1);
    private static final FlagValue D = FlagValue.ofChar('D');

    private final List<String> warnings = new ArrayList<>();
    private final AffixEntryParser parser = new AffixEntryParser(warnings::add);

    private static AffixEntryParser.Context context() {
        return new AffixEntryParser.Context(CHAR_FLAGS, Orientation.STANDARD, "", false, List.of(), false, List.of());
    }

    @Test
    void headerOpensAGroupWithItsOptions() {
        AffixGroupTable<SuffixEntry> table = AffixGroupTable.suffixes();

        assertThat(parser.parse("D Y 4", table, context())).isEmpty();

        assertThat(table.find(D)).hasValueSatisfying(group ->
                assertThat(group.options()).containsExactly(AffixEntryOption.CROSS_PRODUCT));
    }

    @Test
    void headerNotesActiveAliasTables() {
        AffixGroupTable<SuffixEntry> table = AffixGroupTable.suffixes();
        AffixEntryParser.Context context = new AffixEntryParser.Context(
                CHAR_FLAGS, Orientation.STANDARD, "", true, List.of(), true, List.of());

        parser.parse("D N 1", table, context);

        assertThat(table.find(D).orElseThrow().options())
                .containsExactlyInAnyOrder(AffixEntryOption.ALIAS_F, AffixEntryOption.ALIAS_M);
    }

    @Test
    void duplicateHeaderIsRejected() {
        AffixGroupTable<SuffixEntry> table = AffixGroupTable.suffixes();
        parser.parse("D Y 1", table, context());

        Throwable thrown = catchThrowable(() -> parser.parse("D Y 1", table, context()));

        assertThat(thrown).isInstanceOf(AffixFormatException.class).hasMessageContaining("duplicate");
        assertThat(table.groupCount()).isEqualTo(1);
    }

    @Test
    void suffixConditionIsStoredEdgeFirst() {
        AffixGroupTable<SuffixEntry> table = AffixGroupTable.suffixes();

        SuffixEntry entry = parser.parse("D y ied [^aeiou]y", table, context()).orElseThrow();

        assertThat(entry.strip()).isEqualTo("y");
        assertThat(entry.affix()).isEqualTo("ied");
        assertThat(entry.condition().toConditionText()).isEqualTo("y[^aeiou]");
        assertThat(entry.add("carry")).isEqualTo("carried");
    }

    @Test
    void conditionImpliedByTheStripBecomesAllowAny() {
        SuffixEntry entry = parser.parse("G e ing e", AffixGroupTable.suffixes(), context()).orElseThrow();

        assertThat(entry.condition()).isSameAs(CharacterConditionGroup.ALLOW_ANY);
        assertThat(warnings).isEmpty();
    }

    @Test
    void stripContradictingTheConditionIsKeptWithAWarning() {
        SuffixEntry entry = parser.parse("X a b c", AffixGroupTable.suffixes(), context()).orElseThrow();

        assertThat(entry.condition().toConditionText()).isEqualTo("c");
        assertThat(warnings).singleElement().satisfies(warning -> assertThat(warning).contains("can never satisfy"));
    }

    @Test
    void continuationFlagsAreParsedAfterTheSlash() {
        SuffixEntry entry = parser.parse("D 0 s/BA .", AffixGroupTable.suffixes(), context()).orElseThrow();

        assertThat(entry.affix()).isEqualTo("s");
        assertThat(entry.continuationClass()).containsExactly(FlagValue.ofChar('A'), FlagValue.ofChar('B'));
    }

    @Test
    void continuationFlagsResolveThroughTheAliasTable() {
        SortedSet<FlagValue> alias = new TreeSet<>(List.of(FlagValue.ofChar('x'), FlagValue.ofChar('y')));
        AffixEntryParser.Context context = new AffixEntryParser.Context(
                CHAR_FLAGS, Orientation.STANDARD, "", true, List.of(alias), false, List.of());
        AffixGroupTable<SuffixEntry> table = AffixGroupTable.suffixes();

        SuffixEntry entry = parser.parse("D 0 s/1 .", table, context).orElseThrow();

        assertThat(entry.continuationClass()).isEqualTo(alias);
        assertThat(catchThrowable(() -> parser.parse("D 0 s/2 .", table, context)))
                .isInstanceOf(AffixFormatException.class)
                .hasMessageContaining("out of range");
        assertThat(catchThrowable(() -> parser.parse("D 0 s/x .", table, context)))
                .isInstanceOf(AffixFormatException.class);
    }

    @Test
    void morphologyIsLiteralOrAnAliasReference() {
        assertThat(parser.parse("D 0 s . po:noun is:pl", AffixGroupTable.suffixes(), context()).orElseThrow().morphology())
                .containsExactly("po:noun", "is:pl");

        AffixEntryParser.Context aliased = new AffixEntryParser.Context(
                CHAR_FLAGS, Orientation.STANDARD, "", false, List.of(), true, List.of(List.of("st:walk")));
        assertThat(parser.parse("D 0 s . 1", AffixGroupTable.suffixes(), aliased).orElseThrow().morphology())
                .containsExactly("st:walk");
    }

    @Test
    void ignoredCharactersAreRemovedFromTheAffix() {
        AffixEntryParser.Context context = new AffixEntryParser.Context(
                CHAR_FLAGS, Orientation.STANDARD, "-", false, List.of(), false, List.of());

        SuffixEntry entry = parser.parse("D 0 s-x .", AffixGroupTable.suffixes(), context).orElseThrow();

        assertThat(entry.affix()).isEqualTo("sx");
    }

    @Test
    void zeroMeansEmptyStripAndAffix() {
        SuffixEntry entry = parser.parse("D 0 0 .", AffixGroupTable.suffixes(), context()).orElseThrow();

        assertThat(entry.strip()).isEmpty();
        assertThat(entry.affix()).isEmpty();
    }

    @Test
    void bodyWithoutHeaderOpensADefaultGroup() {
        AffixGroupTable<PrefixEntry> table = AffixGroupTable.prefixes();

        parser.parse("D 0 re .", table, context());

        assertThat(table.freeze()).singleElement().satisfies(group -> {
            assertThat(group.flag()).isEqualTo(D);
            assertThat(group.options()).isEmpty();
            assertThat(group.entries()).hasSize(1);
        });
    }

    @Test
    void complexPrefixesMirrorEntryText() {
        AffixEntryParser.Context context = new AffixEntryParser.Context(
                CHAR_FLAGS, Orientation.COMPLEX_PREFIXES, "", false, List.of(), false, List.of());
        AffixGroupTable<PrefixEntry> table = AffixGroupTable.prefixes();

        PrefixEntry entry = parser.parse("D 0 cd [^x]b po:ab", table, context).orElseThrow();
        PrefixEntry stripped = parser.parse("D ab 0 .", table, context).orElseThrow();

        assertThat(entry.affix()).isEqualTo("dc");
        assertThat(entry.condition().toConditionText()).isEqualTo("b[^x]");
        assertThat(entry.morphology()).containsExactly("ba:op");
        assertThat(stripped.strip()).isEqualTo("ba");
    }

    @Test
    void rejectedLineLeavesTheTableUntouched() {
        FlagParser longFlags = new FlagParser(FlagMode.LONG, StandardCharsets.ISO_8859_1);
        AffixEntryParser.Context context = new AffixEntryParser.Context(
                longFlags, Orientation.STANDARD, "", false, List.of(), false, List.of());
        AffixGroupTable<SuffixEntry> table = AffixGroupTable.suffixes();

        assertThat(catchThrowable(() -> parser.parse("A 0 s .", table, context))).isInstanceOf(AffixFormatException.class);
        assertThat(catchThrowable(() -> parser.parse("Aa 0 s [x", table, context))).isInstanceOf(AffixFormatException.class);
        assertThat(catchThrowable(() -> parser.parse("Aa Y", table, context))).isInstanceOf(AffixFormatException.class);
        assertThat(table.groupCount()).isZero();
    }
}

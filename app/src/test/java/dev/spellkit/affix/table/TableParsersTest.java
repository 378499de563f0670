package dev.spellkit.affix.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.spellkit.affix.flag.FlagMode;
import dev.spellkit.affix.flag.FlagParser;
import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.model.AffixFormatException;
import dev.spellkit.affix.table.CompoundRuleToken.FlagSetToken;
import dev.spellkit.affix.table.CompoundRuleToken.FlagToken;
import dev.spellkit.affix.table.CompoundRuleToken.Quantifier;
import dev.spellkit.affix.table.CompoundRuleToken.WildcardToken;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TableParsersTest {

    private static final FlagParser CHAR_FLAGS = new FlagParser(FlagMode.CHAR, StandardCharsets.ISO_8859_1);
    private static final FlagParser LONG_FLAGS = new FlagParser(FlagMode.LONG, StandardCharsets.ISO_8859_1);

    @Test
    void replacementAnchorsSelectThePosition() {
        assertThat(TableParsers.replacement("f ph")).isEqualTo(new ReplacementEntry("f", "ph", ReplacementPosition.MEDIAL));
        assertThat(TableParsers.replacement("^f ph").position()).isEqualTo(ReplacementPosition.INITIAL);
        assertThat(TableParsers.replacement("f$ ph").position()).isEqualTo(ReplacementPosition.FINAL);
        assertThat(TableParsers.replacement("^alot$ a_lot"))
                .isEqualTo(new ReplacementEntry("alot", "a lot", ReplacementPosition.ISOLATED));
    }

    @Test
    void conversionNeedsTwoFields() {
        assertThat(TableParsers.conversion("'  ’")).isEqualTo(new ConversionEntry("'", "’"));
        assertThat(catchThrowable(() -> TableParsers.conversion("a"))).isInstanceOf(AffixFormatException.class);
    }

    @Test
    void phoneticDropsUnderscoresFromTheReplacement() {
        assertThat(TableParsers.phonetic("AH(AEIOUY)-^ *H_")).isEqualTo(new PhoneticEntry("AH(AEIOUY)-^", "*H"));
        assertThat(TableParsers.phonetic("GH _")).isEqualTo(new PhoneticEntry("GH", ""));
    }

    @Test
    void mapGroupsParenthesisedUnits() {
        assertThat(TableParsers.map("uúü").units()).containsExactly("u", "ú", "ü");
        assertThat(TableParsers.map("ß(ss)").units()).containsExactly("ß", "ss");
        assertThat(TableParsers.map("a(b").units()).containsExactly("a", "(", "b");
    }

    @Test
    void compoundPatternReadsOptionalFlagsAndReplacement() {
        CompoundPattern pattern = TableParsers.compoundPattern("o/X b/Y z", CHAR_FLAGS);

        assertThat(pattern.first()).isEqualTo("o");
        assertThat(pattern.second()).contains("b");
        assertThat(pattern.replacement()).contains("z");
        assertThat(pattern.firstFlag()).contains(FlagValue.ofChar('X'));
        assertThat(pattern.secondFlag()).contains(FlagValue.ofChar('Y'));
    }

    @Test
    void compoundPatternWithoutFlags() {
        CompoundPattern pattern = TableParsers.compoundPattern("ss s", CHAR_FLAGS);

        assertThat(pattern.firstFlag()).isEmpty();
        assertThat(pattern.second()).contains("s");
        assertThat(pattern.replacement()).isEmpty();
    }

    @Test
    void compoundRuleTokenizesBareFlagsAndWildcards() {
        CompoundRule rule = TableParsers.compoundRule("n*1t", CHAR_FLAGS);

        assertThat(rule.tokens()).containsExactly(
                new FlagToken(FlagValue.ofChar('n')),
                new WildcardToken(Quantifier.ZERO_OR_MORE),
                new FlagToken(FlagValue.ofChar('1')),
                new FlagToken(FlagValue.ofChar('t')));
    }

    @Test
    void compoundRuleReadsParenthesisedLongFlags() {
        CompoundRule rule = TableParsers.compoundRule("(aa)?(bb)(cc)", LONG_FLAGS);

        assertThat(rule.tokens()).containsExactly(
                new FlagToken(FlagValue.ofPair('a', 'a')),
                new WildcardToken(Quantifier.ZERO_OR_ONE),
                new FlagToken(FlagValue.ofPair('b', 'b')),
                new FlagToken(FlagValue.ofPair('c', 'c')));
    }

    @Test
    void compoundRuleGroupWithSeveralFlagsIsASetToken() {
        CompoundRule rule = TableParsers.compoundRule("(ab)c", CHAR_FLAGS);

        assertThat(rule.tokens().get(0)).isEqualTo(new FlagSetToken(Set.of(FlagValue.ofChar('a'), FlagValue.ofChar('b'))));
    }

    @Test
    void compoundRuleRejectsUnclosedGroups() {
        assertThat(catchThrowable(() -> TableParsers.compoundRule("(ab", CHAR_FLAGS)))
                .isInstanceOf(AffixFormatException.class)
                .hasMessageContaining("unclosed");
    }

    @Test
    void aliasFlagsAreSortedAndDistinct() {
        assertThat(TableParsers.aliasFlags("cabca", CHAR_FLAGS))
                .containsExactly(FlagValue.ofChar('a'), FlagValue.ofChar('b'), FlagValue.ofChar('c'));
    }

    @Test
    void aliasMorphologyAppliesTheMirror() {
        assertThat(TableParsers.aliasMorphology("po:noun is:sg", text -> text)).containsExactly("po:noun", "is:sg");
        assertThat(TableParsers.aliasMorphology("ab cd", text -> new StringBuilder(text).reverse().toString()))
                .containsExactly("dc", "ba");
    }
}

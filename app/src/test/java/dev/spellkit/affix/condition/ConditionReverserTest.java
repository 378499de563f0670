package dev.spellkit.affix.condition;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConditionReverserTest {

    @Test
    void reversesAtomsKeepingNegatedClassesIntact() {
        assertThat(ConditionReverser.reverse("[^ab]c")).isEqualTo("c[^ba]");
        assertThat(ConditionReverser.reverse("x[^ab]")).isEqualTo("[^ba]x");
    }

    @Test
    void reversesPlainClassesAndLiterals() {
        assertThat(ConditionReverser.reverse("[ab]c")).isEqualTo("c[ba]");
        assertThat(ConditionReverser.reverse("abc")).isEqualTo("cba");
        assertThat(ConditionReverser.reverse("a.b")).isEqualTo("b.a");
    }

    @Test
    void reversingTwiceRestoresBalancedConditions() {
        for (String condition : new String[] {"[^aeiou]y", "[aeiou]y", "[^ey]", "y", "x^[ab]", "[^a]b[cd]",
                "[a^]", "[ab^]c", "b[c^]", "[^.]a[a^]"}) {
            assertThat(ConditionReverser.reverse(ConditionReverser.reverse(condition))).isEqualTo(condition);
        }
    }

    @Test
    void keepsACaretThatIsNotANegation() {
        assertThat(ConditionReverser.reverse("x^[ab]")).isEqualTo("[ba]^x");
    }

    @Test
    void caretMemberOfAPositiveClassStaysAMember() {
        assertThat(ConditionReverser.reverse("[a^]")).isEqualTo("[a^]");
        assertThat(ConditionReverser.reverse("[ab^]c")).isEqualTo("c[ba^]");
        assertThat(ConditionReverser.reverse("[^^a]x")).isEqualTo("x[^^a]");
    }

    @Test
    void unclosedBracketIsTurnedAround() {
        assertThat(ConditionReverser.reverse("ab[c")).isEqualTo("c]ba");
        assertThat(ConditionReverser.reverse("c]ba")).isEqualTo("ab[c");
    }

    @Test
    void emptyAndNullPassThrough() {
        assertThat(ConditionReverser.reverse("")).isEmpty();
        assertThat(ConditionReverser.reverse(null)).isNull();
    }
}

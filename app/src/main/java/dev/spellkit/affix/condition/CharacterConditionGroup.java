package dev.spellkit.affix.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered sequence of {@link CharacterCondition}s, stored edge-first: the first atom constrains the character
 * nearest to the edge the condition is anchored to.
 */
public final class CharacterConditionGroup {

    /**
     * Sentinel accepted by every word without evaluating any atom.
     */
    public static final CharacterConditionGroup ALLOW_ANY = new CharacterConditionGroup(List.of(), true);

    private final List<CharacterCondition> conditions;
    private final boolean allowAny;

    private CharacterConditionGroup(List<CharacterCondition> conditions, boolean allowAny) {
        this.conditions = conditions;
        this.allowAny = allowAny;
    }

    public static CharacterConditionGroup of(List<CharacterCondition> conditions) {
        Objects.requireNonNull(conditions, "conditions");
        if (conditions.isEmpty()) {
            return ALLOW_ANY;
        }
        return new CharacterConditionGroup(List.copyOf(conditions), false);
    }

    /**
     * Parses condition text in the order it is written.
     *
     * <p>{@code "."} and the empty text yield {@link #ALLOW_ANY}.
     *
     * @throws ConditionFormatException for an unclosed, empty or stray bracket
     */
    public static CharacterConditionGroup parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty() || ".".equals(text)) {
            return ALLOW_ANY;
        }
        List<CharacterCondition> conditions = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            char c = text.charAt(index);
            if (c == '[') {
                int close = text.indexOf(']', index + 1);
                if (close < 0) {
                    throw new ConditionFormatException("unclosed character class in condition '" + text + "'");
                }
                boolean negated = close > index + 1 && text.charAt(index + 1) == '^';
                String members = text.substring(negated ? index + 2 : index + 1, close);
                if (members.isEmpty()) {
                    throw new ConditionFormatException("empty character class in condition '" + text + "'");
                }
                conditions.add(negated ? CharacterCondition.noneOf(members) : CharacterCondition.anyOf(members));
                index = close + 1;
            } else if (c == ']') {
                throw new ConditionFormatException("unexpected ']' at " + index + " in condition '" + text + "'");
            } else {
                conditions.add(c == '.' ? CharacterCondition.any() : CharacterCondition.literal(c));
                index++;
            }
        }
        return of(conditions);
    }

    public boolean isAllowAnySingleCharacter() {
        return allowAny;
    }

    public List<CharacterCondition> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public int size() {
        return conditions.size();
    }

    /**
     * Tests the characters of {@code text} starting at {@code edge} against the atoms in order.
     */
    public boolean matches(CharSequence text, ConditionEdge edge) {
        Objects.requireNonNull(text, "text");
        if (allowAny) {
            return true;
        }
        if (text.length() < conditions.size()) {
            return false;
        }
        for (int i = 0; i < conditions.size(); i++) {
            if (!conditions.get(i).matches(edge.charAt(text, i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Walks {@code literal} and the atoms in lock-step from {@code edge}.
     */
    public Subsumption checkSubsumption(CharSequence literal, ConditionEdge edge) {
        Objects.requireNonNull(literal, "literal");
        if (allowAny) {
            return Subsumption.SUBSUMED;
        }
        int steps = Math.min(literal.length(), conditions.size());
        for (int i = 0; i < steps; i++) {
            if (!conditions.get(i).matches(edge.charAt(literal, i))) {
                return Subsumption.CONFLICT;
            }
        }
        return conditions.size() <= literal.length() ? Subsumption.SUBSUMED : Subsumption.CONDITION_LONGER;
    }

    public boolean isSubsumedByLiteral(CharSequence literal, ConditionEdge edge) {
        return checkSubsumption(literal, edge) == Subsumption.SUBSUMED;
    }

    /**
     * Renders the atoms in stored order; {@link #ALLOW_ANY} renders as {@code "."}.
     */
    public String toConditionText() {
        if (allowAny) {
            return ".";
        }
        return conditions.stream()
                .map(CharacterCondition::toConditionText)
                .collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CharacterConditionGroup group)) {
            return false;
        }
        return allowAny == group.allowAny && conditions.equals(group.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, allowAny);
    }

    @Override
    public String toString() {
        return "CharacterConditionGroup[" + toConditionText() + "]";
    }
}

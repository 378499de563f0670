package dev.spellkit.affix.condition;

import java.util.Objects;

/**
 * A single condition atom consuming exactly one character of a word.
 */
public record CharacterCondition(Kind kind, String characters) {

    public enum Kind {
        LITERAL,
        CLASS,
        NEGATED_CLASS,
        ANY
    }

    private static final CharacterCondition ANY_CHARACTER = new CharacterCondition(Kind.ANY, "");

    public CharacterCondition {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(characters, "characters");
        if (kind == Kind.LITERAL && characters.length() != 1) {
            throw new IllegalArgumentException("literal conditions hold exactly one character");
        }
        if ((kind == Kind.CLASS || kind == Kind.NEGATED_CLASS) && characters.isEmpty()) {
            throw new IllegalArgumentException("character classes must not be empty");
        }
    }

    public static CharacterCondition literal(char c) {
        return new CharacterCondition(Kind.LITERAL, String.valueOf(c));
    }

    public static CharacterCondition anyOf(String members) {
        return new CharacterCondition(Kind.CLASS, normalize(members));
    }

    public static CharacterCondition noneOf(String members) {
        return new CharacterCondition(Kind.NEGATED_CLASS, normalize(members));
    }

    public static CharacterCondition any() {
        return ANY_CHARACTER;
    }

    public boolean matches(char c) {
        return switch (kind) {
            case LITERAL -> characters.charAt(0) == c;
            case CLASS -> characters.indexOf(c) >= 0;
            case NEGATED_CLASS -> characters.indexOf(c) < 0;
            case ANY -> true;
        };
    }

    /**
     * Renders the atom in condition syntax.
     */
    public String toConditionText() {
        return switch (kind) {
            case LITERAL -> characters;
            case CLASS -> "[" + characters + "]";
            case NEGATED_CLASS -> "[^" + characters + "]";
            case ANY -> ".";
        };
    }

    private static String normalize(String members) {
        StringBuilder builder = new StringBuilder(members.length());
        members.chars()
                .distinct()
                .sorted()
                .forEach(c -> builder.append((char) c));
        return builder.toString();
    }
}

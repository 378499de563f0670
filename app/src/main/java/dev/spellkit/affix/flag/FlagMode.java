package dev.spellkit.affix.flag;

import java.util.Locale;
import java.util.Optional;

/**
 * Encoding used for flag tokens in affix and dictionary files.
 */
public enum FlagMode {
    /**
     * One flag per character.
     */
    CHAR,
    /**
     * Two consecutive characters form one flag.
     */
    LONG,
    /**
     * Comma separated decimal numbers.
     */
    NUM,
    /**
     * Characters re-decoded as UTF-8 before being read as {@link #CHAR}.
     */
    UNI;

    /**
     * Resolves the parameter of a {@code FLAG} directive.
     */
    public static Optional<FlagMode> fromDirective(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "CHAR" -> Optional.of(CHAR);
            case "LONG" -> Optional.of(LONG);
            case "NUM" -> Optional.of(NUM);
            case "UTF-8", "UTF", "UNI" -> Optional.of(UNI);
            default -> Optional.empty();
        };
    }
}

package dev.spellkit.affix.model;

/**
 * Runtime exception raised when a fragment of affix text does not follow the rule language grammar.
 */
public class AffixFormatException extends RuntimeException {

    public AffixFormatException(String message) {
        super(message);
    }

    public AffixFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

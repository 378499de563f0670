package dev.spellkit.affix.flag;

import dev.spellkit.affix.model.AffixFormatException;

/**
 * Raised when flag text cannot be decoded under the active {@link FlagMode}.
 */
public class FlagFormatException extends AffixFormatException {

    public FlagFormatException(String message) {
        super(message);
    }

    public FlagFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

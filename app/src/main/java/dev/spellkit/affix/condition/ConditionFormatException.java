package dev.spellkit.affix.condition;

import dev.spellkit.affix.model.AffixFormatException;

/**
 * Raised for condition text with unbalanced or empty character classes.
 */
public class ConditionFormatException extends AffixFormatException {

    public ConditionFormatException(String message) {
        super(message);
    }
}

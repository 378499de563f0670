package dev.spellkit.affix.reader;

import dev.spellkit.affix.model.AffixFormatException;

/**
 * Applies the parameter text of one directive line.
 */
@FunctionalInterface
interface DirectiveHandler {

    /**
     * @param directive  upper-cased directive name as written
     * @param parameters trimmed text after the directive name, never empty
     * @throws AffixFormatException when the line is rejected
     */
    void apply(String directive, String parameters);
}

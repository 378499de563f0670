package dev.spellkit.affix.model;

import java.util.Objects;

/**
 * Advisory message about one affix file line that was rejected or looked suspicious.
 *
 * @param lineNumber 1-based line number in the source
 * @param directive  upper-cased directive name
 */
public record AffixDiagnostic(int lineNumber, String directive, String message) {

    public AffixDiagnostic {
        Objects.requireNonNull(directive, "directive");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return "line " + lineNumber + " [" + directive + "]: " + message;
    }
}

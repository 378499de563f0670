package dev.spellkit.affix.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Binary options of an affix file. All but {@link #SIMPLIFIED_COMPOUND} are enabled by a bare directive line.
 */
public enum AffixConfigOption {
    COMPLEX_PREFIXES("COMPLEXPREFIXES"),
    COMPOUND_MORE_SUFFIXES("COMPOUNDMORESUFFIXES"),
    CHECK_COMPOUND_DUP("CHECKCOMPOUNDDUP"),
    CHECK_COMPOUND_REP("CHECKCOMPOUNDREP"),
    CHECK_COMPOUND_TRIPLE("CHECKCOMPOUNDTRIPLE"),
    SIMPLIFIED_TRIPLE("SIMPLIFIEDTRIPLE"),
    CHECK_COMPOUND_CASE("CHECKCOMPOUNDCASE"),
    CHECK_NUM("CHECKNUM"),
    ONLY_MAX_DIFF("ONLYMAXDIFF"),
    NO_SPLIT_SUGGESTIONS("NOSPLITSUGS"),
    FULL_STRIP("FULLSTRIP"),
    SUGGEST_WITH_DOTS("SUGSWITHDOTS"),
    FORBID_WARN("FORBIDWARN"),
    CHECK_SHARPS("CHECKSHARPS"),
    /**
     * Set by a CHECKCOMPOUNDPATTERN line carrying a replacement fragment.
     */
    SIMPLIFIED_COMPOUND(null);

    private final String directive;

    AffixConfigOption(String directive) {
        this.directive = directive;
    }

    public Optional<String> directive() {
        return Optional.ofNullable(directive);
    }

    /**
     * Resolves a bare directive name, ignoring case.
     */
    public static Optional<AffixConfigOption> fromDirective(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (AffixConfigOption option : values()) {
            if (upper.equals(option.directive)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}

package dev.spellkit.affix.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scalar settings of an affix file whose value is a single flag.
 */
public enum FlagField {
    COMPOUND_FLAG("COMPOUNDFLAG"),
    COMPOUND_BEGIN("COMPOUNDBEGIN"),
    COMPOUND_MIDDLE("COMPOUNDMIDDLE"),
    COMPOUND_END("COMPOUNDEND"),
    COMPOUND_ROOT("COMPOUNDROOT"),
    COMPOUND_PERMIT("COMPOUNDPERMITFLAG"),
    COMPOUND_FORBID("COMPOUNDFORBIDFLAG"),
    NO_SUGGEST("NOSUGGEST"),
    NO_NGRAM_SUGGEST("NONGRAMSUGGEST"),
    FORBIDDEN_WORD("FORBIDDENWORD"),
    LEMMA_PRESENT("LEMMA_PRESENT"),
    CIRCUMFIX("CIRCUMFIX"),
    ONLY_IN_COMPOUND("ONLYINCOMPOUND"),
    NEED_AFFIX("NEEDAFFIX", "PSEUDOROOT"),
    KEEP_CASE("KEEPCASE"),
    FORCE_UPPER_CASE("FORCEUCASE"),
    WARN("WARN"),
    SUBSTANDARD("SUBSTANDARD");

    private final List<String> directives;

    FlagField(String... directives) {
        this.directives = List.of(directives);
    }

    public List<String> directives() {
        return directives;
    }

    public static Optional<FlagField> fromDirective(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (FlagField field : values()) {
            if (field.directives.contains(upper)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}

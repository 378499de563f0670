package dev.spellkit.affix.table;

import dev.spellkit.affix.flag.FlagValue;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Element of a {@link CompoundRule}.
 */
public interface CompoundRuleToken {

    /**
     * Matches a component carrying {@code flag}.
     */
    record FlagToken(FlagValue flag) implements CompoundRuleToken {

        public FlagToken {
            Objects.requireNonNull(flag, "flag");
        }

        boolean accepts(Collection<FlagValue> componentFlags) {
            return componentFlags.contains(flag);
        }
    }

    /**
     * Matches a component carrying any flag of a parenthesised group.
     */
    record FlagSetToken(Set<FlagValue> flags) implements CompoundRuleToken {

        public FlagSetToken {
            flags = Set.copyOf(flags);
            if (flags.isEmpty()) {
                throw new IllegalArgumentException("flag groups must not be empty");
            }
        }

        boolean accepts(Collection<FlagValue> componentFlags) {
            for (FlagValue flag : componentFlags) {
                if (flags.contains(flag)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Repeats the preceding token.
     */
    record WildcardToken(Quantifier quantifier) implements CompoundRuleToken {

        public WildcardToken {
            Objects.requireNonNull(quantifier, "quantifier");
        }
    }

    enum Quantifier {
        ZERO_OR_MORE('*'),
        ZERO_OR_ONE('?');

        private final char symbol;

        Quantifier(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        static Quantifier fromSymbol(char symbol) {
            for (Quantifier quantifier : values()) {
                if (quantifier.symbol == symbol) {
                    return quantifier;
                }
            }
            return null;
        }
    }
}

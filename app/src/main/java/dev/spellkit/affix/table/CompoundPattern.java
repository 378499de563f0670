package dev.spellkit.affix.table;

import dev.spellkit.affix.flag.FlagValue;
import java.util.Objects;
import java.util.Optional;

/**
 * A CHECKCOMPOUNDPATTERN line: the end of the first component, the start of the second and an optional
 * replacement for the boundary.
 */
public record CompoundPattern(
        String first,
        Optional<String> second,
        Optional<String> replacement,
        Optional<FlagValue> firstFlag,
        Optional<FlagValue> secondFlag
) {

    public CompoundPattern {
        Objects.requireNonNull(first, "first");
        second = second == null ? Optional.empty() : second;
        replacement = replacement == null ? Optional.empty() : replacement;
        firstFlag = firstFlag == null ? Optional.empty() : firstFlag;
        secondFlag = secondFlag == null ? Optional.empty() : secondFlag;
    }
}

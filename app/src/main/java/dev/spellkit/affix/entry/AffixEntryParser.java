package dev.spellkit.affix.entry;

import dev.spellkit.affix.condition.CharacterConditionGroup;
import dev.spellkit.affix.condition.ConditionReverser;
import dev.spellkit.affix.condition.Subsumption;
import dev.spellkit.affix.flag.FlagParser;
import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.model.AffixFormatException;
import dev.spellkit.affix.table.TableParsers;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Turns PFX/SFX parameter lines into affix groups and entries.
 */
public final class AffixEntryParser {

    /**
     * Reader state an affix line is interpreted against.
     *
     * @param aliasFlags      AF table; consulted only when {@code aliasFlagsActive}
     * @param aliasMorphology AM table; consulted only when {@code aliasMorphologyActive}
     */
    public record Context(
            FlagParser flags,
            Orientation orientation,
            String ignoredChars,
            boolean aliasFlagsActive,
            List<SortedSet<FlagValue>> aliasFlags,
            boolean aliasMorphologyActive,
            List<List<String>> aliasMorphology
    ) {

        public Context {
            Objects.requireNonNull(flags, "flags");
            Objects.requireNonNull(orientation, "orientation");
            ignoredChars = ignoredChars == null ? "" : ignoredChars;
            aliasFlags = aliasFlags == null ? List.of() : aliasFlags;
            aliasMorphology = aliasMorphology == null ? List.of() : aliasMorphology;
        }
    }

    private final Consumer<String> warnings;

    /**
     * @param warnings receives advisory messages for lines that are accepted but suspicious
     */
    public AffixEntryParser(Consumer<String> warnings) {
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    /**
     * Applies one parameter line to {@code table}.
     *
     * @return the entry added, or empty when the line was a group header
     * @throws AffixFormatException when the line is rejected; the table is left unchanged
     */
    public <E extends AffixEntry> Optional<E> parse(String parameters, AffixGroupTable<E> table, Context context) {
        AffixLine line = AffixLineTokenizer.tokenize(parameters)
                .orElseThrow(() -> new AffixFormatException("expected a header or an entry line but got '" + parameters + "'"));
        FlagValue flag = context.flags().parseSingleFlag(line.flag());

        if (line instanceof AffixLine.HeaderLine header) {
            openGroup(flag, header, table, context);
            return Optional.empty();
        }
        return Optional.of(addEntry(flag, (AffixLine.BodyLine) line, table, context));
    }

    private <E extends AffixEntry> void openGroup(FlagValue flag, AffixLine.HeaderLine header,
                                                  AffixGroupTable<E> table, Context context) {
        if (table.isOpen(flag)) {
            throw new AffixFormatException("duplicate header for affix flag '" + header.flag() + "'");
        }
        EnumSet<AffixEntryOption> options = EnumSet.noneOf(AffixEntryOption.class);
        if (header.crossProduct()) {
            options.add(AffixEntryOption.CROSS_PRODUCT);
        }
        if (context.aliasMorphologyActive()) {
            options.add(AffixEntryOption.ALIAS_M);
        }
        if (context.aliasFlagsActive()) {
            options.add(AffixEntryOption.ALIAS_F);
        }
        table.open(flag, options, header.expectedCount());
    }

    private <E extends AffixEntry> E addEntry(FlagValue flag, AffixLine.BodyLine body,
                                              AffixGroupTable<E> table, Context context) {
        Orientation orientation = context.orientation();

        String strip = "0".equals(body.strip()) ? "" : orientation.mirror(body.strip());

        String affixField = body.affix();
        int slash = affixField.indexOf('/');
        SortedSet<FlagValue> continuation = slash < 0
                ? Collections.emptySortedSet()
                : parseContinuation(affixField.substring(slash + 1), context);
        String affix = removeIgnored(slash < 0 ? affixField : affixField.substring(0, slash), context.ignoredChars());
        affix = orientation.mirror(affix);
        if ("0".equals(affix)) {
            affix = "";
        }

        String conditionText = orientation.mirrorCondition(body.condition());
        if (table.kind() == AffixKind.SUFFIX) {
            conditionText = ConditionReverser.reverse(conditionText);
        }
        CharacterConditionGroup condition = CharacterConditionGroup.parse(conditionText);
        if (!strip.isEmpty() && !condition.isAllowAnySingleCharacter()) {
            Subsumption subsumption = condition.checkSubsumption(strip, table.kind().edge());
            if (subsumption == Subsumption.SUBSUMED) {
                condition = CharacterConditionGroup.ALLOW_ANY;
            } else if (subsumption == Subsumption.CONFLICT) {
                warnings.accept("strip '" + body.strip() + "' of flag '" + body.flag()
                        + "' can never satisfy condition '" + body.condition() + "'");
            }
        }

        List<String> morphology = body.hasMorphology() ? parseMorphology(body.morphology(), context) : List.of();

        return table.addEntry(flag, strip, affix, condition, continuation, morphology);
    }

    private SortedSet<FlagValue> parseContinuation(String text, Context context) {
        if (context.aliasFlagsActive()) {
            return aliasEntry(text, context.aliasFlags(), "AF");
        }
        return new TreeSet<>(context.flags().parseFlags(text));
    }

    private List<String> parseMorphology(String text, Context context) {
        if (context.aliasMorphologyActive()) {
            return aliasEntry(text, context.aliasMorphology(), "AM");
        }
        return TableParsers.splitFields(context.orientation().mirror(text));
    }

    private static <T> T aliasEntry(String text, List<T> aliases, String directive) {
        int number;
        try {
            number = Integer.parseInt(text.trim());
        } catch (NumberFormatException ex) {
            throw new AffixFormatException(directive + " alias reference is not a number: '" + text + "'", ex);
        }
        if (number < 1 || number > aliases.size()) {
            throw new AffixFormatException(directive + " alias " + number + " is out of range 1.." + aliases.size());
        }
        return aliases.get(number - 1);
    }

    private static String removeIgnored(String text, String ignoredChars) {
        if (ignoredChars.isEmpty()) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (ignoredChars.indexOf(c) < 0) {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}

package dev.spellkit.affix.cli;

import dev.spellkit.affix.condition.ConditionReverser;
import dev.spellkit.affix.entry.AffixEntry;
import dev.spellkit.affix.entry.AffixEntryGroup;
import dev.spellkit.affix.entry.AffixKind;
import dev.spellkit.affix.flag.FlagMode;
import dev.spellkit.affix.flag.FlagParser;
import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.model.AffixConfig;
import dev.spellkit.affix.model.AffixConfigOption;
import dev.spellkit.affix.model.AffixDiagnostic;
import dev.spellkit.affix.model.FlagField;
import dev.spellkit.affix.table.CompoundRule;
import dev.spellkit.affix.table.CompoundRuleToken;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Human readable summary of a compiled affix file.
 */
final class CompilationReport {

    private final AffixConfig config;
    private final FlagParser flags;

    CompilationReport(AffixConfig config) {
        this.config = config;
        this.flags = new FlagParser(config.flagMode(), config.encoding());
    }

    String render(boolean includeEntries) {
        StringBuilder out = new StringBuilder(512);
        line(out, "encoding", config.encoding().name());
        line(out, "flag mode", config.flagMode().name());
        line(out, "language", config.language().orElse("-"));
        line(out, "options", config.options().isEmpty()
                ? "-"
                : config.options().stream().map(CompilationReport::optionName).collect(Collectors.joining(", ")));
        for (Map.Entry<FlagField, FlagValue> flag : config.flags().entrySet()) {
            line(out, flag.getKey().directives().get(0), flags.encode(flag.getValue()));
        }
        line(out, "prefix groups", groupSummary(config.prefixes()));
        line(out, "suffix groups", groupSummary(config.suffixes()));
        line(out, "tables", "REP=" + config.replacements().size()
                + " ICONV=" + config.inputConversions().size()
                + " OCONV=" + config.outputConversions().size()
                + " PHONE=" + config.phonetic().size()
                + " MAP=" + config.relatedCharacters().size()
                + " CHECKCOMPOUNDPATTERN=" + config.compoundPatterns().size()
                + " COMPOUNDRULE=" + config.compoundRules().size()
                + " AF=" + config.aliasFlags().size()
                + " AM=" + config.aliasMorphology().size());
        line(out, "break points", String.join(" ", config.breakPoints()));

        if (includeEntries) {
            appendEntries(out, config.prefixes());
            appendEntries(out, config.suffixes());
            for (CompoundRule rule : config.compoundRules()) {
                out.append("  COMPOUNDRULE ").append(ruleText(rule)).append(System.lineSeparator());
            }
        }

        List<AffixDiagnostic> diagnostics = config.diagnostics();
        line(out, "diagnostics", String.valueOf(diagnostics.size()));
        for (AffixDiagnostic diagnostic : diagnostics) {
            out.append("  ").append(diagnostic).append(System.lineSeparator());
        }
        return out.toString();
    }

    private <E extends AffixEntry> void appendEntries(StringBuilder out, List<AffixEntryGroup<E>> groups) {
        for (AffixEntryGroup<E> group : groups) {
            for (E entry : group.entries()) {
                String directive = entry.kind() == AffixKind.PREFIX ? "PFX" : "SFX";
                String condition = entry.condition().toConditionText();
                if (entry.kind() == AffixKind.SUFFIX) {
                    condition = ConditionReverser.reverse(condition);
                }
                out.append("  ")
                        .append(directive).append(' ')
                        .append(flags.encode(group.flag())).append(' ')
                        .append(entry.strip().isEmpty() ? "0" : entry.strip()).append(' ')
                        .append(entry.affix().isEmpty() ? "0" : entry.affix());
                if (!entry.continuationClass().isEmpty()) {
                    out.append('/').append(flags.encodeAll(entry.continuationClass()));
                }
                out.append(' ').append(condition);
                if (!entry.morphology().isEmpty()) {
                    out.append(' ').append(String.join(" ", entry.morphology()));
                }
                out.append(System.lineSeparator());
            }
        }
    }

    private String ruleText(CompoundRule rule) {
        StringBuilder text = new StringBuilder();
        boolean bare = config.flagMode() == FlagMode.CHAR || config.flagMode() == FlagMode.UNI;
        for (CompoundRuleToken token : rule.tokens()) {
            if (token instanceof CompoundRuleToken.FlagToken flagToken) {
                String flag = flags.encode(flagToken.flag());
                text.append(bare ? flag : "(" + flag + ")");
            } else if (token instanceof CompoundRuleToken.FlagSetToken setToken) {
                text.append('(').append(flags.encodeAll(new TreeSet<>(setToken.flags()))).append(')');
            } else if (token instanceof CompoundRuleToken.WildcardToken wildcard) {
                text.append(wildcard.quantifier().symbol());
            }
        }
        return text.toString();
    }

    private static String optionName(AffixConfigOption option) {
        return option.directive().orElse(option.name());
    }

    private static String groupSummary(List<? extends AffixEntryGroup<?>> groups) {
        int entries = groups.stream().mapToInt(group -> group.entries().size()).sum();
        return groups.size() + " (" + entries + " entries)";
    }

    private static void line(StringBuilder out, String label, String value) {
        out.append(label).append(": ").append(value).append(System.lineSeparator());
    }
}

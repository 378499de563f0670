package dev.spellkit.affix.table;

import dev.spellkit.affix.flag.FlagParser;
import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.model.AffixFormatException;
import dev.spellkit.affix.table.CompoundRuleToken.FlagSetToken;
import dev.spellkit.affix.table.CompoundRuleToken.FlagToken;
import dev.spellkit.affix.table.CompoundRuleToken.Quantifier;
import dev.spellkit.affix.table.CompoundRuleToken.WildcardToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Line grammars of the flat table directives. Each method parses one entry line and throws
 * {@link AffixFormatException} when the line cannot form an entry.
 */
public final class TableParsers {

    private static final Pattern FIELD_SEPARATOR = Pattern.compile("[ \t]+");

    private TableParsers() {
    }

    /**
     * Splits on runs of spaces and tabs, dropping empty fields.
     */
    public static List<String> splitFields(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return List.of(FIELD_SEPARATOR.split(trimmed));
    }

    public static ReplacementEntry replacement(String text) {
        List<String> fields = requireFields(text, 1, "REP");
        String pattern = fields.get(0);
        String replacement = fields.size() > 1 ? fields.get(1) : "";

        boolean initial = pattern.startsWith("^");
        boolean fin = pattern.length() > (initial ? 1 : 0) && pattern.endsWith("$");
        ReplacementPosition position;
        if (initial) {
            position = fin ? ReplacementPosition.ISOLATED : ReplacementPosition.INITIAL;
        } else {
            position = fin ? ReplacementPosition.FINAL : ReplacementPosition.MEDIAL;
        }
        String body = pattern.substring(initial ? 1 : 0, fin ? pattern.length() - 1 : pattern.length());
        return new ReplacementEntry(body.replace('_', ' '), replacement.replace('_', ' '), position);
    }

    public static ConversionEntry conversion(String text) {
        List<String> fields = requireFields(text, 2, "conversion");
        return new ConversionEntry(fields.get(0), fields.get(1));
    }

    public static PhoneticEntry phonetic(String text) {
        List<String> fields = requireFields(text, 1, "PHONE");
        String replacement = fields.size() > 1 ? fields.get(1).replace("_", "") : "";
        return new PhoneticEntry(fields.get(0), replacement);
    }

    public static String breakEntry(String text) {
        return text;
    }

    /**
     * Splits a MAP line into units; a parenthesised run is one unit, an unclosed parenthesis is a unit of its
     * own.
     */
    public static MapEntry map(String text) {
        List<String> units = new ArrayList<>();
        for (int k = 0; k < text.length(); k++) {
            int begin = k;
            int end = k + 1;
            if (text.charAt(k) == '(') {
                int close = text.indexOf(')', k);
                if (close >= 0) {
                    begin = k + 1;
                    end = close;
                    k = close;
                }
            }
            units.add(text.substring(begin, end));
        }
        return new MapEntry(units);
    }

    public static CompoundPattern compoundPattern(String text, FlagParser flags) {
        List<String> fields = requireFields(text, 1, "CHECKCOMPOUNDPATTERN");
        Fragment first = fragment(fields.get(0), flags);
        Optional<Fragment> second = fields.size() > 1 ? Optional.of(fragment(fields.get(1), flags)) : Optional.empty();
        Optional<String> replacement = fields.size() > 2 ? Optional.of(fields.get(2)) : Optional.empty();
        return new CompoundPattern(
                first.text(),
                second.map(Fragment::text),
                replacement,
                first.flag(),
                second.flatMap(Fragment::flag));
    }

    /**
     * Tokenizes a COMPOUNDRULE line. Parenthesised runs become one token (a set token when they hold several
     * flags), {@code *} and {@code ?} become wildcards and any other run is read as bare flags.
     */
    public static CompoundRule compoundRule(String text, FlagParser flags) {
        String rule = text.strip();
        if (rule.isEmpty()) {
            throw new AffixFormatException("COMPOUNDRULE needs a pattern");
        }
        List<CompoundRuleToken> tokens = new ArrayList<>();
        StringBuilder bare = new StringBuilder();
        for (int index = 0; index < rule.length(); index++) {
            char c = rule.charAt(index);
            Quantifier quantifier = Quantifier.fromSymbol(c);
            if (c == '(' || quantifier != null) {
                flushBareFlags(bare, flags, tokens);
            }
            if (c == '(') {
                int close = rule.indexOf(')', index + 1);
                if (close < 0) {
                    throw new AffixFormatException("unclosed '(' in compound rule '" + rule + "'");
                }
                List<FlagValue> group = flags.parseFlags(rule.substring(index + 1, close));
                if (group.isEmpty()) {
                    throw new AffixFormatException("empty flag group in compound rule '" + rule + "'");
                }
                tokens.add(group.size() == 1 ? new FlagToken(group.get(0)) : new FlagSetToken(new TreeSet<>(group)));
                index = close;
            } else if (quantifier != null) {
                tokens.add(new WildcardToken(quantifier));
            } else {
                bare.append(c);
            }
        }
        flushBareFlags(bare, flags, tokens);
        return new CompoundRule(tokens);
    }

    public static SortedSet<FlagValue> aliasFlags(String text, FlagParser flags) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(flags.parseFlags(text.strip())));
    }

    public static List<String> aliasMorphology(String text, UnaryOperator<String> mirror) {
        return splitFields(mirror.apply(text));
    }

    private static void flushBareFlags(StringBuilder bare, FlagParser flags, List<CompoundRuleToken> tokens) {
        if (bare.length() == 0) {
            return;
        }
        for (FlagValue flag : flags.parseFlags(bare.toString())) {
            tokens.add(new FlagToken(flag));
        }
        bare.setLength(0);
    }

    private static Fragment fragment(String field, FlagParser flags) {
        int slash = field.indexOf('/');
        if (slash < 0) {
            return new Fragment(field, Optional.empty());
        }
        FlagValue flag = flags.parseSingleFlag(field.substring(slash + 1));
        return new Fragment(field.substring(0, slash), Optional.of(flag));
    }

    /**
     * Splits {@code text} and rejects it when fewer than {@code minimum} fields remain.
     */
    public static List<String> requireFields(String text, int minimum, String directive) {
        List<String> fields = splitFields(text);
        if (fields.size() < minimum) {
            throw new AffixFormatException(directive + " entries need at least " + minimum + " field(s)");
        }
        return fields;
    }

    private record Fragment(String text, Optional<FlagValue> flag) {
    }
}

package dev.spellkit.affix.model;

import dev.spellkit.affix.entry.AffixEntry;
import dev.spellkit.affix.entry.AffixEntryGroup;
import dev.spellkit.affix.entry.AffixGroupTable;
import dev.spellkit.affix.entry.PrefixEntry;
import dev.spellkit.affix.entry.SuffixEntry;
import dev.spellkit.affix.flag.FlagMode;
import dev.spellkit.affix.flag.FlagValue;
import dev.spellkit.affix.table.CompoundPattern;
import dev.spellkit.affix.table.CompoundRule;
import dev.spellkit.affix.table.ConversionEntry;
import dev.spellkit.affix.table.EntryTable;
import dev.spellkit.affix.table.MapEntry;
import dev.spellkit.affix.table.PhoneticEntry;
import dev.spellkit.affix.table.ReplacementEntry;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;

/**
 * Immutable result of compiling an affix file.
 */
public final class AffixConfig {

    public static final Charset DEFAULT_ENCODING = StandardCharsets.ISO_8859_1;
    public static final String DEFAULT_COMPOUND_VOWELS = "AEIOUaeiou";

    private final Set<AffixConfigOption> options;
    private final FlagMode flagMode;
    private final Charset encoding;
    private final Optional<String> language;
    private final Locale locale;
    private final Optional<String> keyString;
    private final Optional<String> tryString;
    private final Optional<String> version;
    private final String wordChars;
    private final String ignoredChars;
    private final Optional<String> compoundSyllableNum;
    private final Map<FlagField, FlagValue> flags;
    private final OptionalInt compoundMin;
    private final OptionalInt compoundWordMax;
    private final OptionalInt compoundMaxSyllable;
    private final String compoundVowels;
    private final OptionalInt maxNgramSuggestions;
    private final OptionalInt maxDifferency;
    private final OptionalInt maxCompoundSuggestions;
    private final List<ReplacementEntry> replacements;
    private final Map<String, String> inputConversions;
    private final Map<String, String> outputConversions;
    private final List<PhoneticEntry> phonetic;
    private final List<CompoundPattern> compoundPatterns;
    private final List<CompoundRule> compoundRules;
    private final List<MapEntry> relatedCharacters;
    private final List<String> breakPoints;
    private final List<SortedSet<FlagValue>> aliasFlags;
    private final List<List<String>> aliasMorphology;
    private final List<AffixEntryGroup<PrefixEntry>> prefixes;
    private final List<AffixEntryGroup<SuffixEntry>> suffixes;
    private final boolean continuationClasses;
    private final List<AffixDiagnostic> diagnostics;

    private AffixConfig(Builder builder) {
        this.options = builder.options.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(AffixConfigOption.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.options));
        this.flagMode = builder.flagMode;
        this.encoding = builder.encoding;
        this.language = Optional.ofNullable(builder.language);
        this.locale = builder.locale;
        this.keyString = Optional.ofNullable(builder.keyString);
        this.tryString = Optional.ofNullable(builder.tryString);
        this.version = Optional.ofNullable(builder.version);
        this.wordChars = builder.wordChars;
        this.ignoredChars = builder.ignoredChars;
        this.compoundSyllableNum = Optional.ofNullable(builder.compoundSyllableNum);
        this.flags = Collections.unmodifiableMap(new EnumMap<>(builder.flags));
        this.compoundMin = toOptional(builder.compoundMin);
        this.compoundWordMax = toOptional(builder.compoundWordMax);
        this.compoundMaxSyllable = toOptional(builder.compoundMaxSyllable);
        this.compoundVowels = builder.compoundVowels;
        this.maxNgramSuggestions = toOptional(builder.maxNgramSuggestions);
        this.maxDifferency = toOptional(builder.maxDifferency);
        this.maxCompoundSuggestions = toOptional(builder.maxCompoundSuggestions);
        this.replacements = builder.replacements.freeze();
        this.inputConversions = toLookup(builder.inputConversions);
        this.outputConversions = toLookup(builder.outputConversions);
        this.phonetic = builder.phonetic.freeze();
        this.compoundPatterns = builder.compoundPatterns.freeze();
        this.compoundRules = builder.compoundRules.freeze();
        this.relatedCharacters = builder.relatedCharacters.freeze();
        this.breakPoints = builder.breakPoints.freeze();
        this.aliasFlags = builder.aliasFlags.freeze();
        this.aliasMorphology = builder.aliasMorphology.freeze();
        this.prefixes = builder.prefixes.freeze();
        this.suffixes = builder.suffixes.freeze();
        this.continuationClasses = builder.continuationClasses;
        this.diagnostics = List.copyOf(builder.diagnostics);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<AffixConfigOption> options() {
        return options;
    }

    public boolean hasOption(AffixConfigOption option) {
        return options.contains(option);
    }

    public boolean isComplexPrefixes() {
        return options.contains(AffixConfigOption.COMPLEX_PREFIXES);
    }

    public FlagMode flagMode() {
        return flagMode;
    }

    public Charset encoding() {
        return encoding;
    }

    public Optional<String> language() {
        return language;
    }

    public Locale locale() {
        return locale;
    }

    public Optional<String> keyString() {
        return keyString;
    }

    public Optional<String> tryString() {
        return tryString;
    }

    public Optional<String> version() {
        return version;
    }

    public String wordChars() {
        return wordChars;
    }

    public String ignoredChars() {
        return ignoredChars;
    }

    public Optional<String> compoundSyllableNum() {
        return compoundSyllableNum;
    }

    public Optional<FlagValue> flag(FlagField field) {
        return Optional.ofNullable(flags.get(field));
    }

    public Map<FlagField, FlagValue> flags() {
        return flags;
    }

    public Optional<FlagValue> compoundFlag() {
        return flag(FlagField.COMPOUND_FLAG);
    }

    public Optional<FlagValue> compoundBegin() {
        return flag(FlagField.COMPOUND_BEGIN);
    }

    public Optional<FlagValue> compoundEnd() {
        return flag(FlagField.COMPOUND_END);
    }

    public Optional<FlagValue> forbiddenWord() {
        return flag(FlagField.FORBIDDEN_WORD);
    }

    public Optional<FlagValue> needAffix() {
        return flag(FlagField.NEED_AFFIX);
    }

    public OptionalInt compoundMin() {
        return compoundMin;
    }

    public OptionalInt compoundWordMax() {
        return compoundWordMax;
    }

    public OptionalInt compoundMaxSyllable() {
        return compoundMaxSyllable;
    }

    /**
     * Sorted vowels counted by COMPOUNDSYLLABLE.
     */
    public String compoundVowels() {
        return compoundVowels;
    }

    public OptionalInt maxNgramSuggestions() {
        return maxNgramSuggestions;
    }

    public OptionalInt maxDifferency() {
        return maxDifferency;
    }

    public OptionalInt maxCompoundSuggestions() {
        return maxCompoundSuggestions;
    }

    public List<ReplacementEntry> replacements() {
        return replacements;
    }

    public Map<String, String> inputConversions() {
        return inputConversions;
    }

    public Map<String, String> outputConversions() {
        return outputConversions;
    }

    public List<PhoneticEntry> phonetic() {
        return phonetic;
    }

    public List<CompoundPattern> compoundPatterns() {
        return compoundPatterns;
    }

    public List<CompoundRule> compoundRules() {
        return compoundRules;
    }

    public List<MapEntry> relatedCharacters() {
        return relatedCharacters;
    }

    public List<String> breakPoints() {
        return breakPoints;
    }

    public List<SortedSet<FlagValue>> aliasFlags() {
        return aliasFlags;
    }

    public List<List<String>> aliasMorphology() {
        return aliasMorphology;
    }

    public List<AffixEntryGroup<PrefixEntry>> prefixes() {
        return prefixes;
    }

    public List<AffixEntryGroup<SuffixEntry>> suffixes() {
        return suffixes;
    }

    public Optional<AffixEntryGroup<PrefixEntry>> prefixGroup(FlagValue flag) {
        return findGroup(prefixes, flag);
    }

    public Optional<AffixEntryGroup<SuffixEntry>> suffixGroup(FlagValue flag) {
        return findGroup(suffixes, flag);
    }

    /**
     * Whether any affix entry grants continuation flags.
     */
    public boolean hasContinuationClasses() {
        return continuationClasses;
    }

    public List<AffixDiagnostic> diagnostics() {
        return diagnostics;
    }

    private static <E extends AffixEntry> Optional<AffixEntryGroup<E>> findGroup(
            List<AffixEntryGroup<E>> groups, FlagValue flag) {
        for (AffixEntryGroup<E> group : groups) {
            if (group.flag().equals(flag)) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    private static OptionalInt toOptional(Integer value) {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    private static Map<String, String> toLookup(EntryTable<ConversionEntry> table) {
        Map<String, String> lookup = new LinkedHashMap<>();
        for (ConversionEntry entry : table.entries()) {
            lookup.put(entry.input(), entry.output());
        }
        return Collections.unmodifiableMap(lookup);
    }

    /**
     * Mutable accumulator filled line by line while an affix file is read.
     */
    public static final class Builder {

        private final EnumSet<AffixConfigOption> options = EnumSet.noneOf(AffixConfigOption.class);
        private FlagMode flagMode = FlagMode.CHAR;
        private Charset encoding = DEFAULT_ENCODING;
        private String language;
        private Locale locale = Locale.ROOT;
        private String keyString;
        private String tryString;
        private String version;
        private String wordChars = "";
        private String ignoredChars = "";
        private String compoundSyllableNum;
        private final EnumMap<FlagField, FlagValue> flags = new EnumMap<>(FlagField.class);
        private Integer compoundMin;
        private Integer compoundWordMax;
        private Integer compoundMaxSyllable;
        private String compoundVowels = DEFAULT_COMPOUND_VOWELS;
        private Integer maxNgramSuggestions;
        private Integer maxDifferency;
        private Integer maxCompoundSuggestions;
        private final EntryTable<ReplacementEntry> replacements = new EntryTable<>("REP");
        private final EntryTable<ConversionEntry> inputConversions = new EntryTable<>("ICONV");
        private final EntryTable<ConversionEntry> outputConversions = new EntryTable<>("OCONV");
        private final EntryTable<PhoneticEntry> phonetic = new EntryTable<>("PHONE");
        private final EntryTable<CompoundPattern> compoundPatterns = new EntryTable<>("CHECKCOMPOUNDPATTERN");
        private final EntryTable<CompoundRule> compoundRules = new EntryTable<>("COMPOUNDRULE");
        private final EntryTable<MapEntry> relatedCharacters = new EntryTable<>("MAP");
        private final EntryTable<String> breakPoints = new EntryTable<>("BREAK");
        private final EntryTable<SortedSet<FlagValue>> aliasFlags = new EntryTable<>("AF");
        private final EntryTable<List<String>> aliasMorphology = new EntryTable<>("AM");
        private final AffixGroupTable<PrefixEntry> prefixes = AffixGroupTable.prefixes();
        private final AffixGroupTable<SuffixEntry> suffixes = AffixGroupTable.suffixes();
        private boolean continuationClasses;
        private final List<AffixDiagnostic> diagnostics = new ArrayList<>();

        private Builder() {
        }

        public Builder enableOption(AffixConfigOption option) {
            options.add(Objects.requireNonNull(option, "option"));
            return this;
        }

        public boolean hasOption(AffixConfigOption option) {
            return options.contains(option);
        }

        public FlagMode flagMode() {
            return flagMode;
        }

        public Builder flagMode(FlagMode flagMode) {
            this.flagMode = Objects.requireNonNull(flagMode, "flagMode");
            return this;
        }

        public Charset encoding() {
            return encoding;
        }

        public Builder encoding(Charset encoding) {
            this.encoding = Objects.requireNonNull(encoding, "encoding");
            return this;
        }

        public Builder language(String language, Locale locale) {
            this.language = language;
            this.locale = Objects.requireNonNull(locale, "locale");
            return this;
        }

        public Builder keyString(String keyString) {
            this.keyString = keyString;
            return this;
        }

        public Builder tryString(String tryString) {
            this.tryString = tryString;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder wordChars(String wordChars) {
            this.wordChars = Objects.requireNonNull(wordChars, "wordChars");
            return this;
        }

        public String ignoredChars() {
            return ignoredChars;
        }

        public Builder ignoredChars(String ignoredChars) {
            this.ignoredChars = Objects.requireNonNull(ignoredChars, "ignoredChars");
            return this;
        }

        public Builder compoundSyllableNum(String compoundSyllableNum) {
            this.compoundSyllableNum = compoundSyllableNum;
            return this;
        }

        public Builder flag(FlagField field, FlagValue value) {
            flags.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder compoundMin(int compoundMin) {
            this.compoundMin = compoundMin;
            return this;
        }

        public Builder compoundWordMax(int compoundWordMax) {
            this.compoundWordMax = compoundWordMax;
            return this;
        }

        public Builder compoundSyllable(int maxSyllable, String vowels) {
            this.compoundMaxSyllable = maxSyllable;
            this.compoundVowels = Objects.requireNonNull(vowels, "vowels");
            return this;
        }

        public Builder maxNgramSuggestions(int maxNgramSuggestions) {
            this.maxNgramSuggestions = maxNgramSuggestions;
            return this;
        }

        public Builder maxDifferency(int maxDifferency) {
            this.maxDifferency = maxDifferency;
            return this;
        }

        public Builder maxCompoundSuggestions(int maxCompoundSuggestions) {
            this.maxCompoundSuggestions = maxCompoundSuggestions;
            return this;
        }

        public EntryTable<ReplacementEntry> replacements() {
            return replacements;
        }

        public EntryTable<ConversionEntry> inputConversions() {
            return inputConversions;
        }

        public EntryTable<ConversionEntry> outputConversions() {
            return outputConversions;
        }

        public EntryTable<PhoneticEntry> phonetic() {
            return phonetic;
        }

        public EntryTable<CompoundPattern> compoundPatterns() {
            return compoundPatterns;
        }

        public EntryTable<CompoundRule> compoundRules() {
            return compoundRules;
        }

        public EntryTable<MapEntry> relatedCharacters() {
            return relatedCharacters;
        }

        public EntryTable<String> breakPoints() {
            return breakPoints;
        }

        public EntryTable<SortedSet<FlagValue>> aliasFlags() {
            return aliasFlags;
        }

        public EntryTable<List<String>> aliasMorphology() {
            return aliasMorphology;
        }

        public AffixGroupTable<PrefixEntry> prefixes() {
            return prefixes;
        }

        public AffixGroupTable<SuffixEntry> suffixes() {
            return suffixes;
        }

        public Builder markContinuationClasses() {
            this.continuationClasses = true;
            return this;
        }

        public Builder addDiagnostic(AffixDiagnostic diagnostic) {
            diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
            return this;
        }

        public List<AffixDiagnostic> diagnostics() {
            return Collections.unmodifiableList(diagnostics);
        }

        /**
         * Copies the accumulated state into an immutable configuration. The builder stays usable.
         */
        public AffixConfig build() {
            return new AffixConfig(this);
        }
    }
}

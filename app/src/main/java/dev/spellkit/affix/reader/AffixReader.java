package dev.spellkit.affix.reader;

import dev.spellkit.affix.entry.AffixEntry;
import dev.spellkit.affix.entry.AffixEntryParser;
import dev.spellkit.affix.entry.AffixKind;
import dev.spellkit.affix.entry.Orientation;
import dev.spellkit.affix.flag.FlagMode;
import dev.spellkit.affix.flag.FlagParser;
import dev.spellkit.affix.model.AffixConfig;
import dev.spellkit.affix.model.AffixConfigOption;
import dev.spellkit.affix.model.AffixDiagnostic;
import dev.spellkit.affix.model.AffixFormatException;
import dev.spellkit.affix.model.FlagField;
import dev.spellkit.affix.table.CompoundPattern;
import dev.spellkit.affix.table.TableParsers;
import dev.spellkit.affix.table.TableState;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.IntConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Compiles the lines of an affix file, in order, into an {@link AffixConfig}.
 *
 * <p>Every line is either ignored (blank, comment, unknown directive), enables a bare option, or is handed to the
 * handler registered for its directive. A handler that rejects its line leaves the configuration untouched and
 * produces an {@link AffixDiagnostic}; reading always continues with the next line.
 *
 * <p>A reader compiles a single source and is not thread safe.
 */
public final class AffixReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(AffixReader.class);

    /**
     * MDC key carrying the file being compiled.
     */
    public static final String MDC_FILE_KEY = "affix.file";

    private static final Pattern COMMENT = Pattern.compile("^\\s*#");
    private static final Pattern BARE_WORD = Pattern.compile("^[ \\t]*(\\w+)[ \\t]*$");
    private static final Pattern DIRECTIVE = Pattern.compile("^[ \\t]*(\\w+)[ \\t]+(.*?)[ \\t]*$");
    private static final List<String> DEFAULT_BREAK_POINTS = List.of("-", "^-", "-$");

    private final AffixConfig.Builder builder = AffixConfig.builder();
    private final Map<String, DirectiveHandler> handlers = new HashMap<>();
    private final AffixEntryParser entryParser;
    private final AffixLineSource source;
    private int lineNumber;
    private String currentDirective = "";
    private boolean flagsParsed;

    private AffixReader(AffixLineSource source) {
        this.source = Objects.requireNonNull(source, "source");
        this.entryParser = new AffixEntryParser(message -> diagnostic(currentDirective, message));
        registerHandlers();
    }

    /**
     * Reads {@code source} to its end, or until the current thread is interrupted.
     */
    public static AffixConfig read(AffixLineSource source) throws IOException {
        return new AffixReader(source).readAll();
    }

    /**
     * Runs {@link #read(AffixLineSource)} on {@code executor}. I/O failures complete the future exceptionally with
     * an {@link UncheckedIOException} cause.
     */
    public static CompletableFuture<AffixConfig> readAsync(AffixLineSource source, Executor executor) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> {
            try {
                return read(source);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }, executor);
    }

    public static AffixConfig readFile(Path path) throws IOException {
        return readFile(path, AffixConfig.DEFAULT_ENCODING);
    }

    /**
     * Compiles the affix file at {@code path}, decoding it with {@code initialEncoding} until a {@code SET}
     * directive names another encoding.
     */
    public static AffixConfig readFile(Path path, Charset initialEncoding) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(initialEncoding, "initialEncoding");
        MDC.put(MDC_FILE_KEY, path.toString());
        try (InputStream input = Files.newInputStream(path);
             AffixLineSource lines = new DynamicEncodingLineSource(input, initialEncoding)) {
            LOGGER.debug("Compiling affix file {} starting as {}", path, initialEncoding.name());
            return read(lines);
        } finally {
            MDC.remove(MDC_FILE_KEY);
        }
    }

    private AffixConfig readAll() throws IOException {
        String line;
        while ((line = source.readLine()) != null) {
            if (lineNumber == 0) {
                adoptDetectedEncoding();
            }
            if (Thread.currentThread().isInterrupted()) {
                LOGGER.warn("Interrupted after {} lines, returning the configuration read so far", lineNumber);
                break;
            }
            accept(line);
        }
        if (builder.breakPoints().state() == TableState.UNTOUCHED) {
            builder.breakPoints().addAll(DEFAULT_BREAK_POINTS);
        }
        AffixConfig config = builder.build();
        LOGGER.debug("Read {} lines: {} prefix groups, {} suffix groups, {} diagnostics",
                lineNumber, config.prefixes().size(), config.suffixes().size(), config.diagnostics().size());
        return config;
    }

    private void adoptDetectedEncoding() {
        source.detectedEncoding().ifPresent(detected -> {
            LOGGER.debug("Source detected {}, using it as the declared encoding", detected.name());
            builder.encoding(detected);
        });
    }

    private void accept(String line) {
        lineNumber++;
        if (line.isBlank() || COMMENT.matcher(line).find()) {
            return;
        }
        Matcher bare = BARE_WORD.matcher(line);
        if (bare.matches()) {
            enableOption(bare.group(1));
            return;
        }
        Matcher directive = DIRECTIVE.matcher(line);
        if (!directive.matches()) {
            LOGGER.debug("Line {} is not a directive, skipping", lineNumber);
            return;
        }
        String name = directive.group(1).toUpperCase(Locale.ROOT);
        DirectiveHandler handler = handlers.get(name);
        if (handler == null) {
            LOGGER.debug("Line {}: unknown directive {}, skipping", lineNumber, name);
            return;
        }
        currentDirective = name;
        try {
            handler.apply(name, directive.group(2));
        } catch (AffixFormatException ex) {
            diagnostic(name, ex.getMessage());
        }
    }

    private void enableOption(String word) {
        Optional<AffixConfigOption> option = AffixConfigOption.fromDirective(word);
        if (option.isPresent()) {
            builder.enableOption(option.get());
        } else {
            LOGGER.debug("Line {}: unknown option {}, skipping", lineNumber, word);
        }
    }

    private void diagnostic(String directive, String message) {
        builder.addDiagnostic(new AffixDiagnostic(lineNumber, directive, message));
        LOGGER.warn("Line {} [{}]: {}", lineNumber, directive, message);
    }

    private void registerHandlers() {
        handlers.put("FLAG", (name, parameters) -> setFlagMode(parameters));
        handlers.put("SET", (name, parameters) -> setEncoding(parameters));
        handlers.put("LANG", (name, parameters) -> builder.language(parameters, toLocale(parameters)));
        handlers.put("KEY", (name, parameters) -> builder.keyString(parameters));
        handlers.put("TRY", (name, parameters) -> builder.tryString(parameters));
        handlers.put("VERSION", (name, parameters) -> builder.version(parameters));
        handlers.put("WORDCHARS", (name, parameters) -> builder.wordChars(parameters));
        handlers.put("IGNORE", (name, parameters) -> builder.ignoredChars(parameters));
        handlers.put("SYLLABLENUM", (name, parameters) -> builder.compoundSyllableNum(parameters));

        registerInteger("COMPOUNDMIN", value -> builder.compoundMin(Math.max(1, value)));
        registerInteger("COMPOUNDWORDMAX", builder::compoundWordMax);
        registerInteger("MAXNGRAMSUGS", builder::maxNgramSuggestions);
        registerInteger("MAXDIFF", builder::maxDifferency);
        registerInteger("MAXCPDSUGS", builder::maxCompoundSuggestions);
        handlers.put("COMPOUNDSYLLABLE", (name, parameters) -> setCompoundSyllable(parameters));

        for (FlagField field : FlagField.values()) {
            for (String directive : field.directives()) {
                handlers.put(directive, (name, parameters) -> setFlagField(field, parameters));
            }
        }

        handlers.put("REP", (name, parameters) -> builder.replacements().accept(parameters, TableParsers::replacement));
        handlers.put("ICONV", (name, parameters) -> builder.inputConversions().accept(parameters, TableParsers::conversion));
        handlers.put("OCONV", (name, parameters) -> builder.outputConversions().accept(parameters, TableParsers::conversion));
        handlers.put("PHONE", (name, parameters) -> builder.phonetic().accept(parameters, TableParsers::phonetic));
        handlers.put("MAP", (name, parameters) -> builder.relatedCharacters().accept(parameters, TableParsers::map));
        handlers.put("BREAK", (name, parameters) -> builder.breakPoints().accept(parameters, TableParsers::breakEntry));
        handlers.put("CHECKCOMPOUNDPATTERN", (name, parameters) ->
                builder.compoundPatterns().accept(parameters, this::compoundPattern));
        handlers.put("COMPOUNDRULE", (name, parameters) ->
                builder.compoundRules().accept(parameters, text -> TableParsers.compoundRule(text, flags())));
        handlers.put("AF", (name, parameters) ->
                builder.aliasFlags().accept(parameters, text -> TableParsers.aliasFlags(text, flags())));
        handlers.put("AM", (name, parameters) ->
                builder.aliasMorphology().accept(parameters, text -> TableParsers.aliasMorphology(text, orientation()::mirror)));

        handlers.put("PFX", this::addAffixLine);
        handlers.put("SFX", this::addAffixLine);
    }

    private void registerInteger(String directive, IntConsumer setter) {
        handlers.put(directive, (name, parameters) -> setter.accept(parseInteger(name, parameters)));
    }

    private void setFlagMode(String parameters) {
        FlagMode mode = FlagMode.fromDirective(parameters)
                .orElseThrow(() -> new AffixFormatException("unknown flag mode '" + parameters + "'"));
        if (mode == builder.flagMode()) {
            throw new AffixFormatException("flag mode is already " + mode);
        }
        builder.flagMode(mode);
        if (flagsParsed) {
            diagnostic("FLAG", "flag mode changed to " + mode + " after flags were already read");
        }
    }

    private void setEncoding(String parameters) {
        Charset encoding = EncodingNames.resolve(parameters)
                .orElseThrow(() -> new AffixFormatException("unknown encoding '" + parameters + "'"));
        builder.encoding(encoding);
        source.switchEncoding(encoding);
    }

    private void setCompoundSyllable(String parameters) {
        List<String> fields = TableParsers.requireFields(parameters, 1, "COMPOUNDSYLLABLE");
        int maxSyllable = parseInteger("COMPOUNDSYLLABLE", fields.get(0));
        String vowels = fields.size() > 1 ? sorted(fields.get(1)) : AffixConfig.DEFAULT_COMPOUND_VOWELS;
        builder.compoundSyllable(maxSyllable, vowels);
    }

    private void setFlagField(FlagField field, String parameters) {
        FlagField target = field;
        if (field == FlagField.COMPOUND_BEGIN || field == FlagField.COMPOUND_END) {
            Orientation.CompoundBoundary requested = field == FlagField.COMPOUND_BEGIN
                    ? Orientation.CompoundBoundary.BEGIN
                    : Orientation.CompoundBoundary.END;
            target = orientation().compoundBoundary(requested) == Orientation.CompoundBoundary.BEGIN
                    ? FlagField.COMPOUND_BEGIN
                    : FlagField.COMPOUND_END;
        }
        builder.flag(target, flags().parseSingleFlag(parameters));
    }

    private CompoundPattern compoundPattern(String text) {
        CompoundPattern pattern = TableParsers.compoundPattern(text, flags());
        if (pattern.replacement().isPresent()) {
            builder.enableOption(AffixConfigOption.SIMPLIFIED_COMPOUND);
        }
        return pattern;
    }

    private void addAffixLine(String directive, String parameters) {
        AffixEntryParser.Context context = new AffixEntryParser.Context(
                flags(),
                orientation(),
                builder.ignoredChars(),
                builder.aliasFlags().isTouched(),
                builder.aliasFlags().entries(),
                builder.aliasMorphology().isTouched(),
                builder.aliasMorphology().entries());
        Optional<? extends AffixEntry> entry;
        if (orientation().affixKind(directive) == AffixKind.PREFIX) {
            entry = entryParser.parse(parameters, builder.prefixes(), context);
        } else {
            entry = entryParser.parse(parameters, builder.suffixes(), context);
        }
        if (entry.isPresent() && !entry.get().continuationClass().isEmpty()) {
            builder.markContinuationClasses();
        }
    }

    private FlagParser flags() {
        flagsParsed = true;
        return new FlagParser(builder.flagMode(), builder.encoding());
    }

    private Orientation orientation() {
        return Orientation.of(builder.hasOption(AffixConfigOption.COMPLEX_PREFIXES));
    }

    private static int parseInteger(String directive, String text) {
        try {
            return Integer.parseInt(text.strip());
        } catch (NumberFormatException ex) {
            throw new AffixFormatException(directive + " expects an integer but got '" + text + "'", ex);
        }
    }

    private static String sorted(String text) {
        char[] chars = text.toCharArray();
        Arrays.sort(chars);
        return new String(chars);
    }

    static Locale toLocale(String language) {
        Locale locale = Locale.forLanguageTag(language.strip().replace('_', '-'));
        if (!locale.getLanguage().isEmpty()) {
            return locale;
        }
        String primary = language.strip().split("[-_]", 2)[0];
        Locale fallback = Locale.forLanguageTag(primary);
        return fallback.getLanguage().isEmpty() ? Locale.ROOT : fallback;
    }
}

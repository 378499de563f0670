package dev.spellkit.affix.reader;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the encoding names found after {@code SET}, including the legacy spellings used by older dictionaries.
 */
public final class EncodingNames {

    private static final Map<String, String> ALIASES = Map.of(
            "MICROSOFT-CP1251", "windows-1251",
            "ISCII-DEVANAGARI", "x-ISCII91",
            "UTF8", "UTF-8");
    private static final Pattern ISO_8859_WITHOUT_DASH = Pattern.compile("ISO8859[-_]?(\\d+)");

    private EncodingNames() {
    }

    public static Optional<Charset> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.strip();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        String canonical = ALIASES.get(upper);
        if (canonical == null) {
            Matcher iso = ISO_8859_WITHOUT_DASH.matcher(upper);
            canonical = iso.matches() ? "ISO-8859-" + iso.group(1) : trimmed;
        }
        try {
            return Optional.of(Charset.forName(canonical));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            return Optional.empty();
        }
    }
}

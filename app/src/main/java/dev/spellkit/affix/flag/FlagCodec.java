package dev.spellkit.affix.flag;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Encodes and decodes flag tokens under the four {@link FlagMode}s.
 */
public final class FlagCodec {

    private FlagCodec() {
    }

    public static List<FlagValue> parseFlags(String text, FlagMode mode) {
        return parseFlags(text, mode, StandardCharsets.UTF_8);
    }

    /**
     * Decodes every flag contained in {@code text}.
     *
     * @param declaredEncoding encoding the affix file declared with {@code SET}; only consulted by
     *                         {@link FlagMode#UNI}
     * @throws FlagFormatException if the text is malformed for the mode
     */
    public static List<FlagValue> parseFlags(String text, FlagMode mode, Charset declaredEncoding) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(mode, "mode");
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        return switch (mode) {
            case CHAR -> parseCharFlags(text);
            case LONG -> parseLongFlags(text);
            case NUM -> parseNumericFlags(text);
            case UNI -> parseCharFlags(redecodeAsUtf8(text, declaredEncoding));
        };
    }

    public static FlagValue parseSingleFlag(String text, FlagMode mode) {
        return parseSingleFlag(text, mode, StandardCharsets.UTF_8);
    }

    /**
     * Decodes a token that must hold exactly one flag.
     *
     * @throws FlagFormatException if the text is malformed or holds zero or several flags
     */
    public static FlagValue parseSingleFlag(String text, FlagMode mode, Charset declaredEncoding) {
        List<FlagValue> flags = parseFlags(text, mode, declaredEncoding);
        if (flags.size() != 1) {
            throw new FlagFormatException("expected exactly one " + mode + " flag but found " + flags.size()
                    + " in '" + text + "'");
        }
        return flags.get(0);
    }

    /**
     * Renders a flag back into the textual form it has in an affix file.
     */
    public static String encode(FlagValue flag, FlagMode mode) {
        Objects.requireNonNull(flag, "flag");
        return switch (mode) {
            case CHAR, UNI -> new String(Character.toChars(flag.value()));
            case LONG -> new String(new char[] {(char) (flag.value() >>> 16), (char) flag.value()});
            case NUM -> Integer.toString(flag.value());
        };
    }

    public static String encodeAll(Collection<FlagValue> flags, FlagMode mode) {
        String separator = mode == FlagMode.NUM ? "," : "";
        return flags.stream()
                .map(flag -> encode(flag, mode))
                .collect(Collectors.joining(separator));
    }

    /**
     * Re-reads text that was decoded with the declared encoding as if its bytes were UTF-8.
     */
    static String redecodeAsUtf8(String text, Charset declaredEncoding) {
        if (declaredEncoding == null || StandardCharsets.UTF_8.equals(declaredEncoding)) {
            return text;
        }
        byte[] raw = text.getBytes(declaredEncoding);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new FlagFormatException("'" + text + "' is not valid UTF-8 when read as " + declaredEncoding.name(), ex);
        }
    }

    private static List<FlagValue> parseCharFlags(String text) {
        List<FlagValue> flags = new ArrayList<>(text.length());
        text.codePoints().forEach(codePoint -> flags.add(FlagValue.ofChar(codePoint)));
        return flags;
    }

    private static List<FlagValue> parseLongFlags(String text) {
        if (text.length() % 2 != 0) {
            throw new FlagFormatException("long flags need an even number of characters: '" + text + "'");
        }
        List<FlagValue> flags = new ArrayList<>(text.length() / 2);
        for (int i = 0; i < text.length(); i += 2) {
            flags.add(FlagValue.ofPair(text.charAt(i), text.charAt(i + 1)));
        }
        return flags;
    }

    private static List<FlagValue> parseNumericFlags(String text) {
        String[] parts = text.split(",", -1);
        List<FlagValue> flags = new ArrayList<>(parts.length);
        for (String part : parts) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                throw new FlagFormatException("empty numeric flag in '" + text + "'");
            }
            int number;
            try {
                number = Integer.parseInt(trimmed);
            } catch (NumberFormatException ex) {
                throw new FlagFormatException("numeric flag is not an integer: '" + trimmed + "'", ex);
            }
            if (number < 0) {
                throw new FlagFormatException("numeric flag must not be negative: '" + trimmed + "'");
            }
            flags.add(FlagValue.ofNumber(number));
        }
        return flags;
    }
}

package dev.spellkit.affix.flag;

import java.nio.charset.Charset;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Binds the flag mode and declared file encoding in effect while one line is parsed.
 */
public record FlagParser(FlagMode mode, Charset declaredEncoding) {

    public FlagParser {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(declaredEncoding, "declaredEncoding");
    }

    public List<FlagValue> parseFlags(String text) {
        return FlagCodec.parseFlags(text, mode, declaredEncoding);
    }

    public FlagValue parseSingleFlag(String text) {
        return FlagCodec.parseSingleFlag(text, mode, declaredEncoding);
    }

    public String encode(FlagValue flag) {
        return FlagCodec.encode(flag, mode);
    }

    public String encodeAll(Collection<FlagValue> flags) {
        return FlagCodec.encodeAll(flags, mode);
    }
}

package dev.spellkit.affix.cli;

import dev.spellkit.affix.reader.EncodingNames;
import java.nio.charset.Charset;
import picocli.CommandLine;

/**
 * Parses {@code --encoding}, accepting the same names as the {@code SET} directive.
 */
public class CharsetConverter implements CommandLine.ITypeConverter<Charset> {
    @Override
    public Charset convert(String value) {
        return EncodingNames.resolve(value)
                .orElseThrow(() -> new CommandLine.TypeConversionException("Unknown encoding: " + value));
    }
}

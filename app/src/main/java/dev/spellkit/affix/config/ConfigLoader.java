package dev.spellkit.affix.config;

import dev.spellkit.affix.cli.CliArguments;
import dev.spellkit.affix.model.AffixConfig;
import dev.spellkit.affix.reader.EncodingNames;
import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults. Arguments given on
 * the command line win over the environment.
 */
public class ConfigLoader {

    static final String ENV_DEFAULT_ENCODING = "AFFIX_DEFAULT_ENCODING";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_FAIL_ON_WARNINGS = "AFFIX_FAIL_ON_WARNINGS";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.affixFile() == null) {
            throw new IllegalArgumentException("affix file must be provided");
        }
        return new Config(
                arguments.affixFile(),
                resolveEncoding(arguments),
                resolveLogFormat(arguments),
                resolveFailOnWarnings(arguments),
                arguments.printEntries());
    }

    private Charset resolveEncoding(CliArguments arguments) {
        Charset cliEncoding = arguments.encoding();
        if (cliEncoding != null) {
            return cliEncoding;
        }
        return environmentReader.get(ENV_DEFAULT_ENCODING)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> EncodingNames.resolve(value)
                        .orElseThrow(() -> new IllegalArgumentException(ENV_DEFAULT_ENCODING + " names an unknown encoding: " + value)))
                .orElse(AffixConfig.DEFAULT_ENCODING);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFailOnWarnings(CliArguments arguments) {
        if (arguments.failOnWarnings()) {
            return true;
        }
        return environmentReader.get(ENV_FAIL_ON_WARNINGS)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}

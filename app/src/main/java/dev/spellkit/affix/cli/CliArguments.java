package dev.spellkit.affix.cli;

import dev.spellkit.affix.config.LogFormat;
import java.nio.charset.Charset;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "affixc", mixinStandardHelpOptions = true, version = "affixc 0.1.0",
        description = "Compiles a Hunspell affix file and reports what it defines")
public class CliArguments {

    @CommandLine.Parameters(index = "0", description = "Affix (.aff) file to compile", paramLabel = "FILE")
    private Path affixFile;

    @CommandLine.Option(names = "--encoding", converter = CharsetConverter.class,
            description = "Encoding used until the file declares one with SET (default ISO-8859-1)", paramLabel = "CHARSET")
    private Charset encoding;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--fail-on-warnings", description = "Exit with status 1 when the file produced diagnostics")
    private boolean failOnWarnings;

    @CommandLine.Option(names = "--entries", description = "List every prefix and suffix entry in the report")
    private boolean printEntries;

    public Path affixFile() {
        return affixFile;
    }

    public Charset encoding() {
        return encoding;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean failOnWarnings() {
        return failOnWarnings;
    }

    public boolean printEntries() {
        return printEntries;
    }
}

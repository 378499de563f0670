package dev.spellkit.affix.cli;

import dev.spellkit.affix.config.Config;
import dev.spellkit.affix.config.ConfigLoader;
import dev.spellkit.affix.config.SystemEnvironmentReader;
import dev.spellkit.affix.logging.LoggingConfigurator;
import dev.spellkit.affix.model.AffixConfig;
import dev.spellkit.affix.reader.AffixReader;
import java.io.IOException;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and affix reader.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_UNREADABLE = 2;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this(configLoader, null, null);
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        if (out != null) {
            commandLine.setOut(out);
        }
        if (err != null) {
            commandLine.setErr(err);
        }

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        AffixConfig affixConfig;
        try {
            affixConfig = AffixReader.readFile(config.affixFile(), config.defaultEncoding());
        } catch (IOException ex) {
            LOGGER.error("Cannot read affix file {}", config.affixFile(), ex);
            commandLine.getErr().println("Cannot read " + config.affixFile() + ": " + ex.getMessage());
            return EXIT_UNREADABLE;
        }

        commandLine.getOut().print(new CompilationReport(affixConfig).render(config.printEntries()));
        commandLine.getOut().flush();

        if (!affixConfig.diagnostics().isEmpty()) {
            LOGGER.info("{} produced {} diagnostics", config.affixFile(), affixConfig.diagnostics().size());
            if (config.failOnWarnings()) {
                return EXIT_DIAGNOSTICS;
            }
        }
        return EXIT_OK;
    }
}

package dev.spellkit.affix.cli;

import static org.assertj.core.api.Assertions.assertThat;

import dev.spellkit.affix.config.ConfigLoader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CliApplication application = new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new PrintWriter(out, true),
                new PrintWriter(err, true));
        return application.run(args);
    }

    private Path affixFile(String content) throws IOException {
        Path file = tempDir.resolve("test.aff");
        Files.writeString(file, content, StandardCharsets.ISO_8859_1);
        return file;
    }

    @Test
    void printsReportForValidFile() throws IOException {
        Path file = affixFile("""
                SET UTF-8
                LANG de_DE
                NEEDAFFIX X
                PFX A Y 1
                PFX A 0 re .
                SFX B Y 1
                SFX B y ies y
                """);

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString())
                .contains("encoding: UTF-8")
                .contains("flag mode: CHAR")
                .contains("language: de_DE")
                .contains("NEEDAFFIX: X")
                .contains("prefix groups: 1 (1 entries)")
                .contains("suffix groups: 1 (1 entries)")
                .contains("break points: - ^- -$")
                .contains("diagnostics: 0")
                .doesNotContain("  PFX A");
    }

    @Test
    void listsEntriesWhenRequested() throws IOException {
        Path file = affixFile("""
                CHECKSHARPS
                COMPOUNDRULE 2
                COMPOUNDRULE A*B?
                COMPOUNDRULE (AB)B
                PFX A Y 1
                PFX A 0 re .
                SFX B Y 1
                SFX B 0 s/A [^y]
                """);

        int exitCode = run(file.toString(), "--entries");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString())
                .contains("  PFX A 0 re .")
                .contains("  SFX B 0 s/A [^y]")
                .contains("options: CHECKSHARPS")
                .contains("  COMPOUNDRULE A*B?")
                .contains("  COMPOUNDRULE (AB)B");
    }

    @Test
    void diagnosticsAreReportedWithoutFailingByDefault() throws IOException {
        Path file = affixFile("FLAG hex\nPFX A Y 1\nPFX A 0 re .\n");

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString()).contains("diagnostics: 1").contains("hex");
    }

    @Test
    void failOnWarningsTurnsDiagnosticsIntoFailure() throws IOException {
        Path file = affixFile("FLAG hex\n");

        int exitCode = run(file.toString(), "--fail-on-warnings");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_DIAGNOSTICS);
    }

    @Test
    void failOnWarningsKeepsSuccessForCleanFile() throws IOException {
        Path file = affixFile("TRY abc\n");

        assertThat(run(file.toString(), "--fail-on-warnings")).isEqualTo(CliApplication.EXIT_OK);
    }

    @Test
    void missingFileIsUnreadable() {
        int exitCode = run(tempDir.resolve("absent.aff").toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_UNREADABLE);
        assertThat(err.toString()).contains("Cannot read").contains("absent.aff");
    }

    @Test
    void missingArgumentIsInvalidInput() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("FILE");
    }

    @Test
    void unknownEncodingOptionIsInvalidInput() throws IOException {
        Path file = affixFile("TRY abc\n");

        int exitCode = run(file.toString(), "--encoding", "klingon");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void versionIsPrinted() {
        assertThat(run("--version")).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(out.toString()).contains("affixc 0.1.0");
    }
}

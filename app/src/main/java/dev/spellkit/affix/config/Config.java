package dev.spellkit.affix.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable runtime configuration of one compilation, assembled from CLI arguments and environment values.
 *
 * @param affixFile       affix file to compile
 * @param defaultEncoding encoding used until the file declares its own with {@code SET}
 * @param failOnWarnings  whether diagnostics make the run fail
 * @param printEntries    whether the report lists every affix entry
 */
public record Config(
        Path affixFile,
        Charset defaultEncoding,
        LogFormat logFormat,
        boolean failOnWarnings,
        boolean printEntries
) {

    public Config {
        Objects.requireNonNull(affixFile, "affixFile");
        Objects.requireNonNull(defaultEncoding, "defaultEncoding");
        Objects.requireNonNull(logFormat, "logFormat");
        if (affixFile.toString().isBlank()) {
            throw new IllegalArgumentException("affixFile must not be blank");
        }
    }
}

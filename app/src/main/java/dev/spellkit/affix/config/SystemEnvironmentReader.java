package dev.spellkit.affix.config;

import java.util.Optional;

/**
 * Reads environment variables of the running process.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}

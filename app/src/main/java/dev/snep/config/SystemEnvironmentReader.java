package dev.snep.config;

import java.util.Optional;

/**
 * Reads {@code SNEP_*} settings from the environment of the running process.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> value(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}

package dev.snep.config;

import java.util.Optional;

/**
 * Source of {@code SNEP_*} settings. Tests pass a map-backed lambda instead of the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    /**
     * @return the raw value of {@code key}, empty when unset
     */
    Optional<String> value(String key);
}

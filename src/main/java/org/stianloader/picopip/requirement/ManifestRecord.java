package org.stianloader.picopip.requirement;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * A single "name = value" entry of a manifest or lockfile, as produced and consumed by the external
 * TOML/JSON codec. The value is either a {@link String} or a {@link java.util.Map Map&lt;String, Object&gt;}
 * whose values are strings, booleans or lists of strings.
 *
 * @param name The package name as written in the manifest
 * @param value The entry value
 */
public record ManifestRecord(@NotNull String name, @NotNull Object value) {
    public ManifestRecord {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(value, "value may not be null");
    }
}

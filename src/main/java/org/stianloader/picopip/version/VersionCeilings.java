package org.stianloader.picopip.version;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The highest known minor version for every major version of the python interpreter.
 * Used by {@link SpecifierUtil#normalizeOpenBound(VersionSpecifier, VersionCeilings)} to decide whether
 * a bound may be moved to the next minor version.
 *
 * <p>Instances are immutable, use {@link #withCeiling(int, int)} to derive a table for newer interpreters.
 */
public final class VersionCeilings {

    @NotNull
    public static final VersionCeilings DEFAULT;

    static {
        Map<Integer, Integer> ceilings = new TreeMap<>();
        ceilings.put(1, 7);
        ceilings.put(2, 7);
        ceilings.put(3, 11);
        ceilings.put(4, 0);
        DEFAULT = new VersionCeilings(ceilings);
    }

    @NotNull
    private final Map<Integer, Integer> ceilings;

    private VersionCeilings(@NotNull Map<Integer, Integer> ceilings) {
        this.ceilings = Collections.unmodifiableMap(ceilings);
    }

    /**
     * Obtains the highest minor version of the given major version, or null if the major version is unknown.
     *
     * @param major The major version
     * @return The ceiling
     */
    @Nullable
    @Contract(pure = true)
    public Integer getCeiling(int major) {
        return this.ceilings.get(major);
    }

    @NotNull
    public Map<Integer, Integer> asMap() {
        return this.ceilings;
    }

    @NotNull
    @Contract(pure = true)
    public VersionCeilings withCeiling(int major, int maxMinor) {
        if (major < 0 || maxMinor < 0) {
            throw new IllegalArgumentException("Negative version component: " + major + "." + maxMinor);
        }
        Map<Integer, Integer> copy = new TreeMap<>(this.ceilings);
        copy.put(major, maxMinor);
        return new VersionCeilings(copy);
    }

    @Override
    public String toString() {
        return "VersionCeilings" + this.ceilings;
    }
}

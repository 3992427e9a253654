package org.stianloader.picopip.marker;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.version.PackageVersion;

/**
 * The values of the {@link MarkerVariable marker variables} of a target interpreter, along with the set of
 * extras requested for the requirement under evaluation.
 *
 * <p>Variables without a value evaluate as the empty string. Instances are immutable.
 */
public final class MarkerEnvironment {

    @NotNull
    public static final MarkerEnvironment EMPTY = new MarkerEnvironment(new EnumMap<>(MarkerVariable.class), Collections.emptySet());

    @NotNull
    private final Set<@NotNull String> extras;

    @NotNull
    private final Map<@NotNull MarkerVariable, @NotNull String> values;

    private MarkerEnvironment(@NotNull Map<MarkerVariable, String> values, @NotNull Set<String> extras) {
        this.values = Collections.unmodifiableMap(values);
        this.extras = Collections.unmodifiableSet(extras);
    }

    /**
     * Creates an environment for the given interpreter version, populating both python_version
     * and python_full_version. A two-segment version such as "3.9" produces the full version "3.9.0",
     * a three-segment version such as "3.9.7" produces the short version "3.9".
     *
     * @param pythonVersion The interpreter version
     * @return The created environment
     */
    @NotNull
    @Contract(pure = true)
    public static MarkerEnvironment forPython(@NotNull String pythonVersion) {
        PackageVersion version = PackageVersion.parse(pythonVersion);
        String shortVersion = version.getSegment(0) + "." + version.getSegment(1);
        String fullVersion = version.getSegmentCount() > 2 ? version.getOriginText() : shortVersion + "." + version.getSegment(2);
        return MarkerEnvironment.EMPTY
                .with(MarkerVariable.PYTHON_VERSION, shortVersion)
                .with(MarkerVariable.PYTHON_FULL_VERSION, fullVersion)
                .with(MarkerVariable.IMPLEMENTATION_VERSION, fullVersion);
    }

    @NotNull
    public static String normalizeExtra(@NotNull String extra) {
        return extra.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @NotNull
    @Contract(pure = true)
    public String get(@NotNull MarkerVariable variable) {
        return this.values.getOrDefault(variable, "");
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getExtras() {
        return this.extras;
    }

    @NotNull
    @Contract(pure = true)
    public MarkerEnvironment with(@NotNull MarkerVariable variable, @NotNull String value) {
        if (variable == MarkerVariable.EXTRA) {
            throw new IllegalArgumentException("Extras are set through withExtras");
        }
        Map<MarkerVariable, String> copy = new EnumMap<>(MarkerVariable.class);
        copy.putAll(this.values);
        copy.put(variable, Objects.requireNonNull(value, "value may not be null"));
        return new MarkerEnvironment(copy, this.extras);
    }

    @NotNull
    @Contract(pure = true)
    public MarkerEnvironment withExtras(@NotNull Collection<@NotNull String> extras) {
        Set<String> normalized = new TreeSet<>();
        for (String extra : extras) {
            normalized.add(MarkerEnvironment.normalizeExtra(extra));
        }
        Map<MarkerVariable, String> copy = new EnumMap<>(MarkerVariable.class);
        copy.putAll(this.values);
        return new MarkerEnvironment(copy, normalized);
    }

    @Override
    public String toString() {
        return "MarkerEnvironment{values=" + this.values + ", extras=" + this.extras + "}";
    }
}

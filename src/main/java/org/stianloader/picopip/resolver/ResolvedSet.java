package org.stianloader.picopip.resolver;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.requirement.PackageName;

/**
 * The outcome of a successful resolution: one pinned requirement per package, sorted by name.
 */
public final class ResolvedSet {

    @NotNull
    private final SortedMap<PackageName, ResolvedPackage> packages;
    private final int rounds;

    ResolvedSet(@NotNull Map<PackageName, ResolvedPackage> packages, int rounds) {
        this.packages = Collections.unmodifiableSortedMap(new TreeMap<>(packages));
        this.rounds = rounds;
    }

    @NotNull
    public SortedMap<@NotNull PackageName, @NotNull ResolvedPackage> asMap() {
        return this.packages;
    }

    public boolean contains(@NotNull String name) {
        return this.get(name) != null;
    }

    @Nullable
    public ResolvedPackage get(@NotNull String name) {
        return this.packages.get(PackageName.of(name));
    }

    /**
     * Obtains the number of pinning rounds it took until the pins were considered stable.
     *
     * @return The round count
     */
    public int getRounds() {
        return this.rounds;
    }

    public int size() {
        return this.packages.size();
    }

    @Override
    public String toString() {
        return "ResolvedSet" + this.packages.values();
    }
}

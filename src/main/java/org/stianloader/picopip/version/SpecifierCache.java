package org.stianloader.picopip.version;

import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * A bounded, least-recently-used cache of parsed versions and specifier sets.
 *
 * <p>There is no global instance. Whoever needs memoisation creates and owns a cache and passes it along,
 * so that separate resolution runs (and separate tests) never observe each other's entries.
 * Instances are thread-safe.
 */
public class SpecifierCache {

    private static class BoundedMap<K, V> extends LinkedHashMap<K, V> {
        private static final long serialVersionUID = 1L;
        private final int maxEntries;

        BoundedMap(int maxEntries) {
            super(16, 0.75F, true);
            this.maxEntries = maxEntries;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return this.size() > this.maxEntries;
        }
    }

    private final BoundedMap<String, PackageVersion> versions;
    private final BoundedMap<String, SpecifierSet> specifierSets;

    public SpecifierCache() {
        this(1024);
    }

    public SpecifierCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.versions = new BoundedMap<>(maxEntries);
        this.specifierSets = new BoundedMap<>(maxEntries);
    }

    public synchronized void clear() {
        this.versions.clear();
        this.specifierSets.clear();
    }

    public synchronized int size() {
        return this.versions.size() + this.specifierSets.size();
    }

    @NotNull
    public synchronized SpecifierSet specifierSet(@NotNull String string) {
        SpecifierSet set = this.specifierSets.get(string);
        if (set == null) {
            set = SpecifierSet.parse(string);
            this.specifierSets.put(string, set);
        }
        return set;
    }

    @NotNull
    public synchronized PackageVersion version(@NotNull String string) {
        PackageVersion version = this.versions.get(string);
        if (version == null) {
            version = PackageVersion.parse(string);
            this.versions.put(string, version);
        }
        return version;
    }
}

package org.stianloader.picopip.test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.index.PackageIndex;

/**
 * A package index that serves releases registered in memory. Unknown packages and versions fail the returned futures.
 */
public class InMemoryPackageIndex implements PackageIndex {

    private static final class Release {
        private final List<String> dependencies = new ArrayList<>();
        private final Set<String> hashes = new LinkedHashSet<>();
    }

    private final AtomicInteger dependencyLookups = new AtomicInteger();
    private final Map<String, Map<String, Release>> packages = new LinkedHashMap<>();

    @NotNull
    public synchronized InMemoryPackageIndex addRelease(@NotNull String name, @NotNull String version, @NotNull String... dependencies) {
        Release release = this.packages.computeIfAbsent(name, (ignore) -> new LinkedHashMap<>()).computeIfAbsent(version, (ignore) -> new Release());
        for (String dependency : dependencies) {
            release.dependencies.add(dependency);
        }
        return this;
    }

    @NotNull
    public synchronized InMemoryPackageIndex addHashes(@NotNull String name, @NotNull String version, @NotNull String... hashes) {
        Release release = this.release(name, version);
        if (release == null) {
            throw new IllegalStateException("Unknown release " + name + " " + version);
        }
        for (String hash : hashes) {
            release.hashes.add(hash);
        }
        return this;
    }

    public int getDependencyLookups() {
        return this.dependencyLookups.get();
    }

    private synchronized Release release(@NotNull String name, @NotNull String version) {
        Map<String, Release> releases = this.packages.get(name);
        return releases == null ? null : releases.get(version);
    }

    @Override
    @NotNull
    public CompletableFuture<List<@NotNull String>> getDependencies(@NotNull String name, @NotNull String version, @NotNull Executor executor) {
        this.dependencyLookups.incrementAndGet();
        Release release = this.release(name, version);
        if (release == null) {
            return CompletableFuture.failedFuture(new NoSuchElementException("Unknown release " + name + " " + version));
        }
        synchronized (this) {
            return CompletableFuture.completedFuture(new ArrayList<>(release.dependencies));
        }
    }

    @Override
    @NotNull
    public CompletableFuture<Set<@NotNull String>> getHashes(@NotNull String name, @NotNull String version, @NotNull Executor executor) {
        Release release = this.release(name, version);
        if (release == null) {
            return CompletableFuture.failedFuture(new NoSuchElementException("Unknown release " + name + " " + version));
        }
        synchronized (this) {
            return CompletableFuture.completedFuture(new LinkedHashSet<>(release.hashes));
        }
    }

    @Override
    @NotNull
    public synchronized CompletableFuture<List<@NotNull String>> getVersions(@NotNull String name, @NotNull Executor executor) {
        Map<String, Release> releases = this.packages.get(name);
        if (releases == null) {
            return CompletableFuture.failedFuture(new NoSuchElementException("Unknown package " + name));
        }
        return CompletableFuture.completedFuture(new ArrayList<>(releases.keySet()));
    }
}

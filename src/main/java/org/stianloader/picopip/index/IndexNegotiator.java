package org.stianloader.picopip.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.internal.ConcurrencyUtil;
import org.stianloader.picopip.internal.StronglyMultiCompletableFuture;
import org.stianloader.picopip.logging.LoggingAdapter;

/**
 * Negotiates which {@link PackageIndex} is asked for a package. A requirement that names an index
 * (through the manifest's "index" key) is only looked up on that index. All other requirements are
 * looked up on all indexes, in which case the versions and hashes of all indexes are merged and the
 * dependencies are taken from the first index, in registration order, that knows the version.
 *
 * <p>An index negotiator is itself a {@link PackageIndex} that behaves like the merge of all its indexes.
 */
public class IndexNegotiator implements PackageIndex {

    @NotNull
    private final Map<String, PackageIndex> indexes = new LinkedHashMap<>();

    /**
     * Registers an index under a unique id.
     *
     * @param id The id of the index, as used by the "index" key of requirements
     * @param index The index
     * @return This negotiator, for chaining
     * @throws IllegalStateException If an index with the same id was registered before
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null, _ -> fail; _, null -> fail; !null, !null -> this")
    public synchronized IndexNegotiator addIndex(@NotNull String id, @NotNull PackageIndex index) {
        Objects.requireNonNull(id, "id may not be null");
        Objects.requireNonNull(index, "index may not be null");
        if (this.indexes.containsKey(id)) {
            throw new IllegalStateException("There is already an index with the id \"" + id + "\" registered!");
        }
        this.indexes.put(id, index);
        return this;
    }

    /**
     * Obtains the index packages of a requirement should be looked up on.
     *
     * @param indexId The index named by the requirement, or null if the requirement names none
     * @return The named index, or this negotiator if no index was named
     * @throws IllegalStateException If the named index is not registered
     */
    @NotNull
    public synchronized PackageIndex forIndex(@Nullable String indexId) {
        if (indexId == null) {
            return this;
        }
        PackageIndex index = this.indexes.get(indexId);
        if (index == null) {
            throw new IllegalStateException("No index with the id \"" + indexId + "\" is registered. Known indexes: " + this.indexes.keySet());
        }
        return index;
    }

    @NotNull
    private synchronized List<PackageIndex> snapshot() {
        return new ArrayList<>(this.indexes.values());
    }

    @Override
    @NotNull
    public CompletableFuture<List<@NotNull String>> getDependencies(@NotNull String name, @NotNull String version, @NotNull Executor executor) {
        List<PackageIndex> indexes = this.snapshot();
        if (indexes.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No index registered"));
        }
        CompletableFuture<List<String>> result = indexes.get(0).getDependencies(name, version, executor);
        for (int i = 1; i < indexes.size(); i++) {
            PackageIndex fallback = indexes.get(i);
            result = ConcurrencyUtil.configureFallback(result, () -> fallback.getDependencies(name, version, executor));
        }
        return result;
    }

    @Override
    @NotNull
    public CompletableFuture<Set<@NotNull String>> getHashes(@NotNull String name, @NotNull String version, @NotNull Executor executor) {
        return this.merge(name, (index) -> index.getHashes(name, version, executor));
    }

    @Override
    @NotNull
    public CompletableFuture<List<@NotNull String>> getVersions(@NotNull String name, @NotNull Executor executor) {
        return this.merge(name, (index) -> index.getVersions(name, executor)).thenApply((versions) -> {
            return Collections.unmodifiableList(new ArrayList<>(versions));
        });
    }

    @NotNull
    private CompletableFuture<Set<String>> merge(@NotNull String name, @NotNull Function<PackageIndex, CompletableFuture<? extends Iterable<String>>> request) {
        List<PackageIndex> indexes = this.snapshot();
        if (indexes.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No index registered"));
        }
        List<CompletableFuture<Iterable<String>>> futures = new ArrayList<>();
        for (PackageIndex index : indexes) {
            futures.add(request.apply(index).thenApply((values) -> values));
        }
        StronglyMultiCompletableFuture<Iterable<String>> combined = new StronglyMultiCompletableFuture<>(futures);
        return combined.thenApply((results) -> {
            if (results.size() != futures.size()) {
                LoggingAdapter.getDefaultLogger().debug(IndexNegotiator.class, "{} of {} indexes failed to answer for {}: {}",
                        futures.size() - results.size(), futures.size(), name, combined.getFailures());
            }
            Set<String> merged = new LinkedHashSet<>();
            for (Iterable<String> values : results) {
                for (String value : values) {
                    merged.add(value);
                }
            }
            return merged;
        });
    }
}

package org.stianloader.picopip.index;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

/**
 * A source of package metadata, such as a PyPI-compatible simple index. picopip does not ship a network
 * client, implementations are supplied by the caller.
 *
 * <p>All methods are non-blocking. Failures, including unknown packages or versions, are reported by
 * completing the returned future exceptionally. Implementations must not complete futures with null.
 */
public interface PackageIndex {

    /**
     * Obtains the requirement lines a version of a package depends on, as declared by its metadata
     * ("Requires-Dist"). Lines may carry markers, including {@code extra == "name"} clauses.
     *
     * @param name The normalised package name
     * @param version The version, as returned by {@link #getVersions(String, Executor)}
     * @param executor The executor with whom asynchronous operations should be performed
     * @return A future completing with the dependency lines
     */
    @NotNull
    CompletableFuture<List<@NotNull String>> getDependencies(@NotNull String name, @NotNull String version, @NotNull Executor executor);

    /**
     * Obtains the hashes of all artifacts of a version of a package, in the "algorithm:hexdigest" form.
     *
     * @param name The normalised package name
     * @param version The version
     * @param executor The executor with whom asynchronous operations should be performed
     * @return A future completing with the hashes
     */
    @NotNull
    CompletableFuture<Set<@NotNull String>> getHashes(@NotNull String name, @NotNull String version, @NotNull Executor executor);

    /**
     * Obtains all versions of a package that the index provides.
     *
     * @param name The normalised package name
     * @param executor The executor with whom asynchronous operations should be performed
     * @return A future completing with the versions, in no particular order
     */
    @NotNull
    CompletableFuture<List<@NotNull String>> getVersions(@NotNull String name, @NotNull Executor executor);
}

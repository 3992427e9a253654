package org.stianloader.picopip.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.requirement.PackageName;
import org.stianloader.picopip.requirement.Requirement;
import org.stianloader.picopip.version.PackageVersion;

/**
 * The mutable state of a single resolution: the merged constraint on every package encountered so far,
 * the versions each constraint still allows, the current pins and the pins of every finished round.
 *
 * <p>A state may only be used for one resolution. It is not thread-safe, with the exception of the
 * dependency cache which is filled by asynchronous lookups.
 */
public final class ResolverState {

    /**
     * A copy of the constraints and candidate versions, taken before the sub-dependencies of a candidate are added
     * so that they can be rolled back if they conflict.
     */
    public static final class Snapshot {
        @NotNull
        private final Map<PackageName, Set<PackageVersion>> candidateVersions;
        @NotNull
        private final Map<PackageName, AbstractDependency> constraints;

        private Snapshot(@NotNull Map<PackageName, AbstractDependency> constraints, @NotNull Map<PackageName, Set<PackageVersion>> candidateVersions) {
            this.constraints = new LinkedHashMap<>(constraints);
            this.candidateVersions = new LinkedHashMap<>(candidateVersions);
        }
    }

    private boolean begun;
    @NotNull
    private final Map<PackageName, Set<PackageVersion>> candidateVersions = new LinkedHashMap<>();
    @NotNull
    private final Map<PackageName, AbstractDependency> constraints = new LinkedHashMap<>();
    @NotNull
    private final ConcurrentMap<String, CompletableFuture<List<AbstractDependency>>> dependencyCache = new ConcurrentHashMap<>();
    @NotNull
    private final List<Map<PackageName, Requirement>> history = new ArrayList<>();
    @NotNull
    private final Map<PackageName, Requirement> pinned = new LinkedHashMap<>();

    /**
     * Adds a constraint. If the package is constrained already, both constraints are merged and the
     * candidate versions are narrowed down to the versions both accept.
     *
     * @param dependency The constraint to add
     * @throws ResolutionException If the constraints have no version in common
     */
    public void addAbstractDependency(@NotNull AbstractDependency dependency) throws ResolutionException {
        PackageName name = dependency.getName();
        AbstractDependency existing = this.constraints.get(name);
        AbstractDependency merged = existing == null ? dependency : existing.merge(dependency);
        this.constraints.put(name, merged);
        this.candidateVersions.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(merged.getVersionSet())));
    }

    /**
     * Marks the state as in use.
     *
     * @throws IllegalStateException If the state was used for a resolution before
     */
    void begin() {
        if (this.begun) {
            throw new IllegalStateException("A resolver state can only be used for a single resolution");
        }
        this.begun = true;
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull PackageVersion> getCandidateVersions(@NotNull PackageName name) {
        Set<PackageVersion> versions = this.candidateVersions.get(name);
        return versions == null ? Collections.emptySet() : versions;
    }

    @Nullable
    @Contract(pure = true)
    public AbstractDependency getConstraint(@NotNull PackageName name) {
        return this.constraints.get(name);
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull PackageName, @NotNull AbstractDependency> getConstraints() {
        return Collections.unmodifiableMap(this.constraints);
    }

    @NotNull
    ConcurrentMap<String, CompletableFuture<List<AbstractDependency>>> getDependencyCache() {
        return this.dependencyCache;
    }

    /**
     * Obtains the pins as they were at the end of every finished round, oldest first.
     *
     * @return The pin history
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Map<@NotNull PackageName, @NotNull Requirement>> getHistory() {
        return Collections.unmodifiableList(this.history);
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull PackageName, @NotNull Requirement> getPinned() {
        return Collections.unmodifiableMap(this.pinned);
    }

    void pin(@NotNull PackageName name, @NotNull Requirement pin) {
        this.pinned.put(name, pin);
    }

    void recordRound() {
        this.history.add(Collections.unmodifiableMap(new LinkedHashMap<>(this.pinned)));
    }

    void restore(@NotNull Snapshot snapshot) {
        this.constraints.clear();
        this.constraints.putAll(snapshot.constraints);
        this.candidateVersions.clear();
        this.candidateVersions.putAll(snapshot.candidateVersions);
    }

    @NotNull
    Snapshot snapshot() {
        return new Snapshot(this.constraints, this.candidateVersions);
    }
}

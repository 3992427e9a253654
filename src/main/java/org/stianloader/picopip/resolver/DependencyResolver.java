package org.stianloader.picopip.resolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.index.IndexNegotiator;
import org.stianloader.picopip.internal.ConcurrencyUtil;
import org.stianloader.picopip.logging.LoggingAdapter;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.marker.MarkerAlgebra;
import org.stianloader.picopip.marker.MarkerEnvironment;
import org.stianloader.picopip.marker.MarkerVariable;
import org.stianloader.picopip.requirement.PackageName;
import org.stianloader.picopip.requirement.Requirement;
import org.stianloader.picopip.requirement.RequirementKind;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.SpecifierCache;

/**
 * Resolves a set of root requirements into one pin per package through repeated rounds of pinning.
 *
 * <p>Each round visits every package constrained at the start of the round and pins its most preferred
 * candidate whose sub-dependencies can be merged into the existing constraints. Candidates whose
 * sub-dependencies conflict are rolled back and the next candidate is tried. Sub-dependencies added during
 * a round are pinned in the following round. Resolution finishes once a round, starting with the fourth,
 * changes no pin.
 *
 * <p>Package metadata is obtained from an {@link IndexNegotiator}, so requirements that name an index are only
 * looked up on that index.
 */
public class DependencyResolver {

    public static final int DEFAULT_MAX_ROUNDS = 20;

    /**
     * The amount of rounds that are always performed before the pins may be considered stable, as a single
     * unchanged round does not yet mean that sub-dependencies pinned late have settled.
     */
    private static final int MIN_STABLE_ROUND = 3;

    private boolean collectHashes = true;
    @Nullable
    private MarkerEnvironment environment;
    @NotNull
    private Executor executor = ForkJoinPool.commonPool();
    @NotNull
    private final IndexNegotiator index;
    private int maxRounds = DependencyResolver.DEFAULT_MAX_ROUNDS;
    @NotNull
    private SpecifierCache specifierCache = new SpecifierCache();

    public DependencyResolver(@NotNull IndexNegotiator index) {
        this.index = Objects.requireNonNull(index, "index may not be null");
    }

    private boolean applies(@Nullable Marker marker, @NotNull Collection<@NotNull String> extras) {
        if (marker == null) {
            return true;
        }
        MarkerEnvironment environment = this.environment;
        if (environment != null) {
            return marker.evaluate(environment.withExtras(extras));
        }

        // Without an environment only the extras can be checked
        Set<String> required = new HashSet<>();
        for (String extra : MarkerAlgebra.collect(marker, MarkerVariable.EXTRA)) {
            required.add(MarkerEnvironment.normalizeExtra(extra));
        }
        if (required.isEmpty()) {
            return true;
        }
        for (String extra : extras) {
            if (required.contains(MarkerEnvironment.normalizeExtra(extra))) {
                return true;
            }
        }
        return false;
    }

    @NotNull
    private Map<PackageName, ResolvedPackage> collectHashes(@NotNull Map<PackageName, Requirement> pins) {
        Map<PackageName, CompletableFuture<Set<String>>> futures = new LinkedHashMap<>();
        for (Map.Entry<PackageName, Requirement> entry : pins.entrySet()) {
            Requirement pin = entry.getValue();
            PackageVersion version = pin.getPinnedVersion();
            if (!this.collectHashes || pin.isEditable() || pin.getKind() != RequirementKind.NAMED || version == null) {
                futures.put(entry.getKey(), CompletableFuture.completedFuture(Collections.emptySet()));
            } else {
                futures.put(entry.getKey(), this.index.forIndex(pin.getIndex()).getHashes(entry.getKey().getKey(), version.toString(), this.executor));
            }
        }

        try {
            ConcurrencyUtil.all(new ArrayList<>(futures.values())).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Unable to collect the hashes of the resolved packages", ConcurrencyUtil.unwrap(e));
        }

        Map<PackageName, ResolvedPackage> resolved = new LinkedHashMap<>();
        for (Map.Entry<PackageName, CompletableFuture<Set<String>>> entry : futures.entrySet()) {
            Set<String> hashes = Collections.unmodifiableSet(new TreeSet<>(entry.getValue().join()));
            Requirement pin = pins.get(entry.getKey()).withHashes(hashes);
            resolved.put(entry.getKey(), new ResolvedPackage(pin, hashes));
        }
        return resolved;
    }

    /**
     * Obtains the sub-dependencies of a candidate, as applicable to the configured environment and the extras of the
     * candidate. The "extra" clauses are removed from the markers of the sub-dependencies and the markers of the candidate
     * are merged into them.
     */
    @NotNull
    private CompletableFuture<List<AbstractDependency>> fetchDependencies(@NotNull ResolverState state, @NotNull Requirement candidate) {
        PackageName name = candidate.getName();
        PackageVersion version = candidate.getPinnedVersion();
        if (name == null || version == null || candidate.isEditable() || candidate.getKind() != RequirementKind.NAMED) {
            // The metadata of files and checkouts is not served by indexes
            return CompletableFuture.completedFuture(Collections.emptyList());
        }

        return state.getDependencyCache().computeIfAbsent(candidate.toLine(), (ignore) -> {
            return this.index.forIndex(candidate.getIndex()).getDependencies(name.getKey(), version.toString(), this.executor).thenCompose((lines) -> {
                List<CompletableFuture<AbstractDependency>> dependencies = new ArrayList<>();
                for (String line : lines) {
                    Requirement requirement = Requirement.fromLine(line);
                    if (!this.applies(requirement.getMarkers(), candidate.getExtras())) {
                        continue;
                    }
                    if (requirement.getName() == null) {
                        LoggingAdapter.getDefaultLogger().warn(DependencyResolver.class, "Ignoring unnamed dependency '{}' of {}", line, candidate);
                        continue;
                    }
                    requirement = requirement.withMarkers(MarkerAlgebra.strip(requirement.getMarkers(), MarkerVariable.EXTRA).remainder())
                            .mergeMarkers(candidate.getMarkers());
                    dependencies.add(this.lookup(requirement, name));
                }
                return ConcurrencyUtil.all(dependencies);
            });
        });
    }

    @NotNull
    @Contract(pure = true)
    public Executor getExecutor() {
        return this.executor;
    }

    @Contract(pure = true)
    public int getMaxRounds() {
        return this.maxRounds;
    }

    /**
     * Looks up the candidates of a requirement. A requirement whose versions cannot be obtained is treated as having
     * no candidate at all.
     */
    @NotNull
    private CompletableFuture<AbstractDependency> lookup(@NotNull Requirement requirement, @Nullable PackageName parent) {
        return AbstractDependency.fromRequirement(requirement, parent, this.index.forIndex(requirement.getIndex()), this.specifierCache, this.executor)
                .exceptionally((t) -> {
                    Throwable cause = ConcurrencyUtil.unwrap(t);
                    if (cause instanceof IllegalArgumentException && !(cause instanceof RequirementParseException)) {
                        throw new CompletionException(cause);
                    }
                    LoggingAdapter.getDefaultLogger().warn(DependencyResolver.class, "Unable to obtain the versions of {}", requirement, cause);
                    return new AbstractDependency(requirement, Collections.emptyList(), parent);
                });
    }

    /**
     * Pins every package that is constrained at the start of the round. Packages are only pinned to candidates
     * whose sub-dependencies can be merged into the existing constraints.
     */
    private void pinDependencies(@NotNull ResolverState state) throws ResolutionException {
        List<PackageName> names = new ArrayList<>(state.getConstraints().keySet());

        for (PackageName name : names) {
            AbstractDependency constraint = state.getConstraint(name);
            if (constraint != null && !constraint.getCandidates().isEmpty()) {
                List<Requirement> candidates = constraint.getCandidates();
                this.fetchDependencies(state, candidates.get(candidates.size() - 1));
            }
        }

        for (PackageName name : names) {
            AbstractDependency constraint = Objects.requireNonNull(state.getConstraint(name));
            Requirement existingPin = state.getPinned().get(name);
            List<Requirement> candidates = new ArrayList<>(constraint.getCandidates());
            ResolutionException lastConflict = null;
            boolean committed = false;

            while (!candidates.isEmpty() && !committed) {
                Requirement candidate = candidates.remove(candidates.size() - 1);

                if (existingPin != null) {
                    if (existingPin.isEditable()) {
                        // Editable pins are never replaced
                        break;
                    }
                    PackageVersion newVersion = candidate.getPinnedVersion();
                    if (!candidate.isEditable() && newVersion != null && !newVersion.equals(existingPin.getPinnedVersion())
                            && !state.getCandidateVersions(name).contains(newVersion)) {
                        continue;
                    }
                }

                List<AbstractDependency> dependencies;
                try {
                    dependencies = this.fetchDependencies(state, candidate).join();
                } catch (CompletionException e) {
                    LoggingAdapter.getDefaultLogger().warn(DependencyResolver.class, "Unable to obtain the dependencies of {}, skipping the candidate", candidate, ConcurrencyUtil.unwrap(e));
                    continue;
                }

                ResolverState.Snapshot snapshot = state.snapshot();
                try {
                    for (AbstractDependency dependency : dependencies) {
                        state.addAbstractDependency(dependency);
                    }
                } catch (ResolutionException e) {
                    LoggingAdapter.getDefaultLogger().debug(DependencyResolver.class, "Rejecting candidate {}: {}", candidate, e.getMessage());
                    state.restore(snapshot);
                    lastConflict = e;
                    continue;
                }
                state.pin(name, candidate);
                committed = true;
            }

            if (committed) {
                continue;
            }
            if (existingPin != null && (existingPin.isEditable() || existingPin.getPinnedVersion() == null
                    || state.getCandidateVersions(name).contains(existingPin.getPinnedVersion()))) {
                continue;
            }
            if (lastConflict != null) {
                throw lastConflict;
            }
            throw ResolutionException.conflict(name.getKey(), Objects.requireNonNull(state.getConstraint(name)).describe(), "no available candidate");
        }
    }

    /**
     * Resolves the given roots within the configured amount of rounds.
     *
     * @param roots The root requirements
     * @return The resolved packages
     * @throws ResolutionException If the roots conflict or the pins do not settle
     */
    @NotNull
    public ResolvedSet resolve(@NotNull List<@NotNull RequirementInput> roots) throws ResolutionException {
        return this.resolve(roots, this.maxRounds);
    }

    @NotNull
    public ResolvedSet resolve(@NotNull List<@NotNull RequirementInput> roots, int maxRounds) throws ResolutionException {
        return this.resolve(new ResolverState(), roots, maxRounds);
    }

    /**
     * Resolves the given roots using a caller-supplied state, which can be inspected afterwards
     * (for example to look at the pin history of a failed resolution).
     *
     * @param state A state that was not used before
     * @param roots The root requirements. Roots whose markers do not apply to the environment are ignored
     * @param maxRounds The maximum amount of rounds
     * @return The resolved packages
     * @throws ResolutionException If the roots conflict or the pins do not settle
     * @throws IllegalArgumentException If a root is not named or maxRounds is not positive
     * @throws IllegalStateException If the state was used before or the hashes cannot be collected
     */
    @NotNull
    public ResolvedSet resolve(@NotNull ResolverState state, @NotNull List<@NotNull RequirementInput> roots, int maxRounds) throws ResolutionException {
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive, got " + maxRounds);
        }
        state.begin();

        for (AbstractDependency root : this.seed(roots)) {
            state.addAbstractDependency(root);
        }

        for (int round = 0; round < maxRounds; round++) {
            this.pinDependencies(state);
            state.recordRound();

            List<Map<PackageName, Requirement>> history = state.getHistory();
            Set<Requirement> difference = new HashSet<>(history.get(round).values());
            if (round > 0) {
                difference.removeAll(history.get(round - 1).values());
            }

            if (LoggingAdapter.getDefaultLogger().isDebugEnabled(DependencyResolver.class)) {
                LoggingAdapter.getDefaultLogger().debug(DependencyResolver.class, "Round {}: {} pins, {} changed {}", round, history.get(round).size(), difference.size(), difference);
            }

            if (difference.isEmpty() && round >= DependencyResolver.MIN_STABLE_ROUND) {
                return new ResolvedSet(this.collectHashes(state.getPinned()), round + 1);
            }
        }

        throw ResolutionException.noConvergence(maxRounds);
    }

    @NotNull
    private List<AbstractDependency> seed(@NotNull List<@NotNull RequirementInput> roots) {
        List<CompletableFuture<AbstractDependency>> dependencies = new ArrayList<>();
        for (RequirementInput root : roots) {
            Requirement requirement;
            if (root instanceof RequirementInput.Abstract) {
                AbstractDependency dependency = ((RequirementInput.Abstract) root).dependency();
                if (this.applies(dependency.getMarkers(), dependency.getRequirement().getExtras())) {
                    dependencies.add(CompletableFuture.completedFuture(dependency));
                }
                continue;
            } else if (root instanceof RequirementInput.Line) {
                requirement = Requirement.fromLine(((RequirementInput.Line) root).line());
            } else {
                requirement = ((RequirementInput.Parsed) root).requirement();
            }

            if (requirement.getName() == null) {
                throw new IllegalArgumentException("Root requirement " + requirement + " is not named");
            }
            if (this.applies(requirement.getMarkers(), Collections.emptyList())) {
                dependencies.add(this.lookup(requirement, null));
            } else {
                LoggingAdapter.getDefaultLogger().debug(DependencyResolver.class, "Skipping root {} as its markers do not apply", requirement);
            }
        }

        try {
            return ConcurrencyUtil.all(dependencies).join();
        } catch (CompletionException e) {
            Throwable cause = ConcurrencyUtil.unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Unable to look up the root requirements", cause);
        }
    }

    /**
     * Sets whether the hashes of the pinned packages are obtained from the indexes once the pins are stable.
     * Enabled by default.
     *
     * @param collectHashes True to collect hashes
     * @return This resolver, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DependencyResolver setCollectHashes(boolean collectHashes) {
        this.collectHashes = collectHashes;
        return this;
    }

    /**
     * Sets the environment markers are evaluated against. Without an environment, which is the default,
     * only the "extra" clauses of markers are taken into account.
     *
     * @param environment The environment, may be null
     * @return This resolver, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DependencyResolver setEnvironment(@Nullable MarkerEnvironment environment) {
        this.environment = environment;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DependencyResolver setExecutor(@NotNull Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DependencyResolver setMaxRounds(int maxRounds) {
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive, got " + maxRounds);
        }
        this.maxRounds = maxRounds;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DependencyResolver setSpecifierCache(@NotNull SpecifierCache specifierCache) {
        this.specifierCache = Objects.requireNonNull(specifierCache, "specifierCache may not be null");
        return this;
    }
}

package org.stianloader.picopip.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.index.PackageIndex;
import org.stianloader.picopip.logging.LoggingAdapter;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.requirement.NamedSource;
import org.stianloader.picopip.requirement.PackageName;
import org.stianloader.picopip.requirement.Requirement;
import org.stianloader.picopip.requirement.RequirementKind;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.SpecifierCache;
import org.stianloader.picopip.version.SpecifierOperator;
import org.stianloader.picopip.version.SpecifierSet;
import org.stianloader.picopip.version.VersionSpecifier;

/**
 * An unresolved constraint on a package: the requirement as declared (merged over all packages that
 * declare it) along with the concrete candidates that satisfy it.
 *
 * <p>Candidates are pinned requirements ordered from least to most preferred, that is by ascending version.
 * Requirements that do not come from an index (editable, file and VCS requirements) and requirements
 * that are pinned already have themselves as their only candidate.
 *
 * <p>Instances are immutable.
 */
public final class AbstractDependency {

    @NotNull
    private final List<@NotNull Requirement> candidates;
    @Nullable
    private final Marker markers;
    @NotNull
    private final PackageName name;
    @Nullable
    private final PackageName parent;
    @NotNull
    private final Requirement requirement;
    @NotNull
    private final SpecifierSet specifiers;

    public AbstractDependency(@NotNull Requirement requirement, @NotNull List<@NotNull Requirement> candidates, @Nullable PackageName parent) {
        PackageName name = requirement.getName();
        if (name == null) {
            throw new IllegalArgumentException("Requirement " + requirement + " must be named through Requirement.resolveName before it can be resolved");
        }
        this.name = name;
        this.requirement = requirement;
        this.specifiers = requirement.getSpecifiers();
        this.markers = requirement.getMarkers();
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.parent = parent;
    }

    /**
     * Looks up the candidates of a requirement and wraps both in an abstract dependency. Versions the
     * index lists but which cannot be parsed are skipped.
     *
     * @param requirement The requirement
     * @param parent The package that declared the requirement, null for roots
     * @param index The index to look the versions up on
     * @param cache The cache to parse versions through
     * @param executor The executor with whom asynchronous operations should be performed
     * @return A future completing with the abstract dependency
     */
    @NotNull
    public static CompletableFuture<AbstractDependency> fromRequirement(@NotNull Requirement requirement, @Nullable PackageName parent,
            @NotNull PackageIndex index, @NotNull SpecifierCache cache, @NotNull Executor executor) {
        PackageName name = requirement.getName();
        if (name == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Requirement " + requirement + " must be named before it can be resolved"));
        }
        if (requirement.getKind() != RequirementKind.NAMED || requirement.isPinned()) {
            return CompletableFuture.completedFuture(new AbstractDependency(requirement, List.of(requirement), parent));
        }

        return index.getVersions(name.getKey(), executor).thenApply((versionStrings) -> {
            TreeSet<PackageVersion> versions = new TreeSet<>();
            for (String versionString : versionStrings) {
                PackageVersion version;
                try {
                    version = cache.version(versionString);
                } catch (RequirementParseException e) {
                    LoggingAdapter.getDefaultLogger().debug(AbstractDependency.class, "Ignoring version {} of {}: {}", versionString, name, e.getMessage());
                    continue;
                }
                if (requirement.getSpecifiers().containsVersion(version)) {
                    versions.add(version);
                }
            }
            List<Requirement> candidates = new ArrayList<>();
            for (PackageVersion version : versions) {
                candidates.add(AbstractDependency.pinTo(requirement, version));
            }
            return new AbstractDependency(requirement, candidates, parent);
        });
    }

    @NotNull
    private static Requirement pinTo(@NotNull Requirement requirement, @NotNull PackageVersion version) {
        PackageName name = Objects.requireNonNull(requirement.getName());
        return Requirement.of(new NamedSource(name, SpecifierSet.of(new VersionSpecifier(SpecifierOperator.EQ, version))))
                .withExtras(requirement.getExtras())
                .withMarkers(requirement.getMarkers())
                .withIndex(requirement.getIndex());
    }

    /**
     * Computes the versions both dependencies accept.
     *
     * @param other The other dependency on the same package
     * @return The common versions
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull PackageVersion> compatibleVersions(@NotNull AbstractDependency other) {
        Set<PackageVersion> versions = new LinkedHashSet<>(this.getVersionSet());
        versions.retainAll(other.getVersionSet());
        return versions;
    }

    /**
     * Describes the constraint for error messages, naming the package that declared it.
     *
     * @return The description
     */
    @NotNull
    public String describe() {
        if (this.parent == null) {
            return this.requirement.toString();
        }
        return this.requirement + " (required by " + this.parent + ")";
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getCandidates() {
        return this.candidates;
    }

    @Nullable
    @Contract(pure = true)
    public Marker getMarkers() {
        return this.markers;
    }

    @NotNull
    @Contract(pure = true)
    public PackageName getName() {
        return this.name;
    }

    @Nullable
    @Contract(pure = true)
    public PackageName getParent() {
        return this.parent;
    }

    @NotNull
    @Contract(pure = true)
    public Requirement getRequirement() {
        return this.requirement;
    }

    @NotNull
    @Contract(pure = true)
    public SpecifierSet getSpecifiers() {
        return this.specifiers;
    }

    /**
     * Obtains the versions of all candidates. Direct dependencies have no versions.
     *
     * @return The candidate versions
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull PackageVersion> getVersionSet() {
        Set<PackageVersion> versions = new LinkedHashSet<>();
        for (Requirement candidate : this.candidates) {
            PackageVersion version = candidate.getPinnedVersion();
            if (version != null) {
                versions.add(version);
            }
        }
        return versions;
    }

    /**
     * Checks whether this dependency refers to a single installable that does not come from an index,
     * such as an editable checkout, a file or a VCS repository. Such dependencies take precedence over
     * any version constraint on the same package.
     *
     * @return True for direct dependencies
     */
    @Contract(pure = true)
    public boolean isDirect() {
        if (this.candidates.size() != 1) {
            return false;
        }
        Requirement candidate = this.candidates.get(0);
        return candidate.isEditable() || candidate.getKind() != RequirementKind.NAMED;
    }

    /**
     * Merges this dependency with another dependency on the same package. The merged dependency accepts the
     * intersection of both version sets, applies if either marker applies and installs the extras of both.
     * A direct dependency wins over any other dependency.
     *
     * @param other The dependency to merge with
     * @return The merged dependency
     * @throws ResolutionException with {@link ResolutionException.Reason#CONFLICT} if both dependencies have no version in common
     */
    @NotNull
    @Contract(pure = true)
    public AbstractDependency merge(@NotNull AbstractDependency other) throws ResolutionException {
        if (!other.name.equals(this.name)) {
            throw new IllegalArgumentException("Cannot merge dependencies on " + this.name + " and " + other.name);
        }
        if (this.isDirect()) {
            return this;
        } else if (other.isDirect()) {
            return other;
        }

        Set<PackageVersion> compatible = this.compatibleVersions(other);
        if (compatible.isEmpty()) {
            throw ResolutionException.conflict(this.name.getKey(), this.describe(), other.describe());
        }

        Marker mergedMarkers = null;
        if (this.markers != null && other.markers != null) {
            mergedMarkers = this.markers.equals(other.markers) ? this.markers : this.markers.or(other.markers);
        }
        Set<String> extras = new LinkedHashSet<>(this.requirement.getExtras());
        extras.addAll(other.requirement.getExtras());

        Requirement merged = this.requirement.withSpecifiers(this.specifiers.intersect(other.specifiers))
                .withMarkers(mergedMarkers)
                .withExtras(extras);
        List<Requirement> candidates = new ArrayList<>();
        for (Requirement candidate : this.candidates) {
            if (compatible.contains(candidate.getPinnedVersion())) {
                candidates.add(candidate.withMarkers(mergedMarkers).withExtras(extras));
            }
        }
        return new AbstractDependency(merged, candidates, this.parent);
    }

    @Override
    public String toString() {
        return "AbstractDependency[" + this.describe() + ", candidates=" + this.getVersionSet() + "]";
    }
}

package org.stianloader.picopip.version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;

/**
 * An unordered, deduplicated set of {@link VersionSpecifier specifiers}. A version is contained in the set
 * if every specifier contains it.
 *
 * <p>Insertion order is retained for display purposes only, two sets containing the same specifiers
 * in a different order are {@link #equals(Object) equal}.
 */
public final class SpecifierSet {

    /**
     * Sentinel value marking a set without any specifiers, which accepts any version.
     * Corresponds to the empty string as well as to "*".
     */
    @NotNull
    public static final SpecifierSet ANY = new SpecifierSet(Collections.emptySet());

    @NotNull
    private final Set<@NotNull VersionSpecifier> specifiers;

    private SpecifierSet(@NotNull Set<@NotNull VersionSpecifier> specifiers) {
        this.specifiers = Collections.unmodifiableSet(specifiers);
    }

    @NotNull
    @Contract(pure = true)
    public static SpecifierSet of(@NotNull Collection<@NotNull VersionSpecifier> specifiers) {
        if (specifiers.isEmpty()) {
            return SpecifierSet.ANY;
        }
        return new SpecifierSet(new LinkedHashSet<>(specifiers));
    }

    @NotNull
    @Contract(pure = true)
    public static SpecifierSet of(@NotNull VersionSpecifier @NotNull... specifiers) {
        List<VersionSpecifier> list = new ArrayList<>();
        Collections.addAll(list, specifiers);
        return SpecifierSet.of(list);
    }

    /**
     * Parses a comma-separated list of specifiers, for example {@code ">=1.0,<2.0"}.
     * The empty string, "*" and "any" produce {@link #ANY}.
     *
     * @param string The string to parse
     * @return The parsed set
     * @throws RequirementParseException if any of the specifiers is malformed
     */
    @NotNull
    @Contract(pure = true)
    public static SpecifierSet parse(@NotNull String string) {
        String trimmed = string.trim();
        if (trimmed.isEmpty() || trimmed.equals("*") || trimmed.toLowerCase(Locale.ROOT).equals("any")) {
            return SpecifierSet.ANY;
        }
        Set<VersionSpecifier> specifiers = new LinkedHashSet<>();
        for (String token : trimmed.split(",")) {
            if (token.isBlank()) {
                continue;
            }
            specifiers.add(VersionSpecifier.parse(token));
        }
        return SpecifierSet.of(specifiers);
    }

    @Contract(pure = true)
    public boolean containsVersion(@NotNull PackageVersion version) {
        for (VersionSpecifier specifier : this.specifiers) {
            if (!specifier.contains(version)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SpecifierSet) {
            return ((SpecifierSet) obj).specifiers.equals(this.specifiers);
        }
        return false;
    }

    /**
     * Obtains the version this set is pinned to, that is the version of the only {@link SpecifierOperator#EQ}
     * specifier. Returns null if {@link #isPinned()} is false.
     *
     * @return The pinned version, or null
     */
    @Nullable
    public PackageVersion getPinnedVersion() {
        if (!this.isPinned()) {
            return null;
        }
        return this.specifiers.iterator().next().getVersion();
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull VersionSpecifier> getSpecifiers() {
        return this.specifiers;
    }

    @Override
    public int hashCode() {
        return this.specifiers.hashCode();
    }

    /**
     * Intersects two sets. As the semantics of a set are AND-based, this merely unites the specifiers
     * of both sets. Whether the resulting set contains any version at all is not checked.
     *
     * @param other The other set
     * @return A set that contains the versions contained in both sets
     */
    @NotNull
    @Contract(pure = true)
    public SpecifierSet intersect(@NotNull SpecifierSet other) {
        if (this.isAny()) {
            return other;
        } else if (other.isAny()) {
            return this;
        }
        Set<VersionSpecifier> merged = new LinkedHashSet<>(this.specifiers);
        merged.addAll(other.specifiers);
        return new SpecifierSet(merged);
    }

    @Contract(pure = true)
    public boolean isAny() {
        return this.specifiers.isEmpty();
    }

    /**
     * Checks whether this set consists of exactly one non-wildcard {@code ==} or {@code ===} specifier.
     *
     * @return True if the set pins a single version
     */
    @Contract(pure = true)
    public boolean isPinned() {
        if (this.specifiers.size() != 1) {
            return false;
        }
        VersionSpecifier specifier = this.specifiers.iterator().next();
        return (specifier.getOperator() == SpecifierOperator.EQ || specifier.getOperator() == SpecifierOperator.ARBITRARY)
                && !specifier.getVersion().isWildcard();
    }

    /**
     * Selects the newest version out of the given collection that is contained in this set.
     *
     * @param knownAvailable The versions to pick from
     * @return The newest matching version, or null if none matches
     */
    @Nullable
    public PackageVersion selectFrom(@NotNull Collection<@NotNull PackageVersion> knownAvailable) {
        PackageVersion candidateVersion = null;
        for (PackageVersion known : knownAvailable) {
            if ((candidateVersion == null || known.isNewerThan(candidateVersion)) && this.containsVersion(known)) {
                candidateVersion = known;
            }
        }
        return candidateVersion;
    }

    /**
     * Checks whether both sets have the same grouped-and-collapsed string form. Unlike {@link #equals(Object)},
     * this treats {@code >=1.0,>=1.2} and {@code >=1.2} as being the same.
     *
     * @param other The other set
     * @return True if both sets collapse to the same specifiers
     */
    public boolean semanticallyEquals(@NotNull SpecifierSet other) {
        return SpecifierUtil.toCollapsedString(this.specifiers, SpecifierJoin.AND)
                .equals(SpecifierUtil.toCollapsedString(other.specifiers, SpecifierJoin.AND));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (VersionSpecifier specifier : this.specifiers) {
            if (builder.length() != 0) {
                builder.append(',');
            }
            builder.append(specifier);
        }
        return builder.toString();
    }
}

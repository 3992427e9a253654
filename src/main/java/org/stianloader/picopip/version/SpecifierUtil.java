package org.stianloader.picopip.version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Normalisation, grouping and collapsing of specifiers.
 *
 * <p>All methods are pure. Memoisation, where wanted, is done through a caller-owned {@link SpecifierCache}.
 */
public final class SpecifierUtil {

    /**
     * The bucket key used by {@link SpecifierUtil#groupByOperator(Collection)}: the operator and whether the
     * version has more than two segments (that is, whether it carries a patch component).
     */
    public static record SpecifierGroup(@NotNull SpecifierOperator operator, boolean multiSegment) implements Comparable<SpecifierGroup> {
        @Override
        public int compareTo(SpecifierGroup o) {
            int cmp = this.operator.compareTo(o.operator);
            if (cmp != 0) {
                return cmp;
            }
            return Boolean.compare(this.multiSegment, o.multiSegment);
        }
    }

    @NotNull
    private static final Comparator<PackageVersion> VERSION_ORDER = (a, b) -> {
        int cmp = a.compareTo(b);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Boolean.compare(a.isWildcard(), b.isWildcard());
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(a.getSegmentCount(), b.getSegmentCount());
    };

    @NotNull
    private static final Comparator<VersionSpecifier> SPECIFIER_ORDER = (a, b) -> {
        int cmp = SpecifierUtil.VERSION_ORDER.compare(a.getVersion(), b.getVersion());
        if (cmp != 0) {
            return cmp;
        }
        return a.getOperator().compareTo(b.getOperator());
    };

    private SpecifierUtil() {
        throw new UnsupportedOperationException();
    }

    @NotNull
    public static List<@NotNull VersionSpecifier> collapse(@NotNull Collection<@NotNull VersionSpecifier> specifiers, @NotNull SpecifierJoin join) {
        return SpecifierUtil.collapse(specifiers, join, VersionCeilings.DEFAULT);
    }

    /**
     * Reduces a list of specifiers that is interpreted under the given connective to its shortest equivalent form.
     *
     * <ul>
     * <li>Open bounds are first normalised through {@link #normalizeOpenBound(VersionSpecifier, VersionCeilings)}.</li>
     * <li>Lower bounds ({@code >}, {@code >=}) keep the minimum under {@link SpecifierJoin#OR}
     * and the maximum under {@link SpecifierJoin#AND}. Upper bounds keep the opposite.</li>
     * <li>Several {@code ==} versions under OR become one "in" specifier, several {@code !=} versions under AND
     * become one "not in" specifier. Any other equality specifier is kept as-is.</li>
     * <li>An "in" specifier under AND and a "not in" specifier under OR are kept as a whole, any other
     * membership specifier is expanded into its individual versions first.</li>
     * </ul>
     *
     * <p>The result is sorted by version and must be interpreted under the same connective as the input.
     * Applying this method to its own output yields the same output.
     *
     * @param specifiers The specifiers to collapse
     * @param join The connective the specifiers are joined with
     * @param ceilings The ceiling table passed to {@link #normalizeOpenBound(VersionSpecifier, VersionCeilings)}
     * @return The collapsed specifiers
     */
    @NotNull
    @Contract(pure = true)
    public static List<@NotNull VersionSpecifier> collapse(@NotNull Collection<@NotNull VersionSpecifier> specifiers, @NotNull SpecifierJoin join, @NotNull VersionCeilings ceilings) {
        List<VersionSpecifier> normalized = new ArrayList<>();
        List<VersionSpecifier> results = new ArrayList<>();
        for (VersionSpecifier specifier : specifiers) {
            SpecifierOperator op = specifier.getOperator();
            if ((op == SpecifierOperator.IN && join == SpecifierJoin.AND) || (op == SpecifierOperator.NOT_IN && join == SpecifierJoin.OR)) {
                // Membership that does not distribute over the connective is kept as a single unit
                if (!results.contains(specifier)) {
                    results.add(specifier);
                }
            } else {
                normalized.add(SpecifierUtil.normalizeOpenBound(specifier, ceilings));
            }
        }

        for (Map.Entry<SpecifierGroup, List<PackageVersion>> group : SpecifierUtil.groupByOperator(normalized).entrySet()) {
            SpecifierOperator op = group.getKey().operator();
            List<PackageVersion> versions = group.getValue();
            if (op.isLowerBound()) {
                PackageVersion bound = join == SpecifierJoin.OR ? versions.get(0) : versions.get(versions.size() - 1);
                results.add(new VersionSpecifier(op, bound));
            } else if (op.isUpperBound()) {
                PackageVersion bound = join == SpecifierJoin.OR ? versions.get(versions.size() - 1) : versions.get(0);
                results.add(new VersionSpecifier(op, bound));
            } else if (op == SpecifierOperator.EQ && join == SpecifierJoin.OR && versions.size() > 1) {
                results.add(new VersionSpecifier(SpecifierOperator.IN, versions));
            } else if (op == SpecifierOperator.NE && join == SpecifierJoin.AND && versions.size() > 1) {
                results.add(new VersionSpecifier(SpecifierOperator.NOT_IN, versions));
            } else {
                for (PackageVersion version : versions) {
                    results.add(new VersionSpecifier(op, version));
                }
            }
        }

        results.sort(SpecifierUtil.SPECIFIER_ORDER);
        return results;
    }

    /**
     * Expands "in" and "not in" specifiers into their individual {@code ==} and {@code !=} specifiers.
     * Other specifiers are returned unchanged.
     *
     * @param specifiers The specifiers to expand
     * @return The expanded specifiers
     */
    @NotNull
    public static List<@NotNull VersionSpecifier> expandMembership(@NotNull Collection<@NotNull VersionSpecifier> specifiers) {
        List<VersionSpecifier> expanded = new ArrayList<>();
        for (VersionSpecifier specifier : specifiers) {
            SpecifierOperator op = specifier.getOperator();
            if (op.isMembership()) {
                SpecifierOperator single = op == SpecifierOperator.IN ? SpecifierOperator.EQ : SpecifierOperator.NE;
                for (PackageVersion version : specifier.getVersions()) {
                    expanded.add(new VersionSpecifier(single, version));
                }
            } else {
                expanded.add(specifier);
            }
        }
        return expanded;
    }

    /**
     * Buckets the specifiers by operator and by whether their version has more than two segments.
     * The versions within a bucket are deduplicated and sorted in ascending order. Membership
     * specifiers are expanded beforehand.
     *
     * @param specifiers The specifiers to group
     * @return The buckets, ordered by operator
     */
    @NotNull
    @Contract(pure = true)
    public static SortedMap<@NotNull SpecifierGroup, @NotNull List<@NotNull PackageVersion>> groupByOperator(@NotNull Collection<@NotNull VersionSpecifier> specifiers) {
        SortedMap<SpecifierGroup, TreeSet<PackageVersion>> buckets = new TreeMap<>();
        for (VersionSpecifier specifier : SpecifierUtil.expandMembership(specifiers)) {
            PackageVersion version = specifier.getVersion();
            SpecifierGroup key = new SpecifierGroup(specifier.getOperator(), version.getSegmentCount() > 2);
            buckets.computeIfAbsent(key, (ignore) -> new TreeSet<>(SpecifierUtil.VERSION_ORDER)).add(version);
        }
        SortedMap<SpecifierGroup, List<PackageVersion>> grouped = new TreeMap<>();
        buckets.forEach((key, versions) -> grouped.put(key, new ArrayList<>(versions)));
        return grouped;
    }

    /**
     * Moves an open bound onto the next minor version so that ranges are written as half-open {@code [x, y)}
     * intervals: {@code >3.6} becomes {@code >=3.7} and {@code <=3.6} becomes {@code <3.7}. If the next minor
     * version would exceed the ceiling of the major version, if the major version is absent from the ceiling table
     * or if the version carries a patch component, the specifier is returned unchanged.
     *
     * @param specifier The specifier to normalise
     * @param ceilings The ceiling table
     * @return The normalised specifier
     */
    @NotNull
    @Contract(pure = true)
    public static VersionSpecifier normalizeOpenBound(@NotNull VersionSpecifier specifier, @NotNull VersionCeilings ceilings) {
        SpecifierOperator replacement;
        if (specifier.getOperator() == SpecifierOperator.GT) {
            replacement = SpecifierOperator.GE;
        } else if (specifier.getOperator() == SpecifierOperator.LE) {
            replacement = SpecifierOperator.LT;
        } else {
            return specifier;
        }

        PackageVersion version = specifier.getVersion();
        if (version.getSegmentCount() > 2) {
            return specifier;
        }

        int major = version.getSegment(0);
        int nextMinor = version.getSegmentCount() == 1 ? 1 : version.getSegment(1) + 1;
        Integer ceiling = ceilings.getCeiling(major);
        if (ceiling == null || nextMinor > ceiling) {
            return specifier;
        }
        return new VersionSpecifier(replacement, PackageVersion.of(major, nextMinor));
    }

    /**
     * Parses a version through the cache if one is given, and directly otherwise.
     *
     * @param version The version string
     * @param cache The cache, may be null
     * @return The integer segments of the version
     */
    public static int @NotNull[] tuplize(@NotNull String version, @Nullable SpecifierCache cache) {
        if (cache == null) {
            return PackageVersion.tuplize(version);
        }
        return cache.version(version).getSegments();
    }

    @NotNull
    public static String toCollapsedString(@NotNull Collection<@NotNull VersionSpecifier> specifiers, @NotNull SpecifierJoin join) {
        StringBuilder builder = new StringBuilder();
        for (VersionSpecifier specifier : SpecifierUtil.collapse(specifiers, join)) {
            if (builder.length() != 0) {
                builder.append(',');
            }
            builder.append(specifier);
        }
        return builder.toString();
    }
}

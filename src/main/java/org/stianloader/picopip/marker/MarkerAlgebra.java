package org.stianloader.picopip.marker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.SpecifierJoin;
import org.stianloader.picopip.version.SpecifierOperator;
import org.stianloader.picopip.version.SpecifierSet;
import org.stianloader.picopip.version.SpecifierUtil;
import org.stianloader.picopip.version.VersionSpecifier;

/**
 * Operations over {@link Marker markers}: stripping and collecting clauses of a single variable,
 * converting python version clauses into {@link SpecifierSet specifier sets} and merging markers.
 */
public final class MarkerAlgebra {

    private MarkerAlgebra() {
        throw new UnsupportedOperationException();
    }

    /**
     * Gathers all literals compared against the given variable, regardless of their position in the marker.
     *
     * @param marker The marker to search, may be null
     * @param variable The variable
     * @return The sorted literals
     */
    @NotNull
    @Contract(pure = true)
    public static Set<@NotNull String> collect(@Nullable Marker marker, @NotNull MarkerVariable variable) {
        if (marker == null) {
            return Collections.emptySet();
        }
        Set<String> literals = new TreeSet<>();
        MarkerAlgebra.collect(marker.getRoot(), variable, literals);
        return literals;
    }

    private static void collect(@NotNull MarkerNode node, @NotNull MarkerVariable variable, @NotNull Set<String> out) {
        if (node instanceof MarkerGroup) {
            for (MarkerNode operand : ((MarkerGroup) node).getOperands()) {
                MarkerAlgebra.collect(operand, variable, out);
            }
        } else {
            MarkerComparison comparison = (MarkerComparison) node;
            if (comparison.getVariable() == variable) {
                out.add(comparison.getLiteral());
            }
        }
    }

    @NotNull
    private static MarkerComparison format(@NotNull VersionSpecifier specifier) {
        boolean micro = false;
        for (PackageVersion version : specifier.getVersions()) {
            micro |= version.getSegmentCount() > 2;
        }
        MarkerVariable variable = micro ? MarkerVariable.PYTHON_FULL_VERSION : MarkerVariable.PYTHON_VERSION;
        String literal = specifier.getOperator().isMembership() ? specifier.joinVersions() : specifier.getVersion().getOriginText();
        return new MarkerComparison(variable, MarkerOperator.fromSpecifierOperator(specifier.getOperator()), literal);
    }

    /**
     * Creates a marker out of python version specifiers. The specifiers are collapsed under "and" semantics
     * first, each resulting specifier becomes one comparison. Specifiers whose version has a patch component
     * are compared against python_full_version, all others against python_version.
     *
     * @param specifiers The specifiers
     * @return The marker, or null if there are no specifiers
     */
    @Nullable
    @Contract(pure = true)
    public static Marker fromSpecifiers(@NotNull Collection<@NotNull VersionSpecifier> specifiers) {
        List<MarkerNode> leaves = new ArrayList<>();
        for (VersionSpecifier specifier : SpecifierUtil.collapse(specifiers, SpecifierJoin.AND)) {
            leaves.add(MarkerAlgebra.format(specifier));
        }
        if (leaves.isEmpty()) {
            return null;
        }
        return Marker.of(MarkerGroup.join(leaves, MarkerConnective.AND));
    }

    private static boolean isPythonVersionOnly(@NotNull MarkerNode node) {
        if (node instanceof MarkerGroup) {
            for (MarkerNode operand : ((MarkerGroup) node).getOperands()) {
                if (!MarkerAlgebra.isPythonVersionOnly(operand)) {
                    return false;
                }
            }
            return true;
        }
        MarkerVariable variable = ((MarkerComparison) node).getVariable();
        return variable == MarkerVariable.PYTHON_VERSION || variable == MarkerVariable.PYTHON_FULL_VERSION;
    }

    /**
     * Drops {@code >=} and {@code <} bounds that are implied by a stricter bound of the same direction.
     * {@link SpecifierUtil#collapse(Collection, SpecifierJoin)} keeps python_version and python_full_version
     * bounds apart, but under "and" only the strictest inclusive lower and exclusive upper bound matter.
     */
    @NotNull
    private static List<@NotNull VersionSpecifier> dropImpliedBounds(@NotNull List<@NotNull VersionSpecifier> specifiers) {
        VersionSpecifier lower = null;
        VersionSpecifier upper = null;
        for (VersionSpecifier specifier : specifiers) {
            if (specifier.getOperator() == SpecifierOperator.GE) {
                if (lower == null || specifier.getVersion().compareTo(lower.getVersion()) > 0) {
                    lower = specifier;
                }
            } else if (specifier.getOperator() == SpecifierOperator.LT) {
                if (upper == null || specifier.getVersion().compareTo(upper.getVersion()) < 0) {
                    upper = specifier;
                }
            }
        }

        List<VersionSpecifier> kept = new ArrayList<>();
        for (VersionSpecifier specifier : specifiers) {
            SpecifierOperator op = specifier.getOperator();
            if ((op == SpecifierOperator.GE && specifier != lower) || (op == SpecifierOperator.LT && specifier != upper)) {
                continue;
            }
            kept.add(specifier);
        }
        return kept;
    }

    /**
     * Merges two markers with "and". If either side is absent, the other side is returned as-is.
     * Otherwise the python version clauses of both sides are folded into a single canonical
     * set of comparisons (see {@link #normalizePythonVersion(Marker)}), so that repeated merges
     * do not accumulate redundant version clauses. Duplicate top level clauses are dropped.
     *
     * @param a The first marker, may be null
     * @param b The second marker, may be null
     * @return The merged marker, or null if both sides are null
     */
    @Nullable
    @Contract(pure = true, value = "null, null -> null; !null, _ -> !null; _, !null -> !null")
    public static Marker merge(@Nullable Marker a, @Nullable Marker b) {
        if (a == null) {
            return b;
        } else if (b == null) {
            return a;
        }

        List<MarkerNode> operands = new ArrayList<>();
        for (MarkerNode node : MarkerAlgebra.normalizePythonVersion(a).conjunctionOperands()) {
            if (!operands.contains(node)) {
                operands.add(node);
            }
        }
        for (MarkerNode node : MarkerAlgebra.normalizePythonVersion(b).conjunctionOperands()) {
            if (!operands.contains(node)) {
                operands.add(node);
            }
        }
        return MarkerAlgebra.normalizePythonVersion(Marker.of(MarkerGroup.join(operands, MarkerConnective.AND)));
    }

    /**
     * Rewrites the python_version and python_full_version clauses of a marker into their canonical, collapsed form and moves them to
     * the front of the marker. Only clauses that are joined to the rest of the marker with "and" are rewritten,
     * as is a marker which consists of such clauses only. If the clauses cannot be represented
     * as a conjunction of specifiers (for example {@code python_version < '3' or python_version >= '3.6'}),
     * the marker is returned unchanged.
     *
     * @param marker The marker to normalise
     * @return The normalised marker
     */
    @NotNull
    @Contract(pure = true)
    public static Marker normalizePythonVersion(@NotNull Marker marker) {
        List<MarkerNode> pythonOperands = new ArrayList<>();
        List<MarkerNode> otherOperands = new ArrayList<>();
        if (MarkerAlgebra.isPythonVersionOnly(marker.getRoot())) {
            pythonOperands.add(marker.getRoot());
        } else if (marker.getRoot().isConjunction()) {
            for (MarkerNode operand : marker.getRoot().getOperands()) {
                if (MarkerAlgebra.isPythonVersionOnly(operand)) {
                    pythonOperands.add(operand);
                } else {
                    otherOperands.add(operand);
                }
            }
        } else {
            return marker;
        }

        if (pythonOperands.isEmpty()) {
            return marker;
        }

        List<VersionSpecifier> specifiers = new ArrayList<>();
        for (MarkerNode operand : pythonOperands) {
            List<VersionSpecifier> operandSpecifiers = MarkerAlgebra.specifiersOf(operand);
            if (operandSpecifiers == null) {
                return marker;
            }
            specifiers.addAll(operandSpecifiers);
        }

        List<MarkerNode> operands = new ArrayList<>();
        for (VersionSpecifier specifier : MarkerAlgebra.dropImpliedBounds(SpecifierUtil.collapse(specifiers, SpecifierJoin.AND))) {
            operands.add(MarkerAlgebra.format(specifier));
        }
        operands.addAll(otherOperands);
        if (operands.isEmpty()) {
            return marker;
        }
        return Marker.of(MarkerGroup.join(operands, MarkerConnective.AND));
    }

    /**
     * Computes the python version specifiers of a node under "and" semantics. An empty list means that the node
     * does not constrain the interpreter version, null means that the constraint cannot be expressed as
     * a conjunction of specifiers. Comparisons against other variables are treated as unknown and thus
     * as not constraining the interpreter version.
     */
    @Nullable
    private static List<@NotNull VersionSpecifier> specifiersOf(@NotNull MarkerNode node) {
        if (node instanceof MarkerComparison) {
            return MarkerAlgebra.specifiersOf((MarkerComparison) node);
        }

        MarkerGroup group = (MarkerGroup) node;
        List<List<VersionSpecifier>> runs = new ArrayList<>();
        for (List<MarkerNode> run : group.splitDisjunction()) {
            List<VersionSpecifier> specifiers = new ArrayList<>();
            for (MarkerNode operand : run) {
                List<VersionSpecifier> operandSpecifiers = MarkerAlgebra.specifiersOf(operand);
                if (operandSpecifiers == null) {
                    return null;
                }
                specifiers.addAll(operandSpecifiers);
            }
            runs.add(SpecifierUtil.collapse(specifiers, SpecifierJoin.AND));
        }

        if (runs.size() == 1) {
            return runs.get(0);
        }

        List<VersionSpecifier> union = new ArrayList<>();
        for (List<VersionSpecifier> run : runs) {
            if (run.isEmpty()) {
                return Collections.emptyList();
            } else if (run.size() != 1) {
                return null;
            }
            union.add(run.get(0));
        }

        List<VersionSpecifier> collapsed = SpecifierUtil.collapse(union, SpecifierJoin.OR);
        if (collapsed.size() > 1) {
            return null;
        }
        return collapsed;
    }

    @NotNull
    private static List<@NotNull VersionSpecifier> specifiersOf(@NotNull MarkerComparison comparison) {
        MarkerVariable variable = comparison.getVariable();
        if (variable != MarkerVariable.PYTHON_VERSION && variable != MarkerVariable.PYTHON_FULL_VERSION) {
            return Collections.emptyList();
        }

        MarkerOperator op = comparison.getOperator();
        if (op == MarkerOperator.IN || op == MarkerOperator.NOT_IN) {
            if (!comparison.isVariableOnLeft()) {
                // Substring test on the interpreter version, not expressible as a specifier
                return Collections.emptyList();
            }
            List<PackageVersion> versions = new ArrayList<>();
            for (String member : MarkerComparison.splitMembers(comparison.getLiteral())) {
                versions.add(PackageVersion.parse(member));
            }
            if (versions.size() == 1) {
                SpecifierOperator single = op == MarkerOperator.IN ? SpecifierOperator.EQ : SpecifierOperator.NE;
                return Collections.singletonList(new VersionSpecifier(single, versions.get(0)));
            }
            return Collections.singletonList(new VersionSpecifier(op.getSpecifierOperator(), versions));
        }

        MarkerOperator effective = comparison.isVariableOnLeft() ? op : op.mirror();
        if (effective == null) {
            return Collections.emptyList();
        }
        return Collections.singletonList(VersionSpecifier.parse(effective.getSymbol() + comparison.getLiteral()));
    }

    @Nullable
    private static MarkerNode strip(@NotNull MarkerNode node, @NotNull MarkerVariable variable, boolean @NotNull[] modified) {
        if (node instanceof MarkerComparison) {
            if (((MarkerComparison) node).getVariable() == variable) {
                modified[0] = true;
                return null;
            }
            return node;
        }

        MarkerGroup group = (MarkerGroup) node;
        List<MarkerNode> operands = new ArrayList<>(group.getOperands());
        List<MarkerConnective> connectives = new ArrayList<>(group.getConnectives());
        for (int i = operands.size() - 1; i >= 0; i--) {
            MarkerNode stripped = MarkerAlgebra.strip(operands.get(i), variable, modified);
            if (stripped != null) {
                operands.set(i, stripped);
                continue;
            }
            operands.remove(i);
            // Remove the connective pointing at the removed operand
            if (i > 0) {
                connectives.remove(i - 1);
            } else if (!connectives.isEmpty()) {
                connectives.remove(0);
            }
        }

        if (operands.isEmpty()) {
            return null;
        } else if (operands.size() == 1 && operands.get(0) instanceof MarkerGroup) {
            return operands.get(0);
        }
        return new MarkerGroup(operands, connectives);
    }

    /**
     * Removes every comparison against the given variable from the marker, along with the connective
     * that joined it to its preceding operand (or to its following operand if it is the first operand
     * of its group). Groups which become empty are removed as well.
     *
     * <p>This is exact for clauses which are joined with "and" to the rest of the marker, as is the case
     * for the "extra" clauses of generated metadata. For "or"-joined clauses the remainder is merely
     * the marker without these clauses.
     *
     * @param marker The marker to strip, may be null
     * @param variable The variable whose comparisons should be removed
     * @return The remainder (null if nothing remains) and whether anything was removed
     */
    @NotNull
    @Contract(pure = true)
    public static StrippedMarker strip(@Nullable Marker marker, @NotNull MarkerVariable variable) {
        if (marker == null) {
            return new StrippedMarker(null, false);
        }
        boolean[] modified = new boolean[1];
        MarkerNode remainder = MarkerAlgebra.strip(marker.getRoot(), variable, modified);
        if (!modified[0]) {
            return new StrippedMarker(marker, false);
        }
        return new StrippedMarker(remainder == null ? null : Marker.of(remainder), true);
    }

    /**
     * Converts the python_version and python_full_version clauses of a marker into a specifier set,
     * treating "and" as intersection and "or" as union. Clauses on other variables are ignored.
     *
     * @param marker The marker
     * @return The specifier set ({@link SpecifierSet#ANY} if the interpreter version is unconstrained),
     * or null if the union of the clauses cannot be expressed as a specifier set
     */
    @Nullable
    @Contract(pure = true)
    public static SpecifierSet toSpecifierSet(@NotNull Marker marker) {
        List<VersionSpecifier> specifiers = MarkerAlgebra.specifiersOf(marker.getRoot());
        if (specifiers == null) {
            return null;
        }
        return SpecifierSet.of(specifiers);
    }
}

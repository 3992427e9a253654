package org.stianloader.picopip.marker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;
import org.stianloader.picopip.version.SpecifierSet;

/**
 * An environment marker, that is a boolean expression over {@link MarkerVariable environment variables}
 * deciding whether a requirement applies, for example {@code python_version >= '3.7' and os_name == 'nt'}.
 *
 * <p>Markers are immutable. The tree mirrors the structure of the source text, {@link #normalize()}
 * has to be called explicitly to expand "in" and "not in" comparisons.
 */
public final class Marker {

    @NotNull
    private final MarkerGroup root;

    private Marker(@NotNull MarkerGroup root) {
        this.root = root;
    }

    /**
     * Creates a python version marker from a specifier string. "*", "any" and the empty string
     * denote the absence of any constraint, in which case null is returned.
     *
     * @param specifier A specifier string, for example {@code ">=3.6,<4"} or {@code "3.7"}
     * @return The marker, or null
     */
    @Nullable
    public static Marker fromSpecifier(@NotNull String specifier) {
        String trimmed = specifier.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty() || trimmed.equals("*") || trimmed.equals("any") || trimmed.equals("<any>")) {
            return null;
        }
        SpecifierSet set;
        try {
            set = SpecifierSet.parse(specifier);
        } catch (RequirementParseException e) {
            throw new RequirementParseException(Kind.MALFORMED_MARKER, specifier, "Invalid python version specifier", e);
        }
        return MarkerAlgebra.fromSpecifiers(set.getSpecifiers());
    }

    /**
     * Wraps a node in a marker. Groups which consist of a single nested group are unwrapped.
     *
     * @param node The root node
     * @return The created marker
     */
    @NotNull
    @Contract(pure = true)
    public static Marker of(@NotNull MarkerNode node) {
        MarkerNode current = Objects.requireNonNull(node, "node may not be null");
        while (current instanceof MarkerGroup && ((MarkerGroup) current).getOperands().size() == 1) {
            MarkerNode inner = ((MarkerGroup) current).getOperands().get(0);
            if (!(inner instanceof MarkerGroup)) {
                break;
            }
            current = inner;
        }
        if (current instanceof MarkerGroup) {
            return new Marker((MarkerGroup) current);
        }
        return new Marker(MarkerGroup.join(List.of(current), MarkerConnective.AND));
    }

    /**
     * Parses a marker expression.
     *
     * @param marker The marker string
     * @return The parsed marker
     * @throws RequirementParseException with {@link Kind#MALFORMED_MARKER} on syntax errors, unknown
     * variables or unparsable version literals
     */
    @NotNull
    @Contract(pure = true)
    public static Marker parse(@NotNull String marker) {
        if (marker.isBlank()) {
            throw new RequirementParseException(Kind.MALFORMED_MARKER, marker, "Empty marker");
        }
        return Marker.of(MarkerParser.parse(marker));
    }

    @NotNull
    private static MarkerNode expandMembership(@NotNull MarkerNode node) {
        if (node instanceof MarkerGroup) {
            MarkerGroup group = (MarkerGroup) node;
            List<MarkerNode> operands = new ArrayList<>();
            for (MarkerNode operand : group.getOperands()) {
                operands.add(Marker.expandMembership(operand));
            }
            return new MarkerGroup(operands, group.getConnectives());
        }

        MarkerComparison comparison = (MarkerComparison) node;
        MarkerOperator op = comparison.getOperator();
        if ((op != MarkerOperator.IN && op != MarkerOperator.NOT_IN)
                || !comparison.getVariable().isVersion()
                || !comparison.isVariableOnLeft()) {
            return comparison;
        }

        MarkerOperator single = op == MarkerOperator.IN ? MarkerOperator.EQ : MarkerOperator.NE;
        MarkerConnective connective = op == MarkerOperator.IN ? MarkerConnective.OR : MarkerConnective.AND;
        List<MarkerNode> leaves = new ArrayList<>();
        for (String member : MarkerComparison.splitMembers(comparison.getLiteral())) {
            leaves.add(new MarkerComparison(comparison.getVariable(), single, member));
        }
        if (leaves.size() == 1) {
            return leaves.get(0);
        }
        return MarkerGroup.join(leaves, connective);
    }

    /**
     * Joins both markers with "and" without any further normalisation.
     * Use {@link MarkerAlgebra#merge(Marker, Marker)} for merging markers of different requirements.
     *
     * @param other The marker to join with
     * @return The conjunction of both markers
     */
    @NotNull
    @Contract(pure = true)
    public Marker and(@NotNull Marker other) {
        List<MarkerNode> operands = new ArrayList<>();
        operands.addAll(this.conjunctionOperands());
        operands.addAll(other.conjunctionOperands());
        return Marker.of(MarkerGroup.join(operands, MarkerConnective.AND));
    }

    /**
     * Obtains the operands which, when joined by "and", are equivalent to this marker.
     * This is the list of top level operands if the marker is a conjunction, or the whole
     * marker as a single parenthesised group otherwise.
     *
     * @return The conjunctive operands
     */
    @NotNull
    List<@NotNull MarkerNode> conjunctionOperands() {
        if (this.root.isConjunction()) {
            return this.root.getOperands();
        }
        return List.of(this.root);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Marker) {
            return ((Marker) obj).root.equals(this.root);
        }
        return false;
    }

    @Contract(pure = true)
    public boolean evaluate(@NotNull MarkerEnvironment environment) {
        return this.root.evaluate(environment);
    }

    @NotNull
    @Contract(pure = true)
    public MarkerGroup getRoot() {
        return this.root;
    }

    @Override
    public int hashCode() {
        return this.root.hashCode();
    }

    /**
     * Expands "in" and "not in" comparisons on version variables into explicit "or"-joined {@code ==}
     * and "and"-joined {@code !=} comparisons. Comparisons on string variables keep their substring semantics.
     *
     * @return The normalised marker
     */
    @NotNull
    @Contract(pure = true)
    public Marker normalize() {
        return Marker.of(Marker.expandMembership(this.root));
    }

    /**
     * Joins both markers with "or". Operands of top level disjunctions are flattened into the result
     * and a marker that is equal to an operand already present is not added a second time.
     *
     * @param other The marker to join with
     * @return The disjunction of both markers
     */
    @NotNull
    @Contract(pure = true)
    public Marker or(@NotNull Marker other) {
        List<MarkerNode> operands = new ArrayList<>();
        for (MarkerNode operand : this.disjunctionOperands()) {
            if (!operands.contains(operand)) {
                operands.add(operand);
            }
        }
        for (MarkerNode operand : other.disjunctionOperands()) {
            if (!operands.contains(operand)) {
                operands.add(operand);
            }
        }
        return Marker.of(MarkerGroup.join(operands, MarkerConnective.OR));
    }

    @NotNull
    private List<@NotNull MarkerNode> disjunctionOperands() {
        if (this.root.getOperands().size() == 1) {
            return this.root.getOperands();
        }
        for (MarkerConnective connective : this.root.getConnectives()) {
            if (connective != MarkerConnective.OR) {
                return List.of(this.root);
            }
        }
        return this.root.getOperands();
    }

    @Contract(pure = true)
    public boolean references(@NotNull MarkerVariable variable) {
        return this.root.references(variable);
    }

    @Override
    public String toString() {
        return this.root.toString();
    }
}

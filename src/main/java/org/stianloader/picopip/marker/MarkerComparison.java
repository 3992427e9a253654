package org.stianloader.picopip.marker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.VersionSpecifier;

/**
 * A leaf comparison of a marker, such as {@code python_version >= '3.7'}.
 *
 * <p>The orientation of the comparison is retained: {@code '3.7' <= python_version} is kept as written
 * and not flipped into {@code python_version >= '3.7'}.
 */
public final class MarkerComparison implements MarkerNode {

    @NotNull
    private final String literal;
    @NotNull
    private final MarkerOperator operator;
    @NotNull
    private final MarkerVariable variable;
    private final boolean variableOnLeft;

    public MarkerComparison(@NotNull MarkerVariable variable, @NotNull MarkerOperator operator, @NotNull String literal) {
        this(variable, operator, literal, true);
    }

    /**
     * Creates a new comparison, validating the literal against the operator and the variable.
     *
     * @param variable The environment variable
     * @param operator The comparison operator
     * @param literal The literal value, without quotes
     * @param variableOnLeft Whether the variable is written on the left hand side
     * @throws RequirementParseException with {@link Kind#MALFORMED_MARKER} if a version literal cannot be parsed
     * or if the operator is not applicable to the variable
     */
    public MarkerComparison(@NotNull MarkerVariable variable, @NotNull MarkerOperator operator, @NotNull String literal, boolean variableOnLeft) {
        this.variable = Objects.requireNonNull(variable, "variable may not be null");
        this.operator = Objects.requireNonNull(operator, "operator may not be null");
        this.literal = Objects.requireNonNull(literal, "literal may not be null");
        this.variableOnLeft = variableOnLeft;

        if ((operator == MarkerOperator.COMPATIBLE || operator == MarkerOperator.ARBITRARY) && !variable.isVersion()) {
            throw new RequirementParseException(Kind.MALFORMED_MARKER, this.toString(), "Operator " + operator + " is only applicable to version variables");
        }
        if (variable.isVersion() && variableOnLeft) {
            try {
                if (operator == MarkerOperator.IN || operator == MarkerOperator.NOT_IN) {
                    for (String member : MarkerComparison.splitMembers(literal)) {
                        PackageVersion.parse(member);
                    }
                } else {
                    VersionSpecifier.parse(operator.getSymbol() + literal);
                }
            } catch (RequirementParseException e) {
                throw new RequirementParseException(Kind.MALFORMED_MARKER, this.toString(), "Invalid version literal '" + literal + "'", e);
            }
        } else if (variable.isVersion() && operator.mirror() != null) {
            try {
                VersionSpecifier.parse(operator.mirror().getSymbol() + literal);
            } catch (RequirementParseException e) {
                throw new RequirementParseException(Kind.MALFORMED_MARKER, this.toString(), "Invalid version literal '" + literal + "'", e);
            }
        }
    }

    /**
     * Splits the literal of an "in" comparison into its members. Members are separated by commas,
     * or by whitespace if the literal contains no comma.
     *
     * @param literal The literal
     * @return The trimmed, non-empty members
     */
    @NotNull
    static List<@NotNull String> splitMembers(@NotNull String literal) {
        String[] parts = literal.indexOf(',') == -1 ? literal.trim().split("\\s+") : literal.split(",");
        List<String> members = new ArrayList<>();
        for (String part : parts) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                members.add(trimmed);
            }
        }
        return members;
    }

    @Override
    public void appendTo(@NotNull StringBuilder builder) {
        if (this.variableOnLeft) {
            builder.append(this.variable.getIdentifier()).append(' ').append(this.operator.getSymbol()).append(' ');
            MarkerComparison.appendQuoted(builder, this.literal);
        } else {
            MarkerComparison.appendQuoted(builder, this.literal);
            builder.append(' ').append(this.operator.getSymbol()).append(' ').append(this.variable.getIdentifier());
        }
    }

    private static void appendQuoted(@NotNull StringBuilder builder, @NotNull String literal) {
        char quote = literal.indexOf('\'') == -1 ? '\'' : '"';
        builder.append(quote).append(literal).append(quote);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MarkerComparison) {
            MarkerComparison other = (MarkerComparison) obj;
            return other.variable == this.variable
                    && other.operator == this.operator
                    && other.variableOnLeft == this.variableOnLeft
                    && other.literal.equals(this.literal);
        }
        return false;
    }

    @Override
    public boolean evaluate(@NotNull MarkerEnvironment environment) {
        if (this.variable == MarkerVariable.EXTRA) {
            return this.evaluateExtra(environment);
        }

        String value = environment.get(this.variable);
        if (this.operator == MarkerOperator.IN || this.operator == MarkerOperator.NOT_IN) {
            boolean contained;
            if (this.variableOnLeft && this.variable.isVersion()) {
                contained = this.containsVersion(value);
            } else if (this.variableOnLeft) {
                contained = this.literal.contains(value);
            } else {
                contained = value.contains(this.literal);
            }
            return contained == (this.operator == MarkerOperator.IN);
        }

        MarkerOperator op = this.variableOnLeft ? this.operator : Objects.requireNonNull(this.operator.mirror());
        if (this.variable.isVersion()) {
            PackageVersion version;
            try {
                version = PackageVersion.parse(value);
            } catch (RequirementParseException e) {
                // Non-numeric interpreter versions (such as "3.12.0rc1") fall back to plain string comparison
                return MarkerComparison.compareStrings(value, op, this.literal);
            }
            return VersionSpecifier.parse(op.getSymbol() + this.literal).contains(version);
        }
        return MarkerComparison.compareStrings(value, op, this.literal);
    }

    private static boolean compareStrings(@NotNull String value, @NotNull MarkerOperator op, @NotNull String literal) {
        int cmp = value.compareTo(literal);
        switch (op) {
        case EQ:
        case ARBITRARY:
            return cmp == 0;
        case NE:
            return cmp != 0;
        case LT:
            return cmp < 0;
        case LE:
            return cmp <= 0;
        case GT:
            return cmp > 0;
        case GE:
            return cmp >= 0;
        default:
            return false;
        }
    }

    private boolean containsVersion(@NotNull String value) {
        PackageVersion version;
        try {
            version = PackageVersion.parse(value);
        } catch (RequirementParseException e) {
            return MarkerComparison.splitMembers(this.literal).contains(value);
        }
        for (String member : MarkerComparison.splitMembers(this.literal)) {
            if (PackageVersion.parse(member).compareTo(version) == 0) {
                return true;
            }
        }
        return false;
    }

    private boolean evaluateExtra(@NotNull MarkerEnvironment environment) {
        String extra = MarkerEnvironment.normalizeExtra(this.literal);
        switch (this.operator) {
        case EQ:
        case IN:
            return environment.getExtras().contains(extra);
        case NE:
        case NOT_IN:
            return !environment.getExtras().contains(extra);
        default:
            return false;
        }
    }

    @NotNull
    @Contract(pure = true)
    public String getLiteral() {
        return this.literal;
    }

    @NotNull
    @Contract(pure = true)
    public MarkerOperator getOperator() {
        return this.operator;
    }

    @NotNull
    @Contract(pure = true)
    public MarkerVariable getVariable() {
        return this.variable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.variable, this.operator, this.literal, this.variableOnLeft);
    }

    @Contract(pure = true)
    public boolean isVariableOnLeft() {
        return this.variableOnLeft;
    }

    @Override
    public boolean references(@NotNull MarkerVariable variable) {
        return this.variable == variable;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        this.appendTo(builder);
        return builder.toString();
    }
}

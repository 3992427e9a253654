package org.stianloader.picopip.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;

/**
 * A single version constraint such as {@code >=1.0}.
 *
 * <p>Specifiers using the PEP 440 operators always carry exactly one version. The membership
 * operators {@link SpecifierOperator#IN} and {@link SpecifierOperator#NOT_IN} only appear as the
 * result of {@link SpecifierUtil#collapse(java.util.Collection, SpecifierJoin)} and carry one or more versions.
 */
public final class VersionSpecifier {

    @NotNull
    private final SpecifierOperator operator;

    @NotNull
    private final List<@NotNull PackageVersion> versions;

    public VersionSpecifier(@NotNull SpecifierOperator operator, @NotNull PackageVersion version) {
        this(operator, Collections.singletonList(version));
    }

    public VersionSpecifier(@NotNull SpecifierOperator operator, @NotNull List<@NotNull PackageVersion> versions) {
        this.operator = Objects.requireNonNull(operator, "operator may not be null");
        if (versions.isEmpty()) {
            throw new IllegalArgumentException("A specifier needs at least one version");
        }
        if (versions.size() != 1 && !operator.isMembership()) {
            throw new IllegalArgumentException("Operator " + operator + " accepts exactly one version, got " + versions);
        }
        for (PackageVersion version : versions) {
            if (version.isWildcard() && operator != SpecifierOperator.EQ && operator != SpecifierOperator.NE) {
                throw new IllegalArgumentException("Wildcard versions are only permitted for == and !=: " + operator + version);
            }
        }
        this.versions = Collections.unmodifiableList(new ArrayList<>(versions));
    }

    /**
     * Parses a single specifier. A bare version implies the {@link SpecifierOperator#EQ} operator.
     *
     * @param string The specifier string, for example {@code ">= 3.7"}
     * @return The parsed specifier
     * @throws RequirementParseException with {@link Kind#MALFORMED_SPECIFIER} if the string is no valid specifier
     */
    @NotNull
    @Contract(pure = true)
    public static VersionSpecifier parse(@NotNull String string) {
        String trimmed = string.trim();
        SpecifierOperator op = SpecifierOperator.matchPrefix(trimmed);
        String versionString;
        if (op == null) {
            op = SpecifierOperator.EQ;
            versionString = trimmed;
        } else {
            versionString = trimmed.substring(op.getSymbol().length()).trim();
        }

        PackageVersion version;
        try {
            version = PackageVersion.parse(versionString);
        } catch (RequirementParseException e) {
            throw new RequirementParseException(Kind.MALFORMED_SPECIFIER, string, "Invalid version in specifier", e);
        }

        if (version.isWildcard() && op != SpecifierOperator.EQ && op != SpecifierOperator.NE) {
            throw new RequirementParseException(Kind.MALFORMED_SPECIFIER, string, "Wildcards are only permitted for == and !=");
        }
        if (op == SpecifierOperator.COMPATIBLE && version.getSegmentCount() < 2) {
            throw new RequirementParseException(Kind.MALFORMED_SPECIFIER, string, "~= needs a version with at least two segments");
        }
        return new VersionSpecifier(op, version);
    }

    @Contract(pure = true)
    public boolean contains(@NotNull PackageVersion candidate) {
        PackageVersion version = this.versions.get(0);
        switch (this.operator) {
        case EQ:
            return VersionSpecifier.matchesExactly(version, candidate);
        case NE:
            return !VersionSpecifier.matchesExactly(version, candidate);
        case LT:
            return version.isNewerThan(candidate);
        case LE:
            return !candidate.isNewerThan(version);
        case GT:
            return candidate.isNewerThan(version);
        case GE:
            return !version.isNewerThan(candidate);
        case COMPATIBLE:
            return !version.isNewerThan(candidate) && version.truncate(1).isPrefixOf(candidate);
        case ARBITRARY:
            return version.getOriginText().equals(candidate.getOriginText());
        case IN:
            for (PackageVersion member : this.versions) {
                if (VersionSpecifier.matchesExactly(member, candidate)) {
                    return true;
                }
            }
            return false;
        case NOT_IN:
            for (PackageVersion member : this.versions) {
                if (VersionSpecifier.matchesExactly(member, candidate)) {
                    return false;
                }
            }
            return true;
        default:
            throw new IllegalStateException("Unknown operator: " + this.operator);
        }
    }

    private static boolean matchesExactly(@NotNull PackageVersion expected, @NotNull PackageVersion candidate) {
        if (expected.isWildcard()) {
            return expected.isPrefixOf(candidate);
        }
        return expected.compareTo(candidate) == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionSpecifier) {
            VersionSpecifier other = (VersionSpecifier) obj;
            return other.operator == this.operator && other.versions.equals(this.versions);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public SpecifierOperator getOperator() {
        return this.operator;
    }

    /**
     * Obtains the first (and for non-membership operators the only) version of this specifier.
     *
     * @return The version
     */
    @NotNull
    @Contract(pure = true)
    public PackageVersion getVersion() {
        return this.versions.get(0);
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull PackageVersion> getVersions() {
        return this.versions;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.operator, this.versions);
    }

    /**
     * Obtains the versions as a comma-separated string, for example "3.6, 3.7".
     * This is the literal form used by the "in" and "not in" marker operators.
     *
     * @return The joined versions
     */
    @NotNull
    public String joinVersions() {
        StringBuilder builder = new StringBuilder();
        for (PackageVersion version : this.versions) {
            if (builder.length() != 0) {
                builder.append(", ");
            }
            builder.append(version.getOriginText());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        if (this.operator.isMembership()) {
            return this.operator.getSymbol() + ' ' + this.joinVersions();
        }
        return this.operator.getSymbol() + this.versions.get(0).getOriginText();
    }
}

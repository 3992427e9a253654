package org.stianloader.picopip.resolver;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.requirement.Requirement;

/**
 * A root of a resolution: a requirement line, a parsed requirement or an abstract dependency.
 */
public sealed interface RequirementInput {

    public static record Abstract(@NotNull AbstractDependency dependency) implements RequirementInput {
        public Abstract {
            Objects.requireNonNull(dependency, "dependency may not be null");
        }
    }

    public static record Line(@NotNull String line) implements RequirementInput {
        public Line {
            Objects.requireNonNull(line, "line may not be null");
        }
    }

    public static record Parsed(@NotNull Requirement requirement) implements RequirementInput {
        public Parsed {
            Objects.requireNonNull(requirement, "requirement may not be null");
        }
    }

    @NotNull
    public static RequirementInput of(@NotNull AbstractDependency dependency) {
        return new Abstract(dependency);
    }

    @NotNull
    public static RequirementInput of(@NotNull Requirement requirement) {
        return new Parsed(requirement);
    }

    @NotNull
    public static RequirementInput of(@NotNull String line) {
        return new Line(line);
    }
}

package org.stianloader.picopip.resolver;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a set of requirements cannot be resolved. Conflicts name the package and the two
 * constraints that could not be intersected.
 */
public class ResolutionException extends Exception {

    public enum Reason {
        /**
         * The constraints on a package exclude every available version.
         */
        CONFLICT,
        /**
         * The pins did not settle within the configured number of rounds.
         */
        NO_CONVERGENCE;
    }

    private static final long serialVersionUID = -1390745113296502277L;

    @Nullable
    private final String conflictingConstraint;
    @Nullable
    private final String existingConstraint;
    @Nullable
    private final String packageName;
    @NotNull
    private final Reason reason;

    private ResolutionException(@NotNull Reason reason, @NotNull String message, @Nullable String packageName,
            @Nullable String existingConstraint, @Nullable String conflictingConstraint) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason may not be null");
        this.packageName = packageName;
        this.existingConstraint = existingConstraint;
        this.conflictingConstraint = conflictingConstraint;
    }

    @NotNull
    public static ResolutionException conflict(@NotNull String packageName, @NotNull String existingConstraint, @NotNull String conflictingConstraint) {
        return new ResolutionException(Reason.CONFLICT, "Unable to resolve " + packageName + ": '" + existingConstraint
                + "' is incompatible with '" + conflictingConstraint + "'", packageName, existingConstraint, conflictingConstraint);
    }

    @NotNull
    public static ResolutionException noConvergence(int rounds) {
        return new ResolutionException(Reason.NO_CONVERGENCE, "Pins did not settle after " + rounds + " rounds", null, null, null);
    }

    /**
     * Obtains the constraint that was added last and could not be intersected with {@link #getExistingConstraint()}.
     * For packages without any available candidate, this describes why the candidates were rejected.
     *
     * @return The conflicting constraint, null for {@link Reason#NO_CONVERGENCE}
     */
    @Nullable
    public String getConflictingConstraint() {
        return this.conflictingConstraint;
    }

    @Nullable
    public String getExistingConstraint() {
        return this.existingConstraint;
    }

    /**
     * Obtains the normalised name of the package that could not be resolved.
     *
     * @return The package name, null for {@link Reason#NO_CONVERGENCE}
     */
    @Nullable
    public String getPackageName() {
        return this.packageName;
    }

    @NotNull
    public Reason getReason() {
        return this.reason;
    }
}

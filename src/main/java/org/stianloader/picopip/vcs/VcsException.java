package org.stianloader.picopip.vcs;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown by a {@link VcsGateway} when a VCS operation fails. Gateways never retry, callers may retry
 * operations that failed with {@link Reason#UNREACHABLE}.
 */
public class VcsException extends Exception {

    public enum Reason {
        /**
         * The working tree is not a valid checkout or is in a state the VCS cannot work with.
         */
        CORRUPT,
        /**
         * The requested branch, tag or revision does not exist.
         */
        INVALID_REF,
        /**
         * The repository could not be contacted, or the VCS executable could not be run.
         */
        UNREACHABLE;
    }

    private static final long serialVersionUID = 4658101267356622089L;

    @NotNull
    private final Reason reason;

    public VcsException(@NotNull Reason reason, @NotNull String message) {
        this(reason, message, null);
    }

    public VcsException(@NotNull Reason reason, @NotNull String message, @Nullable Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = Objects.requireNonNull(reason, "reason may not be null");
    }

    @NotNull
    public Reason getReason() {
        return this.reason;
    }
}

package org.stianloader.picopip.internal;

import java.util.concurrent.CompletionException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when several futures that were joined together all failed. The individual failures are
 * attached as {@link #getSuppressed() suppressed} exceptions.
 */
public class MultiCompletionException extends CompletionException {

    private static final long serialVersionUID = 2781533245076164210L;

    public MultiCompletionException(@NotNull String message, @Nullable Throwable @NotNull[] causes) {
        super(message);
        for (Throwable t : causes) {
            if (t == null) {
                continue;
            }
            this.addSuppressed(t);
        }
    }
}

package org.stianloader.picopip.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link CompletableFuture} that waits for all of its sources, tolerating failures.
 * It completes normally with the results of the sources that completed normally, in source order,
 * unless every source failed. In that case it completes exceptionally with a {@link MultiCompletionException}.
 * A future without sources completes immediately with an empty list.
 *
 * <p>Sources must not complete with null.
 */
public class StronglyMultiCompletableFuture<T> extends CompletableFuture<List<T>> {

    private final Throwable[] exceptions;
    private final Object[] results;
    private int failures;
    private int pending;

    public StronglyMultiCompletableFuture(@NotNull List<@NotNull CompletableFuture<T>> sources) {
        this.exceptions = new Throwable[sources.size()];
        this.results = new Object[sources.size()];
        this.pending = sources.size();
        if (sources.isEmpty()) {
            this.complete(new ArrayList<>());
            return;
        }
        for (int i = 0; i < sources.size(); i++) {
            final int sourceIndex = i;
            sources.get(i).whenComplete((result, ex) -> {
                if (ex == null) {
                    this.sourceCompleted(sourceIndex, result);
                } else {
                    this.sourceFailed(sourceIndex, ex);
                }
            });
        }
    }

    private void finishIfDone() {
        if (--this.pending != 0) {
            return;
        }
        if (this.failures == this.exceptions.length) {
            this.completeExceptionally(new MultiCompletionException("All " + this.failures + " sources failed", this.exceptions));
            return;
        }
        List<T> collected = new ArrayList<>();
        for (Object result : this.results) {
            if (result != null) {
                @SuppressWarnings("unchecked")
                T value = (T) result;
                collected.add(value);
            }
        }
        this.complete(collected);
    }

    /**
     * Obtains the failures of the sources that completed exceptionally so far.
     *
     * @return The failures, in source order
     */
    @NotNull
    public synchronized List<@NotNull Throwable> getFailures() {
        List<Throwable> failures = new ArrayList<>();
        for (Throwable t : this.exceptions) {
            if (t != null) {
                failures.add(t);
            }
        }
        return failures;
    }

    private synchronized void sourceCompleted(int index, T result) {
        this.results[index] = Objects.requireNonNull(result, "Source futures may not complete with null");
        this.finishIfDone();
    }

    private synchronized void sourceFailed(int index, @NotNull Throwable exception) {
        this.exceptions[index] = exception;
        this.failures++;
        this.finishIfDone();
    }
}

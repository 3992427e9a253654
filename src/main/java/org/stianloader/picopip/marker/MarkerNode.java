package org.stianloader.picopip.marker;

import org.jetbrains.annotations.NotNull;

/**
 * A node of the marker expression tree, either a {@link MarkerComparison leaf}
 * or a {@link MarkerGroup sequence of nodes joined by connectives}.
 */
public sealed interface MarkerNode permits MarkerComparison, MarkerGroup {

    void appendTo(@NotNull StringBuilder builder);

    boolean evaluate(@NotNull MarkerEnvironment environment);

    /**
     * Checks whether this node or any of its children compares against the given variable.
     *
     * @param variable The variable
     * @return True if the variable is referenced
     */
    boolean references(@NotNull MarkerVariable variable);
}

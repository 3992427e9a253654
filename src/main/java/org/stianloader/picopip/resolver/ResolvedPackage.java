package org.stianloader.picopip.resolver;

import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.requirement.Requirement;

/**
 * A package of a {@link ResolvedSet}.
 *
 * @param requirement The pinned requirement, carrying the collected hashes
 * @param hashes The hashes of all artifacts of the pinned version, empty for editable, file and VCS requirements
 */
public record ResolvedPackage(@NotNull Requirement requirement, @NotNull Set<@NotNull String> hashes) {
}

package org.stianloader.picopip.requirement;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The metadata read from a local project or an archive, used to name requirements that were
 * declared without a name.
 *
 * @param name The name declared by the project
 * @param version The version declared by the project, if known
 */
public record PackageMetadata(@NotNull String name, @Nullable String version) {
}

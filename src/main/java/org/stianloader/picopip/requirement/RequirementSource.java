package org.stianloader.picopip.requirement;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Where an installable comes from: a package index, a file or URL, or a VCS repository.
 */
public sealed interface RequirementSource permits NamedSource, FileSource, VcsSource {

    boolean editable();

    @NotNull
    RequirementKind kind();

    /**
     * Obtains the name of the package, which can only be absent for {@link FileSource file sources}
     * that were not named yet.
     *
     * @return The package name or null
     */
    @Nullable
    PackageName name();

    /**
     * Returns a copy of this source that carries the given name.
     *
     * @param name The new name
     * @return The named source
     */
    @NotNull
    RequirementSource withName(@NotNull PackageName name);
}

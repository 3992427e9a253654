package org.stianloader.picopip.requirement;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.line.ParsedUri;

/**
 * A project hosted in a version control repository. The URI keeps its "vcs+" scheme prefix but never
 * carries the ref, the name, the extras or the subdirectory.
 *
 * @param name The name of the package
 * @param vcs The version control system
 * @param uri The repository URL
 * @param ref The branch, tag or revision to check out, null for the default branch
 * @param editable Whether the checkout is installed in editable (development) mode
 * @param subdirectory The directory of the repository that contains the project
 */
public record VcsSource(@NotNull PackageName name, @NotNull VcsType vcs, @NotNull ParsedUri uri, @Nullable String ref, boolean editable,
        @Nullable String subdirectory) implements RequirementSource {

    public VcsSource {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(vcs, "vcs may not be null");
        if (uri.getVcs() != vcs) {
            throw new IllegalArgumentException("The scheme of " + uri + " does not belong to " + vcs);
        }
        if (uri.getRef() != null || uri.getName() != null || uri.getSubdirectory() != null || !uri.getExtras().isEmpty()) {
            throw new IllegalArgumentException("The uri may not carry requirement parts, got " + uri);
        }
    }

    @Override
    @NotNull
    public RequirementKind kind() {
        return RequirementKind.VCS;
    }

    /**
     * Obtains the repository URL as understood by the VCS itself, that is without the "vcs+" prefix
     * and with the credentials in place.
     *
     * @return The URL to clone from
     */
    @NotNull
    public String repositoryUrl() {
        String full = this.uri.getFullUrl();
        String prefix = this.vcs.getKey() + "+";
        if (full.startsWith(prefix)) {
            return full.substring(prefix.length());
        }
        return full;
    }

    @NotNull
    public VcsSource withRef(@Nullable String ref) {
        return new VcsSource(this.name, this.vcs, this.uri, ref, this.editable, this.subdirectory);
    }

    @Override
    @NotNull
    public VcsSource withName(@NotNull PackageName name) {
        return new VcsSource(name, this.vcs, this.uri, this.ref, this.editable, this.subdirectory);
    }
}

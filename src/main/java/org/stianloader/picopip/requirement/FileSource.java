package org.stianloader.picopip.requirement;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.line.ParsedUri;

/**
 * A local path or a remote URL pointing at a project directory, a source distribution or a wheel.
 * Exactly one of {@link #path()} and {@link #uri()} is set. The URI never carries the name, extras or
 * subdirectory; those are held by the requirement and by this record respectively.
 *
 * @param name The name of the package, null until it was declared or read from the package metadata
 * @param path The local path
 * @param uri The URL
 * @param editable Whether the project is installed in editable (development) mode
 * @param subdirectory The directory within the archive or the URL that contains the project
 */
public record FileSource(@Nullable PackageName name, @Nullable String path, @Nullable ParsedUri uri, boolean editable,
        @Nullable String subdirectory) implements RequirementSource {

    public FileSource {
        if ((path == null) == (uri == null)) {
            throw new IllegalArgumentException("Exactly one of path and uri must be set");
        }
        if (uri != null && (uri.getName() != null || !uri.getExtras().isEmpty() || uri.getSubdirectory() != null)) {
            throw new IllegalArgumentException("The uri may not carry requirement parts, got " + uri);
        }
    }

    @Override
    @NotNull
    public RequirementKind kind() {
        return RequirementKind.FILE;
    }

    /**
     * Obtains the path, or the URL written with its password.
     *
     * @return The location
     */
    @NotNull
    public String location() {
        ParsedUri uri = this.uri;
        if (uri != null) {
            return uri.toString(ParsedUri.Format.SHOW_PASSWORD, ParsedUri.Format.INDIRECT);
        }
        return Objects.requireNonNull(this.path, "path and uri are both absent");
    }

    @Override
    @NotNull
    public FileSource withName(@NotNull PackageName name) {
        return new FileSource(name, this.path, this.uri, this.editable, this.subdirectory);
    }
}

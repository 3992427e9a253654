package org.stianloader.picopip.line;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.version.SpecifierSet;

/**
 * The components of a requirement line as split by {@link LineParser}.
 * Exactly one of {@link #name()} (with {@link #specifiers()}), {@link #uri()} or {@link #path()}
 * describes the installable, though a URI may carry a name on its own.
 *
 * @param line The line as it was passed to the parser
 * @param editable Whether the line was prefixed by "-e"
 * @param name The package name of a named requirement, null for URL and path requirements
 * @param specifiers The version specifiers of a named requirement, null for URL and path requirements
 * @param uri The parsed URI of a URL, direct URL or VCS requirement
 * @param path The local path of a path requirement
 * @param extras The canonical extras, from the name, the path or the URI fragment
 * @param markers The environment marker, if any
 * @param hashes The values of the "--hash=" options, in their order of occurrence
 */
public record RequirementLine(@NotNull String line, boolean editable, @Nullable String name, @Nullable SpecifierSet specifiers,
        @Nullable ParsedUri uri, @Nullable String path, @NotNull List<@NotNull String> extras, @Nullable Marker markers,
        @NotNull List<@NotNull String> hashes) {

    @Nullable
    public VcsType vcs() {
        return this.uri == null ? null : this.uri.getVcs();
    }
}

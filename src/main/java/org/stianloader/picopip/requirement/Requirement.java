package org.stianloader.picopip.requirement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.line.Extras;
import org.stianloader.picopip.line.LineParser;
import org.stianloader.picopip.line.ParsedUri;
import org.stianloader.picopip.line.RequirementLine;
import org.stianloader.picopip.marker.Marker;
import org.stianloader.picopip.marker.MarkerAlgebra;
import org.stianloader.picopip.marker.MarkerVariable;
import org.stianloader.picopip.version.PackageVersion;
import org.stianloader.picopip.version.SpecifierSet;

/**
 * A single requirement: the {@link RequirementSource source} of an installable along with the extras
 * that should be installed with it, the environment marker under which it applies, the hashes its
 * artifacts must match and the name of the index it should be fetched from.
 *
 * <p>Requirements are immutable. They are converted from and to three textual forms: pip requirement lines
 * ({@link #fromLine(String)}, {@link #toLine()}), manifest entries ({@link #fromManifest(ManifestRecord)},
 * {@link #toManifest()}) and lockfile entries ({@link #fromLockEntry(ManifestRecord)}, {@link #toLockEntry()}).
 * Converting a requirement to any of these forms and back yields an equal requirement.
 */
public final class Requirement {

    private static final String KEY_EDITABLE = "editable";
    private static final String KEY_EXTRAS = "extras";
    private static final String KEY_FILE = "file";
    private static final String KEY_HASHES = "hashes";
    private static final String KEY_INDEX = "index";
    private static final String KEY_MARKERS = "markers";
    private static final String KEY_PATH = "path";
    private static final String KEY_REF = "ref";
    private static final String KEY_SUBDIRECTORY = "subdirectory";
    private static final String KEY_URI = "uri";
    private static final String KEY_VERSION = "version";

    @NotNull
    private final List<@NotNull String> extras;
    @NotNull
    private final List<@NotNull String> hashes;
    @Nullable
    private final String index;
    @Nullable
    private final Marker markers;
    @NotNull
    private final RequirementSource source;

    private Requirement(@NotNull RequirementSource source, @NotNull Collection<@NotNull String> extras, @Nullable Marker markers,
            @NotNull Collection<@NotNull String> hashes, @Nullable String index) {
        this.source = Objects.requireNonNull(source, "source may not be null");
        this.extras = Extras.canonicalize(extras);
        this.markers = markers;
        if (source.editable()) {
            // Hashes of a mutable checkout are meaningless
            this.hashes = Collections.emptyList();
        } else {
            this.hashes = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(hashes)));
        }
        this.index = index;
    }

    /**
     * Parses a requirement from a lockfile entry. Unlike manifest entries, lockfile entries are always tables
     * and are always pinned: named requirements need an exact version and VCS requirements need a ref.
     *
     * @param entry The lockfile entry
     * @return The parsed requirement
     * @throws RequirementParseException with {@link Kind#INVALID_MANIFEST} if the entry is not a pinned table
     */
    @NotNull
    @Contract(pure = true)
    public static Requirement fromLockEntry(@NotNull ManifestRecord entry) {
        if (!(entry.value() instanceof Map)) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, entry.name(), "Lockfile entries must be tables");
        }
        Requirement requirement = Requirement.fromManifest(entry);
        if (!requirement.isPinned() && requirement.getKind() != RequirementKind.FILE) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, entry.name(), "Lockfile entry is not pinned");
        }
        return requirement;
    }

    /**
     * Parses a pip requirement line.
     *
     * @param line The requirement line, for example {@code requests[security]>=2.20,<3; python_version >= '3.7'}
     * @return The parsed requirement
     * @throws RequirementParseException if the line is malformed. VCS requirements without an egg fragment
     * fail with {@link Kind#MISSING_EGG_FRAGMENT}, editable requirements that are not a path or URL fail with
     * {@link Kind#UNPARSABLE_REQUIREMENT}.
     */
    @NotNull
    @Contract(pure = true)
    public static Requirement fromLine(@NotNull String line) {
        RequirementLine parsed = LineParser.parse(line);
        RequirementSource source;
        ParsedUri uri = parsed.uri();
        String path = parsed.path();
        if (uri != null) {
            VcsType vcs = uri.getVcs();
            if (vcs != null) {
                String egg = uri.getName();
                if (egg == null) {
                    throw new RequirementParseException(Kind.MISSING_EGG_FRAGMENT, line, "VCS requirements need an #egg=<name> fragment");
                }
                source = new VcsSource(PackageName.of(egg), vcs, uri.withoutRequirementParts(), uri.getRef(), parsed.editable(), uri.getSubdirectory());
            } else {
                PackageName name = uri.getName() == null ? PackageName.fromDistributionFileName(uri.getFileName()) : PackageName.of(uri.getName());
                source = new FileSource(name, null, uri.withoutRequirementParts().withRef(uri.getRef()), parsed.editable(), uri.getSubdirectory());
            }
        } else if (path != null) {
            String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
            source = new FileSource(PackageName.fromDistributionFileName(fileName), path, null, parsed.editable(), null);
        } else {
            if (parsed.editable()) {
                throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, line, "Only paths and URLs can be editable");
            }
            String name = Objects.requireNonNull(parsed.name(), "name");
            SpecifierSet specifiers = Objects.requireNonNull(parsed.specifiers(), "specifiers");
            source = new NamedSource(PackageName.of(name), specifiers);
        }
        return new Requirement(source, parsed.extras(), parsed.markers(), parsed.hashes(), null);
    }

    /**
     * Parses a manifest entry. The value is either a specifier string ({@code "*"}, {@code ">=1.0"})
     * or a table with the keys {@code version, extras, markers, editable, path, file, uri, git, hg, svn, bzr,
     * ref, subdirectory, index, hashes}. Marker variables may be used as keys as well, their values being
     * the remainder of a comparison ({@code os_name = "== 'nt'"}). They are joined with the "markers" value.
     *
     * @param record The manifest entry
     * @return The parsed requirement
     * @throws RequirementParseException with {@link Kind#INVALID_MANIFEST} if the entry has unknown keys, keys of the
     * wrong type or more than one source. Malformed specifiers, markers or URIs fail with their respective kind.
     */
    @NotNull
    @Contract(pure = true)
    public static Requirement fromManifest(@NotNull ManifestRecord record) {
        PackageName name = PackageName.of(record.name());
        Object value = record.value();
        if (value instanceof String) {
            return new Requirement(new NamedSource(name, SpecifierSet.parse((String) value)), Collections.emptyList(), null, Collections.emptyList(), null);
        } else if (!(value instanceof Map)) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "Expected a string or a table, got " + value.getClass().getSimpleName());
        }

        Map<String, Object> table = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getKey() instanceof String) || entry.getValue() == null) {
                throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "Invalid entry " + entry);
            }
            table.put((String) entry.getKey(), entry.getValue());
        }

        String version = Requirement.optString(record, table, Requirement.KEY_VERSION);
        String ref = Requirement.optString(record, table, Requirement.KEY_REF);
        String subdirectory = Requirement.optString(record, table, Requirement.KEY_SUBDIRECTORY);
        String index = Requirement.optString(record, table, Requirement.KEY_INDEX);
        String path = Requirement.optString(record, table, Requirement.KEY_PATH);
        String file = Requirement.optString(record, table, Requirement.KEY_FILE);
        String uri = Requirement.optString(record, table, Requirement.KEY_URI);
        List<String> extras = Requirement.optStringList(record, table, Requirement.KEY_EXTRAS);
        List<String> hashes = Requirement.optStringList(record, table, Requirement.KEY_HASHES);
        boolean editable = false;
        Object editableValue = table.remove(Requirement.KEY_EDITABLE);
        if (editableValue instanceof Boolean) {
            editable = (Boolean) editableValue;
        } else if (editableValue != null) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'editable' must be a boolean");
        }

        Marker markers = null;
        String markerString = Requirement.optString(record, table, Requirement.KEY_MARKERS);
        if (markerString != null && !markerString.isBlank()) {
            markers = Marker.parse(markerString);
        }
        // Shorthand marker keys are applied in alphabetical order
        Map<String, String> shorthands = new TreeMap<>();
        for (MarkerVariable variable : MarkerVariable.values()) {
            if (variable == MarkerVariable.EXTRA) {
                continue;
            }
            String comparison = Requirement.optString(record, table, variable.getIdentifier());
            if (comparison != null) {
                shorthands.put(variable.getIdentifier(), comparison);
            }
        }
        for (Map.Entry<String, String> shorthand : shorthands.entrySet()) {
            Marker clause = Marker.parse(shorthand.getKey() + " " + shorthand.getValue());
            markers = markers == null ? clause : markers.and(clause);
        }

        VcsType vcs = null;
        String vcsUrl = null;
        for (VcsType type : VcsType.values()) {
            String url = Requirement.optString(record, table, type.getKey());
            if (url != null) {
                if (vcs != null) {
                    throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "Both " + vcs + " and " + type + " are declared");
                }
                vcs = type;
                vcsUrl = url;
            }
        }

        if (!table.isEmpty()) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "Unknown keys " + table.keySet());
        }

        int sourceCount = (vcs == null ? 0 : 1) + (path == null ? 0 : 1) + (file == null ? 0 : 1) + (uri == null ? 0 : 1);
        if (sourceCount > 1) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "More than one of path, file, uri and the VCS keys are declared");
        }
        if (ref != null && vcs == null) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'ref' is only valid for VCS requirements");
        }
        if (sourceCount != 0 && version != null && !SpecifierSet.parse(version).isAny()) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'version' is only valid for named requirements");
        }

        RequirementSource source;
        if (vcs != null) {
            String prefixed = vcsUrl.startsWith(vcs.getKey() + "+") ? vcsUrl : vcs.getKey() + "+" + vcsUrl;
            ParsedUri parsed = ParsedUri.parse(prefixed);
            String effectiveRef = ref == null ? parsed.getRef() : ref;
            String effectiveSubdirectory = subdirectory == null ? parsed.getSubdirectory() : subdirectory;
            source = new VcsSource(name, vcs, parsed.withoutRequirementParts(), effectiveRef, editable, effectiveSubdirectory);
        } else if (path != null) {
            source = new FileSource(name, path, null, editable, subdirectory);
        } else if (file != null || uri != null) {
            ParsedUri parsed = ParsedUri.parse(file == null ? uri : file);
            String effectiveSubdirectory = subdirectory == null ? parsed.getSubdirectory() : subdirectory;
            source = new FileSource(name, null, parsed.withoutRequirementParts().withRef(parsed.getRef()), editable, effectiveSubdirectory);
        } else {
            if (editable) {
                throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "Only path, file and VCS requirements can be editable");
            }
            if (subdirectory != null) {
                throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'subdirectory' is not valid for named requirements");
            }
            source = new NamedSource(name, SpecifierSet.parse(version == null ? "*" : version));
        }
        return new Requirement(source, extras, markers, hashes, index);
    }

    /**
     * Creates a requirement without extras, markers, hashes or index.
     *
     * @param source The source of the requirement
     * @return The created requirement
     */
    @NotNull
    @Contract(pure = true)
    public static Requirement of(@NotNull RequirementSource source) {
        return new Requirement(source, Collections.emptyList(), null, Collections.emptyList(), null);
    }

    @Nullable
    private static String optString(@NotNull ManifestRecord record, @NotNull Map<String, Object> table, @NotNull String key) {
        Object value = table.remove(key);
        if (value == null) {
            return null;
        } else if (!(value instanceof String)) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'" + key + "' must be a string, got " + value.getClass().getSimpleName());
        }
        return (String) value;
    }

    @NotNull
    private static List<@NotNull String> optStringList(@NotNull ManifestRecord record, @NotNull Map<String, Object> table, @NotNull String key) {
        Object value = table.remove(key);
        if (value == null) {
            return Collections.emptyList();
        } else if (!(value instanceof List)) {
            throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'" + key + "' must be a list, got " + value.getClass().getSimpleName());
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (!(element instanceof String)) {
                throw new RequirementParseException(Kind.INVALID_MANIFEST, record.name(), "'" + key + "' may only contain strings");
            }
            strings.add((String) element);
        }
        return strings;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Requirement) {
            Requirement other = (Requirement) obj;
            return other.source.equals(this.source)
                    && other.extras.equals(this.extras)
                    && Objects.equals(other.markers, this.markers)
                    && other.hashes.equals(this.hashes)
                    && Objects.equals(other.index, this.index);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getExtras() {
        return this.extras;
    }

    /**
     * Obtains the hashes the artifacts of this requirement must match, sorted and without duplicates.
     * Editable requirements never have hashes.
     *
     * @return The hashes
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getHashes() {
        return this.hashes;
    }

    @Nullable
    @Contract(pure = true)
    public String getIndex() {
        return this.index;
    }

    @NotNull
    @Contract(pure = true)
    public RequirementKind getKind() {
        return this.source.kind();
    }

    @Nullable
    @Contract(pure = true)
    public Marker getMarkers() {
        return this.markers;
    }

    @Nullable
    @Contract(pure = true)
    public PackageName getName() {
        return this.source.name();
    }

    /**
     * Obtains the version a named requirement is pinned to.
     *
     * @return The pinned version, or null if the requirement is not a pinned named requirement
     */
    @Nullable
    @Contract(pure = true)
    public PackageVersion getPinnedVersion() {
        if (this.source instanceof NamedSource) {
            return ((NamedSource) this.source).specifiers().getPinnedVersion();
        }
        return null;
    }

    @NotNull
    @Contract(pure = true)
    public RequirementSource getSource() {
        return this.source;
    }

    /**
     * Obtains the version specifiers. Only named requirements can have specifiers,
     * for all other requirements {@link SpecifierSet#ANY} is returned.
     *
     * @return The specifiers
     */
    @NotNull
    @Contract(pure = true)
    public SpecifierSet getSpecifiers() {
        if (this.source instanceof NamedSource) {
            return ((NamedSource) this.source).specifiers();
        }
        return SpecifierSet.ANY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.source, this.extras, this.markers, this.hashes, this.index);
    }

    public boolean isEditable() {
        return this.source.editable();
    }

    /**
     * Checks whether the requirement pins a single installable: a named requirement with an exact version or
     * a VCS requirement with a ref. File requirements are never considered pinned.
     *
     * @return True if pinned
     */
    @Contract(pure = true)
    public boolean isPinned() {
        switch (this.source.kind()) {
        case NAMED:
            return ((NamedSource) this.source).specifiers().isPinned();
        case VCS:
            return ((VcsSource) this.source).ref() != null;
        case FILE:
            return false;
        default:
            throw new IncompatibleClassChangeError("Unknown kind " + this.source.kind());
        }
    }

    /**
     * Merges the given marker into the marker of this requirement.
     *
     * @param marker The marker to merge, may be null
     * @return A requirement with the merged marker
     * @see MarkerAlgebra#merge(Marker, Marker)
     */
    @NotNull
    @Contract(pure = true)
    public Requirement mergeMarkers(@Nullable Marker marker) {
        return this.withMarkers(MarkerAlgebra.merge(this.markers, marker));
    }

    /**
     * Names a requirement whose name could not be determined from its declaration, using the metadata
     * of the local project or archive. A requirement can only be named once.
     *
     * @param metadata The metadata of the project
     * @return The named requirement
     * @throws IllegalStateException If the requirement already has a name
     */
    @NotNull
    @Contract(pure = true)
    public Requirement resolveName(@NotNull PackageMetadata metadata) {
        if (this.source.name() != null) {
            throw new IllegalStateException("Requirement " + this + " is already named");
        }
        return new Requirement(this.source.withName(PackageName.of(metadata.name())), this.extras, this.markers, this.hashes, this.index);
    }

    @NotNull
    private String line(boolean showPassword) {
        StringBuilder builder = new StringBuilder();
        if (this.source.editable()) {
            builder.append("-e ");
        }
        ParsedUri.Format[] format = showPassword ? new ParsedUri.Format[] {ParsedUri.Format.SHOW_PASSWORD} : new ParsedUri.Format[0];
        switch (this.source.kind()) {
        case NAMED: {
            NamedSource named = (NamedSource) this.source;
            builder.append(named.name().getDisplayName()).append(Extras.toString(this.extras)).append(named.specifiers());
            break;
        }
        case FILE: {
            FileSource file = (FileSource) this.source;
            ParsedUri uri = file.uri();
            if (uri == null) {
                builder.append(file.path()).append(Extras.toString(this.extras));
            } else {
                PackageName name = file.name();
                if (name == null) {
                    builder.append(uri.withSubdirectory(file.subdirectory()).toString(format)).append(Extras.toString(this.extras));
                } else {
                    // Named URLs are always written in the "name @ url" form
                    builder.append(uri.withName(name.getDisplayName())
                            .withExtras(this.extras)
                            .withSubdirectory(file.subdirectory())
                            .withDirectUrl(true)
                            .toString(format));
                }
            }
            break;
        }
        case VCS: {
            VcsSource vcs = (VcsSource) this.source;
            ParsedUri uri = vcs.uri().withRef(vcs.ref())
                    .withName(vcs.name().getDisplayName())
                    .withExtras(this.extras)
                    .withSubdirectory(vcs.subdirectory());
            builder.append(showPassword ? uri.toString(ParsedUri.Format.SHOW_PASSWORD, ParsedUri.Format.INDIRECT) : uri.toString(ParsedUri.Format.INDIRECT));
            break;
        }
        default:
            throw new IncompatibleClassChangeError("Unknown kind " + this.source.kind());
        }
        if (this.markers != null) {
            builder.append("; ").append(this.markers);
        }
        for (String hash : this.hashes) {
            builder.append(" --hash=").append(hash);
        }
        return builder.toString();
    }

    /**
     * Writes this requirement as a lockfile entry. Unlike {@link #toManifest()} the entry is always a table,
     * the hashes are always listed for named requirements and the requirement must be pinned.
     *
     * @return The lockfile entry
     * @throws IllegalStateException If a named or VCS requirement is not pinned
     */
    @NotNull
    @Contract(pure = true)
    public ManifestRecord toLockEntry() {
        if (!this.isPinned() && this.source.kind() != RequirementKind.FILE) {
            throw new IllegalStateException("Only pinned requirements can be locked, got " + this);
        }
        Map<String, Object> table = this.toTable();
        if (this.source.kind() == RequirementKind.NAMED) {
            table.put(Requirement.KEY_HASHES, this.hashes);
        }
        return new ManifestRecord(this.getDisplayName(), table);
    }

    /**
     * Writes this requirement as a pip requirement line, including the password of URLs.
     * The line can be parsed back by {@link #fromLine(String)}.
     *
     * @return The requirement line
     */
    @NotNull
    @Contract(pure = true)
    public String toLine() {
        return this.line(true);
    }

    /**
     * Writes this requirement as a manifest entry. Named requirements without extras, markers, hashes and index
     * collapse into their specifier string, all other requirements are written as a table.
     *
     * @return The manifest entry
     * @throws IllegalStateException If the requirement has no name yet
     */
    @NotNull
    @Contract(pure = true)
    public ManifestRecord toManifest() {
        if (this.source instanceof NamedSource && this.extras.isEmpty() && this.markers == null && this.hashes.isEmpty() && this.index == null) {
            SpecifierSet specifiers = ((NamedSource) this.source).specifiers();
            return new ManifestRecord(this.getDisplayName(), specifiers.isAny() ? "*" : specifiers.toString());
        }
        return new ManifestRecord(this.getDisplayName(), this.toTable());
    }

    @NotNull
    private String getDisplayName() {
        PackageName name = this.source.name();
        if (name == null) {
            throw new IllegalStateException("Requirement " + this + " has no name");
        }
        return name.getDisplayName();
    }

    @NotNull
    private Map<String, Object> toTable() {
        Map<String, Object> table = new LinkedHashMap<>();
        switch (this.source.kind()) {
        case NAMED: {
            SpecifierSet specifiers = ((NamedSource) this.source).specifiers();
            table.put(Requirement.KEY_VERSION, specifiers.isAny() ? "*" : specifiers.toString());
            break;
        }
        case FILE: {
            FileSource file = (FileSource) this.source;
            if (file.path() != null) {
                table.put(Requirement.KEY_PATH, file.path());
            } else {
                table.put(Requirement.KEY_FILE, file.location());
            }
            Requirement.putSourceFlags(table, file.editable(), file.subdirectory());
            break;
        }
        case VCS: {
            VcsSource vcs = (VcsSource) this.source;
            String url = vcs.uri().toString(ParsedUri.Format.SHOW_PASSWORD, ParsedUri.Format.INDIRECT);
            table.put(vcs.vcs().getKey(), url.substring(vcs.vcs().getKey().length() + 1));
            if (vcs.ref() != null) {
                table.put(Requirement.KEY_REF, vcs.ref());
            }
            Requirement.putSourceFlags(table, vcs.editable(), vcs.subdirectory());
            break;
        }
        default:
            throw new IncompatibleClassChangeError("Unknown kind " + this.source.kind());
        }
        if (!this.extras.isEmpty()) {
            table.put(Requirement.KEY_EXTRAS, this.extras);
        }
        if (this.markers != null) {
            table.put(Requirement.KEY_MARKERS, this.markers.toString());
        }
        if (this.index != null) {
            table.put(Requirement.KEY_INDEX, this.index);
        }
        if (!this.hashes.isEmpty()) {
            table.put(Requirement.KEY_HASHES, this.hashes);
        }
        return table;
    }

    private static void putSourceFlags(@NotNull Map<String, Object> table, boolean editable, @Nullable String subdirectory) {
        if (editable) {
            table.put(Requirement.KEY_EDITABLE, Boolean.TRUE);
        }
        if (subdirectory != null) {
            table.put(Requirement.KEY_SUBDIRECTORY, subdirectory);
        }
    }

    /**
     * Writes this requirement as a requirement line with the password of URLs replaced by "----".
     *
     * @return The redacted requirement line
     */
    @Override
    public String toString() {
        return this.line(false);
    }

    @NotNull
    @Contract(pure = true)
    public Requirement withExtras(@NotNull Collection<@NotNull String> extras) {
        return new Requirement(this.source, extras, this.markers, this.hashes, this.index);
    }

    /**
     * Adds hashes to the hashes of this requirement. Hashes are ignored for editable requirements.
     *
     * @param hashes The hashes to add
     * @return A requirement with the combined hashes
     */
    @NotNull
    @Contract(pure = true)
    public Requirement withHashes(@NotNull Collection<@NotNull String> hashes) {
        Set<String> combined = new TreeSet<>(this.hashes);
        combined.addAll(hashes);
        return new Requirement(this.source, this.extras, this.markers, combined, this.index);
    }

    @NotNull
    @Contract(pure = true)
    public Requirement withIndex(@Nullable String index) {
        return new Requirement(this.source, this.extras, this.markers, this.hashes, index);
    }

    @NotNull
    @Contract(pure = true)
    public Requirement withMarkers(@Nullable Marker markers) {
        return new Requirement(this.source, this.extras, markers, this.hashes, this.index);
    }

    /**
     * Pins a VCS requirement to the given ref, usually a revision obtained from a checkout.
     *
     * @param ref The ref
     * @return The pinned requirement
     * @throws IllegalStateException If this is not a VCS requirement
     */
    @NotNull
    @Contract(pure = true)
    public Requirement withRef(@NotNull String ref) {
        if (!(this.source instanceof VcsSource)) {
            throw new IllegalStateException("Only VCS requirements have a ref, got " + this);
        }
        return new Requirement(((VcsSource) this.source).withRef(ref), this.extras, this.markers, this.hashes, this.index);
    }

    /**
     * Replaces the specifiers of a named requirement.
     *
     * @param specifiers The new specifiers
     * @return The requirement with the new specifiers
     * @throws IllegalStateException If this is not a named requirement
     */
    @NotNull
    @Contract(pure = true)
    public Requirement withSpecifiers(@NotNull SpecifierSet specifiers) {
        if (!(this.source instanceof NamedSource)) {
            throw new IllegalStateException("Only named requirements have specifiers, got " + this);
        }
        return new Requirement(new NamedSource(((NamedSource) this.source).name(), specifiers), this.extras, this.markers, this.hashes, this.index);
    }
}

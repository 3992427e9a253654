package org.stianloader.picopip.version;

import java.util.Arrays;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;

/**
 * A version of a python package or interpreter, modelled as a tuple of non-negative integers
 * with an optional trailing wildcard segment (as in "3.7.*").
 *
 * <p>Missing segments are treated as zero when comparing versions, so "1.0" and "1" denote the
 * same version. The wildcard is only meaningful when the version is used in a
 * {@link VersionSpecifier} with the {@link SpecifierOperator#EQ} or {@link SpecifierOperator#NE}
 * operators; it is ignored by {@link #compareTo(PackageVersion)}.
 */
public final class PackageVersion implements Comparable<PackageVersion> {

    @NotNull
    private final String originText;
    private final int @NotNull[] segments;
    private final boolean wildcard;

    private PackageVersion(@NotNull String originText, int @NotNull[] segments, boolean wildcard) {
        this.originText = originText;
        this.segments = segments;
        this.wildcard = wildcard;
    }

    /**
     * Splits a version string on '.', drops a trailing "*" segment and parses the remaining
     * segments as integers.
     *
     * @param version The version string, for example "3.7.*"
     * @return The parsed integer segments
     * @throws RequirementParseException with {@link Kind#MALFORMED_VERSION} if a segment is not numeric
     */
    public static int @NotNull[] tuplize(@NotNull String version) {
        return PackageVersion.parse(version).getSegments();
    }

    @NotNull
    @Contract(pure = true)
    public static PackageVersion parse(@NotNull String string) {
        Objects.requireNonNull(string, "string may not be null");
        String trimmed = string.trim();
        if (trimmed.isEmpty()) {
            throw new RequirementParseException(Kind.MALFORMED_VERSION, string, "Empty version string");
        }

        String[] parts = trimmed.split("\\.", -1);
        int length = parts.length;
        boolean wildcard = false;
        if (parts[length - 1].equals("*")) {
            wildcard = true;
            length--;
            if (length == 0) {
                throw new RequirementParseException(Kind.MALFORMED_VERSION, string, "A wildcard needs at least one leading segment");
            }
        }

        int[] segments = new int[length];
        for (int i = 0; i < length; i++) {
            String part = parts[i];
            if (part.isEmpty()) {
                throw new RequirementParseException(Kind.MALFORMED_VERSION, string, "Empty segment at index " + i);
            }
            for (int j = 0; j < part.length(); j++) {
                char c = part.charAt(j);
                if (c < '0' || c > '9') {
                    throw new RequirementParseException(Kind.MALFORMED_VERSION, string, "Non-numeric segment '" + part + "'");
                }
            }
            try {
                segments[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new RequirementParseException(Kind.MALFORMED_VERSION, string, "Segment '" + part + "' out of range", e);
            }
        }

        return new PackageVersion(trimmed, segments, wildcard);
    }

    @NotNull
    @Contract(pure = true)
    public static PackageVersion of(int... segments) {
        StringBuilder builder = new StringBuilder();
        for (int segment : segments) {
            if (segment < 0) {
                throw new IllegalArgumentException("Negative version segment: " + segment);
            }
            builder.append(segment).append('.');
        }
        if (builder.length() == 0) {
            throw new IllegalArgumentException("A version needs at least one segment");
        }
        builder.setLength(builder.length() - 1);
        return new PackageVersion(builder.toString(), segments.clone(), false);
    }

    @Override
    public int compareTo(PackageVersion o) {
        int length = Math.max(this.segments.length, o.segments.length);
        for (int i = 0; i < length; i++) {
            int a = this.getSegment(i);
            int b = o.getSegment(i);
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PackageVersion) {
            PackageVersion other = (PackageVersion) obj;
            return other.wildcard == this.wildcard && other.compareTo(this) == 0;
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    /**
     * Obtains the segment at the given index, or 0 if the version has fewer segments.
     *
     * @param index The segment index
     * @return The value of the segment
     */
    @Contract(pure = true)
    public int getSegment(int index) {
        if (index < this.segments.length) {
            return this.segments[index];
        }
        return 0;
    }

    @Contract(pure = true)
    public int getSegmentCount() {
        return this.segments.length;
    }

    public int @NotNull[] getSegments() {
        return this.segments.clone();
    }

    @Override
    public int hashCode() {
        int significant = this.segments.length;
        while (significant > 0 && this.segments[significant - 1] == 0) {
            significant--;
        }
        return Arrays.hashCode(Arrays.copyOf(this.segments, significant)) * 31 + Boolean.hashCode(this.wildcard);
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull PackageVersion other) {
        return this.compareTo(other) > 0;
    }

    @Contract(pure = true)
    public boolean isWildcard() {
        return this.wildcard;
    }

    /**
     * Checks whether the leading segments of the given version equal all segments of this version.
     * Used to evaluate wildcard and compatible-release specifiers.
     *
     * @param other The version to test
     * @return True if other starts with the segments of this version
     */
    @Contract(pure = true)
    public boolean isPrefixOf(@NotNull PackageVersion other) {
        for (int i = 0; i < this.segments.length; i++) {
            if (this.segments[i] != other.getSegment(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Obtains a copy of this version without the last {@code count} segments and without a wildcard.
     *
     * @param count The amount of segments to drop
     * @return The truncated version
     */
    @NotNull
    public PackageVersion truncate(int count) {
        if (count >= this.segments.length) {
            throw new IllegalArgumentException("Cannot drop " + count + " segments from " + this.originText);
        }
        return PackageVersion.of(Arrays.copyOf(this.segments, this.segments.length - count));
    }

    @Override
    public String toString() {
        return this.originText;
    }
}

package org.stianloader.picopip.requirement;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;

/**
 * The name of a package. Names are compared by their normalised key, in which runs of "-", "_" and "."
 * are replaced by a single "-" and all letters are lower-cased, while the name as written is kept for display.
 */
public final class PackageName implements Comparable<PackageName> {

    private static final Pattern SEPARATORS = Pattern.compile("[-_.]+");
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?");

    @NotNull
    private final String displayName;
    @NotNull
    private final String key;

    private PackageName(@NotNull String displayName) {
        this.displayName = displayName;
        this.key = PackageName.normalize(displayName);
    }

    /**
     * Guesses the package name from the file name of a wheel ({@code name-version-tags.whl})
     * or a source distribution ({@code name-version.tar.gz}).
     *
     * @param fileName The file name, without any directories
     * @return The package name, or null if the file name does not follow either convention
     */
    @Nullable
    @Contract(pure = true)
    public static PackageName fromDistributionFileName(@NotNull String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        String stem;
        if (lower.endsWith(".whl")) {
            int dash = fileName.indexOf('-');
            if (dash <= 0) {
                return null;
            }
            stem = fileName.substring(0, dash);
        } else {
            String base = null;
            for (String extension : new String[] {".tar.gz", ".tar.bz2", ".tar.xz", ".tgz", ".zip", ".tar"}) {
                if (lower.endsWith(extension)) {
                    base = fileName.substring(0, fileName.length() - extension.length());
                    break;
                }
            }
            if (base == null) {
                return null;
            }
            int dash = base.lastIndexOf('-');
            if (dash <= 0 || dash == base.length() - 1 || !Character.isDigit(base.charAt(dash + 1))) {
                return null;
            }
            stem = base.substring(0, dash);
        }
        if (!PackageName.VALID_NAME.matcher(stem).matches()) {
            return null;
        }
        return new PackageName(stem);
    }

    @NotNull
    @Contract(pure = true)
    public static String normalize(@NotNull String name) {
        return PackageName.SEPARATORS.matcher(name).replaceAll("-").toLowerCase(Locale.ROOT);
    }

    /**
     * Validates and wraps a package name.
     *
     * @param name The name as written
     * @return The package name
     * @throws RequirementParseException with {@link Kind#UNPARSABLE_REQUIREMENT} if the name contains characters
     * that are not permitted in package names
     */
    @NotNull
    @Contract(pure = true)
    public static PackageName of(@NotNull String name) {
        String trimmed = Objects.requireNonNull(name, "name may not be null").trim();
        if (!PackageName.VALID_NAME.matcher(trimmed).matches()) {
            throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, name, "Invalid package name");
        }
        return new PackageName(trimmed);
    }

    @Override
    public int compareTo(PackageName o) {
        return this.key.compareTo(o.key);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PackageName) {
            return ((PackageName) obj).key.equals(this.key);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public String getDisplayName() {
        return this.displayName;
    }

    @NotNull
    @Contract(pure = true)
    public String getKey() {
        return this.key;
    }

    @Override
    public int hashCode() {
        return this.key.hashCode();
    }

    @Override
    public String toString() {
        return this.displayName;
    }
}

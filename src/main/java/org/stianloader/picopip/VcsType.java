package org.stianloader.picopip;

import java.util.Locale;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The version control systems a requirement may be fetched from.
 */
public enum VcsType {
    BZR("bzr"),
    GIT("git"),
    HG("hg"),
    SVN("svn");

    @NotNull
    private final String key;

    VcsType(@NotNull String key) {
        this.key = key;
    }

    /**
     * Obtains the {@link VcsType} whose scheme prefix or manifest key equals the given string,
     * ignoring case. Returns null if the string does not name a supported VCS.
     *
     * @param key The key, for example "git"
     * @return The matching {@link VcsType}, or null
     */
    @Nullable
    public static VcsType fromKey(@NotNull String key) {
        String lowered = key.toLowerCase(Locale.ROOT);
        for (VcsType type : VcsType.values()) {
            if (type.key.equals(lowered)) {
                return type;
            }
        }
        return null;
    }

    /**
     * The key as used in manifest records ("git = ...") and as the scheme prefix ("git+https://").
     *
     * @return The lower-case key
     */
    @NotNull
    public String getKey() {
        return this.key;
    }

    @Override
    public String toString() {
        return this.key;
    }
}

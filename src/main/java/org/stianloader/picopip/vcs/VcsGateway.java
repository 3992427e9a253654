package org.stianloader.picopip.vcs;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;

/**
 * Performs checkouts for a single kind of version control system.
 *
 * <p>All operations touch the file system at the given target directory. Implementations must
 * serialise operations on the same directory, operations on distinct directories may run concurrently.
 */
public interface VcsGateway {

    /**
     * Brings the checkout in the given directory to the given ref. Does nothing if the checkout
     * already is at that ref, otherwise behaves like {@link #update(Path, String, String)} with the
     * URL the checkout was obtained from.
     *
     * @param targetDirectory The directory of the checkout
     * @param ref The branch, tag or revision
     * @throws VcsException If the ref does not exist or the checkout is corrupt
     */
    void checkoutRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException;

    @NotNull
    VcsType getType();

    /**
     * Clones or checks out the repository at the given URL into a fresh directory.
     *
     * @param url The repository URL, without the "vcs+" prefix
     * @param targetDirectory The directory to check out into, which must not exist yet
     * @throws VcsException If the repository is unreachable
     */
    void obtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException;

    /**
     * Obtains the canonical identifier of the revision that is checked out, such as a full commit hash.
     * The identifier is memoised per directory for the lifetime of the gateway and is only recomputed
     * after the checkout was modified through this gateway.
     *
     * @param targetDirectory The directory of the checkout
     * @return The revision identifier
     * @throws VcsException If the checkout is corrupt
     */
    @NotNull
    String revision(@NotNull Path targetDirectory) throws VcsException;

    /**
     * Fetches the given ref from the given URL and checks it out.
     *
     * @param targetDirectory The directory of the checkout
     * @param url The repository URL, without the "vcs+" prefix
     * @param ref The branch, tag or revision
     * @throws VcsException If the repository is unreachable or the ref does not exist
     */
    void update(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException;
}

package org.stianloader.picopip.vcs;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.logging.LoggingAdapter;

/**
 * Base class of {@link VcsGateway} implementations that serialises all operations on the same directory
 * and memoises {@link #revision(Path)}. The lock of a directory is only retained while an operation on it
 * is running or waiting.
 */
public abstract class AbstractVcsGateway implements VcsGateway {

    private static final class DirectoryLock {
        @NotNull
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    @NotNull
    private final ConcurrentMap<Path, DirectoryLock> locks = new ConcurrentHashMap<>();
    @NotNull
    private final ConcurrentMap<Path, String> revisions = new ConcurrentHashMap<>();
    @NotNull
    private final VcsType type;

    protected AbstractVcsGateway(@NotNull VcsType type) {
        this.type = Objects.requireNonNull(type, "type may not be null");
    }

    @Override
    public final void checkoutRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
        DirectoryLock lock = this.lock(targetDirectory);
        try {
            if (this.isAtRef(targetDirectory, ref)) {
                return;
            }
            this.update(targetDirectory, this.getRemoteUrl(targetDirectory), ref);
        } finally {
            this.unlock(targetDirectory, lock);
        }
    }

    /**
     * Checks out the given ref in an existing working tree. The caller holds the lock of the directory.
     */
    protected abstract void doCheckout(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException;

    /**
     * Creates a fresh checkout. The caller holds the lock of the directory.
     */
    protected abstract void doObtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException;

    /**
     * Reads the revision of a checkout. The caller holds the lock of the directory.
     */
    @NotNull
    protected abstract String doRevision(@NotNull Path targetDirectory) throws VcsException;

    /**
     * Obtains the URL the checkout in the given directory was obtained from.
     */
    @NotNull
    protected abstract String getRemoteUrl(@NotNull Path targetDirectory) throws VcsException;

    @Override
    @NotNull
    public final VcsType getType() {
        return this.type;
    }

    /**
     * Checks whether the checkout is at the given ref. Returning false when in doubt is always safe,
     * as it merely leads to a redundant update.
     */
    protected abstract boolean isAtRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException;

    /**
     * Obtains the number of directories for which an operation is currently running or waiting.
     */
    protected final int getLockedDirectoryCount() {
        return this.locks.size();
    }

    @NotNull
    private DirectoryLock lock(@NotNull Path targetDirectory) {
        DirectoryLock lock = this.locks.compute(targetDirectory.toAbsolutePath().normalize(), (key, existing) -> {
            DirectoryLock entry = existing == null ? new DirectoryLock() : existing;
            entry.users++;
            return entry;
        });
        lock.lock.lock();
        return lock;
    }

    private void unlock(@NotNull Path targetDirectory, @NotNull DirectoryLock lock) {
        lock.lock.unlock();
        this.locks.compute(targetDirectory.toAbsolutePath().normalize(), (key, existing) -> {
            if (existing != lock) {
                throw new IllegalStateException("Lock of " + key + " was replaced while in use");
            }
            return --existing.users == 0 ? null : existing;
        });
    }

    @Override
    public final void obtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException {
        DirectoryLock lock = this.lock(targetDirectory);
        try {
            LoggingAdapter.getDefaultLogger().debug(AbstractVcsGateway.class, "Obtaining {} checkout of {} in {}", this.type, url, targetDirectory);
            this.revisions.remove(targetDirectory.toAbsolutePath().normalize());
            this.doObtain(url, targetDirectory);
        } finally {
            this.unlock(targetDirectory, lock);
        }
    }

    @Override
    @NotNull
    public final String revision(@NotNull Path targetDirectory) throws VcsException {
        Path key = targetDirectory.toAbsolutePath().normalize();
        String cached = this.revisions.get(key);
        if (cached != null) {
            return cached;
        }
        DirectoryLock lock = this.lock(targetDirectory);
        try {
            cached = this.revisions.get(key);
            if (cached != null) {
                return cached;
            }
            String revision = this.doRevision(targetDirectory);
            this.revisions.put(key, revision);
            return revision;
        } finally {
            this.unlock(targetDirectory, lock);
        }
    }

    @Override
    public final void update(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException {
        DirectoryLock lock = this.lock(targetDirectory);
        try {
            LoggingAdapter.getDefaultLogger().debug(AbstractVcsGateway.class, "Updating {} checkout in {} to {}", this.type, targetDirectory, ref);
            this.revisions.remove(targetDirectory.toAbsolutePath().normalize());
            this.doCheckout(targetDirectory, url, ref);
        } finally {
            this.unlock(targetDirectory, lock);
        }
    }
}

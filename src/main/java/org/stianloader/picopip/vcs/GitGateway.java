package org.stianloader.picopip.vcs;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.vcs.VcsException.Reason;

public class GitGateway extends CommandLineVcsGateway {

    public GitGateway() {
        super(VcsType.GIT, "git");
    }

    @Override
    protected void doCheckout(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException {
        this.run(targetDirectory, Reason.CORRUPT, "remote", "set-url", "origin", url);
        this.run(targetDirectory, Reason.UNREACHABLE, "fetch", "--quiet", "--tags", "origin");
        this.run(targetDirectory, Reason.INVALID_REF, "checkout", "--quiet", ref);
    }

    @Override
    protected void doObtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException {
        CommandLineVcsGateway.prepareTarget(targetDirectory);
        Path absolute = targetDirectory.toAbsolutePath();
        this.run(absolute.getParent(), Reason.UNREACHABLE, "clone", "--quiet", url, absolute.toString());
    }

    @Override
    @NotNull
    protected String doRevision(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "rev-parse", "HEAD").trim();
    }

    @Override
    @NotNull
    protected String getRemoteUrl(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "config", "--get", "remote.origin.url").trim();
    }

    @Override
    protected boolean isAtRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
        String head = this.revision(targetDirectory);
        if (head.equals(ref)) {
            return true;
        }
        String resolved;
        try {
            resolved = this.run(targetDirectory, Reason.INVALID_REF, "rev-parse", "--verify", "--quiet", ref + "^{commit}").trim();
        } catch (VcsException e) {
            if (e.getReason() != Reason.INVALID_REF) {
                throw e;
            }
            // Not known locally yet, fetching it is up to the update
            return false;
        }
        // Branches may have moved upstream, only revisions and tags are considered reached
        return resolved.equals(head) && !this.isBranch(targetDirectory, ref);
    }

    private boolean isBranch(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
        return !this.run(targetDirectory, Reason.CORRUPT, "branch", "--all", "--list", ref, "origin/" + ref).isBlank();
    }
}

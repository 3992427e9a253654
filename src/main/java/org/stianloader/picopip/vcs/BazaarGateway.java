package org.stianloader.picopip.vcs;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.vcs.VcsException.Reason;

public class BazaarGateway extends CommandLineVcsGateway {

    public BazaarGateway() {
        super(VcsType.BZR, "bzr");
    }

    @Override
    protected void doCheckout(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException {
        this.run(targetDirectory, Reason.INVALID_REF, "pull", "--quiet", "--overwrite", "--revision", ref, url);
    }

    @Override
    protected void doObtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException {
        CommandLineVcsGateway.prepareTarget(targetDirectory);
        Path absolute = targetDirectory.toAbsolutePath();
        this.run(absolute.getParent(), Reason.UNREACHABLE, "branch", "--quiet", url, absolute.toString());
    }

    @Override
    @NotNull
    protected String doRevision(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "revno", "--tree").trim();
    }

    @Override
    @NotNull
    protected String getRemoteUrl(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "config", "parent_location").trim();
    }

    @Override
    protected boolean isAtRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
        return this.revision(targetDirectory).equals(ref);
    }
}

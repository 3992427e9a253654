package org.stianloader.picopip.vcs;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.vcs.VcsException.Reason;

public class MercurialGateway extends CommandLineVcsGateway {

    public MercurialGateway() {
        super(VcsType.HG, "hg");
    }

    @Override
    protected void doCheckout(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException {
        this.run(targetDirectory, Reason.UNREACHABLE, "pull", "--quiet", url);
        this.run(targetDirectory, Reason.INVALID_REF, "update", "--quiet", "--rev", ref);
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
        return this.run(targetDirectory, Reason.CORRUPT, "parents", "--template", "{node}").trim();
    }

    @Override
    @NotNull
    protected String getRemoteUrl(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "paths", "default").trim();
    }

    @Override
    protected boolean isAtRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
        return this.revision(targetDirectory).equals(ref);
    }
}

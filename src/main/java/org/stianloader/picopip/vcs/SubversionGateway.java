package org.stianloader.picopip.vcs;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.vcs.VcsException.Reason;

public class SubversionGateway extends CommandLineVcsGateway {

    public SubversionGateway() {
        super(VcsType.SVN, "svn");
    }

    @Override
    protected void doCheckout(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException {
        if (!this.getRemoteUrl(targetDirectory).equals(url)) {
            this.run(targetDirectory, Reason.UNREACHABLE, "switch", "--quiet", "--non-interactive", "--ignore-ancestry", url);
        }
        this.run(targetDirectory, Reason.INVALID_REF, "update", "--quiet", "--non-interactive", "--revision", ref);
    }

    @Override
    protected void doObtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException {
        CommandLineVcsGateway.prepareTarget(targetDirectory);
        Path absolute = targetDirectory.toAbsolutePath();
        this.run(absolute.getParent(), Reason.UNREACHABLE, "checkout", "--quiet", "--non-interactive", url, absolute.toString());
    }

    @Override
    @NotNull
    protected String doRevision(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "info", "--show-item", "revision").trim();
    }

    @Override
    @NotNull
    protected String getRemoteUrl(@NotNull Path targetDirectory) throws VcsException {
        return this.run(targetDirectory, Reason.CORRUPT, "info", "--show-item", "url").trim();
    }

    @Override
    protected boolean isAtRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
        return this.revision(targetDirectory).equals(ref);
    }
}

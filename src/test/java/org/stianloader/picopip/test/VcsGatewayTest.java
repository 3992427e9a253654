package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ForkJoinPool;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.requirement.Requirement;
import org.stianloader.picopip.vcs.AbstractVcsGateway;
import org.stianloader.picopip.vcs.GitGateway;
import org.stianloader.picopip.vcs.VcsException;
import org.stianloader.picopip.vcs.VcsGatewayRegistry;
import org.stianloader.picopip.vcs.VcsRepository;

public class VcsGatewayTest {

    private static class RecordingGateway extends AbstractVcsGateway {
        private int checkouts;
        private String currentRef = "main";
        private String lastUrl;
        private int lockedDirectories = -1;
        private int obtains;
        private int revisionLookups;

        public RecordingGateway() {
            super(VcsType.GIT);
        }

        int currentlyLocked() {
            return this.getLockedDirectoryCount();
        }

        @Override
        protected void doCheckout(@NotNull Path targetDirectory, @NotNull String url, @NotNull String ref) throws VcsException {
            this.checkouts++;
            this.lastUrl = url;
            this.lockedDirectories = this.getLockedDirectoryCount();
            this.currentRef = ref;
        }

        @Override
        protected void doObtain(@NotNull String url, @NotNull Path targetDirectory) throws VcsException {
            this.obtains++;
            this.lastUrl = url;
            this.lockedDirectories = this.getLockedDirectoryCount();
            try {
                Files.createDirectories(targetDirectory);
            } catch (IOException e) {
                throw new VcsException(VcsException.Reason.CORRUPT, "Unable to create " + targetDirectory, e);
            }
        }

        @Override
        @NotNull
        protected String doRevision(@NotNull Path targetDirectory) throws VcsException {
            this.revisionLookups++;
            return "rev-" + this.currentRef;
        }

        @Override
        @NotNull
        protected String getRemoteUrl(@NotNull Path targetDirectory) throws VcsException {
            return "https://example.com/origin.git";
        }

        @Override
        protected boolean isAtRef(@NotNull Path targetDirectory, @NotNull String ref) throws VcsException {
            return this.currentRef.equals(ref);
        }
    }

    @TempDir
    Path tempDir;

    @Test
    public void testRevisionMemoisation() throws VcsException {
        RecordingGateway gateway = new RecordingGateway();
        assertEquals("rev-main", gateway.revision(this.tempDir));
        assertEquals("rev-main", gateway.revision(this.tempDir.resolve(".")));
        assertEquals(1, gateway.revisionLookups);

        gateway.update(this.tempDir, "https://example.com/other.git", "v2");
        assertEquals("rev-v2", gateway.revision(this.tempDir));
        assertEquals(2, gateway.revisionLookups);
        assertEquals("https://example.com/other.git", gateway.lastUrl);
    }

    @Test
    public void testDirectoryLocksAreReleased() throws VcsException {
        RecordingGateway gateway = new RecordingGateway();
        for (int i = 0; i < 16; i++) {
            gateway.obtain("https://example.com/repo.git", this.tempDir.resolve("checkout-" + i));
            assertEquals(1, gateway.lockedDirectories);
        }
        assertEquals(0, gateway.currentlyLocked());

        // checkoutRef re-enters the lock of the same directory through update
        gateway.checkoutRef(this.tempDir, "v3");
        assertEquals(1, gateway.lockedDirectories);
        assertEquals(0, gateway.currentlyLocked());
        assertEquals("rev-v3", gateway.revision(this.tempDir));
        assertEquals(0, gateway.currentlyLocked());
    }

    @Test
    public void testCheckoutRef() throws VcsException {
        RecordingGateway gateway = new RecordingGateway();
        gateway.checkoutRef(this.tempDir, "main");
        assertEquals(0, gateway.checkouts);

        gateway.checkoutRef(this.tempDir, "v1");
        assertEquals(1, gateway.checkouts);
        assertEquals("https://example.com/origin.git", gateway.lastUrl);
        assertEquals("rev-v1", gateway.revision(this.tempDir));
    }

    @Test
    public void testPin() throws VcsException {
        RecordingGateway gateway = new RecordingGateway();
        VcsRepository repository = new VcsRepository(new VcsGatewayRegistry().register(gateway));
        Requirement requirement = Requirement.fromLine("git+https://example.com/repo.git@v1#egg=repo");
        Path checkout = this.tempDir.resolve("repo");

        Requirement pinned = repository.pin(requirement, checkout);
        assertEquals(1, gateway.obtains);
        assertEquals(requirement.withRef("rev-v1"), pinned);
        assertEquals("git+https://example.com/repo.git@rev-v1#egg=repo", pinned.toLine());

        Requirement defaultBranch = Requirement.fromLine("git+https://example.com/repo.git#egg=repo");
        assertEquals(requirement.withRef("rev-v1"), repository.pinAsync(defaultBranch, checkout, ForkJoinPool.commonPool()).join());
        assertEquals(1, gateway.obtains);

        assertThrows(IllegalArgumentException.class, () -> repository.pin(Requirement.fromLine("repo==1.0"), checkout));
    }

    @Test
    public void testRegistry() {
        VcsGatewayRegistry registry = new VcsGatewayRegistry();
        assertThrows(IllegalStateException.class, () -> registry.get(VcsType.HG));
        RecordingGateway gateway = new RecordingGateway();
        registry.register(gateway);
        assertEquals(gateway, registry.get(VcsType.GIT));
        assertEquals(VcsType.SVN, VcsGatewayRegistry.createDefault().get(VcsType.SVN).getType());
    }

    @Test
    public void testMissingClient() {
        GitGateway gateway = new GitGateway();
        gateway.setExecutable("picopip-missing-vcs-client");
        VcsException e = assertThrows(VcsException.class, () -> gateway.revision(this.tempDir));
        assertEquals(VcsException.Reason.UNREACHABLE, e.getReason());

        e = assertThrows(VcsException.class, () -> gateway.obtain("https://example.com/repo.git", this.tempDir));
        assertEquals(VcsException.Reason.CORRUPT, e.getReason());
    }
}

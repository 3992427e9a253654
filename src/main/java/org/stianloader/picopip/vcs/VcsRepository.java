package org.stianloader.picopip.vcs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.internal.ConcurrencyUtil;
import org.stianloader.picopip.logging.LoggingAdapter;
import org.stianloader.picopip.requirement.Requirement;
import org.stianloader.picopip.requirement.VcsSource;

/**
 * Obtains checkouts of VCS requirements and pins the requirements to the revision that was checked out.
 */
public class VcsRepository {

    @NotNull
    private final VcsGatewayRegistry gateways;

    public VcsRepository(@NotNull VcsGatewayRegistry gateways) {
        this.gateways = Objects.requireNonNull(gateways, "gateways may not be null");
    }

    /**
     * Makes sure a checkout of the requirement exists in the given directory, brings it to the
     * requirement's ref (if any) and returns the requirement pinned to the revision of the checkout.
     *
     * @param requirement The VCS requirement
     * @param checkoutDirectory The directory of the checkout, which is created if absent
     * @return The pinned requirement
     * @throws VcsException If the checkout cannot be obtained or updated
     * @throws IllegalArgumentException If the requirement is not a VCS requirement
     */
    @NotNull
    public Requirement pin(@NotNull Requirement requirement, @NotNull Path checkoutDirectory) throws VcsException {
        if (!(requirement.getSource() instanceof VcsSource)) {
            throw new IllegalArgumentException("Not a VCS requirement: " + requirement);
        }
        VcsSource source = (VcsSource) requirement.getSource();
        VcsGateway gateway = this.gateways.get(source.vcs());
        if (!Files.isDirectory(checkoutDirectory)) {
            gateway.obtain(source.repositoryUrl(), checkoutDirectory);
        }
        String ref = source.ref();
        if (ref != null) {
            gateway.checkoutRef(checkoutDirectory, ref);
        }
        String revision = gateway.revision(checkoutDirectory);
        LoggingAdapter.getDefaultLogger().debug(VcsRepository.class, "Pinned {} to revision {}", source.name(), revision);
        return requirement.withRef(revision);
    }

    /**
     * Asynchronous variant of {@link #pin(Requirement, Path)}. Checkouts in distinct directories proceed in parallel.
     *
     * @param requirement The VCS requirement
     * @param checkoutDirectory The directory of the checkout
     * @param executor The executor to run the VCS client on
     * @return A future completing with the pinned requirement, or exceptionally with a {@link VcsException}
     */
    @NotNull
    public CompletableFuture<Requirement> pinAsync(@NotNull Requirement requirement, @NotNull Path checkoutDirectory, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> this.pin(requirement, checkoutDirectory), executor);
    }
}

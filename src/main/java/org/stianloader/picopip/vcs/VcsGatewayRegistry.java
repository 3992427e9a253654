package org.stianloader.picopip.vcs;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;

/**
 * Holds one {@link VcsGateway} per {@link VcsType}.
 */
public class VcsGatewayRegistry {

    @NotNull
    private final Map<VcsType, VcsGateway> gateways = new EnumMap<>(VcsType.class);

    /**
     * Creates a registry with the command line gateways of all supported version control systems.
     *
     * @return The registry
     */
    @NotNull
    public static VcsGatewayRegistry createDefault() {
        return new VcsGatewayRegistry()
                .register(new BazaarGateway())
                .register(new GitGateway())
                .register(new MercurialGateway())
                .register(new SubversionGateway());
    }

    /**
     * Obtains the gateway for the given kind of VCS.
     *
     * @param type The VCS
     * @return The registered gateway
     * @throws IllegalStateException If no gateway is registered for the VCS
     */
    @NotNull
    public synchronized VcsGateway get(@NotNull VcsType type) {
        VcsGateway gateway = this.gateways.get(type);
        if (gateway == null) {
            throw new IllegalStateException("No gateway registered for " + type);
        }
        return gateway;
    }

    /**
     * Registers a gateway, replacing the gateway that was previously registered for the same VCS.
     *
     * @param gateway The gateway
     * @return This registry, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public synchronized VcsGatewayRegistry register(@NotNull VcsGateway gateway) {
        this.gateways.put(Objects.requireNonNull(gateway, "gateway may not be null").getType(), gateway);
        return this;
    }
}

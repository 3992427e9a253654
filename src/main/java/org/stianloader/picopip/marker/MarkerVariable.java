package org.stianloader.picopip.marker;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The environment variables a marker may refer to.
 */
public enum MarkerVariable {
    EXTRA("extra", false),
    IMPLEMENTATION_NAME("implementation_name", false),
    IMPLEMENTATION_VERSION("implementation_version", true),
    OS_NAME("os_name", false),
    PLATFORM_MACHINE("platform_machine", false),
    PLATFORM_PYTHON_IMPLEMENTATION("platform_python_implementation", false),
    PLATFORM_RELEASE("platform_release", false),
    PLATFORM_SYSTEM("platform_system", false),
    PLATFORM_VERSION("platform_version", false),
    PYTHON_FULL_VERSION("python_full_version", true),
    PYTHON_VERSION("python_version", true),
    SYS_PLATFORM("sys_platform", false);

    @NotNull
    private final String identifier;
    private final boolean version;

    MarkerVariable(@NotNull String identifier, boolean version) {
        this.identifier = identifier;
        this.version = version;
    }

    @Nullable
    public static MarkerVariable fromIdentifier(@NotNull String identifier) {
        for (MarkerVariable variable : MarkerVariable.values()) {
            if (variable.identifier.equals(identifier)) {
                return variable;
            }
        }
        return null;
    }

    @NotNull
    public String getIdentifier() {
        return this.identifier;
    }

    /**
     * Whether values of this variable are versions and are thus compared as versions rather than as strings.
     *
     * @return True for version variables
     */
    public boolean isVersion() {
        return this.version;
    }

    @Override
    public String toString() {
        return this.identifier;
    }
}

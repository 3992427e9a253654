package org.stianloader.picopip.requirement;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.version.SpecifierSet;

/**
 * A package that is looked up by name on a package index.
 *
 * @param name The name of the package
 * @param specifiers The acceptable versions
 */
public record NamedSource(@NotNull PackageName name, @NotNull SpecifierSet specifiers) implements RequirementSource {

    public NamedSource {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(specifiers, "specifiers may not be null");
    }

    @Override
    public boolean editable() {
        return false;
    }

    @Override
    @NotNull
    public RequirementKind kind() {
        return RequirementKind.NAMED;
    }

    @Override
    @NotNull
    public NamedSource withName(@NotNull PackageName name) {
        return new NamedSource(name, this.specifiers);
    }
}

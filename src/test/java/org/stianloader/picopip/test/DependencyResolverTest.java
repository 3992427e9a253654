package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.picopip.index.IndexNegotiator;
import org.stianloader.picopip.marker.MarkerEnvironment;
import org.stianloader.picopip.requirement.PackageMetadata;
import org.stianloader.picopip.requirement.Requirement;
import org.stianloader.picopip.resolver.DependencyResolver;
import org.stianloader.picopip.resolver.RequirementInput;
import org.stianloader.picopip.resolver.ResolutionException;
import org.stianloader.picopip.resolver.ResolvedPackage;
import org.stianloader.picopip.resolver.ResolvedSet;
import org.stianloader.picopip.resolver.ResolverState;

public class DependencyResolverTest {

    @NotNull
    private static DependencyResolver resolver(@NotNull InMemoryPackageIndex index) {
        return new DependencyResolver(new IndexNegotiator().addIndex("pypi", index)).setExecutor(Runnable::run);
    }

    @NotNull
    private static List<RequirementInput> roots(@NotNull String... lines) {
        RequirementInput[] inputs = new RequirementInput[lines.length];
        for (int i = 0; i < lines.length; i++) {
            inputs[i] = RequirementInput.of(lines[i]);
        }
        return List.of(inputs);
    }

    @NotNull
    private static String version(@NotNull ResolvedSet resolved, @NotNull String name) {
        ResolvedPackage resolvedPackage = resolved.get(name);
        assertNotNull(resolvedPackage, name);
        return String.valueOf(resolvedPackage.requirement().getPinnedVersion());
    }

    @NotNull
    private static InMemoryPackageIndex simpleIndex() {
        return new InMemoryPackageIndex()
                .addRelease("pkg-a", "1.0")
                .addRelease("pkg-a", "1.5")
                .addRelease("pkg-a", "2.0")
                .addRelease("pkg-b", "3.0");
    }

    @Test
    public void testResolveWithEnvironment() throws ResolutionException {
        List<RequirementInput> roots = DependencyResolverTest.roots("pkg-a>=1,<2", "pkg-b==3.0; python_version>='3.9'");

        ResolvedSet resolved = DependencyResolverTest.resolver(DependencyResolverTest.simpleIndex())
                .setEnvironment(MarkerEnvironment.forPython("3.9"))
                .resolve(roots);
        assertEquals(2, resolved.size());
        assertEquals("1.5", DependencyResolverTest.version(resolved, "pkg-a"));
        assertEquals("3.0", DependencyResolverTest.version(resolved, "pkg_b"));
        assertEquals("pkg-b==3.0; python_version >= '3.9'", resolved.get("pkg-b").requirement().toLine());
        assertEquals(4, resolved.getRounds());

        resolved = DependencyResolverTest.resolver(DependencyResolverTest.simpleIndex())
                .setEnvironment(MarkerEnvironment.forPython("3.8"))
                .resolve(roots);
        assertEquals(1, resolved.size());
        assertEquals("1.5", DependencyResolverTest.version(resolved, "pkg-a"));
        assertFalse(resolved.contains("pkg-b"));
    }

    @Test
    public void testConflict() {
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .addRelease("app-a", "1.0", "pkg==1.0")
                .addRelease("app-b", "1.0", "pkg==2.0")
                .addRelease("pkg", "1.0")
                .addRelease("pkg", "2.0");
        ResolutionException e = assertThrows(ResolutionException.class, () -> DependencyResolverTest.resolver(index).resolve(DependencyResolverTest.roots("app-a", "app-b")));
        assertEquals(ResolutionException.Reason.CONFLICT, e.getReason());
        assertEquals("pkg", e.getPackageName());
        assertEquals("pkg==1.0 (required by app-a)", e.getExistingConstraint());
        assertEquals("pkg==2.0 (required by app-b)", e.getConflictingConstraint());
    }

    @Test
    public void testBacktracking() throws ResolutionException {
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .addRelease("app", "1.0", "lib<2")
                .addRelease("app", "2.0", "lib>=2")
                .addRelease("lib", "1.0")
                .addRelease("lib", "2.0");
        ResolvedSet resolved = DependencyResolverTest.resolver(index).resolve(DependencyResolverTest.roots("app", "lib<2"));
        assertEquals("1.0", DependencyResolverTest.version(resolved, "app"));
        assertEquals("1.0", DependencyResolverTest.version(resolved, "lib"));
    }

    @Test
    public void testTransitiveAndExtras() throws ResolutionException {
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .addRelease("app", "1.0", "PySocks>=1; extra == 'socks'", "idna")
                .addRelease("pysocks", "1.7")
                .addRelease("idna", "3.4");

        ResolvedSet resolved = DependencyResolverTest.resolver(index).resolve(DependencyResolverTest.roots("app[socks]"));
        assertEquals(3, resolved.size());
        assertEquals("1.7", DependencyResolverTest.version(resolved, "pysocks"));
        assertEquals("3.4", DependencyResolverTest.version(resolved, "idna"));
        assertEquals(List.of("socks"), resolved.get("app").requirement().getExtras());
        // Extra clauses are not carried over to the pins
        assertNull(resolved.get("pysocks").requirement().getMarkers());

        resolved = DependencyResolverTest.resolver(index).setEnvironment(MarkerEnvironment.forPython("3.11")).resolve(DependencyResolverTest.roots("app"));
        assertEquals(2, resolved.size());
        assertFalse(resolved.contains("pysocks"));
    }

    @Test
    public void testHashes() throws ResolutionException {
        InMemoryPackageIndex index = DependencyResolverTest.simpleIndex().addHashes("pkg-a", "1.5", "sha256:bbb", "sha256:aaa");
        ResolvedSet resolved = DependencyResolverTest.resolver(index).resolve(DependencyResolverTest.roots("pkg-a<2"));
        ResolvedPackage pkgA = resolved.get("pkg-a");
        assertEquals(Set.of("sha256:aaa", "sha256:bbb"), pkgA.hashes());
        assertEquals(List.of("sha256:aaa", "sha256:bbb"), pkgA.requirement().getHashes());
        assertEquals("pkg-a==1.5 --hash=sha256:aaa --hash=sha256:bbb", pkgA.requirement().toLine());

        resolved = DependencyResolverTest.resolver(index).setCollectHashes(false).resolve(DependencyResolverTest.roots("pkg-a<2"));
        assertTrue(resolved.get("pkg-a").hashes().isEmpty());
    }

    @Test
    public void testUnavailableDependencies() throws ResolutionException {
        InMemoryPackageIndex index = new InMemoryPackageIndex() {
            @Override
            @NotNull
            public CompletableFuture<List<@NotNull String>> getDependencies(@NotNull String name, @NotNull String version, @NotNull Executor executor) {
                if (version.equals("1.5")) {
                    return CompletableFuture.failedFuture(new NoSuchElementException("Metadata of " + name + " " + version + " is unavailable"));
                }
                return super.getDependencies(name, version, executor);
            }
        };
        index.addRelease("pkg-a", "1.0").addRelease("pkg-a", "1.5");
        ResolvedSet resolved = DependencyResolverTest.resolver(index).resolve(DependencyResolverTest.roots("pkg-a"));
        assertEquals("1.0", DependencyResolverTest.version(resolved, "pkg-a"));

        ResolutionException e = assertThrows(ResolutionException.class, () -> DependencyResolverTest.resolver(index).resolve(DependencyResolverTest.roots("missing")));
        assertEquals(ResolutionException.Reason.CONFLICT, e.getReason());
        assertEquals("missing", e.getPackageName());
    }

    @Test
    public void testDirectRequirementsWin() throws ResolutionException {
        InMemoryPackageIndex index = new InMemoryPackageIndex().addRelease("app", "1.0", "local-project>=1");
        Requirement local = Requirement.fromLine("-e ./local/project").resolveName(new PackageMetadata("local-project", null));
        ResolvedSet resolved = DependencyResolverTest.resolver(index).resolve(List.of(RequirementInput.of(local), RequirementInput.of("app")));
        assertEquals(2, resolved.size());
        ResolvedPackage pinned = resolved.get("local-project");
        assertTrue(pinned.requirement().isEditable());
        assertEquals(local, pinned.requirement());
        assertTrue(pinned.hashes().isEmpty());
    }

    @Test
    public void testRounds() throws ResolutionException {
        ResolverState state = new ResolverState();
        DependencyResolver resolver = DependencyResolverTest.resolver(DependencyResolverTest.simpleIndex());
        ResolvedSet resolved = resolver.resolve(state, DependencyResolverTest.roots("pkg-a"), DependencyResolver.DEFAULT_MAX_ROUNDS);
        assertEquals("2.0", DependencyResolverTest.version(resolved, "pkg-a"));
        assertEquals(4, state.getHistory().size());
        assertEquals(3, state.getCandidateVersions(resolved.get("pkg-a").requirement().getName()).size());
        assertThrows(IllegalStateException.class, () -> resolver.resolve(state, DependencyResolverTest.roots("pkg-a"), DependencyResolver.DEFAULT_MAX_ROUNDS));

        ResolutionException e = assertThrows(ResolutionException.class, () -> resolver.resolve(DependencyResolverTest.roots("pkg-a"), 3));
        assertEquals(ResolutionException.Reason.NO_CONVERGENCE, e.getReason());
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(DependencyResolverTest.roots("pkg-a"), 0));
        assertThrows(IllegalArgumentException.class, () -> resolver.setMaxRounds(-1));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(DependencyResolverTest.roots("./local/project")));
    }
}

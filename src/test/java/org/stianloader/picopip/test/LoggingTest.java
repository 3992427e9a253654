package org.stianloader.picopip.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.picopip.index.IndexNegotiator;
import org.stianloader.picopip.logging.LoggingAdapter;
import org.stianloader.picopip.resolver.DependencyResolver;
import org.stianloader.picopip.resolver.RequirementInput;
import org.stianloader.picopip.resolver.ResolutionException;

public class LoggingTest {

    private static class RecordingAdapter extends LoggingAdapter {
        private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
            // Debug output is not recorded
        }

        @Override
        public boolean isDebugEnabled(@NotNull Class<?> clazz) {
            return false;
        }

        @Override
        public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
            this.warnings.add(clazz.getSimpleName() + ": " + message);
        }
    }

    @Test
    public void testWarningsReachTheDefaultLogger() {
        LoggingAdapter previous = LoggingAdapter.getDefaultLogger();
        RecordingAdapter recorder = new RecordingAdapter();
        LoggingAdapter.setDefaultLogger(recorder);
        try {
            DependencyResolver resolver = new DependencyResolver(new IndexNegotiator().addIndex("pypi", new InMemoryPackageIndex()))
                    .setExecutor(Runnable::run);
            ResolutionException e = assertThrows(ResolutionException.class, () -> resolver.resolve(List.of(RequirementInput.of("missing"))));
            assertEquals("missing", e.getPackageName());
            assertEquals(1, recorder.warnings.size());
            assertTrue(recorder.warnings.get(0).startsWith("DependencyResolver: Unable to obtain the versions of"));
        } finally {
            LoggingAdapter.setDefaultLogger(previous);
        }
        assertThrows(NullPointerException.class, () -> LoggingAdapter.setDefaultLogger(null));
    }
}

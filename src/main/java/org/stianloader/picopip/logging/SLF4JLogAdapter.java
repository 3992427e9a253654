package org.stianloader.picopip.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).debug(message, args);
    }

    @Override
    public boolean isDebugEnabled(@NotNull Class<?> clazz) {
        return LoggerFactory.getLogger(clazz).isDebugEnabled();
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).warn(message, args);
    }
}

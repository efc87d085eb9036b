package com.modulestack.resolver.spi;

import java.util.Objects;

/**
 * Handle for a temporary substitution. Closing it restores the original exactly once.
 */
public final class ScopedOverride implements AutoCloseable {

    private final Runnable restore;
    private boolean closed;

    private ScopedOverride(Runnable restore) {
        this.restore = Objects.requireNonNull(restore, "restore");
    }

    public static ScopedOverride of(Runnable restore) {
        return new ScopedOverride(restore);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        restore.run();
    }
}

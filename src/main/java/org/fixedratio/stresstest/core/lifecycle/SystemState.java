package org.fixedratio.stresstest.core.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared "system paused" flag. The lifecycle controller is the only writer; every worker
 * loop reads it at its iteration boundary without blocking.
 */
public final class SystemState {

    private final AtomicBoolean paused = new AtomicBoolean(false);

    public boolean isPaused() {
        return paused.get();
    }

    void setPaused(boolean value) {
        paused.set(value);
    }
}

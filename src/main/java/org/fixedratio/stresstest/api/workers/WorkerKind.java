package org.fixedratio.stresstest.api.workers;

import java.util.Locale;

/**
 * The kind of simulated trader a worker represents.
 */
public enum WorkerKind {
    DEPOSIT,
    WITHDRAWAL,
    SWAP;

    /**
     * Returns the lowercase prefix used in worker ids, e.g. {@code deposit}.
     *
     * @return The id prefix for this kind.
     */
    public String idPrefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}

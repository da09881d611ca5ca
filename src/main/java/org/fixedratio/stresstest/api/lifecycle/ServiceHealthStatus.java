package org.fixedratio.stresstest.api.lifecycle;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time health snapshot.
 *
 * @param healthy   Whether the system is able to do work right now.
 * @param status    Short status label such as {@code Healthy}, {@code Degraded} or {@code Paused}.
 * @param state     The lifecycle state at the time of the snapshot.
 * @param metrics   Named numeric metrics.
 * @param checkedAt When the snapshot was taken.
 */
public record ServiceHealthStatus(
    boolean healthy,
    String status,
    ServiceState state,
    Map<String, Number> metrics,
    Instant checkedAt
) {

    public ServiceHealthStatus {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}

package org.fixedratio.stresstest.api.lifecycle;

import java.time.Instant;

/**
 * A single lifecycle transition.
 *
 * @param previous  The state before the transition.
 * @param current   The state after the transition.
 * @param timestamp When the transition happened.
 * @param reason    Short human-readable reason.
 */
public record StateChange(ServiceState previous, ServiceState current, Instant timestamp, String reason) {
}

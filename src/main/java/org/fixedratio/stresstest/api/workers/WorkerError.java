package org.fixedratio.stresstest.api.workers;

import java.time.Instant;

/**
 * A failed operation recorded for a worker.
 *
 * @param timestamp     When the failure was recorded.
 * @param message       The raw or summarized error message.
 * @param operationKind The kind of operation that failed.
 * @param errorCode     The parsed contract error code, or {@code null} if none was found.
 */
public record WorkerError(
    Instant timestamp,
    String message,
    WorkerKind operationKind,
    Integer errorCode
) {
}

package org.fixedratio.stresstest.api.workers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Operation counters for one worker. Instances are immutable; the owning worker loop
 * publishes a new instance after every operation, so readers always see a consistent view.
 *
 * @param successfulOperations Number of operations that completed.
 * @param failedOperations     Number of operations recorded as failed.
 * @param totalVolume          Sum of input amounts of successful operations (base units).
 * @param totalFeesPaid        Sum of network fees of successful operations (native base units).
 * @param lastOperationAt      Timestamp of the most recent operation, successful or not.
 * @param lastError            Message of the most recent failure, or {@code null}.
 * @param recentErrors         The most recent failures, oldest first, at most {@link #MAX_RECENT_ERRORS}.
 */
public record WorkerStatistics(
    long successfulOperations,
    long failedOperations,
    long totalVolume,
    long totalFeesPaid,
    Instant lastOperationAt,
    String lastError,
    List<WorkerError> recentErrors
) {

    public static final int MAX_RECENT_ERRORS = 10;

    public WorkerStatistics {
        recentErrors = recentErrors == null ? List.of() : List.copyOf(recentErrors);
    }

    public static WorkerStatistics empty() {
        return new WorkerStatistics(0, 0, 0, 0, null, null, List.of());
    }

    public WorkerStatistics withSuccess(long volume, long fee, Instant at) {
        return new WorkerStatistics(successfulOperations + 1, failedOperations, totalVolume + volume,
            totalFeesPaid + fee, at, lastError, recentErrors);
    }

    public WorkerStatistics withFailure(WorkerError error) {
        List<WorkerError> errors = new ArrayList<>(recentErrors);
        errors.add(error);
        while (errors.size() > MAX_RECENT_ERRORS) {
            errors.remove(0);
        }
        return new WorkerStatistics(successfulOperations, failedOperations + 1, totalVolume,
            totalFeesPaid, error.timestamp(), error.message(), errors);
    }

    /**
     * Returns the number of operations attempted, successful or not.
     *
     * @return Successful plus failed operations.
     */
    public long attemptedOperations() {
        return successfulOperations + failedOperations;
    }
}

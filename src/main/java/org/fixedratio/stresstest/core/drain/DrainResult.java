package org.fixedratio.stresstest.core.drain;

import org.fixedratio.stresstest.api.workers.WorkerKind;

import java.time.Instant;

/**
 * Report of one drain.
 *
 * @param workerId           The drained worker.
 * @param kind               The worker kind.
 * @param outcome            The overall outcome.
 * @param mint               The mint that was drained.
 * @param tokensBurned       Amount burned before the terminal operation.
 * @param burnSignature      Signature of the burn transfer.
 * @param operationInput     Input of the terminal operation, 0 if it failed.
 * @param operationOutput    Output of the terminal operation, 0 if it failed.
 * @param outputBurned       Amount of operation output burned afterwards.
 * @param operationSignature Signature of the terminal operation, {@code null} if it failed.
 * @param error              Error of the terminal operation, {@code null} on success.
 * @param nativeSwept        Native amount swept back to the operational wallet.
 * @param networkFee         Fee paid by the terminal operation.
 * @param executedAt         When the drain started.
 */
public record DrainResult(
    String workerId,
    WorkerKind kind,
    DrainOutcome outcome,
    String mint,
    long tokensBurned,
    String burnSignature,
    long operationInput,
    long operationOutput,
    long outputBurned,
    String operationSignature,
    String error,
    long nativeSwept,
    long networkFee,
    Instant executedAt
) {

    static DrainResult nothingToDrain(String workerId, WorkerKind kind, String mint, Instant at) {
        return new DrainResult(workerId, kind, DrainOutcome.NOTHING_TO_DRAIN, mint, 0, null, 0, 0, 0,
            null, null, 0, 0, at);
    }

    public long totalBurned() {
        return tokensBurned + outputBurned;
    }

    public boolean operationSucceeded() {
        return outcome == DrainOutcome.COMPLETED;
    }
}

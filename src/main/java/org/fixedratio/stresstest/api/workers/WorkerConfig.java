package org.fixedratio.stresstest.api.workers;

import org.fixedratio.stresstest.api.chain.WalletCredential;

import java.time.Instant;

/**
 * Persistent configuration of one worker. Instances are immutable; the worker pool replaces
 * them atomically whenever the status or the last-operation timestamp changes.
 *
 * @param id              Worker id in the form {@code <kind>_<hex>}.
 * @param kind            The worker kind.
 * @param poolId          The pool reference.
 * @param tokenSide       The token side worked on.
 * @param swapDirection   Swap direction, {@code null} for non-swap workers.
 * @param wallet          The worker's wallet credential.
 * @param initialAmount   Tokens seeded on first start and used as refill amount.
 * @param autoRefill      Whether the worker re-mints tokens when it runs dry.
 * @param shareOutput     Whether outputs are passed to peer workers.
 * @param status          Lifecycle status, written only by the worker pool.
 * @param createdAt       Creation timestamp.
 * @param lastOperationAt Timestamp of the last successful operation, may be {@code null}.
 */
public record WorkerConfig(
    String id,
    WorkerKind kind,
    String poolId,
    TokenSide tokenSide,
    SwapDirection swapDirection,
    WalletCredential wallet,
    long initialAmount,
    boolean autoRefill,
    boolean shareOutput,
    WorkerStatus status,
    Instant createdAt,
    Instant lastOperationAt
) {

    public WorkerConfig withStatus(WorkerStatus newStatus) {
        return new WorkerConfig(id, kind, poolId, tokenSide, swapDirection, wallet, initialAmount,
            autoRefill, shareOutput, newStatus, createdAt, lastOperationAt);
    }

    public WorkerConfig withLastOperationAt(Instant at) {
        return new WorkerConfig(id, kind, poolId, tokenSide, swapDirection, wallet, initialAmount,
            autoRefill, shareOutput, status, createdAt, at);
    }

    public WorkerConfig withWallet(WalletCredential newWallet) {
        return new WorkerConfig(id, kind, poolId, tokenSide, swapDirection, newWallet, initialAmount,
            autoRefill, shareOutput, status, createdAt, lastOperationAt);
    }
}

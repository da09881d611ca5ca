package org.fixedratio.stresstest.api.workers;

/**
 * Parameters for creating a new worker.
 *
 * @param kind          The kind of worker.
 * @param poolId        The pool the worker trades against.
 * @param tokenSide     The token side for deposit and withdrawal workers.
 * @param swapDirection The direction for swap workers, {@code null} otherwise.
 * @param initialAmount Test tokens seeded into the wallet on first start (base units).
 * @param autoRefill    Whether the worker re-mints tokens when it runs dry.
 * @param shareOutput   Whether received LP tokens or swap proceeds are passed to a peer worker.
 */
public record WorkerRequest(
    WorkerKind kind,
    String poolId,
    TokenSide tokenSide,
    SwapDirection swapDirection,
    long initialAmount,
    boolean autoRefill,
    boolean shareOutput
) {

    public static WorkerRequest deposit(String poolId, TokenSide side, long initialAmount) {
        return new WorkerRequest(WorkerKind.DEPOSIT, poolId, side, null, initialAmount, true, false);
    }

    public static WorkerRequest withdrawal(String poolId, TokenSide side) {
        return new WorkerRequest(WorkerKind.WITHDRAWAL, poolId, side, null, 0L, false, false);
    }

    public static WorkerRequest swap(String poolId, SwapDirection direction, long initialAmount) {
        return new WorkerRequest(WorkerKind.SWAP, poolId, direction.inputSide(), direction, initialAmount, true, false);
    }

    public WorkerRequest withShareOutput(boolean share) {
        return new WorkerRequest(kind, poolId, tokenSide, swapDirection, initialAmount, autoRefill, share);
    }

    public WorkerRequest withAutoRefill(boolean refill) {
        return new WorkerRequest(kind, poolId, tokenSide, swapDirection, initialAmount, refill, shareOutput);
    }
}

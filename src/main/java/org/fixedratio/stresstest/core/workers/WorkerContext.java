package org.fixedratio.stresstest.core.workers;

import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.fixedratio.stresstest.api.workers.TokenSide;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerKind;

/**
 * Per-iteration runtime state of a worker. Rebuilt from the {@link WorkerConfig} at the start of
 * every loop iteration and confined to the worker's own thread.
 */
public final class WorkerContext {

    public static final double DEFAULT_SLIPPAGE = 0.01;

    private final WorkerConfig config;
    private double slippageTolerance = DEFAULT_SLIPPAGE;
    private int retryCount;
    private WorkerKind lastOperationKind;

    public WorkerContext(WorkerConfig config) {
        this.config = config;
    }

    public String workerId() {
        return config.id();
    }

    public WorkerKind kind() {
        return config.kind();
    }

    public String poolId() {
        return config.poolId();
    }

    public TokenSide tokenSide() {
        return config.tokenSide();
    }

    public SwapDirection swapDirection() {
        return config.swapDirection();
    }

    public WalletCredential wallet() {
        return config.wallet();
    }

    public long initialAmount() {
        return config.initialAmount();
    }

    public boolean autoRefill() {
        return config.autoRefill();
    }

    public boolean shareOutput() {
        return config.shareOutput();
    }

    public double slippageTolerance() {
        return slippageTolerance;
    }

    public void setSlippageTolerance(double slippageTolerance) {
        this.slippageTolerance = slippageTolerance;
    }

    public int retryCount() {
        return retryCount;
    }

    public void incrementRetryCount() {
        retryCount++;
    }

    public WorkerKind lastOperationKind() {
        return lastOperationKind;
    }

    public void setLastOperationKind(WorkerKind lastOperationKind) {
        this.lastOperationKind = lastOperationKind;
    }

    public String workingMint(PoolState pool) {
        return workingMint(config, pool);
    }

    /**
     * Returns the mint a worker spends: the pool token for deposits, the side LP mint for
     * withdrawals and the input token for swaps.
     *
     * @param config The worker configuration.
     * @param pool   The pool state.
     * @return The mint whose balance the worker's operations consume.
     */
    public static String workingMint(WorkerConfig config, PoolState pool) {
        return switch (config.kind()) {
            case DEPOSIT -> pool.tokenMint(config.tokenSide());
            case WITHDRAWAL -> pool.lpMint(config.tokenSide());
            case SWAP -> pool.tokenMint(config.swapDirection().inputSide());
        };
    }
}

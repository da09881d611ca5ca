package org.fixedratio.stresstest.core.drain;

import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.OperationReceipt;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerStatus;
import org.fixedratio.stresstest.core.budget.ResourceBudgeter;
import org.fixedratio.stresstest.core.lifecycle.OperationalWallet;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import org.fixedratio.stresstest.core.workers.WorkerContext;
import org.fixedratio.stresstest.core.workers.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Decommissions a worker by irreversibly burning its holdings.
 * <p>
 * The order of steps is fixed:
 * <ol>
 *   <li>read the balance of the worker's working mint; an empty wallet is left untouched</li>
 *   <li>burn the whole balance to {@link IChainClient#BURN_ADDRESS}</li>
 *   <li>run the worker's terminal operation with the burned amount and burn whatever it returns</li>
 *   <li>sweep the remaining native balance, minus a fee buffer, to the operational wallet</li>
 * </ol>
 * The burn in step 2 is never rolled back. A failing terminal operation only changes the outcome
 * to {@link DrainOutcome#OPERATION_FAILED}; a failing sweep is only logged.
 */
public class DrainHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DrainHandler.class);

    static final double SWAP_MINIMUM_OUTPUT_FACTOR = 0.9;

    private final WorkerPool workerPool;
    private final IChainClient chainClient;
    private final ResourceBudgeter budgeter;
    private final RatioNormalizer normalizer;
    private final OperationalWallet operationalWallet;
    private final long feeBuffer;

    public DrainHandler(WorkerPool workerPool, IChainClient chainClient, ResourceBudgeter budgeter,
                        RatioNormalizer normalizer, OperationalWallet operationalWallet, long feeBuffer) {
        if (feeBuffer < 0) {
            throw new IllegalArgumentException("Fee buffer must not be negative");
        }
        this.workerPool = workerPool;
        this.chainClient = chainClient;
        this.budgeter = budgeter;
        this.normalizer = normalizer;
        this.operationalWallet = operationalWallet;
        this.feeBuffer = feeBuffer;
    }

    /**
     * Drains a worker. The worker is stopped first if it is running or paused.
     *
     * @param workerId The worker id.
     * @return The drain report.
     * @throws IllegalArgumentException if the worker does not exist.
     * @throws DrainException           if the balance cannot be read or the burn fails.
     */
    public DrainResult drain(String workerId) {
        WorkerConfig config = workerPool.getConfig(workerId)
            .orElseThrow(() -> new IllegalArgumentException("Worker '" + workerId + "' does not exist"));
        if (config.status() == WorkerStatus.RUNNING || config.status() == WorkerStatus.PAUSED) {
            workerPool.stop(workerId);
        }

        Instant startedAt = Instant.now();
        WalletCredential wallet = config.wallet();
        PoolState pool;
        String mint;
        long balance;
        try {
            pool = chainClient.getPoolState(config.poolId());
            mint = WorkerContext.workingMint(config, pool);
            balance = chainClient.getTokenBalance(wallet.address(), mint);
        } catch (ChainClientException e) {
            throw new DrainException("Could not read balance of worker " + workerId + ": " + e.getMessage(), e);
        }

        if (balance <= 0) {
            LOGGER.info("Worker {} holds no {} tokens, nothing to drain", workerId, mint);
            return DrainResult.nothingToDrain(workerId, config.kind(), mint, startedAt);
        }

        String burnSignature;
        try {
            burnSignature = chainClient.transferTokens(wallet, mint, IChainClient.BURN_ADDRESS, balance);
        } catch (ChainClientException e) {
            throw new DrainException("Burning " + balance + " tokens of worker " + workerId + " failed: " + e.getMessage(), e);
        }
        LOGGER.info("Burned {} tokens of {} held by worker {}", balance, mint, workerId);

        long operationInput = 0;
        long operationOutput = 0;
        long outputBurned = 0;
        long fee = 0;
        String operationSignature = null;
        String error = null;
        DrainOutcome outcome;
        try {
            OperationReceipt receipt = runTerminalOperation(config, wallet, pool, mint, balance);
            operationInput = receipt.amountIn();
            operationOutput = receipt.amountOut();
            operationSignature = receipt.signature();
            fee = receipt.fee();
            outcome = DrainOutcome.COMPLETED;
            if (operationOutput > 0) {
                String outputMint = outputMint(config, pool);
                try {
                    chainClient.transferTokens(wallet, outputMint, IChainClient.BURN_ADDRESS, operationOutput);
                    outputBurned = operationOutput;
                } catch (ChainClientException e) {
                    error = "Burning operation output failed: " + e.getMessage();
                    LOGGER.warn("Worker {} could not burn {} output tokens of {}: {}", workerId, operationOutput, outputMint, e.getMessage());
                }
            }
        } catch (ChainClientException e) {
            outcome = DrainOutcome.OPERATION_FAILED;
            error = e.getMessage();
            LOGGER.warn("Drain operation of worker {} failed after burning {} tokens: {}", workerId, balance, e.getMessage());
        }

        long swept = sweepNative(workerId, wallet);
        DrainResult result = new DrainResult(workerId, config.kind(), outcome, mint, balance, burnSignature,
            operationInput, operationOutput, outputBurned, operationSignature, error, swept, fee, startedAt);
        LOGGER.info("Drained worker {}: outcome={}, burned={}, swept={}", workerId, outcome, result.totalBurned(), swept);
        return result;
    }

    private OperationReceipt runTerminalOperation(WorkerConfig config, WalletCredential wallet, PoolState pool,
                                                  String mint, long amount) throws ChainClientException {
        return switch (config.kind()) {
            case DEPOSIT -> chainClient.deposit(wallet, config.poolId(), mint, amount,
                budgeter.getBudget(ResourceBudgeter.DEPOSIT));
            case WITHDRAWAL -> chainClient.withdraw(wallet, config.poolId(), mint, amount,
                budgeter.getBudget(ResourceBudgeter.WITHDRAW));
            case SWAP -> {
                long expected = normalizer.quoteSwap(pool, config.swapDirection(), amount);
                long minimumOut = (long) (expected * SWAP_MINIMUM_OUTPUT_FACTOR);
                yield chainClient.swap(wallet, config.poolId(), config.swapDirection(), amount, minimumOut,
                    budgeter.getBudget(ResourceBudgeter.SWAP));
            }
        };
    }

    private static String outputMint(WorkerConfig config, PoolState pool) {
        return switch (config.kind()) {
            case DEPOSIT -> pool.lpMint(config.tokenSide());
            case WITHDRAWAL -> pool.tokenMint(config.tokenSide());
            case SWAP -> pool.tokenMint(config.swapDirection().outputSide());
        };
    }

    private long sweepNative(String workerId, WalletCredential wallet) {
        WalletCredential target = operationalWallet.get().orElse(null);
        if (target == null) {
            LOGGER.info("No operational wallet available, skipping native sweep for worker {}", workerId);
            return 0;
        }
        try {
            long nativeBalance = chainClient.getNativeBalance(wallet.address());
            long sweepable = nativeBalance - feeBuffer;
            if (sweepable <= 0) {
                LOGGER.debug("Worker {} native balance {} within fee buffer, nothing to sweep", workerId, nativeBalance);
                return 0;
            }
            chainClient.transferNative(wallet, target.address(), sweepable);
            return sweepable;
        } catch (ChainClientException e) {
            LOGGER.warn("Native sweep of worker {} failed: {}", workerId, e.getMessage());
            return 0;
        }
    }
}

package org.fixedratio.stresstest.core.workers;

import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.OperationReceipt;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerError;
import org.fixedratio.stresstest.api.workers.WorkerKind;
import org.fixedratio.stresstest.core.budget.ResourceBudgeter;
import org.fixedratio.stresstest.core.errors.ErrorClassifier;
import org.fixedratio.stresstest.core.errors.RecoveryVerdict;
import org.fixedratio.stresstest.core.lifecycle.SystemState;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The execution loop of one worker.
 * <p>
 * Each iteration builds one operation from the worker's configuration, submits it through the
 * chain client and reports the outcome to the {@link WorkerPool}. Failures go to the
 * {@link ErrorClassifier}, whose verdict decides whether the same operation is retried. No single
 * failure ends the loop; only cancellation does.
 * <p>
 * Error handling follows the usual rules: transient failures are logged at WARN without a stack
 * trace and recorded in the worker's statistics, stack traces go to DEBUG.
 */
final class WorkerLoop implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerLoop.class);

    private final WorkerConfig config;
    private final CancellationHandle handle;
    private final WorkerPool pool;
    private final IChainClient chainClient;
    private final ErrorClassifier errorClassifier;
    private final ResourceBudgeter budgeter;
    private final RatioNormalizer normalizer;
    private final SystemState systemState;
    private final WorkerSettings settings;

    WorkerLoop(WorkerConfig config, CancellationHandle handle, WorkerPool pool, IChainClient chainClient,
               ErrorClassifier errorClassifier, ResourceBudgeter budgeter, RatioNormalizer normalizer,
               SystemState systemState, WorkerSettings settings) {
        this.config = config;
        this.handle = handle;
        this.pool = pool;
        this.chainClient = chainClient;
        this.errorClassifier = errorClassifier;
        this.budgeter = budgeter;
        this.normalizer = normalizer;
        this.systemState = systemState;
        this.settings = settings;
    }

    @Override
    public void run() {
        LOGGER.debug("Worker loop {} started", config.id());
        try {
            while (!handle.isCancelled()) {
                if (systemState.isPaused()) {
                    if (handle.waitOrCancelled(settings.pausedPollInterval())) {
                        break;
                    }
                    continue;
                }
                try {
                    runIteration();
                } catch (RuntimeException e) {
                    LOGGER.warn("Worker {} hit an unexpected {}: {}", config.id(), e.getClass().getSimpleName(), e.getMessage());
                    LOGGER.debug("Exception details:", e);
                    pool.recordFailure(config.id(), new WorkerError(Instant.now(),
                        e.getClass().getSimpleName() + ": " + e.getMessage(), config.kind(), null));
                    if (handle.waitOrCancelled(settings.errorBackoff())) {
                        break;
                    }
                    continue;
                }
                if (handle.waitOrCancelled(nextDelay())) {
                    break;
                }
            }
        } finally {
            LOGGER.debug("Worker loop {} ended", config.id());
        }
    }

    /**
     * Runs one operation including its retries.
     */
    void runIteration() {
        WorkerContext context = new WorkerContext(config);
        int attempts = 0;
        while (!handle.isCancelled()) {
            attempts++;
            context.setLastOperationKind(config.kind());
            try {
                Optional<Executed> executed = executeOnce(context);
                if (executed.isEmpty()) {
                    return;
                }
                OperationReceipt receipt = executed.get().receipt();
                pool.recordSuccess(config.id(), receipt.amountIn(), receipt.fee(), Instant.now());
                LOGGER.debug("Worker {} {} ok: in={} out={} fee={} sig={}", config.id(), config.kind(),
                    receipt.amountIn(), receipt.amountOut(), receipt.fee(), receipt.signature());
                if (context.shareOutput()) {
                    shareOutput(executed.get());
                }
                return;
            } catch (ChainClientException e) {
                RecoveryVerdict verdict = errorClassifier.handle(e.getMessage(), context, handle);
                switch (verdict) {
                    case RETRY -> {
                        if (attempts >= settings.maxAttemptsPerOperation()) {
                            recordFailure(context, e.getMessage() + " (gave up after " + attempts + " attempts)");
                            return;
                        }
                    }
                    case RECORD_AND_CONTINUE -> {
                        recordFailure(context, e.getMessage());
                        return;
                    }
                    case CONTINUE, CANCELLED -> {
                        return;
                    }
                }
            }
        }
    }

    private Optional<Executed> executeOnce(WorkerContext context) throws ChainClientException {
        PoolState poolState = chainClient.getPoolState(config.poolId());
        return switch (config.kind()) {
            case DEPOSIT -> deposit(context, poolState);
            case WITHDRAWAL -> withdraw(poolState);
            case SWAP -> swap(context, poolState);
        };
    }

    private Optional<Executed> deposit(WorkerContext context, PoolState poolState) throws ChainClientException {
        String mint = poolState.tokenMint(config.tokenSide());
        long balance = availableBalance(context, mint);
        if (balance <= 0) {
            return Optional.empty();
        }
        long lower = Math.min(settings.minDepositAmount(), balance);
        long upper = Math.min(balance, Math.max(settings.minDepositAmount(), (long) (balance * settings.depositMaxFraction())));
        long amount = randomBetween(lower, Math.max(lower, upper));
        OperationReceipt receipt = chainClient.deposit(wallet(), config.poolId(), mint, amount,
            budgeter.getBudget(ResourceBudgeter.DEPOSIT));
        return Optional.of(new Executed(poolState, receipt));
    }

    private Optional<Executed> withdraw(PoolState poolState) throws ChainClientException {
        String lpMint = poolState.lpMint(config.tokenSide());
        long lpBalance = chainClient.getTokenBalance(wallet().address(), lpMint);
        if (lpBalance <= 0) {
            LOGGER.debug("Worker {} has no LP tokens to withdraw", config.id());
            return Optional.empty();
        }
        long amount = randomBetween(1, lpBalance);
        OperationReceipt receipt = chainClient.withdraw(wallet(), config.poolId(), lpMint, amount,
            budgeter.getBudget(ResourceBudgeter.WITHDRAW));
        return Optional.of(new Executed(poolState, receipt));
    }

    private Optional<Executed> swap(WorkerContext context, PoolState poolState) throws ChainClientException {
        SwapDirection direction = config.swapDirection();
        String inputMint = poolState.tokenMint(direction.inputSide());
        long balance = availableBalance(context, inputMint);
        if (balance <= 0) {
            return Optional.empty();
        }
        long upper = Math.min(balance, Math.max(1, (long) (balance * settings.swapMaxFraction())));
        long amount = randomBetween(1, upper);
        long expected = normalizer.quoteSwap(poolState, direction, amount);
        long minimumOut = (long) Math.floor(expected * (1.0 - context.slippageTolerance()));
        OperationReceipt receipt = chainClient.swap(wallet(), config.poolId(), direction, amount, minimumOut,
            budgeter.getBudget(ResourceBudgeter.SWAP));
        return Optional.of(new Executed(poolState, receipt));
    }

    /**
     * Returns the balance of the working mint, refilling it first if it is empty and the worker
     * is allowed to refill.
     */
    private long availableBalance(WorkerContext context, String mint) throws ChainClientException {
        String address = wallet().address();
        long balance = chainClient.getTokenBalance(address, mint);
        if (balance > 0) {
            return balance;
        }
        if (!context.autoRefill() || context.initialAmount() <= 0) {
            LOGGER.debug("Worker {} has no {} tokens and does not refill", config.id(), mint);
            return 0;
        }
        chainClient.mintTokens(mint, address, context.initialAmount());
        LOGGER.info("Refilled worker {} with {} tokens", config.id(), context.initialAmount());
        return chainClient.getTokenBalance(address, mint);
    }

    private void shareOutput(Executed executed) {
        long amount = executed.receipt().amountOut();
        if (amount <= 0) {
            return;
        }
        Optional<WorkerConfig> peer = pool.findSharePeer(config);
        if (peer.isEmpty()) {
            LOGGER.debug("Worker {} found no peer to share {} tokens with", config.id(), amount);
            return;
        }
        String mint = config.kind() == WorkerKind.DEPOSIT
            ? executed.pool().lpMint(config.tokenSide())
            : executed.pool().tokenMint(config.swapDirection().outputSide());
        try {
            chainClient.transferTokens(wallet(), mint, peer.get().wallet().address(), amount);
            LOGGER.debug("Worker {} shared {} tokens of {} with {}", config.id(), amount, mint, peer.get().id());
        } catch (ChainClientException e) {
            LOGGER.warn("Worker {} could not share output with {}: {}", config.id(), peer.get().id(), e.getMessage());
        }
    }

    private void recordFailure(WorkerContext context, String message) {
        Integer code = errorClassifier.classify(message).code();
        WorkerKind kind = context.lastOperationKind() != null ? context.lastOperationKind() : config.kind();
        pool.recordFailure(config.id(), new WorkerError(Instant.now(), message, kind, code));
        LOGGER.warn("Worker {} {} operation failed: {}", config.id(), kind, message);
    }

    private WalletCredential wallet() {
        return config.wallet();
    }

    private Duration nextDelay() {
        return Duration.ofMillis(randomBetween(settings.delayMin().toMillis(), settings.delayMax().toMillis()));
    }

    private static long randomBetween(long lower, long upper) {
        if (upper <= lower) {
            return lower;
        }
        return ThreadLocalRandom.current().nextLong(lower, upper + 1);
    }

    private record Executed(PoolState pool, OperationReceipt receipt) {
    }
}

package org.fixedratio.stresstest.core.errors;

import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.WorkerKind;
import org.fixedratio.stresstest.core.workers.CancellationHandle;
import org.fixedratio.stresstest.core.workers.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw chain-client failures into typed classifications and runs the matching recovery policy.
 * <p>
 * {@link #classify(String)} is a pure function. {@link #handle(String, WorkerContext, CancellationHandle)}
 * executes the policy on the calling worker thread and always returns a verdict; it never throws.
 * All waits go through the worker's {@link CancellationHandle} so a stop is never delayed by a
 * full poll interval.
 */
public class ErrorClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorClassifier.class);

    private static final Pattern CUSTOM_CODE = Pattern.compile("Custom\\((\\d+)\\)");
    private static final Pattern HEX_CODE = Pattern.compile("0x[0-9a-fA-F]+\\s*\\((\\d+)\\)");

    private final IChainClient chainClient;
    private final RecoverySettings settings;

    public ErrorClassifier(IChainClient chainClient, RecoverySettings settings) {
        this.chainClient = chainClient;
        this.settings = settings;
    }

    public RecoverySettings getSettings() {
        return settings;
    }

    /**
     * Extracts a contract error code from a free-text failure and maps it to an error kind.
     *
     * @param rawError The raw failure message, may be {@code null}.
     * @return The classification. Unrecognized text yields {@link ErrorKind#UNKNOWN} without a code;
     *         a code without a dedicated policy yields {@link ErrorKind#UNKNOWN} with the code.
     */
    public ErrorClassification classify(String rawError) {
        Integer code = parseCode(rawError);
        if (code == null) {
            return ErrorClassification.of(ErrorKind.UNKNOWN, null);
        }
        ErrorKind kind = ContractError.fromCode(code).map(ContractError::kind).orElse(ErrorKind.UNKNOWN);
        return ErrorClassification.of(kind, code);
    }

    static Integer parseCode(String rawError) {
        if (rawError == null || rawError.isEmpty()) {
            return null;
        }
        Integer code = firstGroup(CUSTOM_CODE.matcher(rawError));
        return code != null ? code : firstGroup(HEX_CODE.matcher(rawError));
    }

    private static Integer firstGroup(Matcher matcher) {
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            LOGGER.debug("Ignoring unparseable error code '{}'", matcher.group(1));
            return null;
        }
    }

    /**
     * Classifies a failure and runs its recovery policy.
     *
     * @param rawError     The raw failure message.
     * @param context      The failing worker's per-iteration context; slippage and retry count may be updated.
     * @param cancellation The worker's cancellation handle.
     * @return What the worker loop should do next.
     */
    public RecoveryVerdict handle(String rawError, WorkerContext context, CancellationHandle cancellation) {
        ErrorClassification classification = classify(rawError);
        LOGGER.debug("Worker {} failed with {}: {}", context.workerId(), classification.describe(), rawError);
        try {
            return switch (classification.kind()) {
                case INSUFFICIENT_FUNDS -> handleInsufficientFunds(context, cancellation);
                case POOL_PAUSED -> pollUntilClear(context, cancellation, "pool pause",
                    settings.poolPausedMaxPolls(), () -> chainClient.getPoolState(context.poolId()).poolPaused());
                case SYSTEM_PAUSED -> pollUntilClear(context, cancellation, "system pause",
                    settings.systemPausedMaxPolls(), chainClient::isSystemPaused);
                case INSUFFICIENT_LIQUIDITY -> handleInsufficientLiquidity(context, cancellation);
                case SLIPPAGE_EXCEEDED -> handleSlippage(context, cancellation);
                case INVALID_TOKEN_ACCOUNT, INVALID_LP_TOKEN_TYPE -> {
                    LOGGER.warn("Worker {} hit configuration error {}, not retrying",
                        context.workerId(), classification.describe());
                    yield RecoveryVerdict.RECORD_AND_CONTINUE;
                }
                case POOL_SWAPS_PAUSED -> handleSwapsPaused(context, cancellation);
                case UNKNOWN -> handleUnknown(context, cancellation, classification);
            };
        } catch (RuntimeException e) {
            LOGGER.warn("Recovery for worker {} failed: {}", context.workerId(), e.getMessage());
            LOGGER.debug("Recovery failure details:", e);
            return RecoveryVerdict.RECORD_AND_CONTINUE;
        }
    }

    private RecoveryVerdict handleInsufficientFunds(WorkerContext context, CancellationHandle cancellation) {
        if (context.kind() == WorkerKind.DEPOSIT && context.autoRefill() && context.initialAmount() > 0) {
            try {
                PoolState pool = chainClient.getPoolState(context.poolId());
                String mint = pool.tokenMint(context.tokenSide());
                String address = context.wallet().address();
                long balance = chainClient.getTokenBalance(address, mint);
                long threshold = (long) (context.initialAmount() * settings.refillThreshold());
                if (balance < threshold) {
                    LOGGER.info("Refilling worker {} with {} tokens (balance {} below {})",
                        context.workerId(), context.initialAmount(), balance, threshold);
                    chainClient.mintTokens(mint, address, context.initialAmount());
                }
            } catch (ChainClientException e) {
                LOGGER.warn("Refill for worker {} failed: {}", context.workerId(), e.getMessage());
                return RecoveryVerdict.RECORD_AND_CONTINUE;
            }
        }
        return waitThenRetry(cancellation, settings.insufficientFundsDelay());
    }

    private RecoveryVerdict handleInsufficientLiquidity(WorkerContext context, CancellationHandle cancellation) {
        if (context.kind() == WorkerKind.DEPOSIT) {
            LOGGER.warn("Worker {} got insufficient liquidity on a deposit", context.workerId());
            return RecoveryVerdict.RECORD_AND_CONTINUE;
        }
        return waitThenRetry(cancellation, settings.liquidityDelay());
    }

    private RecoveryVerdict handleSlippage(WorkerContext context, CancellationHandle cancellation) {
        double raised = Math.min(context.slippageTolerance() * settings.slippageMultiplier(), settings.slippageCap());
        LOGGER.debug("Worker {} raising slippage tolerance from {} to {}",
            context.workerId(), context.slippageTolerance(), raised);
        context.setSlippageTolerance(raised);
        return waitThenRetry(cancellation, settings.slippageDelay());
    }

    private RecoveryVerdict handleSwapsPaused(WorkerContext context, CancellationHandle cancellation) {
        if (context.kind() != WorkerKind.SWAP) {
            return RecoveryVerdict.CONTINUE;
        }
        return pollUntilClear(context, cancellation, "swap pause",
            settings.swapsPausedMaxPolls(), () -> chainClient.getPoolState(context.poolId()).swapsPaused());
    }

    private RecoveryVerdict handleUnknown(WorkerContext context, CancellationHandle cancellation,
                                          ErrorClassification classification) {
        if (context.retryCount() < settings.unknownMaxRetries()) {
            context.incrementRetryCount();
            LOGGER.debug("Worker {} retrying unknown error {}/{}",
                context.workerId(), context.retryCount(), settings.unknownMaxRetries());
            return waitThenRetry(cancellation, settings.unknownDelay());
        }
        LOGGER.debug("Worker {} exhausted retries for {}", context.workerId(), classification.describe());
        return RecoveryVerdict.RECORD_AND_CONTINUE;
    }

    private RecoveryVerdict pollUntilClear(WorkerContext context, CancellationHandle cancellation,
                                           String what, int maxPolls, PauseProbe probe) {
        if (cancellation.isCancelled()) {
            return RecoveryVerdict.CANCELLED;
        }
        // The pause may already be over by the time the failure is handled.
        if (!stillPaused(context, what, probe)) {
            LOGGER.debug("Worker {} found {} already cleared", context.workerId(), what);
            return RecoveryVerdict.RETRY;
        }
        LOGGER.info("Worker {} waiting for {} to clear", context.workerId(), what);
        for (int poll = 1; poll <= maxPolls; poll++) {
            if (cancellation.waitOrCancelled(settings.pollInterval())) {
                return RecoveryVerdict.CANCELLED;
            }
            if (!stillPaused(context, what, probe)) {
                LOGGER.info("Worker {} resuming after {} cleared ({} polls)", context.workerId(), what, poll);
                return RecoveryVerdict.RETRY;
            }
            if (settings.pollLogEvery() > 0 && poll % settings.pollLogEvery() == 0) {
                LOGGER.info("Worker {} still waiting for {} ({}/{} polls)", context.workerId(), what, poll, maxPolls);
            }
        }
        LOGGER.warn("Worker {} gave up waiting for {} after {} polls", context.workerId(), what, maxPolls);
        return RecoveryVerdict.RECORD_AND_CONTINUE;
    }

    /**
     * A failing probe counts as still paused.
     */
    private static boolean stillPaused(WorkerContext context, String what, PauseProbe probe) {
        try {
            return probe.isPaused();
        } catch (ChainClientException e) {
            LOGGER.debug("Worker {} could not poll {}: {}", context.workerId(), what, e.getMessage());
            return true;
        }
    }

    private static RecoveryVerdict waitThenRetry(CancellationHandle cancellation, Duration delay) {
        return cancellation.waitOrCancelled(delay) ? RecoveryVerdict.CANCELLED : RecoveryVerdict.RETRY;
    }

    @FunctionalInterface
    private interface PauseProbe {
        boolean isPaused() throws ChainClientException;
    }
}

package org.fixedratio.stresstest.core.workers;

import com.typesafe.config.Config;
import org.fixedratio.stresstest.api.chain.IChainClient;

import java.time.Duration;

/**
 * Tunables of the worker pool and its loops.
 *
 * @param delayMin                  Lower bound of the jittered delay between operations.
 * @param delayMax                  Upper bound of the jittered delay between operations.
 * @param stopTimeout               How long a stop waits for the loop thread to end.
 * @param maxAttemptsPerOperation   Retry verdicts honored for one operation before it is recorded as failed.
 * @param errorBackoff              Wait after an unexpected error inside the loop.
 * @param pausedPollInterval        Re-check interval while the system is paused.
 * @param minNativeBalance          Native balance below which a worker is funded on start.
 * @param nativeFundingAmount       Native amount requested when funding a worker.
 * @param minDepositAmount          Smallest deposit a worker makes if its balance allows.
 * @param depositMaxFraction        Largest deposit as a fraction of the token balance.
 * @param swapMaxFraction           Largest swap as a fraction of the input balance.
 */
public record WorkerSettings(
    Duration delayMin,
    Duration delayMax,
    Duration stopTimeout,
    int maxAttemptsPerOperation,
    Duration errorBackoff,
    Duration pausedPollInterval,
    long minNativeBalance,
    long nativeFundingAmount,
    long minDepositAmount,
    double depositMaxFraction,
    double swapMaxFraction
) {

    public WorkerSettings {
        if (delayMax.compareTo(delayMin) < 0) {
            throw new IllegalArgumentException("delay-max must not be shorter than delay-min");
        }
        if (maxAttemptsPerOperation < 1) {
            throw new IllegalArgumentException("max-attempts-per-operation must be at least 1");
        }
    }

    public static WorkerSettings defaults() {
        return new WorkerSettings(
            Duration.ofMillis(750), Duration.ofMillis(2000), Duration.ofSeconds(5), 10,
            Duration.ofSeconds(5), Duration.ofSeconds(1),
            IChainClient.NATIVE_UNITS_PER_COIN / 10, IChainClient.NATIVE_UNITS_PER_COIN,
            1_000L, 0.05, 0.02);
    }

    /**
     * Reads settings from a {@code workers} configuration block. Missing keys keep their defaults.
     *
     * @param options The configuration block.
     * @return The settings.
     */
    public static WorkerSettings fromConfig(Config options) {
        WorkerSettings d = defaults();
        return new WorkerSettings(
            options.hasPath("delay-min") ? options.getDuration("delay-min") : d.delayMin(),
            options.hasPath("delay-max") ? options.getDuration("delay-max") : d.delayMax(),
            options.hasPath("stop-timeout") ? options.getDuration("stop-timeout") : d.stopTimeout(),
            options.hasPath("max-attempts-per-operation") ? options.getInt("max-attempts-per-operation") : d.maxAttemptsPerOperation(),
            options.hasPath("error-backoff") ? options.getDuration("error-backoff") : d.errorBackoff(),
            options.hasPath("paused-poll-interval") ? options.getDuration("paused-poll-interval") : d.pausedPollInterval(),
            options.hasPath("min-native-balance") ? options.getLong("min-native-balance") : d.minNativeBalance(),
            options.hasPath("native-funding-amount") ? options.getLong("native-funding-amount") : d.nativeFundingAmount(),
            options.hasPath("min-deposit-amount") ? options.getLong("min-deposit-amount") : d.minDepositAmount(),
            options.hasPath("deposit-max-fraction") ? options.getDouble("deposit-max-fraction") : d.depositMaxFraction(),
            options.hasPath("swap-max-fraction") ? options.getDouble("swap-max-fraction") : d.swapMaxFraction());
    }

    public WorkerSettings withDelays(Duration min, Duration max) {
        return new WorkerSettings(min, max, stopTimeout, maxAttemptsPerOperation, errorBackoff, pausedPollInterval,
            minNativeBalance, nativeFundingAmount, minDepositAmount, depositMaxFraction, swapMaxFraction);
    }
}

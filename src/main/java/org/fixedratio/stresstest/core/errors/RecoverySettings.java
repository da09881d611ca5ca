package org.fixedratio.stresstest.core.errors;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Timing and limits of the recovery policies.
 * <p>
 * Poll caps translate to wall-clock timeouts of roughly one hour for paused pools, two hours
 * for a paused system and thirty minutes for paused swaps at the default interval.
 *
 * @param pollInterval             Interval between pause-flag polls.
 * @param poolPausedMaxPolls       Poll cap for paused pools.
 * @param systemPausedMaxPolls     Poll cap for a paused system.
 * @param swapsPausedMaxPolls      Poll cap for paused swaps.
 * @param pollLogEvery             Log progress every this many polls.
 * @param insufficientFundsDelay   Wait after an insufficient-funds refill.
 * @param liquidityDelay           Wait after insufficient liquidity.
 * @param slippageDelay            Wait after a slippage failure.
 * @param slippageMultiplier       Factor applied to the slippage tolerance.
 * @param slippageCap              Maximum slippage tolerance.
 * @param unknownDelay             Wait between retries of unknown errors.
 * @param unknownMaxRetries        Retries of unknown errors before recording.
 * @param refillThreshold          Fraction of the initial amount below which a deposit worker refills.
 */
public record RecoverySettings(
    Duration pollInterval,
    int poolPausedMaxPolls,
    int systemPausedMaxPolls,
    int swapsPausedMaxPolls,
    int pollLogEvery,
    Duration insufficientFundsDelay,
    Duration liquidityDelay,
    Duration slippageDelay,
    double slippageMultiplier,
    double slippageCap,
    Duration unknownDelay,
    int unknownMaxRetries,
    double refillThreshold
) {

    public static RecoverySettings defaults() {
        return new RecoverySettings(
            Duration.ofSeconds(30), 120, 240, 60, 4,
            Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(2),
            1.5, 0.10,
            Duration.ofSeconds(5), 3,
            0.1);
    }

    /**
     * Reads settings from a {@code recovery} configuration block. Missing keys keep their defaults.
     *
     * @param options The configuration block.
     * @return The settings.
     */
    public static RecoverySettings fromConfig(Config options) {
        RecoverySettings d = defaults();
        return new RecoverySettings(
            duration(options, "poll-interval", d.pollInterval()),
            integer(options, "pool-paused-max-polls", d.poolPausedMaxPolls()),
            integer(options, "system-paused-max-polls", d.systemPausedMaxPolls()),
            integer(options, "swaps-paused-max-polls", d.swapsPausedMaxPolls()),
            integer(options, "poll-log-every", d.pollLogEvery()),
            duration(options, "insufficient-funds-delay", d.insufficientFundsDelay()),
            duration(options, "liquidity-delay", d.liquidityDelay()),
            duration(options, "slippage-delay", d.slippageDelay()),
            options.hasPath("slippage-multiplier") ? options.getDouble("slippage-multiplier") : d.slippageMultiplier(),
            options.hasPath("slippage-cap") ? options.getDouble("slippage-cap") : d.slippageCap(),
            duration(options, "unknown-delay", d.unknownDelay()),
            integer(options, "unknown-max-retries", d.unknownMaxRetries()),
            options.hasPath("refill-threshold") ? options.getDouble("refill-threshold") : d.refillThreshold());
    }

    private static Duration duration(Config options, String path, Duration fallback) {
        return options.hasPath(path) ? options.getDuration(path) : fallback;
    }

    private static int integer(Config options, String path, int fallback) {
        return options.hasPath(path) ? options.getInt(path) : fallback;
    }
}

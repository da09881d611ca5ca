package org.fixedratio.stresstest.core.pools;

import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Canonicalizes token pairs and exchange ratios.
 * <p>
 * The contract identifies a pool by its ordered token pair. The lexicographically smaller
 * mint (compared as unsigned UTF-8 bytes) is always token A. When the caller supplies the
 * pair in the other order, tokens and ratio sides are swapped together, which keeps the
 * exchange rate {@code ratioB / ratioA} unchanged.
 * <p>
 * This class is stateless and thread-safe.
 */
public class RatioNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RatioNormalizer.class);

    static final double MAX_REASONABLE_RATE = 1_000_000.0;
    static final double MIN_REASONABLE_RATE = 0.000001;

    /**
     * Normalizes a token pair and ratio into its canonical form.
     *
     * @param mintA  First token identity as supplied by the caller.
     * @param mintB  Second token identity as supplied by the caller.
     * @param ratioA Units of the first token.
     * @param ratioB Units of the second token.
     * @return The canonical configuration. Normalizing the result again returns an equal value.
     * @throws IllegalArgumentException if a mint is blank, both mints are equal, or a ratio is not positive.
     */
    public PoolRatioConfig normalize(String mintA, String mintB, long ratioA, long ratioB) {
        if (mintA == null || mintA.isBlank() || mintB == null || mintB.isBlank()) {
            throw new IllegalArgumentException("Token mints must not be blank");
        }
        if (mintA.equals(mintB)) {
            throw new IllegalArgumentException("Token mints must differ, got " + mintA + " twice");
        }
        if (ratioA <= 0 || ratioB <= 0) {
            throw new IllegalArgumentException(String.format("Ratios must be positive, got %d:%d", ratioA, ratioB));
        }

        boolean swap = compareMints(mintA, mintB) > 0;
        String tokenA = swap ? mintB : mintA;
        String tokenB = swap ? mintA : mintB;
        long numerator = swap ? ratioB : ratioA;
        long denominator = swap ? ratioA : ratioB;

        if (swap) {
            LOGGER.debug("Swapped token order for pool {}/{} to canonical {}/{}", mintA, mintB, tokenA, tokenB);
        }
        return new PoolRatioConfig(tokenA, tokenB, numerator, denominator, derivePoolId(tokenA, tokenB), swap);
    }

    /**
     * Validates the anchor-to-one rule: exactly one side of the ratio must equal one whole
     * token of that side. Extreme exchange rates are logged as a warning but accepted.
     *
     * @param config    The canonical configuration.
     * @param decimalsA Decimal places of token A.
     * @param decimalsB Decimal places of token B.
     * @throws InvalidPoolRatioException if neither or both sides are anchored.
     */
    public void validate(PoolRatioConfig config, int decimalsA, int decimalsB) {
        if (decimalsA < 0 || decimalsA > 18 || decimalsB < 0 || decimalsB > 18) {
            throw new InvalidPoolRatioException(String.format(
                "Invalid token decimals %d/%d, expected 0..18", decimalsA, decimalsB));
        }
        long expectedA = pow10(decimalsA);
        long expectedB = pow10(decimalsB);
        boolean anchoredA = config.ratioANumerator() == expectedA;
        boolean anchoredB = config.ratioBDenominator() == expectedB;

        if (!anchoredA && !anchoredB) {
            throw new InvalidPoolRatioException(String.format(
                "Invalid pool ratio: neither side is anchored to 1. Expected ratioA=%d or ratioB=%d, got %d:%d",
                expectedA, expectedB, config.ratioANumerator(), config.ratioBDenominator()));
        }
        if (anchoredA && anchoredB) {
            throw new InvalidPoolRatioException(String.format(
                "Invalid pool ratio: both sides are anchored to 1 (%d:%d), exactly one side must be",
                config.ratioANumerator(), config.ratioBDenominator()));
        }

        double rate = config.exchangeRate();
        if (rate > MAX_REASONABLE_RATE || rate < MIN_REASONABLE_RATE) {
            LOGGER.warn("Pool {} has an extreme exchange rate of {}", config.poolId(), rate);
        }
    }

    /**
     * Formats the exchange rate of a pool in whole-token terms, e.g. {@code 1 A = 2.5 B}.
     *
     * @param config    The canonical configuration.
     * @param decimalsA Decimal places of token A.
     * @param decimalsB Decimal places of token B.
     * @return The human-readable exchange rate.
     */
    public String exchangeRateDisplay(PoolRatioConfig config, int decimalsA, int decimalsB) {
        BigDecimal wholeA = BigDecimal.valueOf(config.ratioANumerator()).movePointLeft(decimalsA);
        BigDecimal wholeB = BigDecimal.valueOf(config.ratioBDenominator()).movePointLeft(decimalsB);
        BigDecimal perA = wholeB.divide(wholeA, 9, RoundingMode.HALF_UP).stripTrailingZeros();
        return "1 A = " + perA.toPlainString() + " B";
    }

    /**
     * Computes the output of a swap at the pool's fixed ratio, rounded down.
     *
     * @param pool      The pool state.
     * @param direction The swap direction.
     * @param amountIn  Input amount in base units.
     * @return Expected output amount in base units.
     */
    public long quoteSwap(PoolState pool, SwapDirection direction, long amountIn) {
        BigInteger in = BigInteger.valueOf(amountIn);
        BigInteger a = BigInteger.valueOf(pool.ratioANumerator());
        BigInteger b = BigInteger.valueOf(pool.ratioBDenominator());
        BigInteger out = direction == SwapDirection.A_TO_B
            ? in.multiply(b).divide(a)
            : in.multiply(a).divide(b);
        return out.min(BigInteger.valueOf(Long.MAX_VALUE)).longValueExact();
    }

    /**
     * Derives the pool reference for a canonical token pair.
     *
     * @param tokenA Token A mint.
     * @param tokenB Token B mint.
     * @return Lowercase hex SHA-256 of {@code tokenA + tokenB}.
     */
    public static String derivePoolId(String tokenA, String tokenB) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((tokenA + tokenB).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static int compareMints(String a, String b) {
        return Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    static long pow10(int exponent) {
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= 10;
        }
        return result;
    }
}

package org.fixedratio.stresstest.api.pools;

/**
 * Canonical representation of a pool's token pair and exchange ratio.
 * <p>
 * {@code ratioANumerator} units of token A trade for {@code ratioBDenominator} units of
 * token B, both in base units. Exactly one side is anchored to one whole token.
 *
 * @param tokenAMint       Identity of token A, the lexicographically smaller mint.
 * @param tokenBMint       Identity of token B.
 * @param ratioANumerator  Token A side of the ratio.
 * @param ratioBDenominator Token B side of the ratio.
 * @param poolId           Derived pool reference.
 * @param wasSwapped       Whether the caller's order had to be swapped.
 */
public record PoolRatioConfig(
    String tokenAMint,
    String tokenBMint,
    long ratioANumerator,
    long ratioBDenominator,
    String poolId,
    boolean wasSwapped
) {

    /**
     * Returns the number of token B base units per token A base unit.
     *
     * @return {@code ratioB / ratioA}.
     */
    public double exchangeRate() {
        return (double) ratioBDenominator / (double) ratioANumerator;
    }
}

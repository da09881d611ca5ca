package org.fixedratio.stresstest.api.pools;

import org.fixedratio.stresstest.api.workers.TokenSide;

/**
 * On-chain view of a pool as reported by the chain client.
 *
 * @param poolId            The pool reference.
 * @param tokenAMint        Token A mint.
 * @param tokenBMint        Token B mint.
 * @param tokenADecimals    Decimal places of token A.
 * @param tokenBDecimals    Decimal places of token B.
 * @param ratioANumerator   Token A side of the ratio.
 * @param ratioBDenominator Token B side of the ratio.
 * @param lpMintA           LP mint issued for token A deposits.
 * @param lpMintB           LP mint issued for token B deposits.
 * @param poolPaused        Whether liquidity operations are paused.
 * @param swapsPaused       Whether swaps are paused.
 */
public record PoolState(
    String poolId,
    String tokenAMint,
    String tokenBMint,
    int tokenADecimals,
    int tokenBDecimals,
    long ratioANumerator,
    long ratioBDenominator,
    String lpMintA,
    String lpMintB,
    boolean poolPaused,
    boolean swapsPaused
) {

    public String tokenMint(TokenSide side) {
        return side == TokenSide.A ? tokenAMint : tokenBMint;
    }

    public String lpMint(TokenSide side) {
        return side == TokenSide.A ? lpMintA : lpMintB;
    }

    public PoolState withPoolPaused(boolean paused) {
        return new PoolState(poolId, tokenAMint, tokenBMint, tokenADecimals, tokenBDecimals,
            ratioANumerator, ratioBDenominator, lpMintA, lpMintB, paused, swapsPaused);
    }

    public PoolState withSwapsPaused(boolean paused) {
        return new PoolState(poolId, tokenAMint, tokenBMint, tokenADecimals, tokenBDecimals,
            ratioANumerator, ratioBDenominator, lpMintA, lpMintB, poolPaused, paused);
    }
}

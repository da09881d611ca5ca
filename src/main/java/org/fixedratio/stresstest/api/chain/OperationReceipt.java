package org.fixedratio.stresstest.api.chain;

/**
 * Outcome of a confirmed deposit, withdrawal or swap.
 *
 * @param signature Transaction signature.
 * @param amountIn  Amount spent by the wallet (base units of the input token).
 * @param amountOut Amount received by the wallet (LP tokens, withdrawn tokens or swap proceeds).
 * @param fee       Network fee paid in native base units.
 */
public record OperationReceipt(String signature, long amountIn, long amountOut, long fee) {
}

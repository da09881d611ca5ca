package org.fixedratio.stresstest.api.workers;

/**
 * Direction of a swap through a pool.
 */
public enum SwapDirection {
    A_TO_B,
    B_TO_A;

    public SwapDirection opposite() {
        return this == A_TO_B ? B_TO_A : A_TO_B;
    }

    /**
     * Returns the side whose token is spent by a swap in this direction.
     *
     * @return The input side.
     */
    public TokenSide inputSide() {
        return this == A_TO_B ? TokenSide.A : TokenSide.B;
    }

    public TokenSide outputSide() {
        return this == A_TO_B ? TokenSide.B : TokenSide.A;
    }
}

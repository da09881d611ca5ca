package org.fixedratio.stresstest.core.budget;

/**
 * Dynamic inputs for operations whose compute budget depends on the request.
 *
 * @param poolCount      Number of pools touched by a fee consolidation.
 * @param donationAmount Donation amount in native base units.
 */
public record BudgetContext(int poolCount, long donationAmount) {

    public static BudgetContext ofPoolCount(int poolCount) {
        return new BudgetContext(poolCount, 0L);
    }

    public static BudgetContext ofDonation(long donationAmount) {
        return new BudgetContext(0, donationAmount);
    }
}

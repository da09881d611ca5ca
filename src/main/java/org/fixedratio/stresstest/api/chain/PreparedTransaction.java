package org.fixedratio.stresstest.api.chain;

import java.util.Map;

/**
 * An administrative transaction built by the harness and handed to the chain client for
 * submission and confirmation.
 *
 * @param operation    The contract instruction name, e.g. {@code process_pool_initialize}.
 * @param computeUnits The compute budget requested for the transaction.
 * @param parameters   Instruction parameters keyed by name.
 */
public record PreparedTransaction(String operation, int computeUnits, Map<String, Object> parameters) {

    public PreparedTransaction {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}

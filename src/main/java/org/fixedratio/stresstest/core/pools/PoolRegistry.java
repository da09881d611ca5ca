package org.fixedratio.stresstest.core.pools;

import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.PreparedTransaction;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.storage.IStateStore;
import org.fixedratio.stresstest.core.budget.ResourceBudgeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the pools the harness trades against, backed by the state store.
 */
public class PoolRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PoolRegistry.class);

    private final IChainClient chainClient;
    private final IStateStore stateStore;
    private final RatioNormalizer normalizer;
    private final ResourceBudgeter budgeter;
    private final Map<String, PoolRatioConfig> pools = new ConcurrentHashMap<>();

    public PoolRegistry(IChainClient chainClient, IStateStore stateStore, RatioNormalizer normalizer,
                        ResourceBudgeter budgeter) {
        this.chainClient = chainClient;
        this.stateStore = stateStore;
        this.normalizer = normalizer;
        this.budgeter = budgeter;
        pools.putAll(stateStore.loadPoolRegistry());
        LOGGER.debug("Loaded {} pool(s) from the state store", pools.size());
    }

    /**
     * Normalizes, validates and initializes a new pool on chain, then records it.
     *
     * @param mintA     First token mint as supplied.
     * @param mintB     Second token mint as supplied.
     * @param ratioA    Units of the first token.
     * @param ratioB    Units of the second token.
     * @param decimalsA Decimal places of the first token.
     * @param decimalsB Decimal places of the second token.
     * @return The canonical pool configuration.
     * @throws ChainClientException     if the initialization transaction fails.
     * @throws InvalidPoolRatioException if the ratio is not anchored.
     * @throws IllegalArgumentException  if the pool is already registered.
     */
    public PoolRatioConfig createPool(String mintA, String mintB, long ratioA, long ratioB,
                                      int decimalsA, int decimalsB) throws ChainClientException {
        PoolRatioConfig config = normalizer.normalize(mintA, mintB, ratioA, ratioB);
        int canonicalDecimalsA = config.wasSwapped() ? decimalsB : decimalsA;
        int canonicalDecimalsB = config.wasSwapped() ? decimalsA : decimalsB;
        normalizer.validate(config, canonicalDecimalsA, canonicalDecimalsB);

        if (pools.containsKey(config.poolId())) {
            throw new IllegalArgumentException("Pool " + config.poolId() + " is already registered");
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("tokenAMint", config.tokenAMint());
        parameters.put("tokenBMint", config.tokenBMint());
        parameters.put("ratioANumerator", config.ratioANumerator());
        parameters.put("ratioBDenominator", config.ratioBDenominator());
        parameters.put("tokenADecimals", canonicalDecimalsA);
        parameters.put("tokenBDecimals", canonicalDecimalsB);
        PreparedTransaction transaction = new PreparedTransaction(ResourceBudgeter.POOL_INITIALIZE,
            budgeter.getBudget(ResourceBudgeter.POOL_INITIALIZE), parameters);

        String signature = chainClient.submitTransaction(transaction);
        pools.put(config.poolId(), config);
        persist();
        LOGGER.info("Created pool {} ({}), signature {}", config.poolId(),
            normalizer.exchangeRateDisplay(config, canonicalDecimalsA, canonicalDecimalsB), signature);
        return config;
    }

    public boolean contains(String poolId) {
        return poolId != null && pools.containsKey(poolId);
    }

    public Optional<PoolRatioConfig> get(String poolId) {
        return Optional.ofNullable(pools.get(poolId));
    }

    public List<PoolRatioConfig> list() {
        List<PoolRatioConfig> result = new ArrayList<>(pools.values());
        result.sort(Comparator.comparing(PoolRatioConfig::poolId));
        return result;
    }

    /**
     * Checks every saved pool against the chain and drops those that can no longer be found.
     *
     * @return The number of pools that remain registered.
     */
    public int validateSavedPools() {
        int removed = 0;
        for (PoolRatioConfig config : list()) {
            try {
                PoolState state = chainClient.getPoolState(config.poolId());
                LOGGER.info("Pool {} ok (paused={}, swapsPaused={})", config.poolId(), state.poolPaused(), state.swapsPaused());
            } catch (ChainClientException e) {
                LOGGER.warn("Removing saved pool {}: {}", config.poolId(), e.getMessage());
                pools.remove(config.poolId());
                removed++;
            }
        }
        if (removed > 0) {
            persist();
        }
        return pools.size();
    }

    private void persist() {
        stateStore.savePoolRegistry(new LinkedHashMap<>(pools));
    }
}

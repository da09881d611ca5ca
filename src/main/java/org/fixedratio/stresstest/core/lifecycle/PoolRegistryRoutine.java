package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.core.pools.PoolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-validates the saved pools against the chain.
 */
public class PoolRegistryRoutine implements IStartupRoutine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PoolRegistryRoutine.class);

    private final PoolRegistry poolRegistry;

    public PoolRegistryRoutine(PoolRegistry poolRegistry) {
        this.poolRegistry = poolRegistry;
    }

    @Override
    public String getName() {
        return "pool-registry";
    }

    @Override
    public void start() {
        int remaining = poolRegistry.validateSavedPools();
        LOGGER.info("{} pool(s) available", remaining);
    }
}

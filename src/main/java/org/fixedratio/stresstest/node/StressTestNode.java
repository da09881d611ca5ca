package org.fixedratio.stresstest.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.lifecycle.IServiceLifecycle;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.storage.IStateStore;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.fixedratio.stresstest.api.workers.TokenSide;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerKind;
import org.fixedratio.stresstest.api.workers.WorkerRequest;
import org.fixedratio.stresstest.api.workers.WorkerStatistics;
import org.fixedratio.stresstest.core.budget.BudgetContext;
import org.fixedratio.stresstest.core.budget.ResourceBudgeter;
import org.fixedratio.stresstest.core.drain.DrainHandler;
import org.fixedratio.stresstest.core.drain.DrainResult;
import org.fixedratio.stresstest.core.errors.ErrorClassifier;
import org.fixedratio.stresstest.core.errors.RecoverySettings;
import org.fixedratio.stresstest.core.lifecycle.ContractVersionRoutine;
import org.fixedratio.stresstest.core.lifecycle.LifecycleController;
import org.fixedratio.stresstest.core.lifecycle.OperationalWallet;
import org.fixedratio.stresstest.core.lifecycle.OperationalWalletRoutine;
import org.fixedratio.stresstest.core.lifecycle.PoolRegistryRoutine;
import org.fixedratio.stresstest.core.lifecycle.StressTestEngine;
import org.fixedratio.stresstest.core.lifecycle.SystemState;
import org.fixedratio.stresstest.core.pools.PoolRegistry;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import org.fixedratio.stresstest.core.workers.WorkerPool;
import org.fixedratio.stresstest.core.workers.WorkerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Composition root of the harness.
 * <p>
 * Builds the chain client and state store from their {@code className}/{@code options}
 * declarations, wires the core components together and exposes the operations the outer
 * surfaces call. Starting the node starts the lifecycle and bootstraps the pools and workers
 * declared under {@code stress-test.bootstrap}; a shutdown hook stops everything.
 */
public final class StressTestNode {

    private static final Logger LOGGER = LoggerFactory.getLogger(StressTestNode.class);
    static final String ROOT_PATH = "stress-test";

    private final IChainClient chainClient;
    private final IStateStore stateStore;
    private final ResourceBudgeter budgeter;
    private final RatioNormalizer normalizer;
    private final PoolRegistry poolRegistry;
    private final WorkerPool workerPool;
    private final DrainHandler drainHandler;
    private final LifecycleController lifecycle;
    private final Config bootstrapConfig;
    private Thread shutdownHook;

    /**
     * Constructs the node from the fully resolved application configuration.
     *
     * @param config The root configuration, containing the {@code stress-test} section.
     */
    public StressTestNode(final Config config) {
        final Config root = config.getConfig(ROOT_PATH);
        try {
            this.chainClient = instantiate("chain", root.getConfig("chain"), IChainClient.class);
            this.stateStore = instantiate("storage", root.getConfig("storage"), IStateStore.class);
        } catch (final ReflectiveOperationException e) {
            LOGGER.error("Failed to initialize the node: {}", e.getMessage());
            throw new IllegalStateException("Node initialization failed", e);
        }

        final SystemState systemState = new SystemState();
        final OperationalWallet operationalWallet = new OperationalWallet();
        this.budgeter = new ResourceBudgeter(optionalConfig(root, "budget"));
        this.normalizer = new RatioNormalizer();
        final ErrorClassifier errorClassifier =
            new ErrorClassifier(chainClient, RecoverySettings.fromConfig(optionalConfig(root, "recovery")));
        this.poolRegistry = new PoolRegistry(chainClient, stateStore, normalizer, budgeter);
        this.workerPool = new WorkerPool(chainClient, stateStore, poolRegistry, errorClassifier, budgeter, normalizer,
            systemState, WorkerSettings.fromConfig(optionalConfig(root, "workers")));
        this.drainHandler = new DrainHandler(workerPool, chainClient, budgeter, normalizer, operationalWallet,
            root.getLong("drain.fee-buffer"));

        final String maxVersion = root.getString("contract.max-supported-version");
        final long minimumBalance = root.getLong("operational-wallet.minimum-balance");
        this.lifecycle = new LifecycleController(() -> new StressTestEngine(List.of(
            new ContractVersionRoutine(chainClient, maxVersion),
            new OperationalWalletRoutine(chainClient, stateStore, operationalWallet, minimumBalance),
            new PoolRegistryRoutine(poolRegistry)
        ), workerPool), workerPool, systemState);
        this.bootstrapConfig = optionalConfig(root, "bootstrap");
        LOGGER.info("Node initialized with chain client {} and state store {}",
            chainClient.getClass().getSimpleName(), stateStore.getClass().getSimpleName());
    }

    /**
     * Starts the lifecycle, bootstraps the configured pools and workers and registers a shutdown hook.
     */
    public void start() {
        lifecycle.start();
        bootstrap();
        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} worker(s). Running until interrupted.", workerPool.listAll().size());
    }

    /**
     * Stops every worker and the engine.
     */
    public void stop() {
        LOGGER.info("Shutdown sequence initiated...");
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }
        lifecycle.stop();
        LOGGER.info("All workers stopped. Goodbye.");
    }

    // ---- core-exposed operations ---------------------------------------------------------

    public String createWorker(final WorkerRequest request) throws ChainClientException {
        return workerPool.create(request);
    }

    public void startWorker(final String workerId) throws ChainClientException {
        workerPool.start(workerId);
    }

    public void stopWorker(final String workerId) {
        workerPool.stop(workerId);
    }

    public void forceStopAllWorkers() {
        workerPool.forceStopAll();
    }

    public void deleteWorker(final String workerId) {
        workerPool.delete(workerId);
    }

    public List<WorkerConfig> listWorkers() {
        return workerPool.listAll();
    }

    public Optional<WorkerConfig> getWorkerConfig(final String workerId) {
        return workerPool.getConfig(workerId);
    }

    public Optional<WorkerStatistics> getWorkerStatistics(final String workerId) {
        return workerPool.getStatistics(workerId);
    }

    public DrainResult drain(final String workerId) {
        return drainHandler.drain(workerId);
    }

    public PoolRatioConfig normalizePool(final String mintA, final String mintB, final long ratioA, final long ratioB) {
        return normalizer.normalize(mintA, mintB, ratioA, ratioB);
    }

    public PoolRatioConfig createPool(final String mintA, final String mintB, final long ratioA, final long ratioB,
                                      final int decimalsA, final int decimalsB) throws ChainClientException {
        return poolRegistry.createPool(mintA, mintB, ratioA, ratioB, decimalsA, decimalsB);
    }

    public int getComputeBudget(final String operation, final BudgetContext context) {
        return budgeter.getBudget(operation, context);
    }

    public IServiceLifecycle getLifecycle() {
        return lifecycle;
    }

    public IChainClient getChainClient() {
        return chainClient;
    }

    // ---- bootstrap -----------------------------------------------------------------------

    /**
     * Creates the pools and workers declared under {@code stress-test.bootstrap}. Pools that are
     * already registered are reused. Workers refer to pools by their index in the pool list.
     */
    void bootstrap() {
        final List<PoolRatioConfig> pools = new ArrayList<>();
        if (bootstrapConfig.hasPath("pools")) {
            for (final Config pool : bootstrapConfig.getConfigList("pools")) {
                pools.add(bootstrapPool(pool));
            }
        }
        if (!bootstrapConfig.hasPath("workers")) {
            return;
        }
        for (final Config worker : bootstrapConfig.getConfigList("workers")) {
            final int poolIndex = worker.hasPath("pool-index") ? worker.getInt("pool-index") : 0;
            if (poolIndex < 0 || poolIndex >= pools.size()) {
                throw new IllegalArgumentException("Bootstrap worker refers to pool-index " + poolIndex
                    + " but only " + pools.size() + " pool(s) are declared");
            }
            final int count = worker.hasPath("count") ? worker.getInt("count") : 1;
            for (int i = 0; i < count; i++) {
                bootstrapWorker(worker, pools.get(poolIndex));
            }
        }
    }

    private PoolRatioConfig bootstrapPool(final Config pool) {
        final String mintA = pool.getString("token-a-mint");
        final String mintB = pool.getString("token-b-mint");
        final long ratioA = pool.getLong("ratio-a");
        final long ratioB = pool.getLong("ratio-b");
        final PoolRatioConfig normalized = normalizer.normalize(mintA, mintB, ratioA, ratioB);
        final Optional<PoolRatioConfig> existing = poolRegistry.get(normalized.poolId());
        if (existing.isPresent()) {
            LOGGER.info("Reusing registered pool {}", normalized.poolId());
            return existing.get();
        }
        try {
            return poolRegistry.createPool(mintA, mintB, ratioA, ratioB,
                pool.hasPath("decimals-a") ? pool.getInt("decimals-a") : 9,
                pool.hasPath("decimals-b") ? pool.getInt("decimals-b") : 9);
        } catch (final ChainClientException e) {
            throw new IllegalStateException("Failed to create bootstrap pool " + mintA + "/" + mintB + ": " + e.getMessage(), e);
        }
    }

    private void bootstrapWorker(final Config worker, final PoolRatioConfig pool) {
        final WorkerKind kind = WorkerKind.valueOf(worker.getString("kind").toUpperCase(Locale.ROOT));
        final long initialAmount = worker.hasPath("initial-amount") ? worker.getLong("initial-amount") : 0L;
        WorkerRequest request = switch (kind) {
            case DEPOSIT -> WorkerRequest.deposit(pool.poolId(), side(worker), initialAmount);
            case WITHDRAWAL -> WorkerRequest.withdrawal(pool.poolId(), side(worker));
            case SWAP -> WorkerRequest.swap(pool.poolId(),
                SwapDirection.valueOf(worker.getString("swap-direction").toUpperCase(Locale.ROOT)), initialAmount);
        };
        if (worker.hasPath("auto-refill")) {
            request = request.withAutoRefill(worker.getBoolean("auto-refill"));
        }
        if (worker.hasPath("share-output")) {
            request = request.withShareOutput(worker.getBoolean("share-output"));
        }
        final boolean autoStart = !worker.hasPath("start") || worker.getBoolean("start");
        try {
            final String id = workerPool.create(request);
            if (autoStart) {
                workerPool.start(id);
            }
            LOGGER.info("Bootstrapped {} worker {} on pool {}", kind, id, pool.poolId());
        } catch (final ChainClientException e) {
            LOGGER.warn("Failed to bootstrap {} worker on pool {}: {}", kind, pool.poolId(), e.getMessage());
        }
    }

    private static TokenSide side(final Config worker) {
        return worker.hasPath("token-side")
            ? TokenSide.valueOf(worker.getString("token-side").toUpperCase(Locale.ROOT))
            : TokenSide.A;
    }

    private static Config optionalConfig(final Config root, final String path) {
        return root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
    }

    private static <T> T instantiate(final String name, final Config section, final Class<T> type)
        throws ReflectiveOperationException {
        final String className = section.getString("className");
        final Config options = section.hasPath("options") ? section.getConfig("options") : ConfigFactory.empty();
        final Class<?> clazz = Class.forName(className);
        if (!type.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("Class " + className + " does not implement " + type.getSimpleName() + ".");
        }
        final Constructor<?> constructor = clazz.getConstructor(String.class, Config.class);
        LOGGER.debug("Instantiating {} '{}' with class '{}'", type.getSimpleName(), name, className);
        return type.cast(constructor.newInstance(name, options));
    }
}

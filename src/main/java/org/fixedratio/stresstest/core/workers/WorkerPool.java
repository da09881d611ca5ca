package org.fixedratio.stresstest.core.workers;

import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.storage.IStateStore;
import org.fixedratio.stresstest.api.storage.StateStoreException;
import org.fixedratio.stresstest.api.workers.TokenSide;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerError;
import org.fixedratio.stresstest.api.workers.WorkerKind;
import org.fixedratio.stresstest.api.workers.WorkerRequest;
import org.fixedratio.stresstest.api.workers.WorkerStatistics;
import org.fixedratio.stresstest.api.workers.WorkerStatus;
import org.fixedratio.stresstest.core.budget.ResourceBudgeter;
import org.fixedratio.stresstest.core.errors.ErrorClassifier;
import org.fixedratio.stresstest.core.lifecycle.SystemState;
import org.fixedratio.stresstest.core.pools.PoolRegistry;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns all workers: their configuration, statistics and execution loops.
 * <p>
 * Each running worker has exactly one loop thread and one {@link CancellationHandle}, both
 * registered under the worker id. The pool is the only writer of a worker's status; the loop
 * reports statistics and the last-operation timestamp back through package-private callbacks.
 * Lifecycle calls for the same worker are serialized by a per-worker lock, calls for different
 * workers run in parallel.
 * <p>
 * Configs persisted with a running status are restored as {@link WorkerStatus#STOPPED}, since
 * no loop survives a process restart.
 */
public class WorkerPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

    private final IChainClient chainClient;
    private final IStateStore stateStore;
    private final PoolRegistry poolRegistry;
    private final ErrorClassifier errorClassifier;
    private final ResourceBudgeter budgeter;
    private final RatioNormalizer normalizer;
    private final SystemState systemState;
    private final WorkerSettings settings;

    private final Map<String, WorkerConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, WorkerStatistics> statistics = new ConcurrentHashMap<>();
    private final Map<String, CancellationHandle> handles = new ConcurrentHashMap<>();
    private final Map<String, Thread> threads = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public WorkerPool(IChainClient chainClient, IStateStore stateStore, PoolRegistry poolRegistry,
                      ErrorClassifier errorClassifier, ResourceBudgeter budgeter, RatioNormalizer normalizer,
                      SystemState systemState, WorkerSettings settings) {
        this.chainClient = chainClient;
        this.stateStore = stateStore;
        this.poolRegistry = poolRegistry;
        this.errorClassifier = errorClassifier;
        this.budgeter = budgeter;
        this.normalizer = normalizer;
        this.systemState = systemState;
        this.settings = settings;
        restorePersistedWorkers();
    }

    private void restorePersistedWorkers() {
        for (WorkerConfig config : stateStore.loadWorkers()) {
            WorkerConfig restored = config;
            if (config.status() == WorkerStatus.RUNNING
                || config.status() == WorkerStatus.PAUSED
                || config.status() == WorkerStatus.STOPPING) {
                restored = config.withStatus(WorkerStatus.STOPPED);
                stateStore.saveWorker(restored);
            }
            configs.put(restored.id(), restored);
            statistics.put(restored.id(), stateStore.loadStatistics(restored.id()).orElseGet(WorkerStatistics::empty));
        }
        if (!configs.isEmpty()) {
            LOGGER.info("Restored {} worker(s) from the state store", configs.size());
        }
    }

    /**
     * Creates and persists a new worker with a freshly generated wallet.
     *
     * @param request The worker parameters.
     * @return The new worker id, prefixed with the lowercase worker kind.
     * @throws ChainClientException     if the wallet cannot be generated.
     * @throws IllegalArgumentException if the request is invalid or the pool is unknown.
     */
    public String create(WorkerRequest request) throws ChainClientException {
        Objects.requireNonNull(request, "request");
        validate(request);

        String id = request.kind().idPrefix() + "_" + UUID.randomUUID().toString().replace("-", "");
        TokenSide side = request.kind() == WorkerKind.SWAP ? request.swapDirection().inputSide() : request.tokenSide();
        WalletCredential wallet = chainClient.generateWallet();
        WorkerConfig config = new WorkerConfig(id, request.kind(), request.poolId(), side,
            request.kind() == WorkerKind.SWAP ? request.swapDirection() : null,
            wallet, request.initialAmount(), request.autoRefill(), request.shareOutput(),
            WorkerStatus.CREATED, Instant.now(), null);

        configs.put(id, config);
        statistics.put(id, WorkerStatistics.empty());
        stateStore.saveWorker(config);
        stateStore.saveStatistics(id, WorkerStatistics.empty());
        LOGGER.info("Created worker {} on pool {} with wallet {}", id, request.poolId(), wallet.address());
        return id;
    }

    private void validate(WorkerRequest request) {
        if (request.kind() == null) {
            throw new IllegalArgumentException("Worker kind is required");
        }
        if (!poolRegistry.contains(request.poolId())) {
            throw new IllegalArgumentException("Pool '" + request.poolId() + "' is not registered");
        }
        if (request.kind() == WorkerKind.SWAP && request.swapDirection() == null) {
            throw new IllegalArgumentException("Swap workers require a swap direction");
        }
        if (request.kind() != WorkerKind.SWAP && request.tokenSide() == null) {
            throw new IllegalArgumentException(request.kind() + " workers require a token side");
        }
        if (request.initialAmount() < 0) {
            throw new IllegalArgumentException("Initial amount must not be negative");
        }
    }

    /**
     * Starts the loop of a worker on its own thread.
     *
     * @param workerId The worker id.
     * @throws ChainClientException     if the wallet cannot be restored or funded; the worker is marked failed.
     * @throws IllegalStateException    if the worker is already running.
     * @throws IllegalArgumentException if the worker is unknown.
     */
    public void start(String workerId) throws ChainClientException {
        synchronized (lockFor(workerId)) {
            WorkerConfig config = requireConfig(workerId);
            if (config.status() == WorkerStatus.RUNNING) {
                throw new IllegalStateException(String.format("Cannot start worker '%s' as it is already running", workerId));
            }

            WalletCredential wallet;
            try {
                wallet = chainClient.restoreWallet(config.wallet());
                ensureNativeFunding(workerId, wallet);
                seedTokens(config, wallet);
            } catch (ChainClientException | RuntimeException e) {
                updateStatus(workerId, WorkerStatus.FAILED);
                LOGGER.warn("Worker {} failed to start: {}", workerId, e.getMessage());
                throw e;
            }

            CancellationHandle handle = new CancellationHandle();
            handles.put(workerId, handle);
            WorkerConfig running = configs.compute(workerId,
                (id, current) -> current.withWallet(wallet).withStatus(WorkerStatus.RUNNING));
            persistConfig(running);

            WorkerLoop loop = new WorkerLoop(running, handle, this, chainClient, errorClassifier,
                budgeter, normalizer, systemState, settings);
            Thread thread = new Thread(loop);
            thread.setName("worker-" + workerId);
            threads.put(workerId, thread);
            thread.start();
            LOGGER.info("Started worker {}", workerId);
        }
    }

    private void ensureNativeFunding(String workerId, WalletCredential wallet) throws ChainClientException {
        long balance = chainClient.getNativeBalance(wallet.address());
        if (balance < settings.minNativeBalance()) {
            LOGGER.info("Funding worker {} with {} native units (balance {})",
                workerId, settings.nativeFundingAmount(), balance);
            chainClient.requestNativeFunding(wallet.address(), settings.nativeFundingAmount());
        }
    }

    private void seedTokens(WorkerConfig config, WalletCredential wallet) throws ChainClientException {
        if (config.kind() == WorkerKind.WITHDRAWAL || config.initialAmount() <= 0) {
            return;
        }
        PoolState pool = chainClient.getPoolState(config.poolId());
        String mint = WorkerContext.workingMint(config, pool);
        if (chainClient.getTokenBalance(wallet.address(), mint) == 0) {
            chainClient.mintTokens(mint, wallet.address(), config.initialAmount());
            LOGGER.debug("Seeded worker {} with {} tokens of {}", config.id(), config.initialAmount(), mint);
        }
    }

    /**
     * Stops a worker's loop and waits for it to observe the cancellation.
     *
     * @param workerId The worker id.
     * @throws IllegalStateException    if the worker is neither running nor paused.
     * @throws IllegalArgumentException if the worker is unknown.
     */
    public void stop(String workerId) {
        synchronized (lockFor(workerId)) {
            WorkerConfig config = requireConfig(workerId);
            if (config.status() == WorkerStatus.PAUSED) {
                updateStatus(workerId, WorkerStatus.STOPPED);
                LOGGER.info("Stopped paused worker {}", workerId);
                return;
            }
            if (config.status() != WorkerStatus.RUNNING) {
                throw new IllegalStateException(String.format("Cannot stop worker '%s' as it is in status %s", workerId, config.status()));
            }
            updateStatus(workerId, WorkerStatus.STOPPING);
            if (haltLoop(workerId)) {
                updateStatus(workerId, WorkerStatus.STOPPED);
                LOGGER.info("Stopped worker {}", workerId);
            }
        }
    }

    /**
     * Signals every running loop at once, then waits for each to end. Used only when the whole
     * system shuts down so that no worker outlives the engine.
     */
    public void forceStopAll() {
        List<String> ids = new ArrayList<>(handles.keySet());
        handles.values().forEach(CancellationHandle::cancel);
        for (String workerId : ids) {
            synchronized (lockFor(workerId)) {
                if (!configs.containsKey(workerId)) {
                    continue;
                }
                if (haltLoop(workerId)) {
                    updateStatus(workerId, WorkerStatus.STOPPED);
                }
            }
        }
        // Paused workers have no loop but must not be resumed by a later engine.
        for (WorkerConfig config : listAll()) {
            if (config.status() == WorkerStatus.PAUSED) {
                synchronized (lockFor(config.id())) {
                    updateStatus(config.id(), WorkerStatus.STOPPED);
                }
            }
        }
        if (!ids.isEmpty()) {
            LOGGER.info("Force-stopped {} worker(s)", ids.size());
        }
    }

    /**
     * Stops every running worker and marks it paused so that {@link #resumePaused()} can restart it.
     *
     * @return The number of workers paused.
     */
    public int pauseAll() {
        int paused = 0;
        for (String workerId : new ArrayList<>(configs.keySet())) {
            synchronized (lockFor(workerId)) {
                WorkerConfig config = configs.get(workerId);
                if (config == null || config.status() != WorkerStatus.RUNNING) {
                    continue;
                }
                if (haltLoop(workerId)) {
                    updateStatus(workerId, WorkerStatus.PAUSED);
                    paused++;
                }
            }
        }
        LOGGER.info("Paused {} worker(s)", paused);
        return paused;
    }

    /**
     * Restarts every worker left in {@link WorkerStatus#PAUSED}.
     *
     * @return The number of workers restarted.
     */
    public int resumePaused() {
        int resumed = 0;
        for (WorkerConfig config : listAll()) {
            if (config.status() != WorkerStatus.PAUSED) {
                continue;
            }
            try {
                start(config.id());
                resumed++;
            } catch (ChainClientException | RuntimeException e) {
                LOGGER.warn("Could not resume worker {}: {}", config.id(), e.getMessage());
            }
        }
        LOGGER.info("Resumed {} worker(s)", resumed);
        return resumed;
    }

    /**
     * Stops a worker if needed and removes its config, statistics and error log.
     *
     * @param workerId The worker id.
     * @throws IllegalArgumentException if the worker is unknown.
     */
    public void delete(String workerId) {
        synchronized (lockFor(workerId)) {
            WorkerConfig config = requireConfig(workerId);
            if (config.status() == WorkerStatus.RUNNING) {
                stop(workerId);
            }
            configs.remove(workerId);
            statistics.remove(workerId);
            stateStore.deleteWorker(workerId);
            LOGGER.info("Deleted worker {}", workerId);
        }
        locks.remove(workerId);
    }

    public Optional<WorkerConfig> getConfig(String workerId) {
        return Optional.ofNullable(configs.get(workerId));
    }

    public Optional<WorkerStatistics> getStatistics(String workerId) {
        return Optional.ofNullable(statistics.get(workerId));
    }

    public List<WorkerError> getErrors(String workerId) {
        requireConfig(workerId);
        return stateStore.loadErrors(workerId);
    }

    /**
     * Returns all workers ordered by creation time.
     *
     * @return A snapshot of all worker configs.
     */
    public List<WorkerConfig> listAll() {
        List<WorkerConfig> result = new ArrayList<>(configs.values());
        result.sort(Comparator.comparing(WorkerConfig::createdAt).thenComparing(WorkerConfig::id));
        return result;
    }

    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        List<WorkerConfig> all = listAll();
        metrics.put("workers_total", all.size());
        metrics.put("workers_running", all.stream().filter(c -> c.status() == WorkerStatus.RUNNING).count());
        metrics.put("workers_paused", all.stream().filter(c -> c.status() == WorkerStatus.PAUSED).count());
        metrics.put("workers_failed", all.stream().filter(c -> c.status().isFaulted()).count());
        return metrics;
    }

    void recordSuccess(String workerId, long volume, long fee, Instant at) {
        WorkerStatistics updated = statistics.computeIfPresent(workerId, (id, s) -> s.withSuccess(volume, fee, at));
        WorkerConfig config = configs.computeIfPresent(workerId, (id, c) -> c.withLastOperationAt(at));
        if (updated != null) {
            persistStatistics(workerId, updated);
        }
        if (config != null) {
            persistConfig(config);
        }
    }

    void recordFailure(String workerId, WorkerError error) {
        WorkerStatistics updated = statistics.computeIfPresent(workerId, (id, s) -> s.withFailure(error));
        if (updated == null) {
            return;
        }
        persistStatistics(workerId, updated);
        try {
            stateStore.appendError(workerId, error);
        } catch (StateStoreException e) {
            LOGGER.warn("Could not persist error of worker {}: {}", workerId, e.getMessage());
        }
    }

    /**
     * Picks a peer that can consume the output of the given worker: a withdrawal worker on the
     * same pool and side for deposits, a swap worker in the opposite direction for swaps.
     */
    Optional<WorkerConfig> findSharePeer(WorkerConfig source) {
        List<WorkerConfig> candidates = configs.values().stream()
            .filter(c -> !c.id().equals(source.id()))
            .filter(c -> c.poolId().equals(source.poolId()))
            .filter(c -> switch (source.kind()) {
                case DEPOSIT -> c.kind() == WorkerKind.WITHDRAWAL && c.tokenSide() == source.tokenSide();
                case SWAP -> c.kind() == WorkerKind.SWAP && c.swapDirection() == source.swapDirection().opposite();
                case WITHDRAWAL -> false;
            })
            .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<WorkerConfig> running = candidates.stream().filter(c -> c.status() == WorkerStatus.RUNNING).toList();
        List<WorkerConfig> pick = running.isEmpty() ? candidates : running;
        return Optional.of(pick.get(ThreadLocalRandom.current().nextInt(pick.size())));
    }

    /**
     * Cancels and joins the loop of a worker.
     *
     * @return {@code false} if the thread did not end within the stop timeout; the worker is then marked as error.
     */
    private boolean haltLoop(String workerId) {
        CancellationHandle handle = handles.remove(workerId);
        if (handle != null) {
            handle.cancel();
        }
        Thread thread = threads.remove(workerId);
        if (thread == null) {
            return true;
        }
        try {
            thread.join(settings.stopTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for worker {} to stop", workerId);
        }
        if (thread.isAlive()) {
            LOGGER.error("Worker {} did not stop within {} ms, marking as ERROR", workerId, settings.stopTimeout().toMillis());
            updateStatus(workerId, WorkerStatus.ERROR);
            return false;
        }
        return true;
    }

    private WorkerConfig updateStatus(String workerId, WorkerStatus status) {
        WorkerConfig updated = configs.computeIfPresent(workerId, (id, c) -> c.withStatus(status));
        if (updated != null) {
            persistConfig(updated);
        }
        return updated;
    }

    private WorkerConfig requireConfig(String workerId) {
        WorkerConfig config = configs.get(workerId);
        if (config == null) {
            throw new IllegalArgumentException("Worker '" + workerId + "' does not exist");
        }
        return config;
    }

    private Object lockFor(String workerId) {
        return locks.computeIfAbsent(workerId, id -> new Object());
    }

    private void persistConfig(WorkerConfig config) {
        try {
            stateStore.saveWorker(config);
        } catch (StateStoreException e) {
            LOGGER.warn("Could not persist worker {}: {}", config.id(), e.getMessage());
        }
    }

    private void persistStatistics(String workerId, WorkerStatistics stats) {
        try {
            stateStore.saveStatistics(workerId, stats);
        } catch (StateStoreException e) {
            LOGGER.warn("Could not persist statistics of worker {}: {}", workerId, e.getMessage());
        }
    }
}

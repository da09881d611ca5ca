package org.fixedratio.stresstest.resources.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.storage.IStateStore;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerError;
import org.fixedratio.stresstest.api.workers.WorkerStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-persistent state store. Everything is lost when the process exits.
 * <p>
 * Error logs are bounded by {@code max-errors-per-worker} (default 1000).
 */
public class InMemoryStateStore implements IStateStore {

    private final int maxErrorsPerWorker;
    private final ConcurrentHashMap<String, WorkerConfig> workers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, WorkerStatistics> statistics = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<WorkerError>> errors = new ConcurrentHashMap<>();
    private final AtomicReference<Map<String, PoolRatioConfig>> pools = new AtomicReference<>(Map.of());
    private final AtomicReference<WalletCredential> operationalWallet = new AtomicReference<>();

    public InMemoryStateStore(String name, Config options) {
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of("max-errors-per-worker", 1000)));
        this.maxErrorsPerWorker = config.getInt("max-errors-per-worker");
    }

    public InMemoryStateStore() {
        this("memory", ConfigFactory.empty());
    }

    @Override
    public List<WorkerConfig> loadWorkers() {
        return List.copyOf(workers.values());
    }

    @Override
    public Optional<WorkerConfig> loadWorker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    @Override
    public void saveWorker(WorkerConfig config) {
        workers.put(config.id(), config);
    }

    @Override
    public Optional<WorkerStatistics> loadStatistics(String workerId) {
        return Optional.ofNullable(statistics.get(workerId));
    }

    @Override
    public void saveStatistics(String workerId, WorkerStatistics stats) {
        statistics.put(workerId, stats);
    }

    @Override
    public void appendError(String workerId, WorkerError error) {
        errors.compute(workerId, (id, existing) -> {
            List<WorkerError> log = existing != null ? existing : new ArrayList<>();
            synchronized (log) {
                log.add(error);
                while (log.size() > maxErrorsPerWorker) {
                    log.remove(0);
                }
            }
            return log;
        });
    }

    @Override
    public List<WorkerError> loadErrors(String workerId) {
        List<WorkerError> log = errors.get(workerId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    @Override
    public void deleteWorker(String workerId) {
        workers.remove(workerId);
        statistics.remove(workerId);
        errors.remove(workerId);
    }

    @Override
    public Map<String, PoolRatioConfig> loadPoolRegistry() {
        return pools.get();
    }

    @Override
    public void savePoolRegistry(Map<String, PoolRatioConfig> registry) {
        pools.set(Map.copyOf(registry));
    }

    @Override
    public Optional<WalletCredential> loadOperationalWallet() {
        return Optional.ofNullable(operationalWallet.get());
    }

    @Override
    public void saveOperationalWallet(WalletCredential wallet) {
        operationalWallet.set(wallet);
    }
}

package org.fixedratio.stresstest.api.storage;

import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerError;
import org.fixedratio.stresstest.api.workers.WorkerStatistics;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for worker records, the pool registry and the operational wallet.
 * <p>
 * Implementations must be thread-safe. They are instantiated reflectively and must
 * provide a public constructor taking {@code (String name, com.typesafe.config.Config options)}.
 * Storage failures are reported as {@link StateStoreException}.
 */
public interface IStateStore {

    List<WorkerConfig> loadWorkers();

    Optional<WorkerConfig> loadWorker(String workerId);

    void saveWorker(WorkerConfig config);

    Optional<WorkerStatistics> loadStatistics(String workerId);

    void saveStatistics(String workerId, WorkerStatistics statistics);

    void appendError(String workerId, WorkerError error);

    List<WorkerError> loadErrors(String workerId);

    /**
     * Removes the config, statistics and error log of a worker.
     *
     * @param workerId The worker id.
     */
    void deleteWorker(String workerId);

    Map<String, PoolRatioConfig> loadPoolRegistry();

    void savePoolRegistry(Map<String, PoolRatioConfig> pools);

    Optional<WalletCredential> loadOperationalWallet();

    void saveOperationalWallet(WalletCredential wallet);
}

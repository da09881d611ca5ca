package org.fixedratio.stresstest.resources.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.storage.IStateStore;
import org.fixedratio.stresstest.api.storage.StateStoreException;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerError;
import org.fixedratio.stresstest.api.workers.WorkerStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * State store that keeps one JSON document per concern in a directory.
 * <p>
 * All documents are read once on construction and cached. Every mutation rewrites the affected
 * document through a temporary file followed by an atomic move, so a crash never leaves a
 * half-written file behind. Reads and writes are guarded by a read/write lock.
 * <p>
 * Options:
 * <pre>
 * options {
 *   directory = "./stress-test-data"
 *   max-errors-per-worker = 1000
 * }
 * </pre>
 */
public class JsonFileStateStore implements IStateStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileStateStore.class);

    static final String WORKERS_FILE = "workers.json";
    static final String STATISTICS_FILE = "statistics.json";
    static final String ERRORS_FILE = "errors.json";
    static final String POOLS_FILE = "pools.json";
    static final String WALLET_FILE = "operational-wallet.json";

    private final String name;
    private final Path directory;
    private final int maxErrorsPerWorker;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, WorkerConfig> workers;
    private final Map<String, WorkerStatistics> statistics;
    private final Map<String, List<WorkerError>> errors;
    private Map<String, PoolRatioConfig> pools;
    private WalletCredential operationalWallet;

    public JsonFileStateStore(String name, Config options) {
        this.name = name;
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "directory", "./stress-test-data",
            "max-errors-per-worker", 1000
        )));
        this.directory = Paths.get(config.getString("directory")).toAbsolutePath();
        this.maxErrorsPerWorker = config.getInt("max-errors-per-worker");
        if (maxErrorsPerWorker < 1) {
            throw new IllegalArgumentException("max-errors-per-worker must be at least 1");
        }
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StateStoreException("Failed to create state directory " + directory, e);
        }

        this.workers = read(WORKERS_FILE, new TypeReference<LinkedHashMap<String, WorkerConfig>>() { }, new LinkedHashMap<>());
        this.statistics = read(STATISTICS_FILE, new TypeReference<LinkedHashMap<String, WorkerStatistics>>() { }, new LinkedHashMap<>());
        this.errors = read(ERRORS_FILE, new TypeReference<LinkedHashMap<String, List<WorkerError>>>() { }, new LinkedHashMap<>());
        this.pools = read(POOLS_FILE, new TypeReference<LinkedHashMap<String, PoolRatioConfig>>() { }, new LinkedHashMap<>());
        this.operationalWallet = read(WALLET_FILE, new TypeReference<WalletCredential>() { }, null);
        LOGGER.debug("State store '{}' opened at {} with {} workers and {} pools", name, directory, workers.size(), pools.size());
    }

    @Override
    public List<WorkerConfig> loadWorkers() {
        lock.readLock().lock();
        try {
            return List.copyOf(workers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<WorkerConfig> loadWorker(String workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(workers.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void saveWorker(WorkerConfig config) {
        lock.writeLock().lock();
        try {
            workers.put(config.id(), config);
            write(WORKERS_FILE, workers);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<WorkerStatistics> loadStatistics(String workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(statistics.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void saveStatistics(String workerId, WorkerStatistics stats) {
        lock.writeLock().lock();
        try {
            statistics.put(workerId, stats);
            write(STATISTICS_FILE, statistics);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void appendError(String workerId, WorkerError error) {
        lock.writeLock().lock();
        try {
            List<WorkerError> log = errors.computeIfAbsent(workerId, k -> new ArrayList<>());
            log.add(error);
            while (log.size() > maxErrorsPerWorker) {
                log.remove(0);
            }
            write(ERRORS_FILE, errors);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<WorkerError> loadErrors(String workerId) {
        lock.readLock().lock();
        try {
            return List.copyOf(errors.getOrDefault(workerId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deleteWorker(String workerId) {
        lock.writeLock().lock();
        try {
            if (workers.remove(workerId) != null) {
                write(WORKERS_FILE, workers);
            }
            if (statistics.remove(workerId) != null) {
                write(STATISTICS_FILE, statistics);
            }
            if (errors.remove(workerId) != null) {
                write(ERRORS_FILE, errors);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, PoolRatioConfig> loadPoolRegistry() {
        lock.readLock().lock();
        try {
            return Map.copyOf(pools);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void savePoolRegistry(Map<String, PoolRatioConfig> registry) {
        lock.writeLock().lock();
        try {
            pools = new LinkedHashMap<>(registry);
            write(POOLS_FILE, pools);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<WalletCredential> loadOperationalWallet() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(operationalWallet);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void saveOperationalWallet(WalletCredential wallet) {
        lock.writeLock().lock();
        try {
            operationalWallet = wallet;
            write(WALLET_FILE, wallet);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private <T> T read(String fileName, TypeReference<T> type, T fallback) {
        Path file = directory.resolve(fileName);
        if (!Files.exists(file)) {
            return fallback;
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            return value != null ? value : fallback;
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private void write(String fileName, Object value) {
        Path file = directory.resolve(fileName);
        Path tempFile = directory.resolve(fileName + "." + UUID.randomUUID() + ".tmp");
        try {
            objectMapper.writeValue(tempFile.toFile(), value);
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                LOGGER.warn("Failed to clean up temp file {} after write failure", tempFile);
            }
            throw new StateStoreException("Failed to write " + file + " in store '" + name + "': " + e.getMessage(), e);
        }
    }
}

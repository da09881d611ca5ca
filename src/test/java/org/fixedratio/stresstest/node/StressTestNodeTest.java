package org.fixedratio.stresstest.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.lifecycle.ServiceState;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.api.workers.TokenSide;
import org.fixedratio.stresstest.api.workers.WorkerConfig;
import org.fixedratio.stresstest.api.workers.WorkerKind;
import org.fixedratio.stresstest.api.workers.WorkerRequest;
import org.fixedratio.stresstest.api.workers.WorkerStatus;
import org.fixedratio.stresstest.core.budget.BudgetContext;
import org.fixedratio.stresstest.core.drain.DrainOutcome;
import org.fixedratio.stresstest.core.drain.DrainResult;
import org.fixedratio.stresstest.junit.extensions.logging.ExpectLog;
import org.fixedratio.stresstest.junit.extensions.logging.LogLevel;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.fixedratio.stresstest.resources.chain.PaperChainClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class StressTestNodeTest {

    private static final String BASE = """
        stress-test {
          storage.className = "org.fixedratio.stresstest.resources.storage.InMemoryStateStore"
          workers { delay-min = 5ms, delay-max = 20ms }
        }
        """;

    private StressTestNode node;

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.stop();
        }
    }

    private static Config config(String overrides) {
        return ConfigFactory.parseString(overrides)
            .withFallback(ConfigFactory.parseString(BASE))
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    @Test
    @DisplayName("Starting the node bootstraps pools and workers from configuration")
    void startBootstrapsConfiguredWorkers() {
        node = new StressTestNode(config("""
            stress-test.bootstrap.workers = [
              { kind = deposit, pool-index = 0, token-side = A, initial-amount = 1000000, share-output = true }
              { kind = withdrawal, pool-index = 0, token-side = A, count = 2, start = false }
            ]
            """));

        node.start();

        assertEquals(ServiceState.STARTED, node.getLifecycle().getState());
        List<WorkerConfig> workers = node.listWorkers();
        assertThat(workers).extracting(WorkerConfig::kind)
            .containsExactlyInAnyOrder(WorkerKind.DEPOSIT, WorkerKind.WITHDRAWAL, WorkerKind.WITHDRAWAL);
        WorkerConfig deposit = workers.stream().filter(w -> w.kind() == WorkerKind.DEPOSIT).findFirst().orElseThrow();
        assertEquals(WorkerStatus.RUNNING, deposit.status());
        await().atMost(Duration.ofSeconds(10))
            .until(() -> node.getWorkerStatistics(deposit.id()).orElseThrow().successfulOperations() >= 1);

        node.stop();

        assertEquals(ServiceState.STOPPED, node.getLifecycle().getState());
        assertEquals(WorkerStatus.STOPPED, node.getWorkerConfig(deposit.id()).orElseThrow().status());
        node = null;
    }

    @Test
    void bootstrapReusesRegisteredPools() {
        node = new StressTestNode(config("stress-test.bootstrap.workers = []"));

        node.bootstrap();
        node.bootstrap();

        assertThat(node.listWorkers()).isEmpty();
    }

    @Test
    void bootstrapRejectsUnknownPoolIndex() {
        node = new StressTestNode(config("stress-test.bootstrap.workers = [ { kind = deposit, pool-index = 3 } ]"));

        assertThatThrownBy(() -> node.bootstrap())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pool-index 3");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Drain operation of worker deposit_.* failed after burning .*")
    void drainBurnsHoldingsAndSweepsNative() throws ChainClientException {
        node = new StressTestNode(config("stress-test.bootstrap.workers = []"));
        node.getLifecycle().start();
        PoolRatioConfig pool = node.createPool("drainA", "drainB", 1_000_000_000L, 500_000_000L, 9, 9);
        String id = node.createWorker(WorkerRequest.deposit(pool.poolId(), TokenSide.A, 1_000_000));
        node.startWorker(id);
        await().atMost(Duration.ofSeconds(10))
            .until(() -> node.getWorkerStatistics(id).orElseThrow().successfulOperations() >= 1);
        node.stopWorker(id);

        DrainResult result = node.drain(id);

        // The burned tokens are gone before the deposit is attempted, so the deposit must fail.
        assertEquals(DrainOutcome.OPERATION_FAILED, result.outcome());
        assertThat(result.tokensBurned()).isPositive();
        PaperChainClient chain = (PaperChainClient) node.getChainClient();
        assertEquals(result.tokensBurned(), chain.getBurnedAmount("drainA"));
        assertEquals(0, chain.getTokenBalance(node.getWorkerConfig(id).orElseThrow().wallet().address(), "drainA"));
        assertThat(result.nativeSwept()).isPositive();
    }

    @Test
    void exposesNormalizationAndBudgets() {
        node = new StressTestNode(config("stress-test.budget.overrides { process_swap_execute = 260000 }"));

        PoolRatioConfig normalized = node.normalizePool("tokenZ", "tokenY", 5, 7);

        assertTrue(normalized.wasSwapped());
        assertEquals("tokenY", normalized.tokenAMint());
        assertEquals(7, normalized.ratioANumerator());
        assertEquals(260_000, node.getComputeBudget("process_swap_execute", new BudgetContext(0, 0)));
        assertEquals(29_000, node.getComputeBudget("process_consolidate_pool_fees", BudgetContext.ofPoolCount(5)));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to initialize the node: .*")
    void unknownChainClassIsRejected() {
        assertThatThrownBy(() -> new StressTestNode(config("stress-test.chain.className = \"com.example.Missing\"")))
            .isInstanceOf(IllegalStateException.class);
    }
}

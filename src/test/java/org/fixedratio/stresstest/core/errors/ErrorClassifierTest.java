package org.fixedratio.stresstest.core.errors;

import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.fixedratio.stresstest.core.workers.CancellationHandle;
import org.fixedratio.stresstest.core.workers.WorkerContext;
import org.fixedratio.stresstest.core.workers.WorkerFixtures;
import org.fixedratio.stresstest.junit.extensions.logging.AllowLog;
import org.fixedratio.stresstest.junit.extensions.logging.ExpectLog;
import org.fixedratio.stresstest.junit.extensions.logging.LogLevel;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class ErrorClassifierTest {

    private static final RecoverySettings FAST = new RecoverySettings(
        Duration.ofMillis(1), 3, 3, 3, 2,
        Duration.ofMillis(1), Duration.ofMillis(1), Duration.ofMillis(1),
        1.5, 0.10,
        Duration.ofMillis(1), 3,
        0.1);

    @Mock
    private IChainClient chainClient;

    private ErrorClassifier classifier;
    private CancellationHandle handle;

    @BeforeEach
    void setUp() {
        classifier = new ErrorClassifier(chainClient, FAST);
        handle = new CancellationHandle();
    }

    @Test
    void customCodeIsExtracted() {
        ErrorClassification result = classifier.classify("Program failed: custom program error: Custom(1002)");

        assertEquals(1002, result.code());
        assertEquals(ErrorKind.UNKNOWN, result.kind());
    }

    @Test
    void hexCodeIsExtracted() {
        ErrorClassification result = classifier.classify("custom program error: 0x3eb (1003)");

        assertEquals(1003, result.code());
    }

    @Test
    void knownCodesMapToKinds() {
        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, classifier.classify("Custom(1015)").kind());
        assertEquals(ErrorKind.SYSTEM_PAUSED, classifier.classify("0x3ec (1004)").kind());
        assertEquals(ErrorKind.POOL_PAUSED, classifier.classify("Custom(1005)").kind());
        assertEquals(ErrorKind.INSUFFICIENT_LIQUIDITY, classifier.classify("Custom(1020)").kind());
        assertEquals(ErrorKind.SLIPPAGE_EXCEEDED, classifier.classify("0x402 (1026)").kind());
        assertEquals(ErrorKind.POOL_SWAPS_PAUSED, classifier.classify("Custom(1030)").kind());
        assertEquals(ErrorKind.INVALID_LP_TOKEN_TYPE, classifier.classify("Custom(1021)").kind());
    }

    @Test
    @DisplayName("Text without a code is unknown and carries no code")
    void unrecognizedTextIsUnknown() {
        ErrorClassification result = classifier.classify("connection reset by peer");

        assertEquals(ErrorKind.UNKNOWN, result.kind());
        assertNull(result.code());
        assertNull(classifier.classify(null).code());
    }

    @Test
    void customPatternWinsOverHex() {
        assertEquals(1015, classifier.classify("0x3ec (1004) then Custom(1015)").code());
    }

    @Test
    @DisplayName("A deposit worker below the refill threshold is topped up and retried")
    void refillsBelowThreshold() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenReturn(WorkerFixtures.pool(false, false));
        when(chainClient.getTokenBalance(WorkerFixtures.WALLET.address(), "mintA")).thenReturn(50L);

        RecoveryVerdict verdict = classifier.handle("Custom(1015)", context, handle);

        assertEquals(RecoveryVerdict.RETRY, verdict);
        verify(chainClient).mintTokens("mintA", WorkerFixtures.WALLET.address(), 1_000);
    }

    @Test
    void doesNotRefillAboveThreshold() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenReturn(WorkerFixtures.pool(false, false));
        when(chainClient.getTokenBalance(WorkerFixtures.WALLET.address(), "mintA")).thenReturn(500L);

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("Custom(1015)", context, handle));
        verify(chainClient, never()).mintTokens(anyString(), anyString(), anyLong());
    }

    @Test
    void workersWithoutRefillOnlyWait() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, false));

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("Custom(1015)", context, handle));
        verify(chainClient, never()).getPoolState(anyString());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Refill for worker deposit_1 failed: .*")
    void failedRefillIsRecorded() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenThrow(new ChainClientException("rpc down"));

        assertEquals(RecoveryVerdict.RECORD_AND_CONTINUE, classifier.handle("Custom(1015)", context, handle));
    }

    @Test
    void poolPauseIsPolledUntilClear() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenReturn(
            WorkerFixtures.pool(true, false), WorkerFixtures.pool(true, false), WorkerFixtures.pool(false, false));

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("Custom(1005)", context, handle));
        verify(chainClient, times(3)).getPoolState(WorkerFixtures.POOL_ID);
    }

    @Test
    @DisplayName("A pause that has already cleared is retried without waiting")
    void clearedPauseIsRetriedImmediately() throws ChainClientException {
        ErrorClassifier slowPolling = new ErrorClassifier(chainClient, RecoverySettings.defaults());
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenReturn(WorkerFixtures.pool(false, false));
        when(chainClient.isSystemPaused()).thenReturn(false);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertEquals(RecoveryVerdict.RETRY, slowPolling.handle("Custom(1005)", context, handle));
            assertEquals(RecoveryVerdict.RETRY, slowPolling.handle("0x3ec (1004)", context, handle));
        });
        verify(chainClient, times(1)).getPoolState(WorkerFixtures.POOL_ID);
        verify(chainClient, times(1)).isSystemPaused();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Worker deposit_1 gave up waiting for pool pause after 3 polls")
    void poolPauseGivesUpAfterCap() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenReturn(WorkerFixtures.pool(true, false));

        assertEquals(RecoveryVerdict.RECORD_AND_CONTINUE, classifier.handle("Custom(1005)", context, handle));
    }

    @Test
    @DisplayName("A failing probe counts as still paused")
    void systemPauseProbeFailureKeepsWaiting() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.swap("swap_1", SwapDirection.A_TO_B));
        when(chainClient.isSystemPaused()).thenThrow(new ChainClientException("timeout")).thenReturn(false);

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("0x3ec (1004)", context, handle));
        verify(chainClient, times(2)).isSystemPaused();
    }

    @Test
    void swapPauseIsIgnoredByNonSwapWorkers() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));

        assertEquals(RecoveryVerdict.CONTINUE, classifier.handle("Custom(1030)", context, handle));
        verify(chainClient, never()).getPoolState(anyString());
    }

    @Test
    void swapPauseIsPolledBySwapWorkers() throws ChainClientException {
        WorkerContext context = new WorkerContext(WorkerFixtures.swap("swap_1", SwapDirection.B_TO_A));
        when(chainClient.getPoolState(WorkerFixtures.POOL_ID)).thenReturn(WorkerFixtures.pool(false, false));

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("Custom(1030)", context, handle));
    }

    @Test
    void cancellationEndsPolling() {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));
        handle.cancel();

        assertEquals(RecoveryVerdict.CANCELLED, classifier.handle("Custom(1005)", context, handle));
    }

    @Test
    void slippageIsRaisedUpToCap() {
        WorkerContext context = new WorkerContext(WorkerFixtures.swap("swap_1", SwapDirection.A_TO_B));

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("Custom(1026)", context, handle));
        assertThat(context.slippageTolerance()).isCloseTo(0.015, offset(1e-9));

        for (int i = 0; i < 10; i++) {
            classifier.handle("Custom(1026)", context, handle);
        }
        assertThat(context.slippageTolerance()).isEqualTo(0.10);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Worker deposit_1 got insufficient liquidity on a deposit")
    void liquidityOnDepositIsRecorded() {
        WorkerContext context = new WorkerContext(WorkerFixtures.deposit("deposit_1", 1_000, true));

        assertEquals(RecoveryVerdict.RECORD_AND_CONTINUE, classifier.handle("Custom(1020)", context, handle));
    }

    @Test
    void liquidityOnSwapIsRetried() {
        WorkerContext context = new WorkerContext(WorkerFixtures.swap("swap_1", SwapDirection.A_TO_B));

        assertEquals(RecoveryVerdict.RETRY, classifier.handle("Custom(1020)", context, handle));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Worker withdrawal_1 hit configuration error .*")
    void configurationErrorsAreNotRetried() {
        WorkerContext context = new WorkerContext(WorkerFixtures.withdrawal("withdrawal_1"));

        assertEquals(RecoveryVerdict.RECORD_AND_CONTINUE, classifier.handle("Custom(1021)", context, handle));
        assertEquals(RecoveryVerdict.RECORD_AND_CONTINUE, classifier.handle("Custom(1014)", context, handle));
    }

    @Test
    @DisplayName("Unknown errors are retried a bounded number of times")
    void unknownErrorsRetryThenRecord() {
        WorkerContext context = new WorkerContext(WorkerFixtures.withdrawal("withdrawal_1"));

        for (int i = 0; i < FAST.unknownMaxRetries(); i++) {
            assertEquals(RecoveryVerdict.RETRY, classifier.handle("blockhash not found", context, handle));
        }
        assertEquals(RecoveryVerdict.RECORD_AND_CONTINUE, classifier.handle("blockhash not found", context, handle));
        assertEquals(FAST.unknownMaxRetries(), context.retryCount());
    }
}

package org.fixedratio.stresstest.resources.chain;

import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.OperationReceipt;
import org.fixedratio.stresstest.api.chain.PreparedTransaction;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.fixedratio.stresstest.core.errors.ErrorClassifier;
import org.fixedratio.stresstest.core.errors.ErrorKind;
import org.fixedratio.stresstest.core.errors.RecoverySettings;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PaperChainClientTest {

    private PaperChainClient chain;
    private PoolState pool;
    private WalletCredential wallet;

    @BeforeEach
    void setUp() {
        chain = new PaperChainClient("paper", ConfigFactory.parseMap(Map.of("transaction-fee", 100)));
        pool = chain.createPool("mintA", "mintB", 9, 9, 1_000_000_000L, 2_000_000_000L);
        wallet = chain.generateWallet();
        chain.requestNativeFunding(wallet.address(), 1_000_000);
        chain.mintTokens("mintA", wallet.address(), 10_000);
    }

    private ErrorKind kindOf(ChainClientException e) {
        return new ErrorClassifier(chain, RecoverySettings.defaults()).classify(e.getMessage()).kind();
    }

    @Test
    void depositMovesTokensIntoVaultAndMintsLp() throws ChainClientException {
        OperationReceipt receipt = chain.deposit(wallet, pool.poolId(), "mintA", 4_000, 0);

        assertEquals(4_000, receipt.amountOut());
        assertEquals(100, receipt.fee());
        assertEquals(6_000, chain.getTokenBalance(wallet.address(), "mintA"));
        assertEquals(4_000, chain.getTokenBalance(wallet.address(), pool.lpMintA()));
        assertEquals(4_000, chain.getVaultBalance(pool.poolId(), "mintA"));
        assertEquals(999_900, chain.getNativeBalance(wallet.address()));
    }

    @Test
    void withdrawBurnsLpAndReturnsTokens() throws ChainClientException {
        chain.deposit(wallet, pool.poolId(), "mintA", 4_000, 0);

        chain.withdraw(wallet, pool.poolId(), pool.lpMintA(), 1_500, 0);

        assertEquals(2_500, chain.getTokenBalance(wallet.address(), pool.lpMintA()));
        assertEquals(7_500, chain.getTokenBalance(wallet.address(), "mintA"));
    }

    @Test
    void swapPaysOutAtFixedRatio() throws ChainClientException {
        WalletCredential provider = chain.generateWallet();
        chain.requestNativeFunding(provider.address(), 1_000);
        chain.mintTokens("mintB", provider.address(), 100_000);
        chain.deposit(provider, pool.poolId(), "mintB", 100_000, 0);

        OperationReceipt receipt = chain.swap(wallet, pool.poolId(), SwapDirection.A_TO_B, 1_000, 2_000, 0);

        assertEquals(2_000, receipt.amountOut());
        assertEquals(2_000, chain.getTokenBalance(wallet.address(), "mintB"));
        assertEquals(98_000, chain.getVaultBalance(pool.poolId(), "mintB"));
    }

    @Test
    void failuresCarryContractCodes() {
        ChainClientException insufficient = catchFailure(() -> chain.deposit(wallet, pool.poolId(), "mintA", 50_000, 0));
        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, kindOf(insufficient));

        ChainClientException liquidity = catchFailure(() -> chain.swap(wallet, pool.poolId(), SwapDirection.A_TO_B, 1_000, 0, 0));
        assertEquals(ErrorKind.INSUFFICIENT_LIQUIDITY, kindOf(liquidity));

        ChainClientException slippage = catchFailure(() -> chain.swap(wallet, pool.poolId(), SwapDirection.A_TO_B, 1_000, 5_000, 0));
        assertEquals(ErrorKind.SLIPPAGE_EXCEEDED, kindOf(slippage));

        ChainClientException lpType = catchFailure(() -> chain.withdraw(wallet, pool.poolId(), "mintA", 1, 0));
        assertEquals(ErrorKind.INVALID_LP_TOKEN_TYPE, kindOf(lpType));
    }

    @Test
    void pausesAreEnforced() throws ChainClientException {
        chain.setPoolPaused(pool.poolId(), true);
        assertEquals(ErrorKind.POOL_PAUSED, kindOf(catchFailure(() -> chain.deposit(wallet, pool.poolId(), "mintA", 1, 0))));
        chain.setPoolPaused(pool.poolId(), false);

        chain.setSwapsPaused(pool.poolId(), true);
        assertEquals(ErrorKind.POOL_SWAPS_PAUSED,
            kindOf(catchFailure(() -> chain.swap(wallet, pool.poolId(), SwapDirection.A_TO_B, 1, 0, 0))));

        chain.setSystemPaused(true);
        assertEquals(ErrorKind.SYSTEM_PAUSED, kindOf(catchFailure(() -> chain.deposit(wallet, pool.poolId(), "mintA", 1, 0))));
    }

    @Test
    void injectedFailureIsRaisedOnce() throws ChainClientException {
        chain.injectFailure(PaperChainClient.OP_DEPOSIT, "custom program error: Custom(1020)");

        assertThatThrownBy(() -> chain.deposit(wallet, pool.poolId(), "mintA", 1, 0)).hasMessageContaining("Custom(1020)");
        assertEquals(1, chain.deposit(wallet, pool.poolId(), "mintA", 1, 0).amountIn());
    }

    @Test
    void burnedTokensAreTracked() throws ChainClientException {
        chain.transferTokens(wallet, "mintA", PaperChainClient.BURN_ADDRESS, 3_000);

        assertEquals(3_000, chain.getBurnedAmount("mintA"));
        assertEquals(7_000, chain.getTokenBalance(wallet.address(), "mintA"));
    }

    @Test
    void restoreRejectsWrongSecret() {
        assertThatThrownBy(() -> chain.restoreWallet(new WalletCredential(wallet.address(), "wrong")))
            .isInstanceOf(ChainClientException.class)
            .hasMessageContaining("Invalid private key");
    }

    @Test
    void poolInitializationTransactionCreatesPool() throws ChainClientException {
        PreparedTransaction init = new PreparedTransaction("process_pool_initialize", 150_000, Map.of(
            "tokenAMint", "mintC", "tokenBMint", "mintD",
            "tokenADecimals", 6, "tokenBDecimals", 9,
            "ratioANumerator", 1_000_000L, "ratioBDenominator", 4_000_000_000L));

        chain.submitTransaction(init);

        assertThat(chain.getPoolState(RatioNormalizer.derivePoolId("mintC", "mintD")).tokenADecimals())
            .isEqualTo(6);
        assertThatThrownBy(() -> chain.submitTransaction(init)).hasMessageContaining("(1011)");
    }

    private static ChainClientException catchFailure(ThrowingCall call) {
        try {
            call.run();
        } catch (ChainClientException e) {
            return e;
        }
        throw new AssertionError("Expected a chain client failure");
    }

    @FunctionalInterface
    private interface ThrowingCall {
        void run() throws ChainClientException;
    }
}

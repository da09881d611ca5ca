package org.fixedratio.stresstest.resources.chain;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.api.chain.ChainClientException;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.OperationReceipt;
import org.fixedratio.stresstest.api.chain.PreparedTransaction;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.SwapDirection;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory ledger that behaves like the fixed-ratio contract on a test network.
 * <p>
 * Balances, pools and vaults live in memory; every operation is confirmed immediately. Contract
 * failures are reported with the same {@code Custom(N)} text a real RPC node produces so that the
 * error classifier sees realistic input. Tests and demos can queue failures for specific
 * operations with {@link #injectFailure(String, String)}.
 * <p>
 * All ledger mutations are serialized on the instance monitor.
 * <p>
 * Options:
 * <pre>
 * options {
 *   contract-version = "0.19.0"
 *   transaction-fee = 5000
 * }
 * </pre>
 */
public class PaperChainClient implements IChainClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(PaperChainClient.class);

    public static final String OP_DEPOSIT = "deposit";
    public static final String OP_WITHDRAW = "withdraw";
    public static final String OP_SWAP = "swap";
    public static final String OP_TRANSFER = "transfer";
    public static final String OP_TRANSFER_NATIVE = "transfer-native";
    public static final String OP_SUBMIT = "submit";

    private final String name;
    private final String contractVersion;
    private final long transactionFee;
    private final SecureRandom random = new SecureRandom();

    private final Map<String, String> walletSecrets = new HashMap<>();
    private final Map<String, Long> nativeBalances = new HashMap<>();
    private final Map<String, Map<String, Long>> tokenBalances = new HashMap<>();
    private final Map<String, PaperPool> pools = new HashMap<>();
    private final Map<String, Deque<String>> injectedFailures = new HashMap<>();
    private final AtomicLong signatureCounter = new AtomicLong();
    private boolean systemPaused;

    public PaperChainClient(String name, Config options) {
        this.name = name;
        this.contractVersion = options.hasPath("contract-version") ? options.getString("contract-version") : "0.19.0";
        this.transactionFee = options.hasPath("transaction-fee") ? options.getLong("transaction-fee") : 5_000L;
        LOGGER.debug("Paper chain client '{}' ready (contract {}, fee {})", name, contractVersion, transactionFee);
    }

    public PaperChainClient() {
        this("paper", ConfigFactory.empty());
    }

    // ---- wallets -------------------------------------------------------------------------

    @Override
    public synchronized WalletCredential generateWallet() {
        String address = randomHex(16);
        String secret = randomHex(32);
        walletSecrets.put(address, secret);
        return new WalletCredential(address, secret);
    }

    @Override
    public synchronized WalletCredential restoreWallet(WalletCredential stored) throws ChainClientException {
        if (stored == null || stored.address() == null) {
            throw new ChainClientException("Invalid wallet: missing key material");
        }
        String secret = walletSecrets.get(stored.address());
        if (secret == null) {
            // Wallets persisted by an earlier process are adopted.
            walletSecrets.put(stored.address(), stored.secret());
        } else if (!secret.equals(stored.secret())) {
            throw new ChainClientException("Invalid private key for wallet " + stored.address());
        }
        return stored;
    }

    @Override
    public synchronized long getNativeBalance(String address) {
        return nativeBalances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized long getTokenBalance(String address, String mint) {
        return tokenBalances.getOrDefault(address, Map.of()).getOrDefault(mint, 0L);
    }

    @Override
    public synchronized String requestNativeFunding(String address, long amount) {
        credit(nativeBalances, address, amount);
        return nextSignature("airdrop");
    }

    // ---- pools ---------------------------------------------------------------------------

    /**
     * Creates a pool directly, bypassing transaction submission.
     *
     * @return The pool state.
     */
    public synchronized PoolState createPool(String tokenAMint, String tokenBMint, int decimalsA, int decimalsB,
                                             long ratioA, long ratioB) {
        String poolId = RatioNormalizer.derivePoolId(tokenAMint, tokenBMint);
        PoolState state = new PoolState(poolId, tokenAMint, tokenBMint, decimalsA, decimalsB, ratioA, ratioB,
            "lpA_" + poolId.substring(0, 16), "lpB_" + poolId.substring(0, 16), false, false);
        pools.put(poolId, new PaperPool(state));
        LOGGER.debug("Created paper pool {}", poolId);
        return state;
    }

    @Override
    public synchronized PoolState getPoolState(String poolId) throws ChainClientException {
        return requirePool(poolId).state;
    }

    @Override
    public synchronized boolean isSystemPaused() {
        return systemPaused;
    }

    public synchronized void setSystemPaused(boolean paused) {
        this.systemPaused = paused;
    }

    public synchronized void setPoolPaused(String poolId, boolean paused) throws ChainClientException {
        PaperPool pool = requirePool(poolId);
        pool.state = pool.state.withPoolPaused(paused);
    }

    public synchronized void setSwapsPaused(String poolId, boolean paused) throws ChainClientException {
        PaperPool pool = requirePool(poolId);
        pool.state = pool.state.withSwapsPaused(paused);
    }

    /**
     * Returns the amount of a token held by a pool vault.
     */
    public synchronized long getVaultBalance(String poolId, String mint) throws ChainClientException {
        PaperPool pool = requirePool(poolId);
        return mint.equals(pool.state.tokenAMint()) ? pool.vaultA : mint.equals(pool.state.tokenBMint()) ? pool.vaultB : 0L;
    }

    // ---- operations ----------------------------------------------------------------------

    @Override
    public synchronized OperationReceipt deposit(WalletCredential wallet, String poolId, String tokenMint, long amount,
                                                 int computeUnits) throws ChainClientException {
        failIfInjected(OP_DEPOSIT);
        PaperPool pool = requirePool(poolId);
        requireSystemActive();
        if (pool.state.poolPaused()) {
            throw contractError(1005);
        }
        boolean sideA = tokenMint.equals(pool.state.tokenAMint());
        if (!sideA && !tokenMint.equals(pool.state.tokenBMint())) {
            throw contractError(1014);
        }
        if (amount <= 0) {
            throw contractError(1019);
        }
        requireTokens(wallet.address(), tokenMint, amount);
        chargeFee(wallet.address());

        debit(wallet.address(), tokenMint, amount);
        if (sideA) {
            pool.vaultA += amount;
        } else {
            pool.vaultB += amount;
        }
        String lpMint = sideA ? pool.state.lpMintA() : pool.state.lpMintB();
        creditToken(wallet.address(), lpMint, amount);
        return new OperationReceipt(nextSignature(OP_DEPOSIT), amount, amount, transactionFee);
    }

    @Override
    public synchronized OperationReceipt withdraw(WalletCredential wallet, String poolId, String lpMint, long lpAmount,
                                                  int computeUnits) throws ChainClientException {
        failIfInjected(OP_WITHDRAW);
        PaperPool pool = requirePool(poolId);
        requireSystemActive();
        if (pool.state.poolPaused()) {
            throw contractError(1005);
        }
        boolean sideA = lpMint.equals(pool.state.lpMintA());
        if (!sideA && !lpMint.equals(pool.state.lpMintB())) {
            throw contractError(1021);
        }
        if (lpAmount <= 0) {
            throw contractError(1019);
        }
        if (getTokenBalance(wallet.address(), lpMint) < lpAmount) {
            throw contractError(1022);
        }
        long vault = sideA ? pool.vaultA : pool.vaultB;
        if (vault < lpAmount) {
            throw contractError(1020);
        }
        chargeFee(wallet.address());

        debit(wallet.address(), lpMint, lpAmount);
        if (sideA) {
            pool.vaultA -= lpAmount;
        } else {
            pool.vaultB -= lpAmount;
        }
        String tokenMint = sideA ? pool.state.tokenAMint() : pool.state.tokenBMint();
        creditToken(wallet.address(), tokenMint, lpAmount);
        return new OperationReceipt(nextSignature(OP_WITHDRAW), lpAmount, lpAmount, transactionFee);
    }

    @Override
    public synchronized OperationReceipt swap(WalletCredential wallet, String poolId, SwapDirection direction,
                                              long amountIn, long minimumAmountOut, int computeUnits)
        throws ChainClientException {
        failIfInjected(OP_SWAP);
        PaperPool pool = requirePool(poolId);
        requireSystemActive();
        if (pool.state.swapsPaused()) {
            throw contractError(1030);
        }
        if (amountIn <= 0) {
            throw contractError(1028);
        }
        boolean aToB = direction == SwapDirection.A_TO_B;
        String inputMint = aToB ? pool.state.tokenAMint() : pool.state.tokenBMint();
        String outputMint = aToB ? pool.state.tokenBMint() : pool.state.tokenAMint();
        requireTokens(wallet.address(), inputMint, amountIn);

        BigInteger in = BigInteger.valueOf(amountIn);
        BigInteger a = BigInteger.valueOf(pool.state.ratioANumerator());
        BigInteger b = BigInteger.valueOf(pool.state.ratioBDenominator());
        long amountOut = (aToB ? in.multiply(b).divide(a) : in.multiply(a).divide(b)).longValueExact();
        if (amountOut <= 0) {
            throw contractError(1025);
        }
        if (amountOut < minimumAmountOut) {
            throw contractError(1026);
        }
        long outputVault = aToB ? pool.vaultB : pool.vaultA;
        if (outputVault < amountOut) {
            throw contractError(1020);
        }
        chargeFee(wallet.address());

        debit(wallet.address(), inputMint, amountIn);
        creditToken(wallet.address(), outputMint, amountOut);
        if (aToB) {
            pool.vaultA += amountIn;
            pool.vaultB -= amountOut;
        } else {
            pool.vaultB += amountIn;
            pool.vaultA -= amountOut;
        }
        return new OperationReceipt(nextSignature(OP_SWAP), amountIn, amountOut, transactionFee);
    }

    @Override
    public synchronized String mintTokens(String mint, String destinationAddress, long amount) {
        creditToken(destinationAddress, mint, amount);
        return nextSignature("mint");
    }

    @Override
    public synchronized String transferTokens(WalletCredential from, String mint, String destinationAddress, long amount)
        throws ChainClientException {
        failIfInjected(OP_TRANSFER);
        requireTokens(from.address(), mint, amount);
        debit(from.address(), mint, amount);
        creditToken(destinationAddress, mint, amount);
        return nextSignature(OP_TRANSFER);
    }

    @Override
    public synchronized String transferNative(WalletCredential from, String destinationAddress, long amount)
        throws ChainClientException {
        failIfInjected(OP_TRANSFER_NATIVE);
        long balance = getNativeBalance(from.address());
        if (balance < amount) {
            throw new ChainClientException("Transfer failed: insufficient lamports " + balance + ", need " + amount);
        }
        nativeBalances.put(from.address(), balance - amount);
        credit(nativeBalances, destinationAddress, amount);
        return nextSignature(OP_TRANSFER_NATIVE);
    }

    @Override
    public synchronized String submitTransaction(PreparedTransaction transaction) throws ChainClientException {
        failIfInjected(OP_SUBMIT);
        if ("process_pool_initialize".equals(transaction.operation())) {
            Map<String, Object> p = transaction.parameters();
            String tokenA = String.valueOf(p.get("tokenAMint"));
            String tokenB = String.valueOf(p.get("tokenBMint"));
            if (pools.containsKey(RatioNormalizer.derivePoolId(tokenA, tokenB))) {
                throw contractError(1011);
            }
            createPool(tokenA, tokenB,
                ((Number) p.get("tokenADecimals")).intValue(), ((Number) p.get("tokenBDecimals")).intValue(),
                ((Number) p.get("ratioANumerator")).longValue(), ((Number) p.get("ratioBDenominator")).longValue());
        } else {
            LOGGER.debug("Paper chain accepted {} with {} compute units", transaction.operation(), transaction.computeUnits());
        }
        return nextSignature(transaction.operation());
    }

    @Override
    public String getContractVersion() {
        return contractVersion;
    }

    // ---- test support --------------------------------------------------------------------

    /**
     * Makes the next call of an operation fail with the given raw message.
     *
     * @param operation One of the {@code OP_*} constants.
     * @param rawMessage The failure text, e.g. {@code "custom program error: Custom(1026)"}.
     */
    public synchronized void injectFailure(String operation, String rawMessage) {
        injectedFailures.computeIfAbsent(operation, k -> new ArrayDeque<>()).add(rawMessage);
    }

    public long getBurnedAmount(String mint) {
        return getTokenBalance(BURN_ADDRESS, mint);
    }

    public String getName() {
        return name;
    }

    // ---- internals -----------------------------------------------------------------------

    private void failIfInjected(String operation) throws ChainClientException {
        Deque<String> queue = injectedFailures.get(operation);
        if (queue != null && !queue.isEmpty()) {
            throw new ChainClientException(queue.poll());
        }
    }

    private PaperPool requirePool(String poolId) throws ChainClientException {
        PaperPool pool = pools.get(poolId);
        if (pool == null) {
            throw contractError(1012);
        }
        return pool;
    }

    private void requireSystemActive() throws ChainClientException {
        if (systemPaused) {
            throw contractError(1004);
        }
    }

    private void requireTokens(String address, String mint, long amount) throws ChainClientException {
        if (getTokenBalance(address, mint) < amount) {
            throw contractError(1015);
        }
    }

    private void chargeFee(String address) throws ChainClientException {
        long balance = getNativeBalance(address);
        if (balance < transactionFee) {
            throw new ChainClientException("Transaction simulation failed: insufficient lamports for fee " + transactionFee);
        }
        nativeBalances.put(address, balance - transactionFee);
    }

    private void debit(String address, String mint, long amount) {
        Map<String, Long> balances = tokenBalances.get(address);
        balances.put(mint, balances.getOrDefault(mint, 0L) - amount);
    }

    private void creditToken(String address, String mint, long amount) {
        credit(tokenBalances.computeIfAbsent(address, k -> new HashMap<>()), mint, amount);
    }

    private static void credit(Map<String, Long> balances, String key, long amount) {
        balances.merge(key, amount, Long::sum);
    }

    private static ChainClientException contractError(int code) {
        return new ChainClientException(String.format(
            "Transaction simulation failed: Error processing Instruction 0: custom program error: 0x%x (%d)", code, code));
    }

    private String nextSignature(String operation) {
        return operation + "-" + signatureCounter.incrementAndGet() + "-" + randomHex(8);
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    private static final class PaperPool {
        PoolState state;
        long vaultA;
        long vaultB;

        PaperPool(PoolState state) {
            this.state = state;
        }
    }
}

package org.fixedratio.stresstest.api.chain;

import org.fixedratio.stresstest.api.pools.PoolState;
import org.fixedratio.stresstest.api.workers.SwapDirection;

/**
 * Capability-typed client for the fixed-ratio trading contract and its chain.
 * <p>
 * Implementations must be thread-safe: every worker loop calls into the same instance
 * concurrently. Implementations are instantiated reflectively and must provide a public
 * constructor taking {@code (String name, com.typesafe.config.Config options)}.
 * <p>
 * All amounts are in base units (token amounts scaled by the token's decimals, native
 * amounts in the smallest native unit).
 */
public interface IChainClient {

    /** Address that receives burned tokens. Nothing can ever be spent from it. */
    String BURN_ADDRESS = "11111111111111111111111111111111";

    /** Native base units per whole native coin. */
    long NATIVE_UNITS_PER_COIN = 1_000_000_000L;

    WalletCredential generateWallet() throws ChainClientException;

    /**
     * Restores a wallet from stored key material and validates that it is usable.
     *
     * @param stored The stored credential.
     * @return The restored credential.
     * @throws ChainClientException if the key material is invalid.
     */
    WalletCredential restoreWallet(WalletCredential stored) throws ChainClientException;

    long getNativeBalance(String address) throws ChainClientException;

    long getTokenBalance(String address, String mint) throws ChainClientException;

    /**
     * Fetches the current on-chain state of a pool.
     *
     * @param poolId The pool reference.
     * @return The pool state.
     * @throws ChainClientException if the pool does not exist or the call fails.
     */
    PoolState getPoolState(String poolId) throws ChainClientException;

    boolean isSystemPaused() throws ChainClientException;

    OperationReceipt deposit(WalletCredential wallet, String poolId, String tokenMint, long amount, int computeUnits)
        throws ChainClientException;

    OperationReceipt withdraw(WalletCredential wallet, String poolId, String lpMint, long lpAmount, int computeUnits)
        throws ChainClientException;

    OperationReceipt swap(WalletCredential wallet, String poolId, SwapDirection direction, long amountIn,
                          long minimumAmountOut, int computeUnits) throws ChainClientException;

    /**
     * Mints test tokens into a wallet. Only meaningful on test networks where the harness
     * controls the mint authority.
     */
    String mintTokens(String mint, String destinationAddress, long amount) throws ChainClientException;

    String transferTokens(WalletCredential from, String mint, String destinationAddress, long amount)
        throws ChainClientException;

    String transferNative(WalletCredential from, String destinationAddress, long amount) throws ChainClientException;

    /**
     * Requests native funding for an address, e.g. through an airdrop or a faucet.
     */
    String requestNativeFunding(String address, long amount) throws ChainClientException;

    /**
     * Submits a prepared transaction and waits for its confirmation.
     *
     * @return The transaction signature.
     */
    String submitTransaction(PreparedTransaction transaction) throws ChainClientException;

    String getContractVersion() throws ChainClientException;
}

package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.api.storage.IStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Loads or creates the operational wallet and tops it up when it falls below the minimum balance.
 */
public class OperationalWalletRoutine implements IStartupRoutine {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperationalWalletRoutine.class);

    private final IChainClient chainClient;
    private final IStateStore stateStore;
    private final OperationalWallet operationalWallet;
    private final long minimumBalance;

    public OperationalWalletRoutine(IChainClient chainClient, IStateStore stateStore,
                                    OperationalWallet operationalWallet, long minimumBalance) {
        this.chainClient = chainClient;
        this.stateStore = stateStore;
        this.operationalWallet = operationalWallet;
        this.minimumBalance = minimumBalance;
    }

    @Override
    public String getName() {
        return "operational-wallet";
    }

    @Override
    public void start() throws Exception {
        Optional<WalletCredential> stored = stateStore.loadOperationalWallet();
        WalletCredential wallet;
        if (stored.isPresent()) {
            wallet = chainClient.restoreWallet(stored.get());
            LOGGER.info("Loaded operational wallet {}", wallet.address());
        } else {
            wallet = chainClient.generateWallet();
            stateStore.saveOperationalWallet(wallet);
            LOGGER.info("Created operational wallet {}", wallet.address());
        }

        long balance = chainClient.getNativeBalance(wallet.address());
        if (balance < minimumBalance) {
            long missing = minimumBalance - balance;
            LOGGER.info("Operational wallet balance {} below {}, requesting {}", balance, minimumBalance, missing);
            chainClient.requestNativeFunding(wallet.address(), missing);
        }
        operationalWallet.set(wallet);
    }
}

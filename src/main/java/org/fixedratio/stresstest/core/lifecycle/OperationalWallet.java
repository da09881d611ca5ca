package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.chain.WalletCredential;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the shared wallet that funds workers and receives native sweeps from drained
 * workers. Populated by the operational wallet startup routine.
 */
public final class OperationalWallet {

    private final AtomicReference<WalletCredential> wallet = new AtomicReference<>();

    public Optional<WalletCredential> get() {
        return Optional.ofNullable(wallet.get());
    }

    public void set(WalletCredential credential) {
        wallet.set(credential);
    }
}

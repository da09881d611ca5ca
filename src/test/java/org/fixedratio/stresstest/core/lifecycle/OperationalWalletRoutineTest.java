package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.chain.IChainClient;
import org.fixedratio.stresstest.api.chain.WalletCredential;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.fixedratio.stresstest.resources.chain.PaperChainClient;
import org.fixedratio.stresstest.resources.storage.InMemoryStateStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class OperationalWalletRoutineTest {

    private static final long MINIMUM = 10 * IChainClient.NATIVE_UNITS_PER_COIN;

    private final PaperChainClient chain = new PaperChainClient();
    private final InMemoryStateStore store = new InMemoryStateStore();
    private final OperationalWallet holder = new OperationalWallet();

    @Test
    void newWalletIsCreatedPersistedAndFunded() throws Exception {
        new OperationalWalletRoutine(chain, store, holder, MINIMUM).start();

        WalletCredential wallet = holder.get().orElseThrow();
        assertThat(store.loadOperationalWallet()).contains(wallet);
        assertEquals(MINIMUM, chain.getNativeBalance(wallet.address()));
    }

    @Test
    void storedWalletIsReusedAndToppedUp() throws Exception {
        WalletCredential existing = chain.generateWallet();
        store.saveOperationalWallet(existing);
        chain.requestNativeFunding(existing.address(), MINIMUM - 1_000);

        new OperationalWalletRoutine(chain, store, holder, MINIMUM).start();

        assertThat(holder.get()).contains(existing);
        assertEquals(MINIMUM, chain.getNativeBalance(existing.address()));
    }

    @Test
    void wellFundedWalletIsLeftAlone() throws Exception {
        WalletCredential existing = chain.generateWallet();
        store.saveOperationalWallet(existing);
        chain.requestNativeFunding(existing.address(), 2 * MINIMUM);

        new OperationalWalletRoutine(chain, store, holder, MINIMUM).start();

        assertEquals(2 * MINIMUM, chain.getNativeBalance(existing.address()));
    }
}

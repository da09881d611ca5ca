package org.fixedratio.stresstest.api.chain;

/**
 * Key material of a wallet as handed out by the chain client.
 *
 * @param address The public address.
 * @param secret  The encoded private key, opaque to the harness.
 */
public record WalletCredential(String address, String secret) {

    @Override
    public String toString() {
        return "WalletCredential[address=" + address + "]";
    }
}

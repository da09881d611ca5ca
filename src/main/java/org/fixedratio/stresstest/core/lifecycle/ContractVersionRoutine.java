package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.chain.IChainClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refuses to start against a contract newer than the harness supports.
 */
public class ContractVersionRoutine implements IStartupRoutine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContractVersionRoutine.class);

    private final IChainClient chainClient;
    private final String maxSupportedVersion;

    public ContractVersionRoutine(IChainClient chainClient, String maxSupportedVersion) {
        this.chainClient = chainClient;
        this.maxSupportedVersion = maxSupportedVersion;
    }

    @Override
    public String getName() {
        return "contract-version";
    }

    @Override
    public void start() throws Exception {
        String version = chainClient.getContractVersion();
        if (compareVersions(version, maxSupportedVersion) > 0) {
            throw new IllegalStateException(String.format(
                "Contract version %s is newer than the maximum supported version %s", version, maxSupportedVersion));
        }
        LOGGER.info("Contract version {} is supported (max {})", version, maxSupportedVersion);
    }

    /**
     * Compares dotted numeric versions component by component; missing components count as zero.
     */
    static int compareVersions(String left, String right) {
        String[] a = left.trim().split("\\.");
        String[] b = right.trim().split("\\.");
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            long x = i < a.length ? parseComponent(a[i], left) : 0;
            long y = i < b.length ? parseComponent(b[i], right) : 0;
            if (x != y) {
                return Long.compare(x, y);
            }
        }
        return 0;
    }

    private static long parseComponent(String component, String version) {
        try {
            return Long.parseLong(component);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version '" + version + "'", e);
        }
    }
}

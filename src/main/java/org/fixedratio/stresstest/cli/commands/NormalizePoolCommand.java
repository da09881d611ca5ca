package org.fixedratio.stresstest.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fixedratio.stresstest.api.pools.PoolRatioConfig;
import org.fixedratio.stresstest.core.pools.InvalidPoolRatioException;
import org.fixedratio.stresstest.core.pools.RatioNormalizer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "normalize-pool",
    description = "Prints the canonical form of a token pair and its ratio as JSON."
)
public class NormalizePoolCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Mint of the first token.")
    private String mintA;

    @Parameters(index = "1", description = "Mint of the second token.")
    private String mintB;

    @Parameters(index = "2", description = "Units of the first token.")
    private long ratioA;

    @Parameters(index = "3", description = "Units of the second token.")
    private long ratioB;

    @Option(names = "--validate", description = "Check that exactly one side of the ratio is anchored to one whole token.")
    private boolean validate;

    @Option(names = "--decimals-a", defaultValue = "9", description = "Decimals of the first token (default: ${DEFAULT-VALUE}).")
    private int decimalsA;

    @Option(names = "--decimals-b", defaultValue = "9", description = "Decimals of the second token (default: ${DEFAULT-VALUE}).")
    private int decimalsB;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public Integer call() throws JsonProcessingException {
        final RatioNormalizer normalizer = new RatioNormalizer();
        final PoolRatioConfig config;
        try {
            config = normalizer.normalize(mintA, mintB, ratioA, ratioB);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 2;
        }

        final Map<String, Object> output = new LinkedHashMap<>();
        output.put("poolId", config.poolId());
        output.put("tokenAMint", config.tokenAMint());
        output.put("tokenBMint", config.tokenBMint());
        output.put("ratioANumerator", config.ratioANumerator());
        output.put("ratioBDenominator", config.ratioBDenominator());
        output.put("wasSwapped", config.wasSwapped());

        if (validate) {
            // Decimals follow the tokens when the pair was swapped.
            final int canonicalDecimalsA = config.wasSwapped() ? decimalsB : decimalsA;
            final int canonicalDecimalsB = config.wasSwapped() ? decimalsA : decimalsB;
            try {
                normalizer.validate(config, canonicalDecimalsA, canonicalDecimalsB);
                output.put("valid", true);
                output.put("exchangeRate", normalizer.exchangeRateDisplay(config, canonicalDecimalsA, canonicalDecimalsB));
            } catch (InvalidPoolRatioException e) {
                output.put("valid", false);
                output.put("error", e.getMessage());
            }
        }

        spec.commandLine().getOut().println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(output));
        return Boolean.FALSE.equals(output.get("valid")) ? 1 : 0;
    }
}

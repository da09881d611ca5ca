package org.fixedratio.stresstest.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.cli.CommandLineInterface;
import org.fixedratio.stresstest.node.StressTestNode;
import org.fixedratio.stresstest.resources.chain.PaperChainClient;
import org.fixedratio.stresstest.resources.storage.InMemoryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the harness and runs the bootstrapped workers until interrupted."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-p", "--paper"},
        description = "Run against the in-memory paper chain with in-memory state, ignoring the configured chain and storage.")
    private boolean paper;

    @Option(names = {"-d", "--duration"},
        description = "Stop automatically after this ISO-8601 duration, e.g. PT10M. Runs until interrupted if omitted.")
    private Duration duration;

    @Override
    public Integer call() throws Exception {
        parent.configureLogging();
        Config config = parent.getConfig();
        if (paper) {
            LOGGER.info("Starting in paper mode...");
            config = ConfigFactory.parseMap(Map.of(
                "stress-test.chain.className", PaperChainClient.class.getName(),
                "stress-test.storage.className", InMemoryStateStore.class.getName()
            )).withFallback(config);
        } else {
            LOGGER.info("Starting against the configured chain...");
        }

        final StressTestNode node = new StressTestNode(config);
        node.start();

        // The shutdown hook in the node handles termination.
        try {
            if (duration != null) {
                Thread.sleep(duration.toMillis());
                node.stop();
            } else {
                Thread.currentThread().join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Harness interrupted.");
        }
        return 0;
    }
}

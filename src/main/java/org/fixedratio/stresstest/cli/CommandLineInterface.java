package org.fixedratio.stresstest.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import org.fixedratio.stresstest.cli.commands.BudgetCommand;
import org.fixedratio.stresstest.cli.commands.NormalizePoolCommand;
import org.fixedratio.stresstest.cli.commands.RunCommand;
import org.fixedratio.stresstest.node.config.ConfigLoader;
import org.fixedratio.stresstest.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "stress-test",
    mixinStandardHelpOptions = true,
    version = "Fixed-Ratio Stress Test 1.0",
    description = "Stress-test harness for the fixed-ratio trading contract",
    subcommands = {
        RunCommand.class,
        NormalizePoolCommand.class,
        BudgetCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: stress-test.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stress-test");
        System.exit(commandLine.execute(args));
    }

    /**
     * Returns the loaded configuration, loading it on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if a file given via {@code --config} does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null) {
                config = ConfigLoader.loadRequired(configFile);
            } else {
                config = ConfigLoader.load();
            }
        }
        return config;
    }

    /**
     * Applies the {@code logging} section of the configuration. Commands that run the node call
     * this before doing anything else.
     */
    public void configureLogging() {
        final Config loaded = getConfig();
        if (loaded.hasPath("logging.format")) {
            final String format = loaded.getString("logging.format");
            System.setProperty("stress-test.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(loaded);
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }
}

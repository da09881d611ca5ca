package org.fixedratio.stresstest.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fixedratio.stresstest.cli.CommandLineInterface;
import org.fixedratio.stresstest.core.budget.BudgetContext;
import org.fixedratio.stresstest.core.budget.ResourceBudgeter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "budget",
    description = "Prints the compute budget requested for a contract operation."
)
public class BudgetCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Contract operation name, e.g. process_swap_execute.")
    private String operation;

    @Option(names = "--pools", description = "Pool count for fee consolidation.")
    private Integer poolCount;

    @Option(names = "--donation", description = "Donation amount in native base units.")
    private Long donationAmount;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final ResourceBudgeter budgeter = new ResourceBudgeter(
            config.hasPath("stress-test.budget") ? config.getConfig("stress-test.budget") : ConfigFactory.empty());
        final BudgetContext context = poolCount == null && donationAmount == null
            ? null
            : new BudgetContext(poolCount == null ? 0 : poolCount, donationAmount == null ? 0L : donationAmount);
        final int units = budgeter.getBudget(operation, context);
        spec.commandLine().getOut().println(operation + ": " + units + " compute units");
        return 0;
    }
}

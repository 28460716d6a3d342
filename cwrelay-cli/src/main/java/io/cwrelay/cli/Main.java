package io.cwrelay.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import io.cwrelay.cli.command.CommandRegistry;
import io.cwrelay.cli.command.RelayCommand;
import io.cwrelay.cli.config.LogbackConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;

/**
 * Command line entry point.
 *
 * Usage:
 * <pre>
 * cwrelay [--verbose] aws-metrics [--config rules.json] [--proxy host:port] [--dry-run]
 *                                 [--no-suffix-for-single] [--prefix p] [--settings relay.conf]
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * Global CLI arguments.
     */
    public static class Args {
        @Parameter(names = "--verbose", description = "More output, including stack traces on failure")
        public boolean verbose;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Show this help message")
        public boolean help;
    }

    public static void main(String[] args) {
        System.exit(run(args, CommandRegistry.defaults(), System.err));
    }

    /**
     * Parses {@code args}, runs the selected command and returns the exit status.
     */
    static int run(String[] args, CommandRegistry registry, PrintStream err) {
        Args cliArgs = new Args();
        Map<String, RelayCommand> commands = registry.createAll();

        JCommander.Builder builder = JCommander.newBuilder()
                .addObject(cliArgs)
                .programName("cwrelay");
        commands.forEach((name, command) -> builder.addCommand(name, command.arguments()));
        JCommander jcommander = builder.build();

        try {
            jcommander.parse(args);
        } catch (ParameterException e) {
            err.println("Error parsing arguments: " + e.getMessage());
            printUsage(jcommander, commands, err);
            return 1;
        }

        String commandName = jcommander.getParsedCommand();
        if (cliArgs.help || commandName == null) {
            printUsage(jcommander, commands, err);
            return cliArgs.help ? 0 : 1;
        }

        RelayCommand command = commands.get(commandName);
        try {
            LogbackConfigurator.configure(command.settings(), cliArgs.verbose);
            return command.execute();
        } catch (Exception e) {
            if (cliArgs.verbose) {
                log.error("{} failed", commandName, e);
            } else {
                err.println("ERROR: " + e.getMessage());
            }
            return 1;
        }
    }

    private static void printUsage(JCommander jcommander, Map<String, RelayCommand> commands, PrintStream err) {
        StringBuilder usage = new StringBuilder();
        jcommander.getUsageFormatter().usage(usage);
        err.print(usage);
        err.println("Available commands:");
        commands.forEach((name, command) -> err.println("  " + name + "  " + command.helpText()));
    }
}

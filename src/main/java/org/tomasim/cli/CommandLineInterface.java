package org.tomasim.cli;

import com.typesafe.config.Config;
import org.tomasim.cli.commands.RunCommand;
import org.tomasim.config.ConfigLoader;
import org.tomasim.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tomasim",
    mixinStandardHelpOptions = true,
    version = "Tomasim 1.0",
    description = "Tomasim - cycle-accurate Tomasulo simulator with a reorder buffer and branch speculation",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: tomasim.conf in the working directory, if present)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // no subcommand: show usage
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * @return A command line for the root command, as used by {@link #main(String[])}.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tomasim");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file given with --config does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}

package org.cognita.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.cognita.cli.commands.DisasmCommand;
import org.cognita.cli.commands.RunCommand;
import org.cognita.config.ConfigLoader;
import org.cognita.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "cognita",
    mixinStandardHelpOptions = true,
    version = "Cognita 1.0",
    description = "Cognita - behavior execution core for autonomous actors",
    subcommands = {
        DisasmCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: cognita.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("cognita");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging levels.
     * @throws ConfigException if the configuration cannot be parsed, or the file given with
     *         {@code --config} does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new ConfigException.Generic("Configuration file specified via --config was not found: "
                        + configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}

package org.treesim.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.treesim.cli.commands.SimulateCommand;
import org.treesim.cli.config.ConfigLoader;
import org.treesim.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "treesim",
    mixinStandardHelpOptions = true,
    version = "treesim 1.0",
    description = "Simulates transmission trees and forests under skyline birth-death-sampling models",
    subcommands = {
        SimulateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "treesim.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/treesim.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("treesim");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Resolves the configuration on first use.
     *
     * @return the application configuration.
     * @throws IllegalArgumentException if an explicitly given configuration file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

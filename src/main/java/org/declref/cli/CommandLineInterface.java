package org.declref.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.declref.cli.commands.CheckCommand;
import org.declref.cli.commands.ResolveCommand;
import org.declref.cli.config.ConfigLoader;
import org.declref.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "declref",
    mixinStandardHelpOptions = true,
    version = "declref 1.0",
    description = "Resolves declaration references against the exported API of a package",
    subcommands = {
        ResolveCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/declref.conf)"
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
        commandLine.setCommandName("declref");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.info(message);
                    case WARN -> log.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            throw e;
        } catch (ConfigException e) {
            log.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("declref.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
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
        } catch (ch.qos.logback.core.joran.spi.JoranException | ClassCastException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @throws IllegalArgumentException if an explicit config file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

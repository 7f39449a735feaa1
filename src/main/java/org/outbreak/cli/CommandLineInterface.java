package org.outbreak.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.outbreak.cli.commands.ConvertCommand;
import org.outbreak.cli.commands.RunCommand;
import org.outbreak.cli.config.ConfigLoader;
import org.outbreak.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "outbreak",
    mixinStandardHelpOptions = true,
    version = "Outbreak 1.0",
    description = "Outbreak - agent-based disease transmission simulator",
    subcommands = {
        RunCommand.class,
        ConvertCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("outbreak");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        if (this.configFile != null && !this.configFile.exists()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
        }
        try {
            this.config = this.configFile != null
                    ? ConfigLoader.load(this.configFile)
                    : ConfigLoader.load();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, LoggingConfigurator.appenderFor(format));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
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
        } catch (JoranException e) {
            LOGGER.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }

    /**
     * @return The merged configuration, loaded on first access.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

package org.ysim.cli;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.cli.commands.RunCommand;
import org.ysim.cli.commands.ValidateCommand;
import org.ysim.cli.config.ConfigLoader;
import org.ysim.cli.config.LoggingConfigurator;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "ysim",
    mixinStandardHelpOptions = true,
    version = "ysim 1.0",
    description = "ysim - agent-based social network simulation",
    subcommands = {
        RunCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ysim.conf)"
    )
    private File configFile;

    @Override
    public Integer call() {
        // No subcommand given.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the configured command line. Tests use it to run commands like the entry point does.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ysim");
        return commandLine;
    }

    /**
     * Resolves the configuration and applies its logging settings.
     *
     * @param overrides dotted paths to values taking precedence over every other source
     * @return the resolved configuration
     * @throws IllegalArgumentException                if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed
     */
    public Config loadConfig(final Map<String, ?> overrides) {
        final Config config = ConfigLoader.resolve(this.configFile, overrides, (level, message) -> {
            switch (level) {
                case INFO -> LOG.info(message);
                case WARN -> LOG.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("ysim.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        return config;
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
}

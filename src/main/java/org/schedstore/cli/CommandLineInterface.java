package org.schedstore.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.schedstore.cli.commands.CountCommand;
import org.schedstore.cli.commands.MigrateCommand;
import org.schedstore.cli.commands.SyncCommand;
import org.schedstore.cli.config.ConfigLoader;
import org.schedstore.store.HybridDataStore;
import org.schedstore.store.api.StoreException;
import org.schedstore.store.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "scheduler-store",
    mixinStandardHelpOptions = true,
    version = "scheduler-store 1.0",
    description = "Operator tools for the scheduler store (relational tier + blob tier)",
    subcommands = {
        MigrateCommand.class,
        SyncCommand.class,
        CountCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Environment overrides:",
        "  DATABASE_URL, DATABASE_READ_URL, USE_DISK, SU_DATA_DIR, MIGRATION_BATCH_SIZE"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/scheduler-store.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: show usage
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
        commandLine.setCommandName("scheduler-store");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            System.exit(1);
        } catch (com.typesafe.config.ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            System.exit(1);
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("scheduler-store.logging.format",
                "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }

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

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Opens the data store from the resolved configuration and creates missing tables.
     *
     * @param forceBlobTier open the blob tier even when {@code store.disk.enabled} is off
     */
    public HybridDataStore openStore(boolean forceBlobTier) throws StoreException {
        StoreConfig storeConfig = StoreConfig.fromConfig(getConfig());
        if (forceBlobTier) {
            storeConfig = storeConfig.withUseDisk(true);
        }
        HybridDataStore store = HybridDataStore.open(storeConfig);
        try {
            store.runMigrations();
        } catch (StoreException e) {
            store.close();
            throw e;
        }
        return store;
    }

    public StoreConfig getStoreConfig() throws StoreException {
        return StoreConfig.fromConfig(getConfig());
    }
}

package de.bsommerfeld.mtgbuilder.app;

import ch.qos.logback.classic.Level;
import com.google.inject.ConfigurationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.mtgbuilder.app.cli.BulkCommand;
import de.bsommerfeld.mtgbuilder.app.cli.CountCommand;
import de.bsommerfeld.mtgbuilder.app.cli.FetchCommand;
import de.bsommerfeld.mtgbuilder.app.cli.FindCommand;
import de.bsommerfeld.mtgbuilder.app.cli.InspectCommand;
import de.bsommerfeld.mtgbuilder.app.cli.SearchCommand;
import de.bsommerfeld.mtgbuilder.app.cli.ShowCommand;
import de.bsommerfeld.mtgbuilder.app.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Command line entry point of the card catalog ingester.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate <query...>} - check queries without sending them</li>
 *   <li>{@code search <query...>} - fetch and store, page by page, queries in parallel</li>
 *   <li>{@code fetch <query>} - fetch every page first, then store</li>
 *   <li>{@code inspect <query>} - print the first result page</li>
 *   <li>{@code bulk} - import the full bulk data file</li>
 *   <li>{@code count}, {@code show <id>}, {@code find <name>} - read the store</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * mtg-ingest search "type:creature c:red" "t:instant cmc<=2"
 * mtg-ingest -v bulk
 * APP_MODE=TEST mtg-ingest search lightning
 * }</pre>
 *
 * <p>
 * Sub-commands are created by Guice, so they receive their collaborators by
 * constructor injection. Exit codes: {@code 0} success, {@code 1} an ingestion
 * step failed, {@code 2} invalid usage.
 */
@Command(
    name = "mtg-ingest",
    mixinStandardHelpOptions = true,
    version = "MTG Builder Ingest 1.0.0",
    description = "Fetches Magic: The Gathering card data from Scryfall into a local database",
    subcommands = {
        ValidateCommand.class,
        SearchCommand.class,
        FetchCommand.class,
        InspectCommand.class,
        BulkCommand.class,
        CountCommand.class,
        ShowCommand.class,
        FindCommand.class
    }
)
public class IngestCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(IngestCli.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    void setVerbose(boolean verbose) {
        if (verbose)
            setRootLevel(Level.DEBUG);
    }

    @Option(names = {"-q", "--quiet"}, description = "Suppress log output except errors")
    void setQuiet(boolean quiet) {
        if (quiet)
            setRootLevel(Level.ERROR);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    private static void setRootLevel(Level level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(level);
        } else {
            LOG.warn("Cannot change log level, logging backend is {}", root.getClass().getName());
        }
    }

    /**
     * Builds the command tree with sub-commands resolved through the given
     * injector.
     */
    public static CommandLine commandLine(Injector injector) {
        return new CommandLine(IngestCli.class, new GuiceFactory(injector));
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new IngestModule());
        int exitCode = commandLine(injector).execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates commands through Guice; picocli's own helper types fall back to
     * the default factory.
     */
    static final class GuiceFactory implements CommandLine.IFactory {

        private final Injector injector;

        GuiceFactory(Injector injector) {
            this.injector = injector;
        }

        @Override
        public <K> K create(Class<K> cls) throws Exception {
            try {
                return injector.getInstance(cls);
            } catch (ConfigurationException e) {
                return CommandLine.defaultFactory().create(cls);
            }
        }
    }
}

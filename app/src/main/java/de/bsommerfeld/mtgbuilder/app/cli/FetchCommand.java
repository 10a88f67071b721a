package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import de.bsommerfeld.mtgbuilder.core.event.ApplicationEventBus;
import de.bsommerfeld.mtgbuilder.scryfall.IngestionPipeline;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Collects every page of one query before writing anything. A failed page
 * leaves the store untouched.
 */
@Command(
    name = "fetch",
    description = "Fetch all pages of a query, then store them at once",
    mixinStandardHelpOptions = true
)
public class FetchCommand extends IngestCommand {

    private final IngestionPipeline pipeline;
    private final ApplicationEventBus eventBus;

    @Parameters(index = "0", paramLabel = "QUERY", description = "Scryfall search query")
    String query;

    @Inject
    public FetchCommand(IngestionPipeline pipeline, ApplicationEventBus eventBus) {
        this.pipeline = pipeline;
        this.eventBus = eventBus;
    }

    @Override
    protected int execute() throws IngestException {
        ProgressPrinter printer = new ProgressPrinter(out());
        eventBus.register(printer);
        try {
            int stored = pipeline.fetchAllThenStore(query);
            out().printf("Stored %d cards%n", stored);
            return 0;
        } finally {
            eventBus.unregister(printer);
        }
    }
}

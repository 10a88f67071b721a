package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.core.event.ApplicationEventBus;
import de.bsommerfeld.mtgbuilder.scryfall.IngestionPipeline;
import de.bsommerfeld.mtgbuilder.scryfall.QueryOutcome;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Fetches every page of each query and stores it as it arrives. Several
 * queries run in parallel, sharing the rate limit.
 */
@Command(
    name = "search",
    description = "Fetch search results and store them page by page",
    mixinStandardHelpOptions = true
)
public class SearchCommand extends IngestCommand {

    private final IngestionPipeline pipeline;
    private final ApplicationEventBus eventBus;

    @Parameters(arity = "1..*", paramLabel = "QUERY", description = "Scryfall search queries")
    List<String> queries;

    @Inject
    public SearchCommand(IngestionPipeline pipeline, ApplicationEventBus eventBus) {
        this.pipeline = pipeline;
        this.eventBus = eventBus;
    }

    @Override
    protected int execute() {
        ProgressPrinter printer = new ProgressPrinter(out());
        eventBus.register(printer);
        try {
            List<QueryOutcome<Integer>> outcomes = pipeline.fetchAndStoreMultiple(queries);

            int total = 0;
            int failed = 0;
            for (QueryOutcome<Integer> outcome : outcomes) {
                if (outcome.isSuccess()) {
                    total += outcome.value();
                } else {
                    failed++;
                    total += outcome.error().getStoredCount();
                    err().printf("Query '%s' failed: %s%n", outcome.query(), outcome.error().getMessage());
                }
            }
            out().printf("Stored %d cards from %d of %d queries%n", total, outcomes.size() - failed, outcomes.size());
            return failed == 0 ? 0 : 1;
        } finally {
            eventBus.unregister(printer);
        }
    }
}

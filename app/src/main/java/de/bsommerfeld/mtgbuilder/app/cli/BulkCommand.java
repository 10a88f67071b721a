package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import de.bsommerfeld.mtgbuilder.core.event.ApplicationEventBus;
import de.bsommerfeld.mtgbuilder.scryfall.BulkDataImporter;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;

/**
 * Imports the configured bulk data file ({@code bulk.type}).
 */
@Command(
    name = "bulk",
    description = "Download the bulk data file and store every card",
    mixinStandardHelpOptions = true
)
public class BulkCommand extends IngestCommand {

    private final BulkDataImporter importer;
    private final ApplicationEventBus eventBus;

    @Inject
    public BulkCommand(BulkDataImporter importer, ApplicationEventBus eventBus) {
        this.importer = importer;
        this.eventBus = eventBus;
    }

    @Override
    protected int execute() throws IngestException {
        ProgressPrinter printer = new ProgressPrinter(out());
        eventBus.register(printer);
        try {
            int stored = importer.downloadAndStore();
            out().printf("Imported %d cards%n", stored);
            return 0;
        } finally {
            eventBus.unregister(printer);
        }
    }
}

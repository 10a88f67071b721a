package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.db.DatabaseService;
import de.bsommerfeld.mtgbuilder.db.StorageException;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Prints the stored upstream payload of one card.
 */
@Command(
    name = "show",
    description = "Print the raw JSON stored for a card",
    mixinStandardHelpOptions = true
)
public class ShowCommand extends IngestCommand {

    private final DatabaseService database;

    @Parameters(index = "0", paramLabel = "ID", description = "Scryfall card ID")
    String id;

    @Inject
    public ShowCommand(DatabaseService database) {
        this.database = database;
    }

    @Override
    protected int execute() throws StorageException {
        String rawJson = database.getRawJson(id);
        if (rawJson == null) {
            err().printf("No card with ID %s%n", id);
            return 1;
        }
        out().println(rawJson);
        return 0;
    }
}

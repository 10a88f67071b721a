package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.db.DatabaseService;
import de.bsommerfeld.mtgbuilder.db.StorageException;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;

@Command(
    name = "count",
    description = "Print the number of stored cards",
    mixinStandardHelpOptions = true
)
public class CountCommand extends IngestCommand {

    private final DatabaseService database;

    @Inject
    public CountCommand(DatabaseService database) {
        this.database = database;
    }

    @Override
    protected int execute() throws StorageException {
        out().println(database.getCardCount());
        return 0;
    }
}

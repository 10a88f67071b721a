package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.scryfall.query.QueryValidator;
import de.bsommerfeld.mtgbuilder.scryfall.query.ValidatedQuery;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Checks queries locally without sending anything to Scryfall.
 *
 * <pre>{@code
 * mtg-ingest validate "type:creature c:red" "(t:instant"
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate search queries without sending them",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends IngestCommand {

    private final QueryValidator validator;

    @Parameters(arity = "1..*", paramLabel = "QUERY", description = "Scryfall search queries")
    List<String> queries;

    @Inject
    public ValidateCommand(QueryValidator validator) {
        this.validator = validator;
    }

    @Override
    protected int execute() {
        boolean allValid = true;
        for (ValidatedQuery result : validator.validateMany(queries)) {
            if (result.isValid()) {
                out().printf("✓ %s -> %s%n", result.query(), validator.encode(result.query()));
            } else {
                allValid = false;
                out().printf("✗ %s: %s%n", result.query(), result.error().get().message());
            }
        }
        return allValid ? 0 : 1;
    }
}

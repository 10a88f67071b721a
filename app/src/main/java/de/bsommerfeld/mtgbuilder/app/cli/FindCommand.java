package de.bsommerfeld.mtgbuilder.app.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import de.bsommerfeld.mtgbuilder.db.DatabaseService;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;

/**
 * Looks up stored cards by a part of their name.
 *
 * <pre>{@code
 * mtg-ingest find bolt --limit 5
 * }</pre>
 */
@Command(
    name = "find",
    description = "Find stored cards by name",
    mixinStandardHelpOptions = true
)
public class FindCommand extends IngestCommand {

    private final DatabaseService database;
    private final ObjectMapper mapper;

    @Parameters(index = "0", paramLabel = "NAME", description = "Part of the card name, case-insensitive")
    String name;

    @Option(names = {"-n", "--limit"}, defaultValue = "20", description = "Maximum results (default: ${DEFAULT-VALUE})")
    int limit;

    @Inject
    public FindCommand(DatabaseService database, ObjectMapper mapper) {
        this.database = database;
        this.mapper = mapper;
    }

    @Override
    protected int execute() throws IngestException {
        List<String> matches = database.searchByName(name, limit);
        if (matches.isEmpty()) {
            out().printf("No cards matching '%s'%n", name);
            return 0;
        }

        for (String rawJson : matches) {
            JsonNode card;
            try {
                card = mapper.readTree(rawJson);
            } catch (JsonProcessingException e) {
                throw new IngestException("Stored payload is not valid JSON", e);
            }
            out().printf("%-40s %-6s %s%n", card.path("name").asText(),
                    card.path("set").asText("").toUpperCase(Locale.ROOT), card.path("id").asText());
        }
        return 0;
    }
}

package de.bsommerfeld.mtgbuilder.app.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import de.bsommerfeld.mtgbuilder.scryfall.IngestionPipeline;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Prints the first result page of a query as sent by Scryfall. Nothing is
 * stored.
 */
@Command(
    name = "inspect",
    description = "Print the first result page of a query",
    mixinStandardHelpOptions = true
)
public class InspectCommand extends IngestCommand {

    private final IngestionPipeline pipeline;
    private final ObjectMapper mapper;

    @Parameters(index = "0", paramLabel = "QUERY", description = "Scryfall search query")
    String query;

    @Inject
    public InspectCommand(IngestionPipeline pipeline, ObjectMapper mapper) {
        this.pipeline = pipeline;
        this.mapper = mapper;
    }

    @Override
    protected int execute() throws IngestException {
        JsonNode page = pipeline.fetchFirstPage(query);
        try {
            out().println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(page));
        } catch (JsonProcessingException e) {
            throw new IngestException("Failed to render result page", e);
        }
        return 0;
    }
}

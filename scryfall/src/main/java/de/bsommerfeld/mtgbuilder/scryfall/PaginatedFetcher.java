package de.bsommerfeld.mtgbuilder.scryfall;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import de.bsommerfeld.mtgbuilder.scryfall.query.QueryValidationError;
import de.bsommerfeld.mtgbuilder.scryfall.query.QueryValidationException;
import de.bsommerfeld.mtgbuilder.scryfall.query.QueryValidator;
import de.bsommerfeld.mtgbuilder.scryfall.transport.ScryfallClient;
import de.bsommerfeld.mtgbuilder.scryfall.transport.SearchPage;
import de.bsommerfeld.mtgbuilder.scryfall.transport.TransportException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the result pages of one search query, strictly in order.
 *
 * <p>
 * The query is validated before the first request; an invalid query never
 * reaches the network. Each page URL depends on the previous response, so
 * pages of one query are never fetched concurrently. The walk stops when a
 * page reports no further data, when the handler throws, or on the first
 * transport failure. A cursor that points to a page already visited aborts
 * the walk instead of looping.
 */
@Singleton
public class PaginatedFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PaginatedFetcher.class);

    /** Receives each page as soon as it arrives. */
    @FunctionalInterface
    public interface PageHandler {
        void onPage(int pageNumber, SearchPage page) throws IngestException;
    }

    private final ScryfallClient client;
    private final QueryValidator validator;

    @Inject
    public PaginatedFetcher(ScryfallClient client, QueryValidator validator) {
        this.client = client;
        this.validator = validator;
    }

    /**
     * Fetches every page of the query and hands each to {@code handler}.
     *
     * @return number of pages fetched
     * @throws QueryValidationException if the query is invalid
     * @throws TransportException       if a page could not be fetched
     * @throws IngestException          whatever the handler throws
     */
    public int forEachPage(String query, PageHandler handler) throws IngestException {
        String url = firstPageUrl(query);
        Set<String> visited = new HashSet<>();
        int pageNumber = 0;

        while (url != null) {
            if (!visited.add(url)) {
                throw new TransportException("Pagination cursor revisits " + url + " for query '" + query + "'");
            }
            pageNumber++;
            LOG.info("Fetching page {} of '{}'", pageNumber, query);

            SearchPage page = client.fetchPage(url);
            handler.onPage(pageNumber, page);

            url = page.hasNextPage() ? page.nextPage() : null;
        }
        return pageNumber;
    }

    /**
     * Fetches only the first result page and returns the document as sent
     * by the server.
     */
    public JsonNode fetchFirstPageJson(String query) throws IngestException {
        return client.getJson(firstPageUrl(query));
    }

    private String firstPageUrl(String query) throws QueryValidationException {
        Optional<QueryValidationError> error = validator.validate(query);
        if (error.isPresent()) {
            throw new QueryValidationException(query, error.get());
        }
        return client.searchUrl(validator.encode(query.trim()));
    }
}

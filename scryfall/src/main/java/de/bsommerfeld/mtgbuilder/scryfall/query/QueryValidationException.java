package de.bsommerfeld.mtgbuilder.scryfall.query;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;

/**
 * Thrown by fetch operations when their query fails validation. Nothing has
 * been sent and nothing stored.
 */
public class QueryValidationException extends IngestException {

    private final QueryValidationError error;

    public QueryValidationException(String query, QueryValidationError error) {
        super("Query validation failed for '" + query + "': " + error.message());
        this.error = error;
    }

    public QueryValidationError getError() {
        return error;
    }
}

package de.bsommerfeld.mtgbuilder.scryfall.query;

import java.util.Optional;

/**
 * One entry of {@link QueryValidator#validateMany}: the input query, its
 * position in the input list, and the validation outcome.
 */
public record ValidatedQuery(int index, String query, Optional<QueryValidationError> error) {

    public boolean isValid() {
        return error.isEmpty();
    }
}

package de.bsommerfeld.mtgbuilder.scryfall;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;

/**
 * Result of one query in a multi-query run, at the position the query had in
 * the input list.
 *
 * @param index position in the input list
 * @param query the query as given
 * @param value result on success, {@code null} on failure
 * @param error failure, {@code null} on success
 * @param <T>   result type
 */
public record QueryOutcome<T>(int index, String query, T value, IngestException error) {

    public static <T> QueryOutcome<T> success(int index, String query, T value) {
        return new QueryOutcome<>(index, query, value, null);
    }

    public static <T> QueryOutcome<T> failure(int index, String query, IngestException error) {
        return new QueryOutcome<>(index, query, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

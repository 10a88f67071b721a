package de.bsommerfeld.mtgbuilder.db;

import de.bsommerfeld.mtgbuilder.core.domain.CardRow;

import java.util.List;

/**
 * Persistence contract for the card catalog. All implementations must be
 * thread-safe: concurrent fetch tasks write through the same instance.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: production persistence via SQLite</li>
 * <li>{@link TestDatabaseService}: in-memory store for TEST mode, no disk
 * I/O</li>
 * </ul>
 *
 * <p>
 * Switching between implementations is done at the Guice module level.
 * Writers normally go through {@link BatchUpserter}, which adds chunking on
 * top of this contract.
 */
public interface DatabaseService {

    /**
     * Inserts the card, or replaces every normalized column and the raw
     * payload of the existing row with the same ID. The original
     * {@code created_at} is preserved; {@code updated_at} is refreshed.
     *
     * @throws StorageException if the statement fails
     */
    void upsertCard(CardRow card) throws StorageException;

    /**
     * Upserts all cards in a single transaction. Either every row is
     * committed or none is.
     *
     * @return number of rows written
     * @throws StorageException if any row fails; the transaction has been
     *                          rolled back
     */
    int upsertCardsBatch(List<CardRow> cards) throws StorageException;

    /** Number of stored cards. */
    long getCardCount() throws StorageException;

    /**
     * Returns the verbatim upstream payload stored for the given ID, or
     * {@code null} if the card is unknown.
     */
    String getRawJson(String id) throws StorageException;

    /**
     * Returns the stored card with its normalized columns and timestamps, or
     * {@code null} if the card is unknown.
     */
    StoredCard getCard(String id) throws StorageException;

    /**
     * Case-insensitive substring search on the card name. Returns raw
     * payloads ordered by name.
     *
     * @param fragment part of the name, matched literally
     * @param limit    maximum number of results
     */
    List<String> searchByName(String fragment, int limit) throws StorageException;
}

package de.bsommerfeld.mtgbuilder.db;

import com.google.common.collect.Lists;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Write entry point used by the fetch pipeline. Splits large row lists into
 * chunks of {@code storage.batch-size} and stores each chunk in its own
 * transaction, so a failure only loses the chunk that failed.
 */
@Singleton
public class BatchUpserter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchUpserter.class);

    private final DatabaseService database;
    private final int batchSize;

    @Inject
    public BatchUpserter(DatabaseService database, IngestConfig config) {
        this(database, config.getStorage().getBatchSize());
    }

    public BatchUpserter(DatabaseService database, int batchSize) {
        if (batchSize < 1)
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        this.database = database;
        this.batchSize = batchSize;
    }

    /** Stores a single row. */
    public int upsertOne(CardRow card) throws StorageException {
        database.upsertCard(card);
        return 1;
    }

    /**
     * Stores all rows, one transaction per chunk.
     *
     * @return number of rows stored
     * @throws StorageException if a chunk fails; its stored count includes
     *                          every row committed by earlier chunks
     */
    public int upsertBatch(List<CardRow> cards) throws StorageException {
        int stored = 0;
        for (List<CardRow> chunk : Lists.partition(cards, batchSize)) {
            try {
                stored += database.upsertCardsBatch(chunk);
            } catch (StorageException e) {
                LOG.error("Batch failed after {} stored rows", stored, e);
                throw new StorageException(e.getMessage(), e, stored);
            }
            LOG.debug("Stored chunk of {} ({}/{})", chunk.size(), stored, cards.size());
        }
        return stored;
    }

    public int getBatchSize() {
        return batchSize;
    }
}

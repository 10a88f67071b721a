package de.bsommerfeld.mtgbuilder.scryfall;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Stopwatch;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;
import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import de.bsommerfeld.mtgbuilder.core.event.ApplicationEventBus;
import de.bsommerfeld.mtgbuilder.core.event.IngestEvents;
import de.bsommerfeld.mtgbuilder.db.BatchUpserter;
import de.bsommerfeld.mtgbuilder.db.StorageException;
import de.bsommerfeld.mtgbuilder.scryfall.normalize.CardNormalizer;
import de.bsommerfeld.mtgbuilder.scryfall.query.QueryValidationException;
import de.bsommerfeld.mtgbuilder.scryfall.query.QueryValidator;
import de.bsommerfeld.mtgbuilder.scryfall.query.ValidatedQuery;
import de.bsommerfeld.mtgbuilder.scryfall.transport.TransportException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fetch, normalize and store search results.
 *
 * <h3>Modes</h3>
 * <ul>
 * <li>{@link #fetchAndStore}: every page is stored as soon as it arrives. If
 * a later page fails, the pages stored so far stay committed and the failure
 * reports how many rows they contained.</li>
 * <li>{@link #fetchAllThenStore}: all pages are collected first and stored
 * only once the query completed. A failure stores nothing.</li>
 * <li>{@link #fetchAll}: like the above without storing.</li>
 * </ul>
 *
 * <h3>Multi-query fan-out</h3>
 * {@link #fetchMultiple} and {@link #fetchAndStoreMultiple} validate every
 * query up front. Invalid queries are reported at their input position and
 * never reach the network; valid ones run concurrently on the fetch executor,
 * throttled by the shared rate limiter. Each task carries its input index, and
 * results are placed by that index, so completion order never matters.
 *
 * <p>
 * Progress is posted to the {@link ApplicationEventBus} and logged.
 */
@Singleton
public class IngestionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionPipeline.class);

    @FunctionalInterface
    private interface QueryTask<T> {
        T run(String query) throws IngestException;
    }

    private final PaginatedFetcher fetcher;
    private final CardNormalizer normalizer;
    private final BatchUpserter upserter;
    private final QueryValidator validator;
    private final ApplicationEventBus eventBus;
    private final ExecutorService executor;

    @Inject
    public IngestionPipeline(PaginatedFetcher fetcher, CardNormalizer normalizer, BatchUpserter upserter,
            QueryValidator validator, ApplicationEventBus eventBus, ExecutorService executor) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.upserter = upserter;
        this.validator = validator;
        this.eventBus = eventBus;
        this.executor = executor;
    }

    // =====================================================================
    // Single Query
    // =====================================================================

    /**
     * Fetches every page of the query and stores each page immediately.
     *
     * @return number of rows stored
     * @throws IngestException on validation, transport or storage failure;
     *                         {@link IngestException#getStoredCount()} holds
     *                         the rows committed before the failure
     */
    public int fetchAndStore(String query) throws IngestException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        int[] stored = { 0 };
        try {
            fetcher.forEachPage(query, (pageNumber, page) -> {
                List<CardRow> rows = normalizer.normalizeAll(page.cards());
                int pageStored;
                try {
                    pageStored = upserter.upsertBatch(rows);
                } catch (StorageException e) {
                    throw new StorageException(e.getMessage(), e, stored[0] + e.getStoredCount());
                }
                stored[0] += pageStored;

                LOG.info("  Got {} cards, stored {} (total: {}) [{}s elapsed]",
                        page.cards().size(), pageStored, page.totalCards(), seconds(stopwatch));
                eventBus.post(new IngestEvents.PageStoredEvent(query, pageNumber, page.cards().size(), stored[0]));
            });
        } catch (TransportException e) {
            finished(query, stored[0], e);
            throw e.withStoredCount(stored[0]);
        } catch (IngestException e) {
            finished(query, stored[0], e);
            throw e;
        }
        finished(query, stored[0], null);
        return stored[0];
    }

    /**
     * Fetches every page first and stores the rows only after the last page
     * arrived. Nothing is stored if any page fails.
     *
     * @return number of rows stored
     */
    public int fetchAllThenStore(String query) throws IngestException {
        List<CardRow> rows;
        try {
            rows = fetchAll(query);
        } catch (IngestException e) {
            finished(query, 0, e);
            throw e;
        }
        int stored;
        try {
            stored = upserter.upsertBatch(rows);
        } catch (StorageException e) {
            finished(query, e.getStoredCount(), e);
            throw e;
        }
        finished(query, stored, null);
        return stored;
    }

    /**
     * Fetches and normalizes every page without storing.
     *
     * @return all rows in server order
     */
    public List<CardRow> fetchAll(String query) throws IngestException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<CardRow> rows = new ArrayList<>();
        fetcher.forEachPage(query, (pageNumber, page) -> {
            rows.addAll(normalizer.normalizeAll(page.cards()));
            LOG.info("  Got {} cards (total: {}) [{}s elapsed]",
                    page.cards().size(), page.totalCards(), seconds(stopwatch));
        });
        return rows;
    }

    /** Validates the query and returns its first result page unmodified. */
    public JsonNode fetchFirstPage(String query) throws IngestException {
        return fetcher.fetchFirstPageJson(query);
    }

    // =====================================================================
    // Fan-out
    // =====================================================================

    /**
     * Runs {@link #fetchAll} for every query.
     *
     * @return one outcome per input query, in input order
     */
    public List<QueryOutcome<List<CardRow>>> fetchMultiple(List<String> queries) {
        return fanOut(queries, this::fetchAll);
    }

    /**
     * Runs {@link #fetchAndStore} for every query.
     *
     * @return one outcome per input query, in input order, holding the stored
     *         row count
     */
    public List<QueryOutcome<Integer>> fetchAndStoreMultiple(List<String> queries) {
        return fanOut(queries, this::fetchAndStore);
    }

    private <T> List<QueryOutcome<T>> fanOut(List<String> queries, QueryTask<T> task) {
        List<ValidatedQuery> validated = validator.validateMany(queries);
        List<QueryOutcome<T>> outcomes = new ArrayList<>(Collections.nCopies(queries.size(), null));
        List<IndexedFuture<T>> running = new ArrayList<>();

        for (ValidatedQuery vq : validated) {
            if (!vq.isValid()) {
                QueryValidationException error = new QueryValidationException(vq.query(), vq.error().get());
                LOG.warn("Skipping query: {}", error.getMessage());
                outcomes.set(vq.index(), QueryOutcome.failure(vq.index(), vq.query(), error));
                continue;
            }
            CompletableFuture<QueryOutcome<T>> future = CompletableFuture
                    .supplyAsync(() -> runQuery(vq, task), executor);
            running.add(new IndexedFuture<>(vq.index(), future));
        }

        for (IndexedFuture<T> indexed : running) {
            outcomes.set(indexed.index(), indexed.future().join());
        }
        return outcomes;
    }

    private <T> QueryOutcome<T> runQuery(ValidatedQuery vq, QueryTask<T> task) {
        try {
            return QueryOutcome.success(vq.index(), vq.query(), task.run(vq.query()));
        } catch (IngestException e) {
            LOG.error("Query '{}' failed: {}", vq.query(), e.getMessage());
            return QueryOutcome.failure(vq.index(), vq.query(), e);
        } catch (RuntimeException e) {
            LOG.error("Query '{}' failed unexpectedly", vq.query(), e);
            return QueryOutcome.failure(vq.index(), vq.query(),
                    new IngestException("Unexpected failure for query '" + vq.query() + "': " + e.getMessage(), e));
        }
    }

    private record IndexedFuture<T>(int index, CompletableFuture<QueryOutcome<T>> future) {
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private void finished(String query, int stored, IngestException error) {
        eventBus.post(new IngestEvents.QueryFinishedEvent(query, stored, error == null ? null : error.getMessage()));
    }

    private static String seconds(Stopwatch stopwatch) {
        return String.format(Locale.ROOT, "%.2f", stopwatch.elapsed(TimeUnit.MILLISECONDS) / 1000.0);
    }
}

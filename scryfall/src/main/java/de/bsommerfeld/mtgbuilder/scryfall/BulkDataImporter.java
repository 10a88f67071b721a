package de.bsommerfeld.mtgbuilder.scryfall;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.Lists;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import de.bsommerfeld.mtgbuilder.core.event.ApplicationEventBus;
import de.bsommerfeld.mtgbuilder.core.event.IngestEvents;
import de.bsommerfeld.mtgbuilder.db.BatchUpserter;
import de.bsommerfeld.mtgbuilder.db.StorageException;
import de.bsommerfeld.mtgbuilder.scryfall.normalize.CardNormalizer;
import de.bsommerfeld.mtgbuilder.scryfall.transport.DownloadProgressListener;
import de.bsommerfeld.mtgbuilder.scryfall.transport.ScryfallClient;
import de.bsommerfeld.mtgbuilder.scryfall.transport.TransportException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Imports the complete card catalog from Scryfall's bulk data files instead
 * of paginated searches.
 *
 * <ol>
 * <li>GET {@code /bulk-data} (rate limited) and pick the entry whose
 * {@code type} matches {@code bulk.type}, {@code default_cards} unless
 * configured otherwise</li>
 * <li>download its {@code download_uri} from the CDN without throttling,
 * reporting progress at most every 500 ms</li>
 * <li>parse the file as one JSON array</li>
 * <li>normalize and store it in chunks of {@code ingest.batch-size}, one
 * transaction per chunk</li>
 * </ol>
 *
 * <p>
 * The whole file is held in memory while it is parsed.
 */
@Singleton
public class BulkDataImporter {

    private static final Logger LOG = LoggerFactory.getLogger(BulkDataImporter.class);

    static final long PROGRESS_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(500);
    private static final double MB = 1024.0 * 1024.0;

    private final ScryfallClient client;
    private final CardNormalizer normalizer;
    private final BatchUpserter upserter;
    private final ObjectMapper mapper;
    private final ApplicationEventBus eventBus;
    private final String bulkType;
    private final Ticker ticker;

    @Inject
    public BulkDataImporter(ScryfallClient client, CardNormalizer normalizer, BatchUpserter upserter,
            ObjectMapper mapper, ApplicationEventBus eventBus, IngestConfig config) {
        this(client, normalizer, upserter, mapper, eventBus, config.getBulk().getType(), Ticker.systemTicker());
    }

    BulkDataImporter(ScryfallClient client, CardNormalizer normalizer, BatchUpserter upserter,
            ObjectMapper mapper, ApplicationEventBus eventBus, String bulkType, Ticker ticker) {
        this.client = client;
        this.normalizer = normalizer;
        this.upserter = upserter;
        this.mapper = mapper;
        this.eventBus = eventBus;
        this.bulkType = bulkType;
        this.ticker = ticker;
    }

    /**
     * Runs the full import.
     *
     * @return number of cards stored
     * @throws TransportException if the catalog or the file cannot be fetched
     *                            or parsed
     * @throws StorageException   if a chunk fails; chunks committed before it
     *                            stay and are counted in the exception
     */
    public int downloadAndStore() throws TransportException, StorageException {
        String downloadUri = resolveDownloadUri();

        Stopwatch downloadWatch = Stopwatch.createStarted(ticker);
        byte[] bytes = client.download(downloadUri, throttledProgress());
        LOG.info("Download complete in {}s ({} MB)", format(downloadWatch.elapsed(TimeUnit.MILLISECONDS) / 1000.0),
                format(bytes.length / MB));

        List<JsonNode> cards = parse(bytes, downloadUri);
        return store(cards);
    }

    // =====================================================================
    // Catalog
    // =====================================================================

    String resolveDownloadUri() throws TransportException {
        LOG.info("Fetching bulk data catalog...");
        JsonNode catalog = client.getJson(client.bulkCatalogUrl());

        JsonNode entry = null;
        for (JsonNode candidate : catalog.path("data")) {
            if (bulkType.equals(candidate.path("type").asText(null))) {
                entry = candidate;
                break;
            }
        }
        if (entry == null) {
            throw new TransportException("Could not find " + bulkType + " in bulk data catalog");
        }

        JsonNode uri = entry.get("download_uri");
        if (uri == null || !uri.isTextual() || uri.asText().isEmpty()) {
            throw new TransportException("No download_uri in bulk data entry " + bulkType);
        }

        LOG.info("Bulk data last updated: {}", entry.path("updated_at").asText("unknown"));
        LOG.info("Downloading: {}", uri.asText());
        return uri.asText();
    }

    /**
     * Posts {@link IngestEvents.DownloadProgressEvent} at most once per
     * interval; the first chunk always reports.
     */
    DownloadProgressListener throttledProgress() {
        long[] lastReport = { Long.MIN_VALUE };
        return (bytesRead, totalBytes) -> {
            long now = ticker.read();
            if (lastReport[0] != Long.MIN_VALUE && now - lastReport[0] < PROGRESS_INTERVAL_NANOS)
                return;
            lastReport[0] = now;
            if (totalBytes > 0) {
                LOG.info("Downloading: {}/{} MB ({}%)", format(bytesRead / MB), format(totalBytes / MB),
                        format(bytesRead * 100.0 / totalBytes));
            } else {
                LOG.info("Downloading: {} MB", format(bytesRead / MB));
            }
            eventBus.post(new IngestEvents.DownloadProgressEvent(bytesRead, totalBytes));
        };
    }

    // =====================================================================
    // Parse and Store
    // =====================================================================

    private List<JsonNode> parse(byte[] bytes, String uri) throws TransportException {
        LOG.info("Parsing JSON...");
        Stopwatch parseWatch = Stopwatch.createStarted(ticker);
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new TransportException("Failed to parse bulk data JSON from " + uri, e);
        }
        if (root == null || !root.isArray()) {
            throw new TransportException("Bulk data from " + uri + " is not a JSON array");
        }

        List<JsonNode> cards = new ArrayList<>(root.size());
        root.forEach(cards::add);
        LOG.info("Parsed {} cards in {}s", cards.size(), format(parseWatch.elapsed(TimeUnit.MILLISECONDS) / 1000.0));
        return cards;
    }

    private int store(List<JsonNode> cards) throws StorageException {
        int total = cards.size();
        int stored = 0;
        Stopwatch storeWatch = Stopwatch.createStarted(ticker);

        for (List<JsonNode> chunk : Lists.partition(cards, upserter.getBatchSize())) {
            try {
                stored += upserter.upsertBatch(normalizer.normalizeAll(chunk));
            } catch (StorageException e) {
                throw new StorageException(e.getMessage(), e, stored + e.getStoredCount());
            }

            double elapsed = storeWatch.elapsed(TimeUnit.MILLISECONDS) / 1000.0;
            LOG.info("Storing: {}/{} ({}%) - {} cards/sec", stored, total,
                    format(stored * 100.0 / total), format(elapsed > 0 ? stored / elapsed : 0));
            eventBus.post(new IngestEvents.BulkStoreProgressEvent(stored, total));
        }

        LOG.info("Stored {} cards in {}s", stored, format(storeWatch.elapsed(TimeUnit.MILLISECONDS) / 1000.0));
        return stored;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}

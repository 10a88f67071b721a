package de.bsommerfeld.mtgbuilder.db;

import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite,
 * no schema. Bound by Guice when the application runs with
 * {@code app.mode=TEST}.
 *
 * <p>
 * Upsert semantics mirror the SQL implementation: a re-stored card replaces
 * its values and raw payload but keeps its first {@code createdAt}. Batches
 * are all-or-nothing: a card without a name rejects the whole batch, the way
 * the {@code NOT NULL} constraint does in SQLite.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Map<String, StoredCard> memoryStore = new ConcurrentHashMap<>();

    public TestDatabaseService() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");
    }

    @Override
    public void upsertCard(CardRow card) throws StorageException {
        upsertCardsBatch(List.of(card));
    }

    @Override
    public synchronized int upsertCardsBatch(List<CardRow> cards) throws StorageException {
        if (cards == null || cards.isEmpty())
            return 0;
        for (CardRow card : cards) {
            if (card.name() == null) {
                throw new StorageException("Card " + card.id() + " has no name",
                        new IllegalArgumentException("name must not be null"));
            }
        }

        String now = LocalDateTime.now(ZoneOffset.UTC).format(TIMESTAMP);
        for (CardRow card : cards) {
            StoredCard previous = memoryStore.get(card.id());
            String createdAt = previous != null ? previous.createdAt() : now;
            memoryStore.put(card.id(), new StoredCard(card, createdAt, now));
        }
        return cards.size();
    }

    @Override
    public long getCardCount() {
        return memoryStore.size();
    }

    @Override
    public String getRawJson(String id) {
        StoredCard stored = memoryStore.get(id);
        return stored != null ? stored.row().rawJson() : null;
    }

    @Override
    public StoredCard getCard(String id) {
        return memoryStore.get(id);
    }

    @Override
    public List<String> searchByName(String fragment, int limit) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        List<CardRow> matches = new ArrayList<>();
        for (StoredCard stored : memoryStore.values()) {
            if (stored.row().name().toLowerCase(Locale.ROOT).contains(needle))
                matches.add(stored.row());
        }
        matches.sort(Comparator.comparing(CardRow::name).thenComparing(CardRow::id));
        return matches.stream().limit(limit).map(CardRow::rawJson).toList();
    }
}

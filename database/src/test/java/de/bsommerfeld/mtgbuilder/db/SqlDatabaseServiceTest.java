package de.bsommerfeld.mtgbuilder.db;

import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import de.bsommerfeld.mtgbuilder.core.domain.CardColumn;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static de.bsommerfeld.mtgbuilder.db.TestCards.card;
import static de.bsommerfeld.mtgbuilder.db.TestCards.nameless;
import static de.bsommerfeld.mtgbuilder.db.TestCards.withValue;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlDatabaseService against a real temporary SQLite
 * database: schema init, upserts, transactions, and the read side.
 */
class SqlDatabaseServiceTest {

    @TempDir
    Path tempDir;

    private String url;
    private SqlDatabaseService db;

    @BeforeEach
    void setUp() {
        url = "jdbc:sqlite:" + tempDir.resolve("test.db").toAbsolutePath();
        db = new SqlDatabaseService(url);
    }

    // -- Schema --

    @Test
    void constructor_shouldCreateMissingParentDirectory() {
        Path nested = tempDir.resolve("a/b/cards.db");
        new SqlDatabaseService("jdbc:sqlite:" + nested);
        assertTrue(Files.exists(nested));
    }

    @Test
    void constructor_shouldReadUrlFromConfig() throws Exception {
        IngestConfig config = new IngestConfig();
        config.getStorage().setDatabaseUrl("jdbc:sqlite:" + tempDir.resolve("configured.db"));

        SqlDatabaseService configured = new SqlDatabaseService(config);
        configured.upsertCard(card("c1", "Opt"));

        assertTrue(Files.exists(tempDir.resolve("configured.db")));
        assertEquals(1, configured.getCardCount());
    }

    @Test
    void constructor_shouldBeIdempotentOnExistingDatabase() throws Exception {
        db.upsertCard(card("c1", "Opt"));
        SqlDatabaseService reopened = new SqlDatabaseService(url);
        assertEquals(1, reopened.getCardCount());
    }

    @Test
    void constructor_shouldAddLateColumnsToOlderSchema() throws Exception {
        String oldUrl = "jdbc:sqlite:" + tempDir.resolve("old.db");
        try (Connection conn = DriverManager.getConnection(oldUrl);
                Statement stmt = conn.createStatement()) {
            StringBuilder ddl = new StringBuilder("CREATE TABLE cards (id TEXT PRIMARY KEY");
            for (CardColumn column : CardColumn.values()) {
                if (!SqlDatabaseService.LATE_COLUMNS.contains(column))
                    ddl.append(", ").append(column.columnName());
            }
            ddl.append(", raw_json TEXT NOT NULL, created_at TIMESTAMP, updated_at TIMESTAMP)");
            stmt.execute(ddl.toString());
        }

        new SqlDatabaseService(oldUrl);

        List<String> columns = new ArrayList<>();
        try (Connection conn = DriverManager.getConnection(oldUrl);
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT name FROM pragma_table_info('cards')")) {
            while (rs.next())
                columns.add(rs.getString(1));
        }
        assertTrue(columns.contains("loyalty"));
        assertTrue(columns.contains("defense"));
        assertEquals(CardColumn.values().length + 4, columns.size());
    }

    @Test
    void schema_shouldCreateLookupIndexes() throws SQLException {
        List<String> indexes = new ArrayList<>();
        try (Connection conn = db.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT name FROM sqlite_master WHERE type = 'index'")) {
            while (rs.next())
                indexes.add(rs.getString(1));
        }
        assertTrue(indexes.containsAll(List.of(
                "idx_cards_name", "idx_cards_set_code", "idx_cards_rarity", "idx_cards_type_line")));
    }

    // -- Upserts --

    @Test
    void upsertCard_shouldPersistAndRetrieve() throws Exception {
        CardRow row = card("c1", "Lightning Bolt");
        db.upsertCard(row);

        StoredCard stored = db.getCard("c1");
        assertNotNull(stored);
        assertEquals(row, stored.row());
        assertNotNull(stored.createdAt());
        assertNotNull(stored.updatedAt());
    }

    @Test
    void upsertCard_shouldStoreAbsentValuesAsNull() throws Exception {
        db.upsertCard(card("c1", "Opt"));

        try (Connection conn = db.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT power, cmc, card_faces FROM cards WHERE id = 'c1'")) {
            assertTrue(rs.next());
            assertNull(rs.getObject("power"));
            assertNotNull(rs.getObject("cmc"));
            assertNull(rs.getObject("card_faces"));
        }
    }

    @Test
    void upsertCard_shouldReplaceValuesAndKeepCreatedAt() throws Exception {
        db.upsertCard(card("c1", "Original"));
        String createdAt = db.getCard("c1").createdAt();

        CardRow updated = withValue(card("c1", "Renamed"), CardColumn.EDHREC_RANK, null);
        db.upsertCard(updated);

        StoredCard stored = db.getCard("c1");
        assertEquals("Renamed", stored.row().name());
        assertFalse(stored.row().has(CardColumn.EDHREC_RANK), "re-upsert should clear dropped values");
        assertEquals(createdAt, stored.createdAt());
        assertEquals(1, db.getCardCount());
    }

    @Test
    void upsertCard_sameRowTwice_shouldBeIdempotent() throws Exception {
        CardRow row = card("c1", "Opt");
        db.upsertCard(row);
        db.upsertCard(row);

        assertEquals(1, db.getCardCount());
        assertEquals(row, db.getCard("c1").row());
    }

    @Test
    void upsertCard_shouldFailForMissingName() {
        StorageException e = assertThrows(StorageException.class, () -> db.upsertCard(nameless("c1")));
        assertEquals(0, e.getStoredCount());
    }

    @Test
    void upsertCardsBatch_shouldPersistAll() throws Exception {
        int stored = db.upsertCardsBatch(List.of(card("a", "A"), card("b", "B"), card("c", "C")));

        assertEquals(3, stored);
        assertEquals(3, db.getCardCount());
    }

    @Test
    void upsertCardsBatch_shouldRollBackWholeBatchOnFailure() {
        List<CardRow> batch = List.of(card("a", "A"), nameless("b"), card("c", "C"));

        assertThrows(StorageException.class, () -> db.upsertCardsBatch(batch));

        assertDoesNotThrow(() -> assertEquals(0, db.getCardCount()));
    }

    @Test
    void upsertCardsBatch_shouldReturnZeroForEmptyList() throws Exception {
        assertEquals(0, db.upsertCardsBatch(List.of()));
    }

    // -- Reads --

    @Test
    void getRawJson_shouldReturnVerbatimPayload() throws Exception {
        CardRow row = card("c1", "Opt");
        db.upsertCard(row);
        assertEquals(row.rawJson(), db.getRawJson("c1"));
    }

    @Test
    void getRawJson_shouldReturnNullForUnknownId() throws Exception {
        assertNull(db.getRawJson("missing"));
    }

    @Test
    void getCard_shouldReturnNullForUnknownId() throws Exception {
        assertNull(db.getCard("missing"));
    }

    @Test
    void searchByName_shouldMatchCaseInsensitiveSubstringOrderedByName() throws Exception {
        db.upsertCardsBatch(List.of(
                card("1", "Shock"), card("2", "Lightning Bolt"), card("3", "Chain Lightning"), card("4", "Opt")));

        List<String> results = db.searchByName("LIGHTNING", 10);

        assertEquals(List.of(card("3", "Chain Lightning").rawJson(), card("2", "Lightning Bolt").rawJson()), results);
    }

    @Test
    void searchByName_shouldRespectLimit() throws Exception {
        db.upsertCardsBatch(List.of(card("1", "Elf A"), card("2", "Elf B"), card("3", "Elf C")));
        assertEquals(2, db.searchByName("elf", 2).size());
    }

    @Test
    void searchByName_shouldTreatWildcardsLiterally() throws Exception {
        db.upsertCardsBatch(List.of(card("1", "100% Sure"), card("2", "Anything")));

        assertEquals(1, db.searchByName("%", 10).size());
        assertTrue(db.searchByName("_", 10).isEmpty());
    }
}

package de.bsommerfeld.mtgbuilder.db;

import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import de.bsommerfeld.mtgbuilder.core.domain.CardColumn;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run. Columns that
 * were added to {@code cards} after the first release are added with
 * {@code ALTER TABLE} when an older database lacks them.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, so concurrent fetch tasks
 * simply queue on the database lock.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #upsertCardsBatch} runs in one explicit transaction with
 * rollback-on-failure. Single-row upserts and reads use auto-commit.
 *
 * @see SqlLoader
 * @see BatchUpserter
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    /** Columns introduced after the initial schema, added when missing. */
    static final List<CardColumn> LATE_COLUMNS = List.of(CardColumn.LOYALTY, CardColumn.DEFENSE);

    private static final int FIRST_VALUE_PARAM = 2;
    private static final int RAW_JSON_PARAM = FIRST_VALUE_PARAM + CardColumn.values().length;

    private final String dbUrl;

    @Inject
    public SqlDatabaseService(IngestConfig config) {
        this(config.getStorage().getDatabaseUrl());
    }

    SqlDatabaseService(String dbUrl) {
        this.dbUrl = dbUrl;
        ensureParentDirectory(dbUrl);
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private static void ensureParentDirectory(String dbUrl) {
        if (!dbUrl.startsWith("jdbc:sqlite:") || dbUrl.contains(":memory:"))
            return;
        Path file = Paths.get(dbUrl.substring("jdbc:sqlite:".length())).toAbsolutePath();
        Path parent = file.getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", parent, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
            addLateColumns(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}. Splits on semicolons and
     * executes each statement individually.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found in classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = SqlLoader.stripComments(sql);
                if (statement.isEmpty())
                    continue;
                stmt.execute(statement);
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (IOException | SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private void addLateColumns(Connection conn) throws SQLException {
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-card-columns"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                existing.add(rs.getString(1));
        }

        for (CardColumn column : LATE_COLUMNS) {
            if (existing.contains(column.columnName()))
                continue;
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("ALTER TABLE cards ADD COLUMN " + column.columnName() + " TEXT");
                LOG.info("Added missing column cards.{}", column.columnName());
            }
        }
    }

    // =====================================================================
    // Write Operations
    // =====================================================================

    @Override
    public void upsertCard(CardRow card) throws StorageException {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-card"))) {
            bindCard(ps, card);
            ps.executeUpdate();
            LOG.debug("[DB] Saved/Updated card: {}", card.id());
        } catch (SQLException e) {
            throw new StorageException("Failed to upsert card " + card.id(), e);
        }
    }

    @Override
    public int upsertCardsBatch(List<CardRow> cards) throws StorageException {
        if (cards == null || cards.isEmpty())
            return 0;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-card"))) {
                for (CardRow card : cards) {
                    bindCard(ps, card);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store batch of " + cards.size() + " cards", e);
        }

        LOG.debug("[DB] Batch saved {} cards.", cards.size());
        return cards.size();
    }

    /**
     * Binds id, every {@link CardColumn} in declaration order, then the raw
     * payload. Absent columns are bound as typed SQL {@code NULL}.
     */
    private void bindCard(PreparedStatement ps, CardRow card) throws SQLException {
        ps.setString(1, card.id());
        int index = FIRST_VALUE_PARAM;
        for (CardColumn column : CardColumn.values()) {
            bindValue(ps, index++, column, card.get(column));
        }
        ps.setString(RAW_JSON_PARAM, card.rawJson());
    }

    private void bindValue(PreparedStatement ps, int index, CardColumn column, Object value) throws SQLException {
        switch (column.type()) {
            case TEXT -> {
                if (value == null)
                    ps.setNull(index, Types.VARCHAR);
                else
                    ps.setString(index, (String) value);
            }
            case REAL -> {
                if (value == null)
                    ps.setNull(index, Types.DOUBLE);
                else
                    ps.setDouble(index, (Double) value);
            }
            case INTEGER -> {
                if (value == null)
                    ps.setNull(index, Types.INTEGER);
                else
                    ps.setInt(index, (Integer) value);
            }
            case BOOLEAN -> {
                if (value == null)
                    ps.setNull(index, Types.BOOLEAN);
                else
                    ps.setBoolean(index, (Boolean) value);
            }
        }
    }

    // =====================================================================
    // Query Operations
    // =====================================================================

    @Override
    public long getCardCount() throws StorageException {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-cards"));
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to count cards", e);
        }
    }

    @Override
    public String getRawJson(String id) throws StorageException {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-raw-json"))) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to fetch raw payload of card " + id, e);
        }
    }

    @Override
    public StoredCard getCard(String id) throws StorageException {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-card"))) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return null;
                return new StoredCard(mapCard(rs), rs.getString("created_at"), rs.getString("updated_at"));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to fetch card " + id, e);
        }
    }

    @Override
    public List<String> searchByName(String fragment, int limit) throws StorageException {
        List<String> results = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("search-cards-by-name"))) {
            ps.setString(1, escapeLike(fragment));
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    results.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to search cards by name '" + fragment + "'", e);
        }
        return results;
    }

    /** Escapes LIKE wildcards so the fragment matches literally. */
    static String escapeLike(String fragment) {
        return fragment.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    // =====================================================================
    // ResultSet -> Domain Mapping
    // =====================================================================

    private CardRow mapCard(ResultSet rs) throws SQLException {
        Map<CardColumn, Object> values = new EnumMap<>(CardColumn.class);
        for (CardColumn column : CardColumn.values()) {
            Object value = switch (column.type()) {
                case TEXT -> rs.getString(column.columnName());
                case REAL -> {
                    double d = rs.getDouble(column.columnName());
                    yield rs.wasNull() ? null : d;
                }
                case INTEGER -> {
                    int i = rs.getInt(column.columnName());
                    yield rs.wasNull() ? null : i;
                }
                case BOOLEAN -> {
                    boolean b = rs.getBoolean(column.columnName());
                    yield rs.wasNull() ? null : b;
                }
            };
            if (value != null)
                values.put(column, value);
        }
        return new CardRow(rs.getString("id"), values, rs.getString("raw_json"));
    }
}

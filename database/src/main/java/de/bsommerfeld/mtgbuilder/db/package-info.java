/**
 * Card catalog persistence: SQLite-backed in production, in-memory in TEST
 * mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Fetch pipeline / bulk importer]
 *        │
 *        ▼
 *   BatchUpserter      ← chunking, one transaction per chunk
 *        │
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlDB   TestDB
 * </pre>
 *
 * <h2>Table {@code cards}</h2>
 * One denormalized row per Scryfall printing. {@code id} is the Scryfall ID
 * and the upsert conflict key. The normalized columns follow
 * {@link de.bsommerfeld.mtgbuilder.core.domain.CardColumn}; multi-valued
 * fields are comma-joined text, nested objects are compact JSON text.
 * {@code raw_json} keeps the untouched upstream record. {@code created_at} is
 * written once, {@code updated_at} on every upsert.
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql}, loaded via {@link SqlLoader}:
 * <ul>
 * <li>{@code upsert-card.sql}: INSERT ... ON CONFLICT(id) DO UPDATE</li>
 * <li>{@code select-card.sql}: full row by id</li>
 * <li>{@code select-raw-json.sql}: stored payload by id</li>
 * <li>{@code count-cards.sql}: row count</li>
 * <li>{@code search-cards-by-name.sql}: case-insensitive name search</li>
 * <li>{@code select-card-columns.sql}: column inventory for late
 * migrations</li>
 * </ul>
 */
package de.bsommerfeld.mtgbuilder.db;

package de.bsommerfeld.mtgbuilder.db;

import de.bsommerfeld.mtgbuilder.core.domain.CardRow;

/**
 * A card as read back from storage, with the bookkeeping timestamps the
 * database maintains. Timestamps are SQLite {@code CURRENT_TIMESTAMP} text
 * ({@code yyyy-MM-dd HH:mm:ss}, UTC).
 */
public record StoredCard(CardRow row, String createdAt, String updatedAt) {
}

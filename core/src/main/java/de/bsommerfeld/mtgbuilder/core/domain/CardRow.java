package de.bsommerfeld.mtgbuilder.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat storage representation of one catalog card.
 *
 * <p>
 * {@code id} is the external Scryfall ID and the upsert conflict key.
 * {@code values} holds every normalized column that is present; a column
 * missing from the map is stored as SQL {@code NULL}. {@code rawJson} is the
 * complete original record, kept for lossless retrieval.
 *
 * @param id      external identity, never {@code null}
 * @param values  present column values, typed per {@link CardColumn.Type}
 * @param rawJson serialized original record
 */
public record CardRow(String id, Map<CardColumn, Object> values, String rawJson) {

    public CardRow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rawJson, "rawJson");
        EnumMap<CardColumn, Object> copy = new EnumMap<>(CardColumn.class);
        if (values != null) {
            for (Map.Entry<CardColumn, Object> e : values.entrySet()) {
                if (e.getValue() == null)
                    continue;
                Class<?> expected = e.getKey().type().javaType();
                if (!expected.isInstance(e.getValue())) {
                    throw new IllegalArgumentException("Column " + e.getKey().columnName()
                            + " expects " + expected.getSimpleName()
                            + " but got " + e.getValue().getClass().getSimpleName());
                }
                copy.put(e.getKey(), e.getValue());
            }
        }
        values = Collections.unmodifiableMap(copy);
    }

    /** Returns the column value, or {@code null} when absent. */
    public Object get(CardColumn column) {
        return values.get(column);
    }

    /** Returns a TEXT column value, or {@code null} when absent. */
    public String text(CardColumn column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public boolean has(CardColumn column) {
        return values.containsKey(column);
    }

    /** Card name, {@code null} if the source record had none. */
    public String name() {
        return text(CardColumn.NAME);
    }
}

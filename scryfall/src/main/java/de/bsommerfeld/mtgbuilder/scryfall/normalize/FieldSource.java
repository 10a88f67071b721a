package de.bsommerfeld.mtgbuilder.scryfall.normalize;

/**
 * Outcome of looking up one field in one place of a card record.
 *
 * <ul>
 * <li>{@link Present}: the field exists with a usable value</li>
 * <li>{@link AbsentUseFallback}: missing here, the front face may supply
 * it</li>
 * <li>{@link Absent}: missing, and there is nowhere else to look</li>
 * </ul>
 */
public sealed interface FieldSource
        permits FieldSource.Present, FieldSource.AbsentUseFallback, FieldSource.Absent {

    FieldSource ABSENT = new Absent();
    FieldSource USE_FALLBACK = new AbsentUseFallback();

    static FieldSource present(Object value) {
        return new Present(value);
    }

    record Present(Object value) implements FieldSource {
    }

    record AbsentUseFallback() implements FieldSource {
    }

    record Absent() implements FieldSource {
    }
}

package de.bsommerfeld.mtgbuilder.scryfall.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.mtgbuilder.core.domain.CardColumn;

import java.util.function.Function;

/**
 * How one column is read from a card record: a top-level accessor and, for
 * fields that multi-faced cards keep per face, a front-face accessor.
 *
 * <p>
 * The front face is only consulted when the top-level accessor answers
 * {@link FieldSource.AbsentUseFallback}; a present top-level value always
 * wins.
 *
 * @param column    target column
 * @param topLevel  lookup on the record itself
 * @param frontFace lookup on {@code card_faces[0]}, {@code null} if the field
 *                  is never per-face
 */
public record FieldRule(CardColumn column,
        Function<JsonNode, FieldSource> topLevel,
        Function<JsonNode, FieldSource> frontFace) {

    /** A field that only exists at the top level. */
    public static FieldRule topLevel(CardColumn column, Function<JsonNode, FieldSource> accessor) {
        return new FieldRule(column, accessor, null);
    }

    /**
     * A field that multi-faced cards may carry on their faces. The same
     * accessor is used for both places.
     */
    public static FieldRule withFaceFallback(CardColumn column, Function<JsonNode, FieldSource> accessor) {
        return new FieldRule(column, card -> {
            FieldSource source = accessor.apply(card);
            return source instanceof FieldSource.Present ? source : FieldSource.USE_FALLBACK;
        }, accessor);
    }

    /**
     * Resolves the column for a record.
     *
     * @param card      the record
     * @param frontFace first element of {@code card_faces}, or {@code null}
     * @return {@link FieldSource.Present} or {@link FieldSource.Absent}
     */
    public FieldSource resolve(JsonNode card, JsonNode frontFace) {
        FieldSource top = topLevel.apply(card);
        if (top instanceof FieldSource.Present)
            return top;
        if (top instanceof FieldSource.AbsentUseFallback && frontFace != null && this.frontFace != null) {
            FieldSource face = this.frontFace.apply(frontFace);
            if (face instanceof FieldSource.Present)
                return face;
        }
        return FieldSource.ABSENT;
    }
}

package de.bsommerfeld.mtgbuilder.scryfall.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.domain.CardColumn;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static de.bsommerfeld.mtgbuilder.scryfall.normalize.FieldRule.topLevel;
import static de.bsommerfeld.mtgbuilder.scryfall.normalize.FieldRule.withFaceFallback;

/**
 * Turns a raw Scryfall card object into a flat {@link CardRow}.
 *
 * <h3>Multi-faced cards</h3>
 * Transform, modal double-faced, split, flip, adventure and meld cards keep
 * some fields in {@code card_faces[]} instead of at the top level. For those
 * fields ({@code mana_cost}, {@code oracle_text}, {@code power},
 * {@code toughness}, {@code loyalty}, {@code defense}, {@code flavor_text},
 * {@code artist}, {@code illustration_id}, {@code colors},
 * {@code color_identity}, {@code image_uris}) the top-level value is used when
 * present and the first face's value otherwise.
 *
 * <h3>Value shapes</h3>
 * <ul>
 * <li>string lists ({@code colors}, {@code keywords}, {@code games},
 * {@code finishes}, {@code artist_ids}): joined with {@code ,}; an empty list
 * becomes an empty string</li>
 * <li>nested objects ({@code legalities}, {@code prices}, URI maps,
 * {@code card_faces}, {@code all_parts}): compact JSON text</li>
 * <li>anything missing or of an unexpected type: absent (SQL
 * {@code NULL})</li>
 * </ul>
 *
 * <p>
 * Normalization never fails and has no side effects. The complete record is
 * kept as {@link CardRow#rawJson()}.
 */
@Singleton
public class CardNormalizer {

    static final List<FieldRule> RULES = buildRules();

    /**
     * Normalizes one record.
     *
     * @param card a card object; anything else yields a row with an empty id
     *             and no values
     */
    public CardRow normalize(JsonNode card) {
        JsonNode frontFace = frontFace(card);
        Map<CardColumn, Object> values = new EnumMap<>(CardColumn.class);
        for (FieldRule rule : RULES) {
            if (rule.resolve(card, frontFace) instanceof FieldSource.Present present)
                values.put(rule.column(), present.value());
        }
        String id = card.path("id").isTextual() ? card.get("id").asText() : "";
        return new CardRow(id, values, card.toString());
    }

    public List<CardRow> normalizeAll(List<JsonNode> cards) {
        List<CardRow> rows = new ArrayList<>(cards.size());
        for (JsonNode card : cards)
            rows.add(normalize(card));
        return rows;
    }

    private static JsonNode frontFace(JsonNode card) {
        JsonNode faces = card.get("card_faces");
        return faces != null && faces.isArray() && !faces.isEmpty() ? faces.get(0) : null;
    }

    // =====================================================================
    // Rules, in column order
    // =====================================================================

    private static List<FieldRule> buildRules() {
        return List.of(
                topLevel(CardColumn.ORACLE_ID, text("oracle_id")),
                topLevel(CardColumn.NAME, text("name")),
                topLevel(CardColumn.LANG, text("lang")),
                topLevel(CardColumn.RELEASED_AT, text("released_at")),
                topLevel(CardColumn.URI, text("uri")),
                topLevel(CardColumn.SCRYFALL_URI, text("scryfall_uri")),
                topLevel(CardColumn.LAYOUT, text("layout")),
                topLevel(CardColumn.HIGHRES_IMAGE, bool("highres_image")),
                topLevel(CardColumn.IMAGE_STATUS, text("image_status")),
                withFaceFallback(CardColumn.MANA_COST, text("mana_cost")),
                topLevel(CardColumn.CMC, real("cmc")),
                topLevel(CardColumn.TYPE_LINE, text("type_line")),
                withFaceFallback(CardColumn.ORACLE_TEXT, text("oracle_text")),
                withFaceFallback(CardColumn.POWER, text("power")),
                withFaceFallback(CardColumn.TOUGHNESS, text("toughness")),
                withFaceFallback(CardColumn.LOYALTY, text("loyalty")),
                withFaceFallback(CardColumn.DEFENSE, text("defense")),
                withFaceFallback(CardColumn.COLORS, joined("colors")),
                withFaceFallback(CardColumn.COLOR_IDENTITY, joined("color_identity")),
                topLevel(CardColumn.KEYWORDS, joined("keywords")),
                topLevel(CardColumn.LEGALITIES, blob("legalities")),
                topLevel(CardColumn.GAMES, joined("games")),
                topLevel(CardColumn.RESERVED, bool("reserved")),
                topLevel(CardColumn.FOIL, bool("foil")),
                topLevel(CardColumn.NONFOIL, bool("nonfoil")),
                topLevel(CardColumn.FINISHES, joined("finishes")),
                topLevel(CardColumn.OVERSIZED, bool("oversized")),
                topLevel(CardColumn.PROMO, bool("promo")),
                topLevel(CardColumn.REPRINT, bool("reprint")),
                topLevel(CardColumn.VARIATION, bool("variation")),
                topLevel(CardColumn.SET_ID, text("set_id")),
                topLevel(CardColumn.SET_CODE, text("set")),
                topLevel(CardColumn.SET_NAME, text("set_name")),
                topLevel(CardColumn.SET_TYPE, text("set_type")),
                topLevel(CardColumn.SET_URI, text("set_uri")),
                topLevel(CardColumn.SET_SEARCH_URI, text("set_search_uri")),
                topLevel(CardColumn.SCRYFALL_SET_URI, text("scryfall_set_uri")),
                topLevel(CardColumn.RULINGS_URI, text("rulings_uri")),
                topLevel(CardColumn.PRINTS_SEARCH_URI, text("prints_search_uri")),
                topLevel(CardColumn.COLLECTOR_NUMBER, text("collector_number")),
                topLevel(CardColumn.DIGITAL, bool("digital")),
                topLevel(CardColumn.RARITY, text("rarity")),
                withFaceFallback(CardColumn.FLAVOR_TEXT, text("flavor_text")),
                topLevel(CardColumn.CARD_BACK_ID, text("card_back_id")),
                withFaceFallback(CardColumn.ARTIST, text("artist")),
                topLevel(CardColumn.ARTIST_IDS, joined("artist_ids")),
                withFaceFallback(CardColumn.ILLUSTRATION_ID, text("illustration_id")),
                topLevel(CardColumn.BORDER_COLOR, text("border_color")),
                topLevel(CardColumn.FRAME, text("frame")),
                topLevel(CardColumn.FULL_ART, bool("full_art")),
                topLevel(CardColumn.TEXTLESS, bool("textless")),
                topLevel(CardColumn.BOOSTER, bool("booster")),
                topLevel(CardColumn.STORY_SPOTLIGHT, bool("story_spotlight")),
                topLevel(CardColumn.EDHREC_RANK, integer("edhrec_rank")),
                topLevel(CardColumn.PENNY_RANK, integer("penny_rank")),
                topLevel(CardColumn.PRICES, blob("prices")),
                topLevel(CardColumn.RELATED_URIS, blob("related_uris")),
                topLevel(CardColumn.PURCHASE_URIS, blob("purchase_uris")),
                withFaceFallback(CardColumn.IMAGE_URIS, object("image_uris")),
                topLevel(CardColumn.CARD_FACES, blob("card_faces")),
                topLevel(CardColumn.ALL_PARTS, blob("all_parts")));
    }

    // =====================================================================
    // Accessors
    // =====================================================================

    static Function<JsonNode, FieldSource> text(String field) {
        return node -> {
            JsonNode value = node.get(field);
            return value != null && value.isTextual() ? FieldSource.present(value.asText()) : FieldSource.ABSENT;
        };
    }

    static Function<JsonNode, FieldSource> bool(String field) {
        return node -> {
            JsonNode value = node.get(field);
            return value != null && value.isBoolean() ? FieldSource.present(value.booleanValue()) : FieldSource.ABSENT;
        };
    }

    static Function<JsonNode, FieldSource> real(String field) {
        return node -> {
            JsonNode value = node.get(field);
            return value != null && value.isNumber() ? FieldSource.present(value.doubleValue()) : FieldSource.ABSENT;
        };
    }

    /** Integral numbers within {@code int} range; anything larger counts as absent. */
    static Function<JsonNode, FieldSource> integer(String field) {
        return node -> {
            JsonNode value = node.get(field);
            return value != null && value.isIntegralNumber() && value.canConvertToInt()
                    ? FieldSource.present(value.intValue())
                    : FieldSource.ABSENT;
        };
    }

    /** Comma-joins the string elements of an array; non-strings are skipped. */
    static Function<JsonNode, FieldSource> joined(String field) {
        return node -> {
            JsonNode value = node.get(field);
            if (value == null || !value.isArray())
                return FieldSource.ABSENT;
            List<String> parts = new ArrayList<>(value.size());
            for (JsonNode element : value) {
                if (element.isTextual())
                    parts.add(element.asText());
            }
            return FieldSource.present(String.join(",", parts));
        };
    }

    /** Any non-null JSON value, serialized compactly. */
    static Function<JsonNode, FieldSource> blob(String field) {
        return node -> {
            JsonNode value = node.get(field);
            return value != null && !value.isNull() ? FieldSource.present(value.toString()) : FieldSource.ABSENT;
        };
    }

    /** Like {@link #blob} but only accepts JSON objects. */
    static Function<JsonNode, FieldSource> object(String field) {
        return node -> {
            JsonNode value = node.get(field);
            return value != null && value.isObject() ? FieldSource.present(value.toString()) : FieldSource.ABSENT;
        };
    }
}

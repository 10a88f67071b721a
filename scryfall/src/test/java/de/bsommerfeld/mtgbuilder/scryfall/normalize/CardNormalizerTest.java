package de.bsommerfeld.mtgbuilder.scryfall.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.mtgbuilder.core.domain.CardColumn;
import de.bsommerfeld.mtgbuilder.core.domain.CardRow;
import de.bsommerfeld.mtgbuilder.scryfall.transport.ScryfallJson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CardNormalizerTest {

    private final ObjectMapper mapper = ScryfallJson.newMapper();
    private final CardNormalizer normalizer = new CardNormalizer();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private static final String BOLT = """
            {"object":"card","id":"e3285e6b-3e79-4d7c-bf96-d920f973b80d",
             "oracle_id":"4457ed35-7c10-48c8-9776-456485fdf070","name":"Lightning Bolt","lang":"en",
             "released_at":"1993-08-05","layout":"normal","highres_image":true,"mana_cost":"{R}",
             "cmc":1.0,"type_line":"Instant","oracle_text":"Lightning Bolt deals 3 damage to any target.",
             "colors":["R"],"color_identity":["R"],"keywords":[],
             "legalities":{"modern":"legal","vintage":"legal"},"games":["paper","mtgo"],
             "reserved":false,"foil":false,"nonfoil":true,"finishes":["nonfoil"],
             "set":"lea","set_name":"Limited Edition Alpha","collector_number":"161","rarity":"common",
             "artist":"Christopher Rush","edhrec_rank":3,
             "prices":{"usd":null,"eur":"1.50"},
             "image_uris":{"small":"https://cards.example/small/bolt.jpg"}}
            """;

    // =====================================================================
    // Flat fields
    // =====================================================================

    @Test
    void normalize_shouldMapScalarFields() throws Exception {
        CardRow row = normalizer.normalize(json(BOLT));

        assertEquals("e3285e6b-3e79-4d7c-bf96-d920f973b80d", row.id());
        assertEquals("Lightning Bolt", row.name());
        assertEquals("4457ed35-7c10-48c8-9776-456485fdf070", row.get(CardColumn.ORACLE_ID));
        assertEquals("{R}", row.get(CardColumn.MANA_COST));
        assertEquals(1.0, row.get(CardColumn.CMC));
        assertEquals(Boolean.TRUE, row.get(CardColumn.HIGHRES_IMAGE));
        assertEquals(Boolean.FALSE, row.get(CardColumn.RESERVED));
        assertEquals(3, row.get(CardColumn.EDHREC_RANK));
        assertEquals("common", row.get(CardColumn.RARITY));
    }

    @Test
    void normalize_shouldReadSetCodeFromSetField() throws Exception {
        CardRow row = normalizer.normalize(json(BOLT));

        assertEquals("lea", row.get(CardColumn.SET_CODE));
        assertEquals("Limited Edition Alpha", row.get(CardColumn.SET_NAME));
    }

    @Test
    void normalize_shouldJoinStringLists() throws Exception {
        CardRow row = normalizer.normalize(json(BOLT));

        assertEquals("R", row.get(CardColumn.COLORS));
        assertEquals("paper,mtgo", row.get(CardColumn.GAMES));
        assertEquals("", row.get(CardColumn.KEYWORDS), "empty list joins to an empty string");
    }

    @Test
    void normalize_shouldSkipNonStringListElements() throws Exception {
        CardRow row = normalizer.normalize(json("{\"id\":\"x\",\"name\":\"X\",\"colors\":[\"W\",1,null,\"U\"]}"));

        assertEquals("W,U", row.get(CardColumn.COLORS));
    }

    @Test
    void normalize_shouldSerializeNestedObjectsCompactly() throws Exception {
        CardRow row = normalizer.normalize(json(BOLT));

        assertEquals("{\"modern\":\"legal\",\"vintage\":\"legal\"}", row.get(CardColumn.LEGALITIES));
        assertEquals("{\"usd\":null,\"eur\":\"1.50\"}", row.get(CardColumn.PRICES));
        assertEquals("{\"small\":\"https://cards.example/small/bolt.jpg\"}", row.get(CardColumn.IMAGE_URIS));
    }

    @Test
    void normalize_shouldLeaveMissingAndMistypedFieldsAbsent() throws Exception {
        CardRow row = normalizer.normalize(json(
                "{\"id\":\"x\",\"name\":\"X\",\"cmc\":\"one\",\"legalities\":null,\"reserved\":\"no\",\"keywords\":\"Flying\"}"));

        assertFalse(row.has(CardColumn.CMC));
        assertFalse(row.has(CardColumn.LEGALITIES));
        assertFalse(row.has(CardColumn.RESERVED));
        assertFalse(row.has(CardColumn.KEYWORDS));
        assertFalse(row.has(CardColumn.PENNY_RANK));
        assertFalse(row.has(CardColumn.CARD_FACES));
    }

    @Test
    void normalize_shouldRejectFractionalRank() throws Exception {
        CardRow row = normalizer.normalize(json("{\"id\":\"x\",\"name\":\"X\",\"edhrec_rank\":1.5,\"penny_rank\":7}"));

        assertFalse(row.has(CardColumn.EDHREC_RANK));
        assertEquals(7, row.get(CardColumn.PENNY_RANK));
    }

    @Test
    void normalize_shouldLeaveRankOutsideIntRangeAbsent() throws Exception {
        CardRow row = normalizer.normalize(json(
                "{\"id\":\"x\",\"name\":\"X\",\"edhrec_rank\":4294967297,\"penny_rank\":2147483647}"));

        assertFalse(row.has(CardColumn.EDHREC_RANK));
        assertEquals(Integer.MAX_VALUE, row.get(CardColumn.PENNY_RANK));
    }

    @Test
    void normalize_shouldUseEmptyIdWhenMissing() throws Exception {
        CardRow row = normalizer.normalize(json("{\"name\":\"No Id\"}"));

        assertEquals("", row.id());
        assertEquals("No Id", row.name());
    }

    // =====================================================================
    // Multi-faced cards
    // =====================================================================

    private static final String DELVER = """
            {"id":"d1","name":"Delver of Secrets // Insectile Aberration","layout":"transform","cmc":1.0,
             "type_line":"Creature - Human Wizard // Creature - Human Insect","color_identity":["U"],
             "card_faces":[
               {"name":"Delver of Secrets","mana_cost":"{U}","type_line":"Creature - Human Wizard",
                "oracle_text":"At the beginning of your upkeep, look at the top card of your library.",
                "colors":["U"],"power":"1","toughness":"1","artist":"Matt Stewart",
                "illustration_id":"ill-front","flavor_text":"Front flavor",
                "image_uris":{"normal":"https://cards.example/front.jpg"}},
               {"name":"Insectile Aberration","mana_cost":"","colors":["U"],"power":"3","toughness":"2",
                "oracle_text":"Flying","image_uris":{"normal":"https://cards.example/back.jpg"}}
             ]}
            """;

    @Test
    void normalize_shouldFallBackToFrontFaceForPerFaceFields() throws Exception {
        CardRow row = normalizer.normalize(json(DELVER));

        assertEquals("{U}", row.get(CardColumn.MANA_COST));
        assertEquals("At the beginning of your upkeep, look at the top card of your library.",
                row.get(CardColumn.ORACLE_TEXT));
        assertEquals("1", row.get(CardColumn.POWER));
        assertEquals("1", row.get(CardColumn.TOUGHNESS));
        assertEquals("U", row.get(CardColumn.COLORS));
        assertEquals("Matt Stewart", row.get(CardColumn.ARTIST));
        assertEquals("ill-front", row.get(CardColumn.ILLUSTRATION_ID));
        assertEquals("Front flavor", row.get(CardColumn.FLAVOR_TEXT));
        assertEquals("{\"normal\":\"https://cards.example/front.jpg\"}", row.get(CardColumn.IMAGE_URIS));
    }

    @Test
    void normalize_shouldPreferTopLevelValueOverFace() throws Exception {
        CardRow row = normalizer.normalize(json(DELVER));

        assertEquals("Delver of Secrets // Insectile Aberration", row.name());
        assertEquals("U", row.get(CardColumn.COLOR_IDENTITY));
        assertEquals("Creature - Human Wizard // Creature - Human Insect", row.get(CardColumn.TYPE_LINE));
    }

    @Test
    void normalize_shouldNotMixFaceValueIntoPresentTopLevelValue() throws Exception {
        CardRow row = normalizer.normalize(json(
                "{\"id\":\"f\",\"name\":\"Flip\",\"mana_cost\":\"{1}{W}\",\"artist\":\"Top Artist\","
                        + "\"card_faces\":[{\"mana_cost\":\"{2}{U}\",\"artist\":\"Face Artist\"}]}"));

        assertEquals("{1}{W}", row.get(CardColumn.MANA_COST));
        assertEquals("Top Artist", row.get(CardColumn.ARTIST));
    }

    @Test
    void normalize_shouldKeepFacesAsBlob() throws Exception {
        JsonNode card = json(DELVER);
        CardRow row = normalizer.normalize(card);

        assertEquals(card.get("card_faces").toString(), row.get(CardColumn.CARD_FACES));
    }

    @Test
    void normalize_shouldNotFallBackForTopLevelOnlyFields() throws Exception {
        CardRow row = normalizer.normalize(json(
                "{\"id\":\"s\",\"name\":\"Split\",\"card_faces\":[{\"type_line\":\"Instant\",\"rarity\":\"rare\"}]}"));

        assertFalse(row.has(CardColumn.TYPE_LINE));
        assertFalse(row.has(CardColumn.RARITY));
    }

    @Test
    void normalize_shouldLeaveFieldAbsentWhenNeitherTopLevelNorFaceHasIt() throws Exception {
        CardRow row = normalizer.normalize(json("{\"id\":\"s\",\"name\":\"S\",\"card_faces\":[{\"name\":\"A\"}]}"));

        assertFalse(row.has(CardColumn.MANA_COST));
        assertFalse(row.has(CardColumn.LOYALTY));
        assertFalse(row.has(CardColumn.DEFENSE));
    }

    @Test
    void normalize_shouldIgnoreEmptyFaceList() throws Exception {
        CardRow row = normalizer.normalize(json("{\"id\":\"s\",\"name\":\"S\",\"card_faces\":[]}"));

        assertFalse(row.has(CardColumn.MANA_COST));
        assertEquals("[]", row.get(CardColumn.CARD_FACES));
    }

    // =====================================================================
    // Raw payload
    // =====================================================================

    @Test
    void normalize_shouldKeepRawRecordUnchanged() throws Exception {
        String compact = "{\"id\":\"r\",\"name\":\"R\",\"cmc\":3.0,\"prices\":{\"usd\":\"0.10\"},\"extra\":[1,2]}";
        CardRow row = normalizer.normalize(json(compact));

        assertEquals(compact, row.rawJson());
        assertEquals(json(compact), json(row.rawJson()));
    }

    @Test
    void normalizeAll_shouldPreserveOrder() throws Exception {
        List<CardRow> rows = normalizer.normalizeAll(List.of(
                json("{\"id\":\"1\",\"name\":\"A\"}"),
                json("{\"id\":\"2\",\"name\":\"B\"}")));

        assertEquals(List.of("1", "2"), rows.stream().map(CardRow::id).toList());
    }

    // =====================================================================
    // Rule table
    // =====================================================================

    @Test
    void rules_shouldCoverEveryColumnOnceInDeclarationOrder() {
        List<CardColumn> columns = CardNormalizer.RULES.stream().map(FieldRule::column).toList();

        assertEquals(List.of(CardColumn.values()), columns);
    }

    @Test
    void resolve_shouldOnlyConsultFaceWhenTopLevelAsksForFallback() throws Exception {
        FieldRule rule = FieldRule.topLevel(CardColumn.NAME, CardNormalizer.text("name"));
        JsonNode face = json("{\"name\":\"Face\"}");

        assertEquals(FieldSource.ABSENT, rule.resolve(json("{}"), face));
        assertEquals(FieldSource.present("Top"), rule.resolve(json("{\"name\":\"Top\"}"), face));
    }
}

package de.bsommerfeld.mtgbuilder.core.domain;

/**
 * Every normalized column of the {@code cards} table, in the exact order the
 * upsert statement binds them (after {@code id}, before {@code raw_json}).
 *
 * <p>
 * The declaration order is a contract with {@code sql/upsert-card.sql}: the
 * storage layer binds {@code values()} positionally starting at parameter 2.
 */
public enum CardColumn {

    ORACLE_ID("oracle_id", Type.TEXT),
    NAME("name", Type.TEXT),
    LANG("lang", Type.TEXT),
    RELEASED_AT("released_at", Type.TEXT),
    URI("uri", Type.TEXT),
    SCRYFALL_URI("scryfall_uri", Type.TEXT),
    LAYOUT("layout", Type.TEXT),
    HIGHRES_IMAGE("highres_image", Type.BOOLEAN),
    IMAGE_STATUS("image_status", Type.TEXT),
    MANA_COST("mana_cost", Type.TEXT),
    CMC("cmc", Type.REAL),
    TYPE_LINE("type_line", Type.TEXT),
    ORACLE_TEXT("oracle_text", Type.TEXT),
    POWER("power", Type.TEXT),
    TOUGHNESS("toughness", Type.TEXT),
    LOYALTY("loyalty", Type.TEXT),
    DEFENSE("defense", Type.TEXT),
    COLORS("colors", Type.TEXT),
    COLOR_IDENTITY("color_identity", Type.TEXT),
    KEYWORDS("keywords", Type.TEXT),
    LEGALITIES("legalities", Type.TEXT),
    GAMES("games", Type.TEXT),
    RESERVED("reserved", Type.BOOLEAN),
    FOIL("foil", Type.BOOLEAN),
    NONFOIL("nonfoil", Type.BOOLEAN),
    FINISHES("finishes", Type.TEXT),
    OVERSIZED("oversized", Type.BOOLEAN),
    PROMO("promo", Type.BOOLEAN),
    REPRINT("reprint", Type.BOOLEAN),
    VARIATION("variation", Type.BOOLEAN),
    SET_ID("set_id", Type.TEXT),
    SET_CODE("set_code", Type.TEXT),
    SET_NAME("set_name", Type.TEXT),
    SET_TYPE("set_type", Type.TEXT),
    SET_URI("set_uri", Type.TEXT),
    SET_SEARCH_URI("set_search_uri", Type.TEXT),
    SCRYFALL_SET_URI("scryfall_set_uri", Type.TEXT),
    RULINGS_URI("rulings_uri", Type.TEXT),
    PRINTS_SEARCH_URI("prints_search_uri", Type.TEXT),
    COLLECTOR_NUMBER("collector_number", Type.TEXT),
    DIGITAL("digital", Type.BOOLEAN),
    RARITY("rarity", Type.TEXT),
    FLAVOR_TEXT("flavor_text", Type.TEXT),
    CARD_BACK_ID("card_back_id", Type.TEXT),
    ARTIST("artist", Type.TEXT),
    ARTIST_IDS("artist_ids", Type.TEXT),
    ILLUSTRATION_ID("illustration_id", Type.TEXT),
    BORDER_COLOR("border_color", Type.TEXT),
    FRAME("frame", Type.TEXT),
    FULL_ART("full_art", Type.BOOLEAN),
    TEXTLESS("textless", Type.BOOLEAN),
    BOOSTER("booster", Type.BOOLEAN),
    STORY_SPOTLIGHT("story_spotlight", Type.BOOLEAN),
    EDHREC_RANK("edhrec_rank", Type.INTEGER),
    PENNY_RANK("penny_rank", Type.INTEGER),
    PRICES("prices", Type.TEXT),
    RELATED_URIS("related_uris", Type.TEXT),
    PURCHASE_URIS("purchase_uris", Type.TEXT),
    IMAGE_URIS("image_uris", Type.TEXT),
    CARD_FACES("card_faces", Type.TEXT),
    ALL_PARTS("all_parts", Type.TEXT);

    /** Java-side value type; decides which JDBC setter binds the column. */
    public enum Type {
        TEXT(String.class),
        REAL(Double.class),
        INTEGER(Integer.class),
        BOOLEAN(Boolean.class);

        private final Class<?> javaType;

        Type(Class<?> javaType) {
            this.javaType = javaType;
        }

        public Class<?> javaType() {
            return javaType;
        }
    }

    private final String columnName;
    private final Type type;

    CardColumn(String columnName, Type type) {
        this.columnName = columnName;
        this.type = type;
    }

    public String columnName() {
        return columnName;
    }

    public Type type() {
        return type;
    }
}

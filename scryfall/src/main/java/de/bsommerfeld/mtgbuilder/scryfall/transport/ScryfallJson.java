package de.bsommerfeld.mtgbuilder.scryfall.transport;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Jackson setup for Scryfall payloads. Decimals are read as exact
 * {@link java.math.BigDecimal} values so a stored record serializes back to
 * the same text it was read from ({@code 3.0} stays {@code 3.0}).
 */
public final class ScryfallJson {

    private ScryfallJson() {
    }

    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        return mapper;
    }
}

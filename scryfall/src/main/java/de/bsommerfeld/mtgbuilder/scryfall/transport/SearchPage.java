package de.bsommerfeld.mtgbuilder.scryfall.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a search result: the raw card records, the total-count hint
 * and the cursor to the next page. Pages are consumed once.
 *
 * @param cards      raw card records in server order
 * @param totalCards total number of matches reported by the server
 * @param hasMore    whether the server reports further pages
 * @param nextPage   cursor URL of the next page, {@code null} if none
 */
public record SearchPage(List<JsonNode> cards, long totalCards, boolean hasMore, String nextPage) {

    public SearchPage {
        cards = List.copyOf(cards);
    }

    /**
     * Reads a search response ({@code data}, {@code total_cards},
     * {@code has_more}, {@code next_page}). Missing flags default to
     * "no more pages".
     *
     * @throws TransportException if the document has no {@code data} array
     */
    public static SearchPage fromJson(JsonNode json) throws TransportException {
        JsonNode data = json == null ? null : json.get("data");
        if (data == null || !data.isArray()) {
            throw new TransportException("Malformed search response: missing 'data' array");
        }
        List<JsonNode> cards = new ArrayList<>(data.size());
        data.forEach(cards::add);

        JsonNode next = json.get("next_page");
        return new SearchPage(
                cards,
                json.path("total_cards").asLong(0),
                json.path("has_more").asBoolean(false),
                next != null && next.isTextual() ? next.asText() : null);
    }

    /** True if there is a cursor to follow. */
    public boolean hasNextPage() {
        return hasMore && nextPage != null && !nextPage.isEmpty();
    }
}

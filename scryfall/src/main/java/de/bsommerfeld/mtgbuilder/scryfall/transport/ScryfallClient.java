package de.bsommerfeld.mtgbuilder.scryfall.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import jakarta.inject.Inject;

/**
 * Rate-limited access to the Scryfall API. Every API request takes a
 * {@link RateLimiter} permit for its whole duration. Bulk downloads come
 * from the CDN and bypass the limiter.
 */
@Singleton
public class ScryfallClient {

    private final ScryfallTransport transport;
    private final RateLimiter rateLimiter;
    private final String baseUrl;

    @Inject
    public ScryfallClient(ScryfallTransport transport, RateLimiter rateLimiter, IngestConfig config) {
        this(transport, rateLimiter, config.getScryfall().getBaseUrl());
    }

    public ScryfallClient(ScryfallTransport transport, RateLimiter rateLimiter, String baseUrl) {
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /** URL of the first result page for an already encoded query. */
    public String searchUrl(String encodedQuery) {
        return baseUrl + "/cards/search?q=" + encodedQuery;
    }

    public String bulkCatalogUrl() {
        return baseUrl + "/bulk-data";
    }

    /** Fetches one search page, first page or cursor URL alike. */
    public SearchPage fetchPage(String url) throws TransportException {
        return SearchPage.fromJson(getJson(url));
    }

    /**
     * Rate-limited GET of a JSON document.
     *
     * @throws TransportException also when interrupted while waiting for the
     *                            limiter; the interrupt flag is restored
     */
    public JsonNode getJson(String url) throws TransportException {
        try (RateLimiter.Permit permit = rateLimiter.acquire()) {
            return transport.getJson(url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for rate limiter: " + url, e);
        }
    }

    /** Downloads a bulk file without throttling. */
    public byte[] download(String url, DownloadProgressListener listener) throws TransportException {
        return transport.download(url, listener);
    }
}

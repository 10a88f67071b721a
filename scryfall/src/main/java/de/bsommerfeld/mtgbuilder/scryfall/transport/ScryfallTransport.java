package de.bsommerfeld.mtgbuilder.scryfall.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw HTTP access to the catalog API. Implementations do not throttle;
 * {@link ScryfallClient} applies the {@link RateLimiter} on top.
 */
public interface ScryfallTransport {

    /**
     * GETs a JSON document from an API URL.
     *
     * @throws TransportException on non-2xx status, I/O failure or a body
     *                            that is not JSON
     */
    JsonNode getJson(String url) throws TransportException;

    /**
     * Downloads a large payload, such as a bulk snapshot, with the long
     * bulk timeouts, following redirects.
     *
     * @throws TransportException on non-2xx status or I/O failure
     */
    byte[] download(String url, DownloadProgressListener listener) throws TransportException;
}

package de.bsommerfeld.mtgbuilder.scryfall.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Properties;

/**
 * {@link ScryfallTransport} on top of {@link HttpClient}.
 *
 * <h3>Clients</h3>
 * API calls and bulk downloads use separate clients: the API client has the
 * short request timeouts, the bulk client the long ones and follows
 * redirects, since bulk files are served from a CDN on a different host.
 *
 * <h3>User-Agent convention</h3>
 * Scryfall asks every client to send an identifying User-Agent. The version
 * is injected from {@code scryfall-version.properties} at build time via
 * Maven resource filtering.
 */
@Singleton
public class HttpScryfallTransport implements ScryfallTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpScryfallTransport.class);

    static final String USER_AGENT = buildUserAgent();

    private final HttpClient apiClient;
    private final HttpClient bulkClient;
    private final Duration requestTimeout;
    private final Duration bulkRequestTimeout;

    /**
     * Jackson's {@link ObjectMapper} is thread-safe for reading, so one
     * instance serves every concurrent fetch task.
     */
    private final ObjectMapper mapper;

    @Inject
    public HttpScryfallTransport(IngestConfig config, ObjectMapper mapper) {
        this.mapper = mapper;
        this.requestTimeout = config.getScryfall().getRequestTimeout();
        this.bulkRequestTimeout = config.getBulk().getRequestTimeout();
        this.apiClient = HttpClient.newBuilder()
                .connectTimeout(config.getScryfall().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.bulkClient = HttpClient.newBuilder()
                .connectTimeout(config.getBulk().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public JsonNode getJson(String url) throws TransportException {
        HttpRequest request = newRequest(url, requestTimeout)
                .header("Accept", "application/json")
                .build();
        HttpResponse<byte[]> response = send(apiClient, request, HttpResponse.BodyHandlers.ofByteArray(), url);
        validateStatus(response.statusCode(), url, response.body());

        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new TransportException("Malformed JSON from " + url, response.statusCode(), e);
        }
    }

    @Override
    public byte[] download(String url, DownloadProgressListener listener) throws TransportException {
        HttpRequest request = newRequest(url, bulkRequestTimeout).build();
        HttpResponse<InputStream> response = send(bulkClient, request, HttpResponse.BodyHandlers.ofInputStream(),
                url);

        try (InputStream in = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                validateStatus(response.statusCode(), url, in.readNBytes(512));
            }
            long totalBytes = response.headers().firstValueAsLong("Content-Length").orElse(-1);
            return readWithProgress(in, totalBytes, listener);
        } catch (IOException e) {
            throw new TransportException("Download failed: " + url, e);
        }
    }

    private HttpRequest.Builder newRequest(String url, Duration timeout) throws TransportException {
        try {
            return HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .GET();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid URL: " + url, e);
        }
    }

    private <T> HttpResponse<T> send(HttpClient client, HttpRequest request,
            HttpResponse.BodyHandler<T> handler, String url) throws TransportException {
        try {
            LOG.debug("GET {}", url);
            return client.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted: " + url, e);
        } catch (IOException e) {
            throw new TransportException("Request failed: " + url + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Reads the body into memory while reporting progress. Pre-allocates to
     * Content-Length when it is known.
     */
    private static byte[] readWithProgress(InputStream in, long totalBytes, DownloadProgressListener listener)
            throws IOException {
        int initial = totalBytes > 0 && totalBytes < Integer.MAX_VALUE ? (int) totalBytes : 8192;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(initial);
        byte[] chunk = new byte[8192];
        long transferred = 0;
        int read;
        while ((read = in.read(chunk)) != -1) {
            buffer.write(chunk, 0, read);
            transferred += read;
            listener.onProgress(transferred, totalBytes);
        }
        return buffer.toByteArray();
    }

    /**
     * Rejects non-2xx responses. Scryfall error bodies carry a
     * {@code details} field which is included in the message when present.
     */
    private void validateStatus(int status, String url, byte[] body) throws TransportException {
        if (status >= 200 && status < 300)
            return;
        String details = "";
        try {
            JsonNode error = mapper.readTree(body);
            if (error != null && error.hasNonNull("details"))
                details = ": " + error.get("details").asText();
        } catch (JsonProcessingException e) {
            LOG.trace("Error body of {} is not JSON", url);
        } catch (IOException e) {
            LOG.trace("Error body of {} could not be read", url);
        }
        throw new TransportException("HTTP " + status + " for " + url + details, status, null);
    }

    private static String buildUserAgent() {
        String version = "1.0";
        try (InputStream in = HttpScryfallTransport.class.getResourceAsStream("/scryfall-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                String value = props.getProperty("app.version", version);
                // Unfiltered resource when run from an IDE
                if (!value.startsWith("${"))
                    version = value;
            }
        } catch (IOException e) {
            LOG.warn("Could not read scryfall-version.properties, using default version", e);
        }
        return "MTGBuilderApp/" + version;
    }
}

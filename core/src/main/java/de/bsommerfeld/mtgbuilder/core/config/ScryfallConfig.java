package de.bsommerfeld.mtgbuilder.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Scryfall API access. Scryfall asks clients to stay below ten requests per
 * second; the defaults keep well under that.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScryfallConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://api.scryfall.com";

    @JsonProperty("max-concurrent")
    private int maxConcurrent = 5;

    @JsonProperty("min-delay-ms")
    private int minDelayMs = 100;

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 10;

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 30;

    /** Without a trailing slash. */
    public String getBaseUrl() {
        String url = baseUrl.trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /** Upper bound of requests in flight at the same time. */
    public int getMaxConcurrent() {
        return IngestConfig.atLeast("scryfall.max-concurrent", maxConcurrent, 1);
    }

    /** Minimum spacing between the start of two consecutive API requests. */
    public Duration getMinDelay() {
        return Duration.ofMillis(IngestConfig.atLeast("scryfall.min-delay-ms", minDelayMs, 0));
    }

    public Duration getConnectTimeout() {
        return Duration.ofSeconds(IngestConfig.atLeast("scryfall.connect-timeout-seconds", connectTimeoutSeconds, 1));
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(IngestConfig.atLeast("scryfall.request-timeout-seconds", requestTimeoutSeconds, 1));
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public void setMinDelayMs(int minDelayMs) {
        this.minDelayMs = minDelayMs;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}

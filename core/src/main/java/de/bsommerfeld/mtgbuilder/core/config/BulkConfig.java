package de.bsommerfeld.mtgbuilder.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Bulk data import. The files are served from a CDN without rate limit, but
 * they are large, hence the long request timeout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BulkConfig {

    @JsonProperty("type")
    private String type = "default_cards";

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 30;

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 600;

    /** Bulk catalog entry to download, e.g. {@code default_cards} or {@code oracle_cards}. */
    public String getType() {
        return type.trim();
    }

    public Duration getConnectTimeout() {
        return Duration.ofSeconds(IngestConfig.atLeast("bulk.connect-timeout-seconds", connectTimeoutSeconds, 1));
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(IngestConfig.atLeast("bulk.request-timeout-seconds", requestTimeoutSeconds, 1));
    }

    public void setType(String type) {
        this.type = type;
    }
}

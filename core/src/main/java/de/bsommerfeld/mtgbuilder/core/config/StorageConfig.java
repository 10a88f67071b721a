package de.bsommerfeld.mtgbuilder.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.mtgbuilder.core.util.StorageUtils;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageConfig {

    @JsonProperty("database-url")
    private String databaseUrl;

    @JsonProperty("batch-size")
    private int batchSize = 500;

    /** JDBC URL; a SQLite file in the application data directory when unset. */
    public String getDatabaseUrl() {
        return databaseUrl == null || databaseUrl.isBlank() ? StorageUtils.defaultDatabaseUrl() : databaseUrl.trim();
    }

    /** Rows per storage transaction during bulk imports. */
    public int getBatchSize() {
        return IngestConfig.atLeast("storage.batch-size", batchSize, 1);
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}

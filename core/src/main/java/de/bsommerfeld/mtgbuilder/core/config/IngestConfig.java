package de.bsommerfeld.mtgbuilder.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.bsommerfeld.mtgbuilder.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

/**
 * Ingester configuration, one section per concern. Every field has a default,
 * so an absent file is a valid configuration.
 *
 * <p><b>Example {@code config.yaml}:</b>
 * <pre>{@code
 * scryfall:
 *   max-concurrent: 3
 *   min-delay-ms: 150
 * bulk:
 *   type: oracle_cards
 * storage:
 *   database-url: jdbc:sqlite:/data/cards.db
 *   batch-size: 1000
 * }</pre>
 *
 * <p>
 * {@link #load()} reads {@code config.yaml} from the application data
 * directory, then applies system properties named {@code <section>.<key>}
 * (e.g. {@code -Dscryfall.min-delay-ms=200}), then the {@code DATABASE_URL}
 * environment variable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestConfig {

    private static final Logger LOG = LoggerFactory.getLogger(IngestConfig.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String CONFIG_FILE = "config.yaml";
    private static final Set<String> SECTIONS = Set.of("scryfall", "bulk", "storage");

    @JsonMerge
    @JsonProperty("scryfall")
    private ScryfallConfig scryfall = new ScryfallConfig();

    @JsonMerge
    @JsonProperty("bulk")
    private BulkConfig bulk = new BulkConfig();

    @JsonMerge
    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public ScryfallConfig getScryfall() {
        return scryfall;
    }

    public BulkConfig getBulk() {
        return bulk;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public static IngestConfig load() {
        Path configPath = StorageUtils.appDataDir().resolve(CONFIG_FILE);
        return load(configPath, System.getProperties(), System.getenv("DATABASE_URL"));
    }

    /**
     * @throws IllegalStateException if an override is not valid for its key
     */
    static IngestConfig load(Path configPath, Properties overrides, String databaseUrl) {
        IngestConfig config = readFile(configPath);
        applyOverrides(config, overrides);
        if (databaseUrl != null && !databaseUrl.isBlank()) {
            config.storage.setDatabaseUrl(databaseUrl);
        }
        return config;
    }

    private static IngestConfig readFile(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            LOG.debug("No configuration file at {}, using defaults", configPath);
            return new IngestConfig();
        }
        try {
            LOG.info("Loading Configuration from: {}", configPath);
            return YAML_MAPPER.readValue(configPath.toFile(), IngestConfig.class);
        } catch (IOException e) {
            LOG.error("Failed to parse configuration file: {}. Using defaults. Error: {}", configPath,
                    e.getMessage());
            return new IngestConfig();
        }
    }

    private static void applyOverrides(IngestConfig config, Properties overrides) {
        ObjectNode tree = YAML_MAPPER.createObjectNode();
        for (String key : overrides.stringPropertyNames()) {
            int dot = key.indexOf('.');
            if (dot < 0 || !SECTIONS.contains(key.substring(0, dot)))
                continue;
            String section = key.substring(0, dot);
            ObjectNode node = tree.has(section) ? (ObjectNode) tree.get(section) : tree.putObject(section);
            node.put(key.substring(dot + 1), overrides.getProperty(key));
        }
        if (tree.isEmpty())
            return;

        LOG.info("Applying configuration overrides: {}", tree);
        try {
            YAML_MAPPER.readerForUpdating(config).readValue(tree);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid configuration override: " + e.getMessage(), e);
        }
    }

    static int atLeast(String key, int value, int min) {
        if (value < min) {
            throw new IllegalStateException("Config value " + key + "=" + value + " must be >= " + min);
        }
        return value;
    }
}

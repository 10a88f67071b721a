package de.bsommerfeld.mtgbuilder.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.mtgbuilder.core.config.ApplicationMode;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import de.bsommerfeld.mtgbuilder.db.DatabaseService;
import de.bsommerfeld.mtgbuilder.db.SqlDatabaseService;
import de.bsommerfeld.mtgbuilder.db.TestDatabaseService;
import de.bsommerfeld.mtgbuilder.scryfall.transport.HttpScryfallTransport;
import de.bsommerfeld.mtgbuilder.scryfall.transport.RateLimiter;
import de.bsommerfeld.mtgbuilder.scryfall.transport.ScryfallJson;
import de.bsommerfeld.mtgbuilder.scryfall.transport.ScryfallTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Guice Module for the ingester.
 *
 * <p>
 * There is exactly one {@link RateLimiter} per injector. Every fetch task, the
 * fan-out workers and the bulk catalog request all go through it.
 */
public class IngestModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(IngestModule.class);

    private final IngestConfig config;
    private final ApplicationMode mode;

    public IngestModule() {
        this(IngestConfig.load(), ApplicationMode.get());
    }

    public IngestModule(IngestConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(IngestConfig.class).toInstance(config);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            // TEST MODE: in-memory store, nothing is written to disk
            bind(DatabaseService.class).to(TestDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }

        bind(ScryfallTransport.class).to(HttpScryfallTransport.class);
    }

    @Provides
    @Singleton
    ObjectMapper objectMapper() {
        return ScryfallJson.newMapper();
    }

    @Provides
    @Singleton
    RateLimiter rateLimiter(IngestConfig config) {
        LOG.info("Rate limit: {} concurrent, {} ms between requests",
                config.getScryfall().getMaxConcurrent(), config.getScryfall().getMinDelay().toMillis());
        return new RateLimiter(config.getScryfall().getMaxConcurrent(), config.getScryfall().getMinDelay());
    }

    /**
     * Workers for multi-query fan-out. Sized like the rate limiter; more
     * threads would only queue on its permits.
     */
    @Provides
    @Singleton
    ExecutorService fetchExecutor(IngestConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getScryfall().getMaxConcurrent(), r -> {
            Thread t = new Thread(r, "ScryfallFetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

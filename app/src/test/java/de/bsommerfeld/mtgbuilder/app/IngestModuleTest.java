package de.bsommerfeld.mtgbuilder.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.mtgbuilder.core.config.ApplicationMode;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import de.bsommerfeld.mtgbuilder.db.DatabaseService;
import de.bsommerfeld.mtgbuilder.db.SqlDatabaseService;
import de.bsommerfeld.mtgbuilder.db.TestDatabaseService;
import de.bsommerfeld.mtgbuilder.scryfall.BulkDataImporter;
import de.bsommerfeld.mtgbuilder.scryfall.IngestionPipeline;
import de.bsommerfeld.mtgbuilder.scryfall.transport.HttpScryfallTransport;
import de.bsommerfeld.mtgbuilder.scryfall.transport.RateLimiter;
import de.bsommerfeld.mtgbuilder.scryfall.transport.ScryfallTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class IngestModuleTest {

    private static Injector injector(ApplicationMode mode, IngestConfig config) {
        return Guice.createInjector(new IngestModule(config, mode));
    }

    @Test
    void testMode_shouldBindInMemoryStore() {
        Injector injector = injector(ApplicationMode.TEST, new IngestConfig());

        DatabaseService database = injector.getInstance(DatabaseService.class);

        assertInstanceOf(TestDatabaseService.class, database);
        assertSame(database, injector.getInstance(DatabaseService.class));
    }

    @Test
    void prodMode_shouldBindSqliteStoreAtConfiguredUrl(@TempDir Path dir) throws Exception {
        IngestConfig config = new IngestConfig();
        config.getStorage().setDatabaseUrl("jdbc:sqlite:" + dir.resolve("cards.db"));
        Injector injector = injector(ApplicationMode.PROD, config);

        DatabaseService database = injector.getInstance(DatabaseService.class);

        assertInstanceOf(SqlDatabaseService.class, database);
        assertEquals(0, database.getCardCount());
    }

    @Test
    void rateLimiter_shouldBeSharedByEveryConsumer() {
        Injector injector = injector(ApplicationMode.TEST, new IngestConfig());

        assertSame(injector.getInstance(RateLimiter.class), injector.getInstance(RateLimiter.class));
        assertSame(injector.getInstance(ExecutorService.class), injector.getInstance(ExecutorService.class));
    }

    @Test
    void injector_shouldResolvePipelineAndImporter() {
        Injector injector = injector(ApplicationMode.TEST, new IngestConfig());

        assertNotNull(injector.getInstance(IngestionPipeline.class));
        assertNotNull(injector.getInstance(BulkDataImporter.class));
        assertInstanceOf(HttpScryfallTransport.class, injector.getInstance(ScryfallTransport.class));
    }
}

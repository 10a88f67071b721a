package de.bsommerfeld.mtgbuilder.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.mtgbuilder.core.config.ApplicationMode;
import de.bsommerfeld.mtgbuilder.core.config.IngestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class IngestCliTest {

    private static final String PAGE = "{\"object\":\"list\",\"total_cards\":2,\"has_more\":false,\"data\":["
            + "{\"object\":\"card\",\"id\":\"bolt-1\",\"name\":\"Lightning Bolt\",\"set\":\"lea\",\"cmc\":1.0},"
            + "{\"object\":\"card\",\"id\":\"shock-1\",\"name\":\"Shock\",\"set\":\"m19\",\"cmc\":1.0}]}";

    private HttpServer server;
    private String baseUrl;
    private Injector injector;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        IngestConfig config = new IngestConfig();
        config.getScryfall().setBaseUrl(baseUrl);
        config.getScryfall().setMinDelayMs(0);
        config.getScryfall().setMaxConcurrent(2);
        config.getScryfall().setConnectTimeoutSeconds(5);
        config.getScryfall().setRequestTimeoutSeconds(5);
        config.getStorage().setBatchSize(1);
        injector = Guice.createInjector(new IngestModule(config, ApplicationMode.TEST));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        server.createContext(path, exchange -> {
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = IngestCli.commandLine(injector);
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    // =====================================================================
    // validate
    // =====================================================================

    @Test
    void validate_shouldSucceedForValidQueries() {
        assertEquals(0, run("validate", "type:creature c:red", "t:instant"));
        assertTrue(out.toString().contains("✓ type:creature c:red -> type%3Acreature%20c%3Ared"));
    }

    @Test
    void validate_shouldFailWhenAnyQueryIsInvalid() {
        assertEquals(1, run("validate", "c:red", "(type:creature"));
        assertTrue(out.toString().contains("✗ (type:creature: Unbalanced parentheses in query"));
    }

    @Test
    void validate_shouldRequireAtLeastOneQuery() {
        assertEquals(CommandLine.ExitCode.USAGE, run("validate"));
    }

    @Test
    void unknownOption_shouldBeUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run("--bogus"));
    }

    // =====================================================================
    // search, fetch, inspect
    // =====================================================================

    @Test
    void search_shouldStoreCardsReadableByOtherCommands() {
        respond("/cards/search", 200, PAGE);

        assertEquals(0, run("search", "c:red"));
        assertTrue(out.toString().contains("[c:red] page 1: 2 cards (2 total)"));
        assertTrue(out.toString().contains("Stored 2 cards from 1 of 1 queries"));

        assertEquals(0, run("count"));
        assertEquals("2", out.toString().trim());

        assertEquals(0, run("show", "bolt-1"));
        assertTrue(out.toString().contains("\"name\":\"Lightning Bolt\""));

        assertEquals(0, run("find", "BOLT"));
        assertTrue(out.toString().contains("Lightning Bolt"));
        assertTrue(out.toString().contains("LEA"));
        assertFalse(out.toString().contains("Shock"));
    }

    @Test
    void search_shouldReportFailedQueryWithExitCodeOne() {
        respond("/cards/search", 500, "{\"object\":\"error\",\"details\":\"boom\"}");

        assertEquals(1, run("search", "c:red"));
        assertTrue(err.toString().contains("Query 'c:red' failed"));
    }

    @Test
    void search_shouldRejectInvalidQueryWithoutContactingServer() {
        assertEquals(1, run("search", "c:red or"));
        assertEquals(0, run("count"));
        assertEquals("0", out.toString().trim());
    }

    @Test
    void fetch_shouldStoreAllCards() {
        respond("/cards/search", 200, PAGE);

        assertEquals(0, run("fetch", "c:red"));
        assertTrue(out.toString().contains("Stored 2 cards"));
    }

    @Test
    void fetch_shouldPrintErrorOnFailure() {
        respond("/cards/search", 503, "unavailable");

        assertEquals(1, run("fetch", "c:red"));
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    void inspect_shouldPrettyPrintFirstPage() {
        respond("/cards/search", 200, PAGE);

        assertEquals(0, run("inspect", "c:red"));
        assertTrue(out.toString().contains("\"has_more\" : false"));
        assertEquals(0, run("count"));
        assertEquals("0", out.toString().trim());
    }

    // =====================================================================
    // bulk
    // =====================================================================

    @Test
    void bulk_shouldImportConfiguredFile() {
        respond("/bulk-data", 200, "{\"object\":\"list\",\"data\":[{\"type\":\"default_cards\","
                + "\"download_uri\":\"" + baseUrl + "/files/default-cards.json\"}]}");
        respond("/files/default-cards.json", 200,
                "[{\"id\":\"a\",\"name\":\"Alpha\"},{\"id\":\"b\",\"name\":\"Beta\"}]");

        assertEquals(0, run("bulk"));
        assertTrue(out.toString().contains("Storing... 1/2"));
        assertTrue(out.toString().contains("Imported 2 cards"));
    }

    // =====================================================================
    // Store lookups
    // =====================================================================

    @Test
    void show_shouldFailForUnknownCard() {
        assertEquals(1, run("show", "missing"));
        assertTrue(err.toString().contains("No card with ID missing"));
    }

    @Test
    void find_shouldReportNoMatches() {
        assertEquals(0, run("find", "nothing"));
        assertTrue(out.toString().contains("No cards matching 'nothing'"));
    }
}

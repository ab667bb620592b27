package io.trading.aggregator.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.aggregator.config.AggregatorConfig;
import io.trading.aggregator.core.BookManager;
import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the HTTP endpoints against a server bound to an ephemeral port.
 */
class MetricsServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private BookManager manager;
    private MetricsServer server;

    @BeforeEach
    void setUp() throws Exception {
        AggregatorConfig config = AggregatorConfig.fromMap(Map.of(
            "AGGREGATOR_ID", "agg-test",
            "VENUES", "binance_spot:2;okx_spot:2",
            "AGGREGATE_PRECISION", "2"
        ));
        AggregatorMetrics metrics = new AggregatorMetrics(new CollectorRegistry());
        manager = BookManager.fromConfig(config, metrics);
        server = new MetricsServer(0, metrics, config, manager);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path)).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealthNeedsEverySyncedVenue() throws Exception {
        manager.applySnapshot(Venue.BINANCE_SPOT, List.of(QuoteLevel.of(100.00, 1)), List.of());

        HttpResponse<String> response = get("/health");
        assertEquals(503, response.statusCode());
        assertFalse(objectMapper.readTree(response.body()).get("healthy").asBoolean());

        manager.applySnapshot(Venue.OKX_SPOT, List.of(QuoteLevel.of(100.00, 2)), List.of());

        response = get("/health");
        assertEquals(200, response.statusCode());
        assertTrue(objectMapper.readTree(response.body()).get("healthy").asBoolean());
    }

    @Test
    void testBookEndpointShowsAttribution() throws Exception {
        manager.applySnapshot(Venue.BINANCE_SPOT, List.of(QuoteLevel.of(100.00, 5), QuoteLevel.of(99.00, 1)),
            List.of(QuoteLevel.of(101.00, 2)));
        manager.applySnapshot(Venue.OKX_SPOT, List.of(QuoteLevel.of(100.00, 3)), List.of());

        HttpResponse<String> response = get("/api/book?depth=1");
        assertEquals(200, response.statusCode());

        JsonNode book = objectMapper.readTree(response.body());
        assertFalse(book.get("crossed").asBoolean());
        assertEquals(1, book.get("bids").size());
        JsonNode best = book.get("bids").get(0);
        assertEquals(100.00, best.get("price").asDouble());
        assertEquals(8.0, best.get("size").asDouble());
        assertEquals(5.0, best.get("sources").get("binance_spot").asDouble());
        assertEquals(3.0, best.get("sources").get("okx_spot").asDouble());

        assertEquals(400, get("/api/book?depth=-1").statusCode());
        assertEquals(400, get("/api/book?depth=abc").statusCode());
    }

    @Test
    void testStatusAndConfig() throws Exception {
        manager.applySnapshot(Venue.BINANCE_SPOT, List.of(QuoteLevel.of(100.00, 1)), List.of());

        JsonNode status = objectMapper.readTree(get("/api/status").body());
        assertEquals("agg-test", status.get("aggregatorId").asText());
        assertEquals(1, status.get("bidLevels").asInt());
        assertEquals("SNAPSHOTTED", status.get("venues").get("binance_spot").get("state").asText());
        assertEquals("REGISTERED", status.get("venues").get("okx_spot").get("state").asText());

        JsonNode config = objectMapper.readTree(get("/api/config").body());
        assertEquals(2, config.get("aggregatePrecision").asInt());
        assertEquals("USDT", config.get("aggregateCurrency").asText());
    }

    @Test
    void testPrometheusEndpoint() throws Exception {
        manager.applySnapshot(Venue.BINANCE_SPOT, List.of(QuoteLevel.of(100.00, 1)), List.of());

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("aggregator_snapshots_applied_total{venue=\"BINANCE_SPOT\",} 1.0"));
    }

    @Test
    void testParseDepth() {
        assertEquals(MetricsServer.DEFAULT_BOOK_DEPTH, MetricsServer.parseDepth(null));
        assertEquals(5, MetricsServer.parseDepth("foo=bar&depth=5"));
        assertThrows(IllegalArgumentException.class, () -> MetricsServer.parseDepth("depth=100000"));
    }
}

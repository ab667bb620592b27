package io.trading.aggregator.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.aggregator.config.AggregatorConfig;
import io.trading.aggregator.core.BookManager;
import io.trading.aggregator.core.VenueMetrics;
import io.trading.aggregator.core.VenueState;
import io.trading.orderbook.book.AggregatedBookView;
import io.trading.orderbook.model.AggregatedLevel;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, health, status, aggregated book and config endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    static final int DEFAULT_BOOK_DEPTH = 20;
    static final int MAX_BOOK_DEPTH = 1000;

    private final int port;
    private final AggregatorConfig config;
    private final BookManager bookManager;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(int port, AggregatorMetrics metrics, AggregatorConfig config, BookManager bookManager) {
        this.port = port;
        this.config = config;
        this.bookManager = bookManager;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/book", handleBook());
        server.createContext("/api/config", handleConfig());

        server.setExecutor(null);
        server.start();

        int boundPort = getPort();
        LOGGER.info("HTTP server started on port {}", boundPort);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", boundPort);
        LOGGER.info("  Health:     http://localhost:{}/health", boundPort);
        LOGGER.info("  API Status: http://localhost:{}/api/status", boundPort);
        LOGGER.info("  API Book:   http://localhost:{}/api/book?depth=N", boundPort);
        LOGGER.info("  API Config: http://localhost:{}/api/config", boundPort);
    }

    /**
     * The bound port, which differs from the configured one when started on port 0.
     */
    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                byte[] response = writer.toString().getBytes(StandardCharsets.UTF_8);

                exchange.getResponseHeaders().set("Content-Type", TextFormat.CONTENT_TYPE_004);
                exchange.sendResponseHeaders(200, response.length);

                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(response);
                }
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                boolean healthy = bookManager.getAggregatedOrderbook().isConsistent();
                String message = healthy ? "All venues synced" : "Aggregated book inconsistent";

                for (Venue venue : config.venuePrecisions().keySet()) {
                    VenueState state = bookManager.getState(venue);
                    if (!state.isSynced()) {
                        healthy = false;
                        message = venue.name() + " " + state.name().toLowerCase();
                    }
                }

                HealthResponse health = new HealthResponse(healthy, message);
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health);
                sendJsonResponse(exchange, healthy ? 200 : 503, response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                Map<String, VenueStatusInfo> venues = new LinkedHashMap<>();
                for (Map.Entry<Venue, VenueMetrics> entry : bookManager.getMetrics().entrySet()) {
                    Venue venue = entry.getKey();
                    VenueMetrics venueMetrics = entry.getValue();
                    venues.put(venue.name().toLowerCase(), new VenueStatusInfo(
                        venue.getDisplayName(),
                        bookManager.getState(venue).name(),
                        venueMetrics.getUpdatesProcessed(),
                        venueMetrics.getSnapshotsApplied(),
                        venueMetrics.getReconnects(),
                        venueMetrics.getResyncs(),
                        finiteOrNull(venueMetrics.getAvgLatencyMs()),
                        finiteOrNull(venueMetrics.getBestBid()),
                        finiteOrNull(venueMetrics.getBestAsk()),
                        venueMetrics.getLastUpdateTimeMs()
                    ));
                }

                AggregatedBookView book = bookManager.getAggregatedOrderbook();
                StatusResponse statusResponse = new StatusResponse(
                    config.aggregatorId(),
                    System.currentTimeMillis() - startTime,
                    book.levelCount(true),
                    book.levelCount(false),
                    book.crossedBook().isPresent(),
                    venues
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(statusResponse);
                sendJsonResponse(exchange, 200, response);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleBook() {
        return exchange -> {
            try {
                int depth;
                try {
                    depth = parseDepth(exchange.getRequestURI().getQuery());
                } catch (IllegalArgumentException e) {
                    sendJsonResponse(exchange, 400, "{\"error\":\"Invalid depth\"}");
                    return;
                }

                AggregatedBookView book = bookManager.getAggregatedOrderbook();
                BookDepth<AggregatedLevel> levels = book.getDepthWithPrices(depth);
                BookResponse bookResponse = new BookResponse(
                    book.precision(),
                    book.crossedBook().isPresent(),
                    toLevelInfo(levels.bids()),
                    toLevelInfo(levels.asks())
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(bookResponse);
                sendJsonResponse(exchange, 200, response);
            } catch (Exception e) {
                LOGGER.error("Error handling book request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                ConfigInfo configInfo = new ConfigInfo(
                    config.aggregatorId(),
                    config.venueConfigs().toString(),
                    config.aggregatePrecision(),
                    config.aggregationDepth(),
                    config.aggregateCurrency().name(),
                    config.normalizeQuotes(),
                    config.rateTtlMs(),
                    config.staleFeedMs(),
                    config.healthCheckMs(),
                    config.sequencerCapacity(),
                    config.metricsPort()
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo);
                sendJsonResponse(exchange, 200, response);
            } catch (Exception e) {
                LOGGER.error("Error handling config request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    static int parseDepth(String query) {
        if (query == null || query.isEmpty()) {
            return DEFAULT_BOOK_DEPTH;
        }
        for (String param : query.split("&")) {
            String[] pair = param.split("=", 2);
            if (pair.length == 2 && pair[0].equals("depth")) {
                int depth = Integer.parseInt(pair[1]);
                if (depth < 0 || depth > MAX_BOOK_DEPTH) {
                    throw new IllegalArgumentException("depth out of range: " + depth);
                }
                return depth;
            }
        }
        return DEFAULT_BOOK_DEPTH;
    }

    private static List<LevelInfo> toLevelInfo(List<AggregatedLevel> levels) {
        List<LevelInfo> result = new ArrayList<>(levels.size());
        for (AggregatedLevel level : levels) {
            Map<String, BigDecimal> sources = new LinkedHashMap<>();
            level.sources().forEach((venue, size) -> sources.put(venue.name().toLowerCase(), size));
            result.add(new LevelInfo(level.price(), level.size(), sources));
        }
        return result;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private void sendJsonResponse(HttpExchange exchange, int statusCode, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record HealthResponse(boolean healthy, String message) {}

    private record StatusResponse(String aggregatorId, long uptimeMs, int bidLevels, int askLevels,
                                  boolean crossed, Map<String, VenueStatusInfo> venues) {}

    private record VenueStatusInfo(String venue, String state, long updates, long snapshots, long reconnects,
                                   long resyncs, Double avgLatencyMs, Double bestBid, Double bestAsk,
                                   long lastUpdateTimeMs) {}

    private record BookResponse(int precision, boolean crossed, List<LevelInfo> bids, List<LevelInfo> asks) {}

    private record LevelInfo(double price, BigDecimal size, Map<String, BigDecimal> sources) {}

    private record ConfigInfo(String aggregatorId, String venues, int aggregatePrecision, int aggregationDepth,
                              String aggregateCurrency, boolean normalizeQuotes, long rateTtlMs, long staleFeedMs,
                              int healthCheckMs, int sequencerCapacity, int metricsPort) {}
}

package io.trading.aggregator;

import io.prometheus.client.hotspot.DefaultExports;
import io.trading.aggregator.config.AggregatorConfig;
import io.trading.aggregator.core.AggregatorController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Order Book Aggregator application.
 */
public class OrderBookAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrderBookAggregator.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Order Book Aggregator Starting...");
        LOGGER.info("========================================");

        try {
            // Load configuration from environment variables
            AggregatorConfig config = AggregatorConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Aggregator ID: {}", config.aggregatorId());
            LOGGER.info("  Venues: {}", config.venueConfigs());
            LOGGER.info("  Aggregate Precision: {}", config.aggregatePrecision());
            LOGGER.info("  Aggregation Depth: {}", config.aggregationDepth() == 0 ? "all" : config.aggregationDepth());

            // JVM metrics (GC, memory, threads) next to the aggregator metrics
            DefaultExports.initialize();

            // Venue feeds are attached through registerFeed before start
            AggregatorController controller = new AggregatorController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Order Book Aggregator", e);
            System.exit(1);
        }

        LOGGER.info("Order Book Aggregator exited");
    }
}

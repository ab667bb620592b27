package io.trading.aggregator.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.trading.aggregator.core.VenueState;
import io.trading.orderbook.model.Venue;

/**
 * Prometheus metrics collector for the order book aggregator.
 *
 * Tracks:
 * - Applied snapshots and incremental updates per venue
 * - Rejected updates per venue and reason
 * - Resyncs and crossed aggregated books
 * - Best prices, venue state and aggregated level counts
 * - Feed latency per venue
 */
public class AggregatorMetrics {

    public static final String UNKNOWN_VENUE_LABEL = "UNKNOWN";

    private final CollectorRegistry registry;

    // Counters
    private final Counter updatesApplied;
    private final Counter snapshotsApplied;
    private final Counter rejectedUpdates;
    private final Counter resyncs;
    private final Counter crossedBooks;
    private final Counter sequencerDropped;

    // Gauges
    private final Gauge bestBid;
    private final Gauge bestAsk;
    private final Gauge venueState;
    private final Gauge levels;

    // Summary (latency tracking)
    private final Summary updateLatency;

    public AggregatorMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public AggregatorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.updatesApplied = Counter.build()
            .name("aggregator_updates_applied_total")
            .help("Total number of incremental level updates applied")
            .labelNames("venue")
            .register(registry);

        this.snapshotsApplied = Counter.build()
            .name("aggregator_snapshots_applied_total")
            .help("Total number of snapshots applied")
            .labelNames("venue")
            .register(registry);

        this.rejectedUpdates = Counter.build()
            .name("aggregator_rejected_updates_total")
            .help("Total number of rejected snapshots and updates")
            .labelNames("venue", "reason")
            .register(registry);

        this.resyncs = Counter.build()
            .name("aggregator_resyncs_total")
            .help("Total number of venue resyncs")
            .labelNames("venue")
            .register(registry);

        this.crossedBooks = Counter.build()
            .name("aggregator_crossed_book_total")
            .help("Number of times the aggregated book became crossed")
            .register(registry);

        this.sequencerDropped = Counter.build()
            .name("aggregator_sequencer_dropped_total")
            .help("Events dropped because the update sequencer was full")
            .register(registry);

        this.bestBid = Gauge.build()
            .name("aggregator_best_bid")
            .help("Best bid price per venue")
            .labelNames("venue")
            .register(registry);

        this.bestAsk = Gauge.build()
            .name("aggregator_best_ask")
            .help("Best ask price per venue")
            .labelNames("venue")
            .register(registry);

        // 0 = unregistered, 1 = registered, 2 = snapshotted, 3 = live
        this.venueState = Gauge.build()
            .name("aggregator_venue_state")
            .help("Venue lifecycle state (0 = unregistered, 1 = registered, 2 = snapshotted, 3 = live)")
            .labelNames("venue")
            .register(registry);

        this.levels = Gauge.build()
            .name("aggregator_levels")
            .help("Number of price levels in the aggregated book")
            .labelNames("side")
            .register(registry);

        this.updateLatency = Summary.build()
            .name("aggregator_update_latency_milliseconds")
            .help("Latency from feed receipt to book apply in milliseconds")
            .labelNames("venue")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);
    }

    public void recordUpdateApplied(Venue venue) {
        updatesApplied.labels(venue.name()).inc();
    }

    public void recordSnapshotApplied(Venue venue) {
        snapshotsApplied.labels(venue.name()).inc();
    }

    /**
     * Records a rejected snapshot or update.
     *
     * @param venue  The venue, or null when the venue could not be resolved
     * @param reason Short machine readable reason, e.g. "invalid_price"
     */
    public void recordRejected(Venue venue, String reason) {
        rejectedUpdates.labels(label(venue), reason).inc();
    }

    public void recordResync(Venue venue) {
        resyncs.labels(venue.name()).inc();
    }

    public void recordCrossedBook() {
        crossedBooks.inc();
    }

    public void recordSequencerDropped() {
        sequencerDropped.inc();
    }

    /**
     * Sets the best prices for a venue. NaN marks an empty side.
     */
    public void setBestPrices(Venue venue, double bid, double ask) {
        bestBid.labels(venue.name()).set(bid);
        bestAsk.labels(venue.name()).set(ask);
    }

    public void setVenueState(Venue venue, VenueState state) {
        venueState.labels(venue.name()).set(state.code());
    }

    public void setLevelCounts(int bidLevels, int askLevels) {
        levels.labels("bid").set(bidLevels);
        levels.labels("ask").set(askLevels);
    }

    /**
     * Records feed latency.
     *
     * @param venue     The venue
     * @param latencyMs Latency in milliseconds
     */
    public void recordFeedLatency(Venue venue, double latencyMs) {
        updateLatency.labels(venue.name()).observe(latencyMs);
    }

    /**
     * Returns the CollectorRegistry for HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getUpdatesApplied(Venue venue) {
        return updatesApplied.labels(venue.name()).get();
    }

    public double getSnapshotsApplied(Venue venue) {
        return snapshotsApplied.labels(venue.name()).get();
    }

    public double getRejected(Venue venue, String reason) {
        return rejectedUpdates.labels(label(venue), reason).get();
    }

    public double getResyncs(Venue venue) {
        return resyncs.labels(venue.name()).get();
    }

    public double getCrossedBookCount() {
        return crossedBooks.get();
    }

    public double getSequencerDropped() {
        return sequencerDropped.get();
    }

    public double getVenueState(Venue venue) {
        return venueState.labels(venue.name()).get();
    }

    private static String label(Venue venue) {
        return venue == null ? UNKNOWN_VENUE_LABEL : venue.name();
    }
}

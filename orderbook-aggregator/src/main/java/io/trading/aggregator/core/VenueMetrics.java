package io.trading.aggregator.core;

import io.trading.orderbook.model.Venue;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-venue runtime statistics kept next to the venue book.
 */
public class VenueMetrics {

    private final Venue venue;
    private final AtomicLong updatesProcessed = new AtomicLong();
    private final AtomicLong snapshotsApplied = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicLong resyncs = new AtomicLong();

    private volatile double lastLatencyMs = Double.NaN;
    private volatile double avgLatencyMs = Double.NaN;
    private long latencySamples = 0;

    private volatile double bestBid = Double.NaN;
    private volatile double bestAsk = Double.NaN;
    private volatile long lastUpdateTimeMs = 0;

    public VenueMetrics(Venue venue) {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        this.venue = venue;
    }

    /**
     * Records a feed latency sample and folds it into the running average.
     */
    public synchronized void recordLatency(double latencyMs) {
        latencySamples++;
        lastLatencyMs = latencyMs;
        if (latencySamples == 1) {
            avgLatencyMs = latencyMs;
        } else {
            avgLatencyMs = avgLatencyMs + (latencyMs - avgLatencyMs) / latencySamples;
        }
    }

    void recordUpdate(long nowMs) {
        updatesProcessed.incrementAndGet();
        lastUpdateTimeMs = nowMs;
    }

    void recordSnapshot(long nowMs) {
        snapshotsApplied.incrementAndGet();
        lastUpdateTimeMs = nowMs;
    }

    void recordReconnect() {
        reconnects.incrementAndGet();
    }

    void recordResync() {
        resyncs.incrementAndGet();
    }

    /**
     * Sets the venue's best prices, NaN for an empty side.
     */
    void recordBestPrices(double bid, double ask) {
        this.bestBid = bid;
        this.bestAsk = ask;
    }

    public Venue getVenue() {
        return venue;
    }

    public long getUpdatesProcessed() {
        return updatesProcessed.get();
    }

    public long getSnapshotsApplied() {
        return snapshotsApplied.get();
    }

    public long getReconnects() {
        return reconnects.get();
    }

    public long getResyncs() {
        return resyncs.get();
    }

    public double getLastLatencyMs() {
        return lastLatencyMs;
    }

    public double getAvgLatencyMs() {
        return avgLatencyMs;
    }

    public double getBestBid() {
        return bestBid;
    }

    public double getBestAsk() {
        return bestAsk;
    }

    /**
     * Wall clock time of the last applied snapshot or update, 0 if none.
     */
    public long getLastUpdateTimeMs() {
        return lastUpdateTimeMs;
    }
}

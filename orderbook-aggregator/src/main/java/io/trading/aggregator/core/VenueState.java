package io.trading.aggregator.core;

/**
 * Lifecycle of a venue inside the {@link BookManager}.
 *
 * UNREGISTERED -> REGISTERED (add) -> SNAPSHOTTED (first snapshot) -> LIVE (first incremental update).
 * A reset or re-registration drives a venue back to REGISTERED; removal drives it to UNREGISTERED.
 */
public enum VenueState {
    UNREGISTERED(0),
    REGISTERED(1),
    SNAPSHOTTED(2),
    LIVE(3);

    private final int code;

    VenueState(int code) {
        this.code = code;
    }

    /**
     * Numeric code exported through the venue state gauge.
     */
    public int code() {
        return code;
    }

    /**
     * Whether the venue holds a full book (snapshot applied).
     */
    public boolean isSynced() {
        return this == SNAPSHOTTED || this == LIVE;
    }
}

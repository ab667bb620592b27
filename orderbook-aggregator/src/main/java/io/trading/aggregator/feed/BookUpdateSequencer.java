package io.trading.aggregator.feed;

import io.trading.aggregator.core.BookManager;
import io.trading.aggregator.metrics.AggregatorMetrics;
import io.trading.orderbook.error.OrderBookException;
import org.agrona.CloseHelper;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * Funnels book events from any number of feed threads into a single writer thread.
 *
 * Feeds {@link #offer(BookEvent)} onto a bounded queue; the agent drains it into the
 * {@link BookManager} so every book mutation happens on one thread in arrival order.
 */
public class BookUpdateSequencer implements Agent, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookUpdateSequencer.class);

    private static final int DRAIN_LIMIT = 256;

    private final BookManager bookManager;
    private final AggregatorMetrics metrics;
    private final ManyToOneConcurrentArrayQueue<BookEvent> queue;
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    private volatile BiConsumer<BookEvent, OrderBookException> rejectionHandler;
    private AgentRunner runner;

    public BookUpdateSequencer(BookManager bookManager, AggregatorMetrics metrics, int capacity) {
        if (bookManager == null) {
            throw new IllegalArgumentException("bookManager cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.bookManager = bookManager;
        this.metrics = metrics;
        this.queue = new ManyToOneConcurrentArrayQueue<>(capacity);
    }

    /**
     * Queues an event. Safe to call from any thread.
     *
     * @return false if the queue is full and the event was dropped
     */
    public boolean offer(BookEvent event) {
        if (!queue.offer(event)) {
            metrics.recordSequencerDropped();
            LOGGER.warn("[{}] Sequencer full, dropped {} event", event.venue(), event.type());
            return false;
        }
        return true;
    }

    /**
     * Starts the writer thread.
     */
    public synchronized void start() {
        if (runner != null) {
            return;
        }
        runner = new AgentRunner(
            new BackoffIdleStrategy(100, 10, TimeUnit.MICROSECONDS.toNanos(1), TimeUnit.MILLISECONDS.toNanos(1)),
            this::onAgentError,
            null,
            this
        );
        AgentRunner.startOnThread(runner);
        LOGGER.info("Book update sequencer started (capacity: {})", queue.capacity());
    }

    @Override
    public int doWork() {
        return queue.drain(this::apply, DRAIN_LIMIT);
    }

    @Override
    public String roleName() {
        return "book-update-sequencer";
    }

    /**
     * Sets the handler notified when the book manager rejects an event.
     */
    public void setRejectionHandler(BiConsumer<BookEvent, OrderBookException> handler) {
        this.rejectionHandler = handler;
    }

    public int queueSize() {
        return queue.size();
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    private void apply(BookEvent event) {
        try {
            switch (event.type()) {
                case SNAPSHOT -> bookManager.applySnapshot(event.venue(), event.bids(), event.asks());
                case LEVEL_UPDATE -> bookManager.updateOrderbook(event.venue(), event.price(), event.size(), event.isBid());
                case RESET -> bookManager.resetVenue(event.venue());
            }
            processedCount.incrementAndGet();
            if (event.type() != BookEvent.Type.RESET) {
                // receive to applied, queue wait included
                bookManager.updateMetrics(event.venue(), (System.nanoTime() - event.receivedNanos()) / 1e6);
            }
        } catch (OrderBookException e) {
            errorCount.incrementAndGet();
            BiConsumer<BookEvent, OrderBookException> handler = rejectionHandler;
            if (handler != null) {
                handler.accept(event, e);
            }
        }
    }

    private void onAgentError(Throwable throwable) {
        errorCount.incrementAndGet();
        LOGGER.error("Book update sequencer error", throwable);
    }

    @Override
    public synchronized void close() {
        CloseHelper.quietClose(runner);
        runner = null;
    }
}

package io.trading.orderbook.book;

import io.trading.orderbook.error.InvalidPriceException;
import io.trading.orderbook.model.AggregatedLevel;
import io.trading.orderbook.model.BestBidAsk;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.CrossedBook;
import io.trading.orderbook.model.QuoteCurrency;
import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AggregatedBook.
 */
class AggregatedBookTest {

    private static final Venue A = Venue.BINANCE_SPOT;
    private static final Venue B = Venue.OKX_SPOT;
    private static final Venue C = Venue.BYBIT_SPOT;

    private AggregatedBook book;

    @BeforeEach
    void setUp() {
        book = new AggregatedBook(2);
    }

    @Test
    void testContributionsSumPerLevel() {
        book.update(100.00, 5, true, A);
        book.update(100.00, 3, true, B);

        AggregatedLevel best = book.bestBid().orElseThrow();
        assertEquals(100.00, best.price());
        assertEquals(0, new BigDecimal("8.0").compareTo(best.size()));
        assertEquals(Set.of(A, B), best.sources().keySet());
        assertEquals(0, new BigDecimal("5.0").compareTo(best.sizeFrom(A)));
    }

    @Test
    void testUpdateOverwritesVenueContribution() {
        book.update(100.00, 5, true, A);
        book.update(100.00, 3, true, B);
        book.update(100.00, 2, true, A);

        AggregatedLevel best = book.bestBid().orElseThrow();
        assertEquals(0, new BigDecimal("5.0").compareTo(best.size()));
        assertEquals(0, new BigDecimal("2.0").compareTo(best.sizeFrom(A)));
    }

    @Test
    void testZeroSizeRemovesOnlyThatVenue() {
        book.update(100.00, 5, true, A);
        book.update(100.00, 3, true, B);

        book.update(100.00, 0, true, A);

        AggregatedLevel best = book.bestBid().orElseThrow();
        assertEquals(0, new BigDecimal("3.0").compareTo(best.size()));
        assertEquals(Set.of(B), best.sources().keySet());
    }

    @Test
    void testLastContributionRemovalDeletesLevel() {
        book.update(100.00, 5, false, A);
        book.update(100.00, 0, false, A);

        assertEquals(0, book.levelCount(false));
        assertTrue(book.bestAsk().isEmpty());
    }

    @Test
    void testClearVenueIsolation() {
        book.update(100.00, 5, true, A);
        book.update(100.00, 3, true, B);
        book.update(99.00, 1, true, A);
        book.update(101.00, 2, false, B);
        book.update(102.00, 4, false, A);

        book.clearVenue(A);

        assertEquals(Set.of(B), book.contributingVenues());
        assertEquals(1, book.levelCount(true));
        assertEquals(1, book.levelCount(false));
        assertEquals(0, new BigDecimal("3.0").compareTo(book.volumeFromVenue(100.00, true, B)));
        assertEquals(0, new BigDecimal("2.0").compareTo(book.volumeFromVenue(101.00, false, B)));
        assertEquals(BigDecimal.ZERO, book.volumeFromVenue(99.00, true, A));
        assertTrue(book.isConsistent());
    }

    @Test
    @DisplayName("A:5 + B:3 at 100.00, A drops out, then B is cleared")
    void testTwoVenueScenario() {
        VenueBook bookA = new VenueBook(2);
        VenueBook bookB = new VenueBook(2);
        bookA.applySnapshot(List.of(QuoteLevel.of(100.00, 5)), List.of());
        bookB.applySnapshot(List.of(QuoteLevel.of(100.00, 3)), List.of());
        book.updateFromVenue(A, bookA, AggregatedBook.FULL_DEPTH);
        book.updateFromVenue(B, bookB, AggregatedBook.FULL_DEPTH);

        AggregatedLevel best = book.bestBid().orElseThrow();
        assertEquals(100.00, best.price());
        assertEquals(0, new BigDecimal("8.0").compareTo(best.size()));
        assertEquals(Map.of(A, new BigDecimal("5.0"), B, new BigDecimal("3.0")), best.sources());

        book.update(100.00, 0, true, A);
        best = book.bestBid().orElseThrow();
        assertEquals(0, new BigDecimal("3.0").compareTo(best.size()));
        assertEquals(Set.of(B), best.sources().keySet());

        book.clearVenue(B);
        assertTrue(book.bestBid().isEmpty());
        assertTrue(book.levelAt(10000L, true).isEmpty());
    }

    @Test
    void testUpdateFromVenueReplacesStaleLevels() {
        book.update(105.00, 1, false, A);
        book.update(105.00, 2, false, B);

        VenueBook fresh = new VenueBook(2);
        fresh.applySnapshot(List.of(QuoteLevel.of(100.00, 1)), List.of(QuoteLevel.of(101.00, 1)));
        book.updateFromVenue(A, fresh, AggregatedBook.FULL_DEPTH);

        assertEquals(BigDecimal.ZERO, book.volumeFromVenue(105.00, false, A));
        assertEquals(0, new BigDecimal("2.0").compareTo(book.volumeFromVenue(105.00, false, B)));
        assertEquals(101.00, book.bestAsk().orElseThrow().price());
    }

    @Test
    void testUpdateFromVenueHonoursDepthLimit() {
        VenueBook venueBook = new VenueBook(2);
        venueBook.applySnapshot(
            List.of(QuoteLevel.of(100.00, 1), QuoteLevel.of(99.00, 1), QuoteLevel.of(98.00, 1)),
            List.of(QuoteLevel.of(101.00, 1), QuoteLevel.of(102.00, 1), QuoteLevel.of(103.00, 1))
        );

        book.updateFromVenue(A, venueBook, 2);

        assertEquals(2, book.levelCount(true));
        assertEquals(2, book.levelCount(false));
    }

    @Test
    void testFinerVenueCollapsesOntoCoarserGrid() {
        AggregatedBook coarse = new AggregatedBook(1);
        coarse.update(100.01, 1, true, A);
        coarse.update(100.04, 2, true, B);
        coarse.update(100.06, 4, true, C);

        BookDepth<AggregatedLevel> depth = coarse.getDepthWithPrices(10);
        assertEquals(2, depth.bids().size());
        assertEquals(100.1, depth.bids().get(0).price());
        assertEquals(100.0, depth.bids().get(1).price());
        assertEquals(0, new BigDecimal("3.0").compareTo(depth.bids().get(1).size()));
    }

    @Test
    void testDepthOrderingAcrossVenues() {
        book.update(99.00, 1, true, A);
        book.update(100.00, 1, true, B);
        book.update(98.00, 1, true, C);
        book.update(103.00, 1, false, A);
        book.update(101.00, 1, false, B);
        book.update(102.00, 1, false, C);

        BookDepth<AggregatedLevel> depth = book.getDepthWithPrices(3);

        assertEquals(List.of(100.00, 99.00, 98.00), depth.bids().stream().map(AggregatedLevel::price).toList());
        assertEquals(List.of(101.00, 102.00, 103.00), depth.asks().stream().map(AggregatedLevel::price).toList());
        assertEquals(1, book.getDepthWithPrices(1).bids().size());
        assertTrue(book.getDepthWithPrices(0).isEmpty());
    }

    @Test
    void testCrossedBookIsObservedNotResolved() {
        book.update(100.00, 1, true, A);
        book.update(101.00, 1, false, B);
        assertTrue(book.crossedBook().isEmpty());

        book.update(101.50, 2, true, C);

        CrossedBook crossed = book.crossedBook().orElseThrow();
        assertEquals(101.50, crossed.bestBid());
        assertEquals(101.00, crossed.bestAsk());
        assertEquals(Set.of(C), crossed.bidVenues());
        assertEquals(Set.of(B), crossed.askVenues());
        assertEquals(2, book.levelCount(true));
    }

    @Test
    void testQuoteRateNormalizesUsdVenue() {
        Venue usdVenue = Venue.BINANCE_COINM;
        assertTrue(book.updateQuoteRate(QuoteCurrency.USD, 0.99));

        book.update(100.00, 1, true, usdVenue);
        book.update(99.00, 1, true, A);

        AggregatedLevel best = book.bestBid().orElseThrow();
        assertEquals(99.00, best.price());
        assertEquals(Set.of(usdVenue, A), best.sources().keySet());
        assertEquals(0, BigDecimal.ONE.compareTo(book.volumeFromVenue(100.00, true, usdVenue)));
    }

    @Test
    void testQuoteRateChangeClearsBook() {
        book.update(100.00, 1, true, A);

        assertFalse(book.updateQuoteRate(QuoteCurrency.USDT, 1.0));
        assertEquals(1, book.levelCount(true));

        assertTrue(book.updateQuoteRate(QuoteCurrency.USDT, 1.001));
        assertEquals(0, book.levelCount(true));
        assertEquals(1.001, book.quoteRate(QuoteCurrency.USDT));
    }

    @Test
    void testBestPricesByVenueProjectBack() {
        book.updateQuoteRate(QuoteCurrency.USD, 0.5);
        book.update(50.00, 1, true, A);
        book.update(52.00, 1, false, A);

        assertEquals(new BestBidAsk(50.00, 52.00), book.bestBidAskPrices().orElseThrow());
        assertEquals(new BestBidAsk(100.00, 104.00),
            book.bestBidAskPricesByVenue(Venue.BINANCE_COINM).orElseThrow());
    }

    @Test
    void testProjectionUsesFactorOfStoredKeys() throws Exception {
        Venue coinm = Venue.BINANCE_COINM;
        Thread writer = new Thread(() -> {
            double[] rates = {0.5, 0.25};
            for (int i = 0; i < 2_000; i++) {
                book.updateQuoteRate(QuoteCurrency.USD, rates[i % 2]);
                book.update(100.00, 1, true, coinm);
                book.update(104.00, 1, false, coinm);
            }
        });
        writer.start();

        while (writer.isAlive()) {
            Optional<BestBidAsk> projected = book.bestBidAskPricesByVenue(coinm);
            if (projected.isPresent()) {
                assertEquals(100.00, projected.get().bid(), 1e-9);
                assertEquals(104.00, projected.get().ask(), 1e-9);
            }
        }
        writer.join();
    }

    @Test
    void testNonFiniteSizeIsInvalid() {
        book.update(100.00, 1, true, A);

        assertThrows(InvalidPriceException.class, () -> book.update(100.00, Double.NaN, true, A));
        assertThrows(InvalidPriceException.class, () -> book.update(100.00, Double.NEGATIVE_INFINITY, true, B));

        assertEquals(Set.of(A), book.contributingVenues());
    }

    @Test
    void testInvalidPriceLeavesBookUnchanged() {
        book.update(100.00, 1, true, A);

        assertThrows(InvalidPriceException.class, () -> book.update(Double.NaN, 1, true, A));
        assertThrows(InvalidPriceException.class, () -> book.update(0.0, 1, true, B));

        assertEquals(1, book.levelCount(true));
        assertEquals(Set.of(A), book.contributingVenues());
    }

    @Test
    void testRebuildReplacesEverything() {
        book.update(90.00, 1, true, C);

        VenueBook bookA = new VenueBook(2);
        bookA.applySnapshot(List.of(QuoteLevel.of(100.00, 2)), List.of(QuoteLevel.of(101.00, 2)));
        VenueBook bookB = new VenueBook(2);
        bookB.applySnapshot(List.of(QuoteLevel.of(100.00, 1)), List.of());

        book.rebuild(Map.of(
            A, bookA.getDepthWithPrices(AggregatedBook.FULL_DEPTH),
            B, bookB.getDepthWithPrices(AggregatedBook.FULL_DEPTH)
        ));

        assertEquals(Set.of(A, B), book.contributingVenues());
        assertEquals(0, new BigDecimal("3.0").compareTo(book.bestBid().orElseThrow().size()));
    }

    @Test
    void testSumInvariantUnderRandomOperations() {
        Random random = new Random(42);
        Venue[] venues = {A, B, C};

        for (int i = 0; i < 5_000; i++) {
            Venue venue = venues[random.nextInt(venues.length)];
            int op = random.nextInt(20);
            if (op == 0) {
                book.clearVenue(venue);
            } else {
                double price = 100.00 + random.nextInt(20) / 100.0;
                double size = random.nextInt(4) == 0 ? 0.0 : random.nextInt(1_000) / 10.0;
                book.update(price, size, random.nextBoolean(), venue);
            }
            assertTrue(book.isConsistent(), "sum invariant broken at step " + i);
        }

        for (AggregatedLevel level : book.getDepthWithPrices(AggregatedBook.FULL_DEPTH).bids()) {
            BigDecimal sum = level.sources().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, sum.compareTo(level.size()));
        }
    }
}

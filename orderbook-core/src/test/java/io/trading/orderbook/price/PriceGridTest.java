package io.trading.orderbook.price;

import io.trading.orderbook.error.InvalidPriceException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PriceGrid.
 */
class PriceGridTest {

    @Test
    void testToTicksScalesByPrecision() {
        PriceGrid grid = new PriceGrid(2);
        assertEquals(10000L, grid.toTicks(100.00));
        assertEquals(4325050L, grid.toTicks(43250.50));
    }

    @Test
    void testToTicksRoundsHalfUp() {
        PriceGrid grid = new PriceGrid(2);
        assertEquals(10001L, grid.toTicks(100.005));
        assertEquals(10000L, grid.toTicks(100.004));
    }

    @Test
    void testBinaryFractionsDoNotDrift() {
        PriceGrid grid = new PriceGrid(8);
        assertEquals(10000000L, grid.toTicks(0.1));
        assertEquals(30000000L, grid.toTicks(0.1 + 0.2));
    }

    @Test
    void testCoarserGridCollapsesNearbyPrices() {
        PriceGrid grid = new PriceGrid(1);
        assertEquals(grid.toTicks(100.04), grid.toTicks(100.01));
        assertNotEquals(grid.toTicks(100.04), grid.toTicks(100.06));
    }

    @Test
    void testToPriceInvertsToTicks() {
        PriceGrid grid = new PriceGrid(8);
        long ticks = grid.toTicks(43250.12345678);
        assertEquals(43250.12345678, grid.toPrice(ticks), 1e-9);

        PriceGrid whole = new PriceGrid(0);
        assertEquals(43251.0, whole.toPrice(whole.toTicks(43250.5)));
    }

    @Test
    void testRejectsNonFinitePrices() {
        PriceGrid grid = new PriceGrid(2);
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(Double.NaN));
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(Double.POSITIVE_INFINITY));
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(Double.NEGATIVE_INFINITY));
    }

    @Test
    void testRejectsNonPositivePrices() {
        PriceGrid grid = new PriceGrid(2);
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(0.0));
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(-1.5));
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(0.001));
    }

    @Test
    void testRejectsTickOverflow() {
        PriceGrid grid = new PriceGrid(8);
        assertThrows(InvalidPriceException.class, () -> grid.toTicks(1e300));
    }

    @Test
    void testRejectsInvalidPrecision() {
        assertThrows(InvalidPriceException.class, () -> new PriceGrid(-1));
        assertThrows(InvalidPriceException.class, () -> new PriceGrid(PriceGrid.MAX_PRECISION + 1));
    }
}

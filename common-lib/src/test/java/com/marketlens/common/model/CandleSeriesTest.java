package com.marketlens.common.model;

import com.marketlens.common.CandleFixtures;
import com.marketlens.common.exception.InvalidCandleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.marketlens.common.CandleFixtures.at;
import static org.junit.jupiter.api.Assertions.*;

class CandleSeriesTest {

    @Nested
    @DisplayName("of() — contract validation")
    class ValidationTests {

        @Test
        @DisplayName("empty series is rejected")
        void emptyRejected() {
            InvalidCandleException e = assertThrows(InvalidCandleException.class,
                () -> CandleSeries.of("AAPL", "1h", List.of()));
            assertEquals("AAPL", e.getSymbol());
        }

        @Test
        @DisplayName("null candle list is rejected")
        void nullRejected() {
            assertThrows(InvalidCandleException.class, () -> CandleSeries.of("AAPL", "1h", null));
        }

        @Test
        @DisplayName("blank symbol is rejected")
        void blankSymbol() {
            assertThrows(InvalidCandleException.class,
                () -> CandleSeries.of(" ", "1h", CandleFixtures.uptrend(3)));
        }

        @Test
        @DisplayName("non-positive price is rejected with the candle index")
        void nonPositivePrice() {
            List<Candle> candles = new ArrayList<>(CandleFixtures.uptrend(5));
            candles.set(3, Candle.of(at(3), 0, 1, 0, 1, 10));
            InvalidCandleException e = assertThrows(InvalidCandleException.class,
                () -> CandleSeries.of("AAPL", "1h", candles));
            assertTrue(e.getMessage().contains("candle[3]"));
        }

        @Test
        @DisplayName("non-finite price is rejected")
        void nonFinitePrice() {
            List<Candle> candles = List.of(Candle.of(at(0), 10, Double.NaN, 9, 10, 1));
            assertThrows(InvalidCandleException.class, () -> CandleSeries.of("AAPL", "1h", candles));
        }

        @Test
        @DisplayName("negative volume is rejected")
        void negativeVolume() {
            List<Candle> candles = List.of(Candle.of(at(0), 10, 11, 9, 10, -1));
            assertThrows(InvalidCandleException.class, () -> CandleSeries.of("AAPL", "1h", candles));
        }

        @Test
        @DisplayName("high below the body is rejected")
        void inconsistentOhlc() {
            List<Candle> candles = List.of(Candle.of(at(0), 10, 10.5, 9, 11, 1));
            assertThrows(InvalidCandleException.class, () -> CandleSeries.of("AAPL", "1h", candles));
        }

        @Test
        @DisplayName("duplicate timestamps are rejected")
        void duplicateTimestamp() {
            List<Candle> candles = List.of(
                Candle.of(at(0), 10, 11, 9, 10, 1),
                Candle.of(at(0), 10, 11, 9, 10, 1));
            assertThrows(InvalidCandleException.class, () -> CandleSeries.of("AAPL", "1h", candles));
        }

        @Test
        @DisplayName("descending timestamps are rejected")
        void descendingTimestamps() {
            List<Candle> candles = List.of(
                Candle.of(at(1), 10, 11, 9, 10, 1),
                Candle.of(at(0), 10, 11, 9, 10, 1));
            assertThrows(InvalidCandleException.class, () -> CandleSeries.of("AAPL", "1h", candles));
        }

        @Test
        @DisplayName("zero volume and a single candle are valid")
        void minimalValid() {
            CandleSeries series = CandleSeries.of("AAPL", "1h", List.of(Candle.of(at(0), 10, 11, 9, 10, 0)));
            assertEquals(1, series.size());
            assertEquals(10.0, series.lastClose());
        }
    }

    @Nested
    @DisplayName("accessors")
    class AccessorTests {

        @Test
        @DisplayName("raw arrays are defensive copies")
        void arraysAreCopies() {
            CandleSeries series = CandleFixtures.series("AAPL", CandleFixtures.uptrend(10));
            double[] closes = series.closes();
            closes[0] = -1;
            assertEquals(100.0, series.close(0));
        }

        @Test
        @DisplayName("candle list is unmodifiable")
        void candlesUnmodifiable() {
            CandleSeries series = CandleFixtures.series("AAPL", CandleFixtures.uptrend(10));
            assertThrows(UnsupportedOperationException.class, () -> series.candles().remove(0));
        }

        @Test
        @DisplayName("last candle and last index line up")
        void lastCandle() {
            CandleSeries series = CandleFixtures.series("AAPL", CandleFixtures.uptrend(10));
            assertEquals(9, series.lastIndex());
            assertEquals(109.0, series.lastClose());
            assertEquals(at(9), series.last().timestamp());
        }
    }
}

package com.tradedash.analytics.rate;

import com.tradedash.analytics.exception.UndefinedRateException;
import com.tradedash.analytics.trade.SideSummary;
import com.tradedash.analytics.trade.TradeSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RateNormalizerTest {

    // BUY: 2 orders, 1000 notional, 2 fee — SELL: 1 order, 500 notional, 1 fee
    private static final TradeSummary SUMMARY = TradeSummary.of(
        new SideSummary(2, new BigDecimal("1000"), new BigDecimal("2"), BigDecimal.ZERO, false),
        new SideSummary(1, new BigDecimal("500"), new BigDecimal("1"), BigDecimal.ZERO, false));

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Nested
    @DisplayName("hourlyRates()")
    class HourlyTests {

        @Test
        @DisplayName("one hour → totals unchanged, GLOBAL = BUY + SELL")
        void oneHour() {
            Map<FlowScope, FlowRate> rates = RateNormalizer.hourlyRates(SUMMARY, Duration.ofHours(1));

            assertDecimal("1000", rates.get(FlowScope.BUY).notional());
            assertDecimal("500", rates.get(FlowScope.SELL).notional());
            assertDecimal("1500", rates.get(FlowScope.GLOBAL).notional());
            assertDecimal("3", rates.get(FlowScope.GLOBAL).orderCount());
            assertDecimal("3", rates.get(FlowScope.GLOBAL).fee());
        }

        @Test
        @DisplayName("two hours → halved")
        void twoHours() {
            Map<FlowScope, FlowRate> rates = RateNormalizer.hourlyRates(SUMMARY, Duration.ofHours(2));
            assertDecimal("500", rates.get(FlowScope.BUY).notional());
            assertDecimal("1", rates.get(FlowScope.BUY).orderCount());
            assertDecimal("0.5", rates.get(FlowScope.SELL).fee());
        }

        @Test
        @DisplayName("30 minutes → doubled")
        void halfHour() {
            Map<FlowScope, FlowRate> rates = RateNormalizer.hourlyRates(SUMMARY, Duration.ofMinutes(30));
            assertDecimal("3000", rates.get(FlowScope.GLOBAL).notional());
        }

        @Test
        @DisplayName("zero or negative timespan → UndefinedRateException")
        void undefinedTimespan() {
            assertThrows(UndefinedRateException.class, () -> RateNormalizer.hourlyRates(SUMMARY, Duration.ZERO));
            assertThrows(UndefinedRateException.class, () -> RateNormalizer.hourlyRates(SUMMARY, Duration.ofSeconds(-5)));
            UndefinedRateException e = assertThrows(UndefinedRateException.class,
                () -> RateNormalizer.hourlyRates(SUMMARY, null));
            assertEquals("RateNormalizer", e.origin());
            assertTrue(e.rendersAsSentinel(), "an undefined rate is displayed as --");
        }
    }

    @Nested
    @DisplayName("normalize() — period selection")
    class NormalizeTests {

        @Test
        @DisplayName("hourly notional ≥ equity / 10 → per hour")
        void highTurnoverStaysHourly() {
            NormalizedRates rates = RateNormalizer.normalize(SUMMARY, Duration.ofHours(1), new BigDecimal("10000"));
            assertEquals(RatePeriod.HOUR, rates.period());
            assertEquals("h", rates.period().label());
            assertDecimal("1500", rates.get(FlowScope.GLOBAL).notional());
        }

        @Test
        @DisplayName("exactly at the threshold → per hour")
        void atThreshold() {
            NormalizedRates rates = RateNormalizer.normalize(SUMMARY, Duration.ofHours(1), new BigDecimal("15000"));
            assertEquals(RatePeriod.HOUR, rates.period());
        }

        @Test
        @DisplayName("hourly notional < equity / 10 → every rate × 24, per day")
        void lowTurnoverScaledToDay() {
            NormalizedRates rates = RateNormalizer.normalize(SUMMARY, Duration.ofHours(1), new BigDecimal("100000"));
            assertEquals(RatePeriod.DAY, rates.period());
            assertEquals("day", rates.period().label());
            assertDecimal("36000", rates.get(FlowScope.GLOBAL).notional());
            assertDecimal("72", rates.get(FlowScope.GLOBAL).orderCount());
            assertDecimal("24000", rates.get(FlowScope.BUY).notional());
            assertDecimal("24", rates.get(FlowScope.SELL).fee());
        }

        @Test
        @DisplayName("rates without GLOBAL rejected")
        void missingGlobal() {
            Map<FlowScope, FlowRate> partial = Map.of(FlowScope.BUY,
                new FlowRate(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE));
            assertThrows(IllegalArgumentException.class, () -> RateNormalizer.normalize(partial, BigDecimal.TEN));
        }
    }
}

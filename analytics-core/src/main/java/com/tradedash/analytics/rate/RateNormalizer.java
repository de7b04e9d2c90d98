package com.tradedash.analytics.rate;

import com.tradedash.analytics.exception.UndefinedRateException;
import com.tradedash.analytics.trade.SideSummary;
import com.tradedash.analytics.trade.TradeSummary;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Converts trade totals observed over a timespan into human-scaled rates.
 *
 * <h3>Policy</h3>
 * <p>Rates are first expressed per hour. When the global hourly notional is below
 * {@code equity / }{@value #LOW_TURNOVER_DIVISOR}, every rate is multiplied by 24
 * and reported per day, so that low-turnover portfolios do not show sub-unit
 * hourly figures. Otherwise the hourly figures are reported unchanged.
 *
 * <p>The timespan must be positive; zero or negative spans raise
 * {@link UndefinedRateException}. Callers guard before invoking.
 */
public final class RateNormalizer {

    private static final int LOW_TURNOVER_DIVISOR = 10;

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private RateNormalizer() {}

    /**
     * Per-hour flow per side, plus the GLOBAL sum of both sides.
     *
     * @param summary aggregated trades observed during {@code elapsed}
     * @param elapsed time since the first trade; must be positive
     */
    public static Map<FlowScope, FlowRate> hourlyRates(TradeSummary summary, Duration elapsed) {
        if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) {
            throw new UndefinedRateException(elapsed);
        }
        BigDecimal seconds = BigDecimal.valueOf(elapsed.toNanos()).movePointLeft(9);

        FlowRate buy = perHour(summary.buy(), seconds);
        FlowRate sell = perHour(summary.sell(), seconds);

        Map<FlowScope, FlowRate> rates = new EnumMap<>(FlowScope.class);
        rates.put(FlowScope.BUY, buy);
        rates.put(FlowScope.SELL, sell);
        rates.put(FlowScope.GLOBAL, buy.plus(sell));
        return rates;
    }

    /**
     * Chooses the reporting period for a set of hourly rates.
     *
     * @param hourly rates per hour; must contain {@link FlowScope#GLOBAL}
     * @param equity current portfolio equity
     */
    public static NormalizedRates normalize(Map<FlowScope, FlowRate> hourly, BigDecimal equity) {
        FlowRate global = hourly.get(FlowScope.GLOBAL);
        if (global == null) {
            throw new IllegalArgumentException("hourly rates must include " + FlowScope.GLOBAL);
        }
        BigDecimal threshold = equity.divide(BigDecimal.valueOf(LOW_TURNOVER_DIVISOR), MathContext.DECIMAL64);
        if (global.notional().compareTo(threshold) >= 0) {
            return new NormalizedRates(hourly, RatePeriod.HOUR);
        }

        BigDecimal factor = BigDecimal.valueOf(RatePeriod.DAY.hours());
        Map<FlowScope, FlowRate> daily = new EnumMap<>(FlowScope.class);
        hourly.forEach((scope, rate) -> daily.put(scope, rate.times(factor)));
        return new NormalizedRates(daily, RatePeriod.DAY);
    }

    public static NormalizedRates normalize(TradeSummary summary, Duration elapsed, BigDecimal equity) {
        return normalize(hourlyRates(summary, elapsed), equity);
    }

    private static FlowRate perHour(SideSummary side, BigDecimal seconds) {
        return new FlowRate(
            hourly(side.notional(), seconds),
            hourly(BigDecimal.valueOf(side.count()), seconds),
            hourly(side.fee(), seconds)
        );
    }

    private static BigDecimal hourly(BigDecimal total, BigDecimal seconds) {
        return total.multiply(SECONDS_PER_HOUR).divide(seconds, MathContext.DECIMAL64);
    }
}

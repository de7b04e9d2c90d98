package com.tradedash.analytics.trade;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a list of {@link TradeRecord}s into a {@link TradeSummary}.
 *
 * <p>Per side: record count, Σ notional, Σ fee and Σ current value. A trade
 * without a current value adds nothing to the side's value and flags it
 * incomplete. A side without trades is zero-filled rather than left out, so
 * TOTAL never depends on which sides happened to trade.
 *
 * <p>Pure and order-independent.
 */
public final class TradeAggregator {

    private TradeAggregator() {}

    public static TradeSummary aggregate(List<TradeRecord> trades) {
        Map<TradeSide, SideSummary> bySide = new EnumMap<>(TradeSide.class);
        for (TradeSide side : TradeSide.values()) {
            bySide.put(side, SideSummary.EMPTY);
        }
        if (trades != null) {
            for (TradeRecord trade : trades) {
                bySide.merge(trade.side(), contribution(trade), SideSummary::plus);
            }
        }
        return TradeSummary.of(bySide.get(TradeSide.BUY), bySide.get(TradeSide.SELL));
    }

    private static SideSummary contribution(TradeRecord trade) {
        boolean priced = trade.hasCurrentValue();
        return new SideSummary(
            1,
            trade.notional(),
            trade.fee(),
            priced ? trade.currentValue() : BigDecimal.ZERO,
            !priced
        );
    }
}

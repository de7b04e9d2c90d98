package com.tradedash.overview.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradedash.analytics.multiples.CapitalSnapshot;
import com.tradedash.analytics.multiples.Multiples;
import com.tradedash.analytics.multiples.MultiplesCalculator;
import com.tradedash.analytics.palette.AgingPaletteEngine;
import com.tradedash.analytics.palette.OrderStatus;
import com.tradedash.analytics.palette.Palette;
import com.tradedash.analytics.palette.RowStyle;
import com.tradedash.analytics.rate.NormalizedRates;
import com.tradedash.analytics.rate.RateNormalizer;
import com.tradedash.analytics.reconcile.MismatchMap;
import com.tradedash.analytics.reconcile.ReconciliationDetector;
import com.tradedash.analytics.trade.TradeSummary;
import com.tradedash.overview.adapter.AssetsOverviewAdapter;
import com.tradedash.overview.adapter.BalancePayloadAdapter;
import com.tradedash.overview.adapter.TradesOverviewAdapter;
import com.tradedash.overview.config.DashboardSettings;
import com.tradedash.overview.model.AssetsOverview;
import com.tradedash.overview.model.AssetsReconciliation;
import com.tradedash.overview.model.BalanceSnapshot;
import com.tradedash.overview.model.OrderRow;
import com.tradedash.overview.model.PerformanceReport;
import com.tradedash.overview.model.StyledOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the analytics core over already-fetched back-end payloads.
 *
 * <h3>Flow</h3>
 * <pre>
 *   /balance          → BalanceSnapshot (equity, portfolio)
 *   /overview/trades  → TradeSummary → CapitalSnapshot → Multiples
 *                                    → NormalizedRates (when the span is known)
 *   /overview/assets  → two MetricSets → MismatchMap
 *   /orders           → StyledOrder per row
 * </pre>
 *
 * <p>Fetching, caching and rendering belong to the caller. Every method is
 * stateless apart from the injected configuration.
 */
@Service
public class DashboardAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(DashboardAnalyticsService.class);

    private final BalancePayloadAdapter balanceAdapter;
    private final TradesOverviewAdapter tradesAdapter;
    private final AssetsOverviewAdapter assetsAdapter;
    private final AgingPaletteEngine paletteEngine;
    private final DashboardSettings settings;

    public DashboardAnalyticsService(BalancePayloadAdapter balanceAdapter,
                                     TradesOverviewAdapter tradesAdapter,
                                     AssetsOverviewAdapter assetsAdapter,
                                     AgingPaletteEngine paletteEngine,
                                     DashboardSettings settings) {
        this.balanceAdapter = balanceAdapter;
        this.tradesAdapter = tradesAdapter;
        this.assetsAdapter = assetsAdapter;
        this.paletteEngine = paletteEngine;
        this.settings = settings;
    }

    public BalanceSnapshot balance(JsonNode balancePayload, Map<String, BigDecimal> prices) {
        BalanceSnapshot snapshot = balanceAdapter.resolve(balancePayload, prices);
        if (snapshot.hasUnpricedAssets()) {
            log.warn("BALANCE_UNPRICED quote={} equity={} assets={}",
                settings.quoteAsset(), snapshot.equity(), snapshot.assets().size());
        }
        return snapshot;
    }

    /**
     * Performance figures for the trade book.
     *
     * <p>Multiples are computed on the trade book only: their equity is the
     * current value of what the trades still hold. The account balance, cash
     * included, only sets the turnover threshold of the rate period.
     *
     * @param balanceEquity account equity in the quote asset, from {@link #balance}
     * @param elapsed       span the trades were observed over; null or non-positive
     *                      leaves {@link PerformanceReport#rates()} null
     */
    public PerformanceReport performance(JsonNode tradesPayload, Map<String, BigDecimal> prices,
                                         BigDecimal balanceEquity, Duration elapsed) {
        TradeSummary trades = tradesAdapter.resolve(tradesPayload, prices);
        CapitalSnapshot capital = CapitalSnapshot.fromTrades(trades);
        Multiples multiples = MultiplesCalculator.compute(capital, trades);

        NormalizedRates rates = null;
        if (elapsed != null && !elapsed.isZero() && !elapsed.isNegative()) {
            rates = RateNormalizer.normalize(trades, elapsed, balanceEquity);
        } else {
            log.info("RATES_SKIPPED reason=unknown_span elapsed={}", elapsed);
        }

        log.info("TRADES_OVERVIEW quote={} orders={} notional={} incomplete={} basis={} period={}",
            settings.quoteAsset(), trades.total().count(), trades.total().notional(),
            trades.total().amountValueIncomplete(), multiples.roiBasis(),
            rates == null ? "-" : rates.period().label());
        return new PerformanceReport(settings.quoteAsset(), trades, capital, multiples, rates);
    }

    /** Compares the frozen figures the balance and order-book sources computed independently. */
    public AssetsReconciliation reconcile(JsonNode assetsPayload) {
        AssetsOverview overview = assetsAdapter.resolve(assetsPayload);
        MismatchMap mismatch = ReconciliationDetector.reconcile(overview.balanceSource(), overview.ordersSource());
        if (mismatch.anyMismatch()) {
            log.warn("ASSETS_MISMATCH cash={} fields={}", overview.cashAsset(), mismatch.mismatchedFields());
        }
        return new AssetsReconciliation(overview, mismatch);
    }

    public List<StyledOrder> styleOrders(List<OrderRow> orders, Instant now) {
        Palette palette = AgingPaletteEngine.buildPalette(settings.visualDegradations());
        List<StyledOrder> styled = orders.stream()
            .map(order -> new StyledOrder(
                order,
                OrderStatus.lightFor(order.status()),
                paletteEngine.styleFor(order, palette, settings.freshWindow(), now).orElse(null),
                order.executionLatencySeconds().orElse(null)))
            .toList();

        long fresh = styled.stream().map(StyledOrder::style).filter(Objects::nonNull).count();
        log.debug("ORDERS_STYLED rows={} styled={} levels={} window={}",
            styled.size(), fresh, palette.levels(), settings.freshWindow());
        return styled;
    }

    /** Style for a single row, for callers that render lazily. */
    public RowStyle styleFor(OrderRow order, Instant now) {
        return paletteEngine.styleFor(order, settings.visualDegradations(), settings.freshWindow(), now)
            .orElse(null);
    }
}

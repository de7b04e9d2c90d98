package com.tradedash.analytics.multiples;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradedash.analytics.trade.TradeSummary;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Capital figures from the ledger, treated as ground truth for multiples.
 *
 * @param equity        current value of the invested capital
 * @param paidInCapital total capital contributed
 * @param distributions total capital returned
 */
public record CapitalSnapshot(
    @JsonProperty("equity")          BigDecimal equity,
    @JsonProperty("paid_in_capital") BigDecimal paidInCapital,
    @JsonProperty("distributions")   BigDecimal distributions
) {
    public CapitalSnapshot {
        Objects.requireNonNull(equity, "equity");
        Objects.requireNonNull(paidInCapital, "paidInCapital");
        Objects.requireNonNull(distributions, "distributions");
    }

    public BigDecimal netInvestment() {
        return paidInCapital.subtract(distributions);
    }

    /**
     * Capital derived from the trade book when no ledger is available: BUY
     * notional is paid in, SELL notional is distributed, and equity is what the
     * trades still hold at current prices (BUY value − SELL value). Cash sitting
     * in the account is not part of it.
     */
    public static CapitalSnapshot fromTrades(TradeSummary summary) {
        BigDecimal heldValue = summary.buy().amountValue().subtract(summary.sell().amountValue());
        return new CapitalSnapshot(heldValue, summary.buy().notional(), summary.sell().notional());
    }
}

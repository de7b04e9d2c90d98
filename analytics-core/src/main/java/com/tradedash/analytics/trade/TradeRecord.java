package com.tradedash.analytics.trade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One executed trade or fill, in canonical form.
 *
 * @param side          BUY or SELL
 * @param notional      cash value at execution (price × amount)
 * @param fee           fee paid, in the quote asset
 * @param amount        executed base-asset amount
 * @param currentValue  mark-to-market value of {@code amount}; {@code null} when no
 *                      price could be resolved for the base asset
 */
public record TradeRecord(
    @JsonProperty("side")          TradeSide side,
    @JsonProperty("notional")      BigDecimal notional,
    @JsonProperty("fee")           BigDecimal fee,
    @JsonProperty("amount")        BigDecimal amount,
    @JsonProperty("current_value") BigDecimal currentValue
) {
    public TradeRecord {
        Objects.requireNonNull(side, "side");
        notional = notional != null ? notional : BigDecimal.ZERO;
        fee = fee != null ? fee : BigDecimal.ZERO;
        amount = amount != null ? amount : BigDecimal.ZERO;
    }

    public boolean hasCurrentValue() {
        return currentValue != null;
    }
}

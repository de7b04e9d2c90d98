package com.tradedash.analytics.rate;

/** Which trades a {@link FlowRate} covers. GLOBAL is BUY + SELL. */
public enum FlowScope {
    BUY,
    SELL,
    GLOBAL
}

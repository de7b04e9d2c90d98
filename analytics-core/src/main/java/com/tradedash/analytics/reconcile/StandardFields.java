package com.tradedash.analytics.reconcile;

import java.util.List;

/** Field vocabulary shared by the balance and order-book metric sets. */
public final class StandardFields {

    public static final String TOTAL_EQUITY        = "total_equity";
    public static final String TOTAL_FREE_VALUE    = "total_free_value";
    public static final String TOTAL_FROZEN_VALUE  = "total_frozen_value";
    public static final String CASH_TOTAL_VALUE    = "cash_total_value";
    public static final String CASH_FREE_VALUE     = "cash_free_value";
    public static final String CASH_FROZEN_VALUE   = "cash_frozen_value";
    public static final String ASSETS_TOTAL_VALUE  = "assets_total_value";
    public static final String ASSETS_FREE_VALUE   = "assets_free_value";
    public static final String ASSETS_FROZEN_VALUE = "assets_frozen_value";

    public static final List<String> ALL = List.of(
        TOTAL_EQUITY, TOTAL_FREE_VALUE, TOTAL_FROZEN_VALUE,
        CASH_TOTAL_VALUE, CASH_FREE_VALUE, CASH_FROZEN_VALUE,
        ASSETS_TOTAL_VALUE, ASSETS_FREE_VALUE, ASSETS_FROZEN_VALUE
    );

    /** Frozen amounts are the figures both sources derive independently. */
    public static final List<String> RECONCILED = List.of(
        TOTAL_FROZEN_VALUE, CASH_FROZEN_VALUE, ASSETS_FROZEN_VALUE
    );

    private StandardFields() {}
}

package com.tradedash.analytics.multiples;

/**
 * Which denominator makes ROI meaningful for a portfolio.
 *
 * <ul>
 *   <li>{@link #COST}  — capital is still at risk (net investment &gt; 0)</li>
 *   <li>{@link #VALUE} — all capital has been recovered but positions remain
 *       (net investment ≤ 0, equity &gt; 0); the surplus is free carry</li>
 *   <li>{@link #NONE}  — neither denominator is positive</li>
 * </ul>
 */
public enum RoiBasis {
    COST,
    VALUE,
    NONE
}

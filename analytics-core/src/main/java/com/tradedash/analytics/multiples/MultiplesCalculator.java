package com.tradedash.analytics.multiples;

import com.tradedash.analytics.trade.TradeSummary;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Derives ROI, DPI, RVPI and TVPI/MOIC from a {@link CapitalSnapshot} and
 * aggregated trade values.
 *
 * <h3>Derivation order</h3>
 * <pre>
 *   assets_current_value = buy_current_value − sell_current_value
 *   net_investment       = paid_in_capital − distributions
 *   gross_earnings       = equity − net_investment
 *   net_earnings         = gross_earnings − fees
 *   ROI on cost          = earnings / net_investment   (net_investment &gt; 0)
 *   ROI on value         = earnings / equity           (equity &gt; 0)
 *   RVPI                 = equity / paid_in_capital    (paid_in_capital &gt; 0)
 *   DPI                  = distributions / paid_in_capital
 *   TVPI                 = DPI + RVPI                  (both present)
 * </pre>
 *
 * <p>A multiple over zero or negative invested capital is meaningless, so a
 * failed guard yields {@code null} rather than a number or an exception. A missing
 * term is never replaced by zero.
 */
public final class MultiplesCalculator {

    private static final MathContext CONTEXT = MathContext.DECIMAL64;

    private MultiplesCalculator() {}

    public static Multiples compute(CapitalSnapshot capital,
                                    BigDecimal buyCurrentValue,
                                    BigDecimal sellCurrentValue,
                                    BigDecimal fees) {
        BigDecimal assetsCurrentValue = buyCurrentValue.subtract(sellCurrentValue);
        BigDecimal netInvestment = capital.netInvestment();
        BigDecimal grossEarnings = capital.equity().subtract(netInvestment);
        BigDecimal netEarnings = grossEarnings.subtract(fees);

        BigDecimal rvpi = ratio(capital.equity(), capital.paidInCapital());
        BigDecimal dpi = ratio(capital.distributions(), capital.paidInCapital());
        BigDecimal tvpi = (rvpi != null && dpi != null) ? dpi.add(rvpi) : null;

        return new Multiples(
            assetsCurrentValue,
            netInvestment,
            grossEarnings,
            netEarnings,
            ratio(grossEarnings, netInvestment),
            ratio(netEarnings, netInvestment),
            ratio(grossEarnings, capital.equity()),
            ratio(netEarnings, capital.equity()),
            rvpi,
            dpi,
            tvpi,
            basis(netInvestment, capital.equity())
        );
    }

    /** Uses BUY/SELL amount values and TOTAL fees from an aggregated trade book. */
    public static Multiples compute(CapitalSnapshot capital, TradeSummary trades) {
        return compute(capital, trades.buy().amountValue(), trades.sell().amountValue(), trades.total().fee());
    }

    static RoiBasis basis(BigDecimal netInvestment, BigDecimal equity) {
        if (netInvestment.signum() > 0) return RoiBasis.COST;
        if (equity.signum() > 0) return RoiBasis.VALUE;
        return RoiBasis.NONE;
    }

    /** {@code numerator / denominator}, or {@code null} unless the denominator is positive. */
    private static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() <= 0) {
            return null;
        }
        return numerator.divide(denominator, CONTEXT);
    }
}

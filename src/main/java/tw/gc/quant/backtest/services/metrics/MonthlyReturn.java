package tw.gc.quant.backtest.services.metrics;

import java.time.YearMonth;

/**
 * Return of one calendar month (UTC) of the equity curve.
 *
 * @param month calendar month
 * @param returnPct first-to-last equity change within the month, as a fraction
 * @param volatility standard deviation of bar returns within the month, scaled by sqrt(21)
 */
public record MonthlyReturn(YearMonth month, double returnPct, double volatility) {
}

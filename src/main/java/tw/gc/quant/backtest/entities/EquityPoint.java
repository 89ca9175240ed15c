package tw.gc.quant.backtest.entities;

import java.time.Instant;

/**
 * Equity sample taken once per bar.
 *
 * @param timestamp timestamp of the bar the sample belongs to
 * @param equity realized capital plus unrealized P&L of open trades net of their costs
 * @param drawdown {@code max(0, (peakEquity - equity) / peakEquity)}, clamped to [0, 1]
 */
public record EquityPoint(Instant timestamp, double equity, double drawdown) {

    public EquityPoint {
        if (drawdown < 0.0 || drawdown > 1.0) {
            throw new IllegalArgumentException("drawdown must be within [0, 1], got: " + drawdown);
        }
    }

    /**
     * Build a point from the running equity peak.
     */
    public static EquityPoint of(Instant timestamp, double equity, double peakEquity) {
        double drawdown = peakEquity > 0 ? (peakEquity - equity) / peakEquity : 0.0;
        return new EquityPoint(timestamp, equity, Math.min(1.0, Math.max(0.0, drawdown)));
    }
}

package tw.gc.quant.backtest.entities;

import java.time.Instant;

/**
 * Bar at which equity fell below the margin requirement. Reported only; the simulator never
 * liquidates.
 */
public record MarginEvent(Instant timestamp, double equity, double requiredEquity, int openPositions) {
}

package tw.gc.quant.backtest.entities;

import lombok.Builder;

import java.time.Instant;

/**
 * OHLCV bar for one symbol and timeframe.
 *
 * <p>Bars are supplied by the caller fully materialized and are never mutated by the engine;
 * a run only reads them.
 *
 * @param timestamp bar open time, strictly increasing within a series
 * @param symbol trading symbol (e.g. "BTCUSDT")
 * @param open opening price
 * @param high highest price
 * @param low lowest price
 * @param close closing price, the price every simulated fill uses
 * @param volume traded volume in units, never negative
 */
@Builder(toBuilder = true)
public record Bar(
        Instant timestamp,
        String symbol,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
    public Bar {
        if (timestamp == null) {
            throw new IllegalArgumentException("Bar timestamp must not be null");
        }
        if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
            throw new IllegalArgumentException("Bar prices must be positive at %s".formatted(timestamp));
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Bar volume must be non-negative at %s".formatted(timestamp));
        }
    }

    /**
     * Create a bar whose open, high, low and close are all {@code price}.
     */
    public static Bar flat(String symbol, Instant timestamp, double price, double volume) {
        return new Bar(timestamp, symbol, price, price, price, price, volume);
    }
}

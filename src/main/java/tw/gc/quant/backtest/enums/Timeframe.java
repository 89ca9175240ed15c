package tw.gc.quant.backtest.enums;

import java.time.Duration;

/**
 * Bar timeframe. Markets are assumed to trade around the clock, so a year holds
 * {@code 365 days / barDuration} bars.
 */
public enum Timeframe {
    M1("1m", Duration.ofMinutes(1)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    D1("1d", Duration.ofDays(1));

    private static final Duration YEAR = Duration.ofDays(365);

    private final String code;
    private final Duration barDuration;

    Timeframe(String code, Duration barDuration) {
        this.code = code;
        this.barDuration = barDuration;
    }

    public String getCode() {
        return code;
    }

    public Duration getBarDuration() {
        return barDuration;
    }

    public double periodsPerYear() {
        return (double) YEAR.toMinutes() / barDuration.toMinutes();
    }

    /**
     * Parse from code string (e.g. "1h") or enum name (case-insensitive).
     */
    public static Timeframe fromCode(String value) {
        for (Timeframe timeframe : values()) {
            if (timeframe.code.equalsIgnoreCase(value) || timeframe.name().equalsIgnoreCase(value)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + value);
    }
}

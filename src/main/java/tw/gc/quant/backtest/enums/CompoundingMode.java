package tw.gc.quant.backtest.enums;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;

/**
 * How realized profits feed back into position sizing.
 */
public enum CompoundingMode {
    /** Always size from the initial capital */
    NONE("none"),
    /** Size from the current realized capital */
    PER_TRADE("per_trade"),
    /** Refresh the sizing capital at the first bar of each UTC day */
    DAILY("daily"),
    /** Refresh the sizing capital at the first bar of each ISO week */
    WEEKLY("weekly"),
    /** Refresh the sizing capital at the first bar of each calendar month */
    MONTHLY("monthly");

    private final String code;

    CompoundingMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Key of the compounding period a timestamp belongs to. Two timestamps with the same key
     * share one sizing capital. Only meaningful for the periodic modes.
     */
    public long periodKey(Instant timestamp) {
        LocalDate date = timestamp.atZone(ZoneOffset.UTC).toLocalDate();
        return switch (this) {
            case DAILY -> date.toEpochDay();
            case WEEKLY -> date.get(IsoFields.WEEK_BASED_YEAR) * 100L + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            case MONTHLY -> date.getYear() * 100L + date.getMonthValue();
            case NONE, PER_TRADE -> 0L;
        };
    }

    public boolean isPeriodic() {
        return this == DAILY || this == WEEKLY || this == MONTHLY;
    }

    /**
     * Parse from code string or enum name (case-insensitive).
     */
    public static CompoundingMode fromCode(String value) {
        for (CompoundingMode mode : values()) {
            if (mode.code.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown compounding mode: " + value);
    }
}

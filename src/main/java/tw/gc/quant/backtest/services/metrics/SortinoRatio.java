package tw.gc.quant.backtest.services.metrics;

/**
 * Sortino ratio with an explicit state instead of a numeric infinity.
 *
 * @param value mean return over downside deviation; 0 unless {@code state} is {@link SortinoState#DEFINED}
 * @param state whether the ratio could be computed
 */
public record SortinoRatio(double value, SortinoState state) {

    public enum SortinoState {
        /** Ratio computed from at least one negative return */
        DEFINED,
        /** Positive mean return and no negative return: unbounded-good */
        NO_DOWNSIDE,
        /** No returns, no nonzero return, or a degenerate zero downside deviation */
        INSUFFICIENT_DATA
    }

    public SortinoRatio {
        if (state == null) {
            throw new IllegalArgumentException("Sortino state must not be null");
        }
        if (state != SortinoState.DEFINED && value != 0.0) {
            throw new IllegalArgumentException("Sortino value must be 0 when state is " + state);
        }
    }

    public static SortinoRatio of(double value) {
        return new SortinoRatio(value, SortinoState.DEFINED);
    }

    public static SortinoRatio noDownside() {
        return new SortinoRatio(0.0, SortinoState.NO_DOWNSIDE);
    }

    public static SortinoRatio insufficientData() {
        return new SortinoRatio(0.0, SortinoState.INSUFFICIENT_DATA);
    }

    /**
     * Number to rank runs by: the ratio when defined, {@link Double#MAX_VALUE} without downside,
     * 0 without data. A run with no losing bar therefore ranks above any run with one.
     */
    public double objectiveValue() {
        return switch (state) {
            case DEFINED -> value;
            case NO_DOWNSIDE -> Double.MAX_VALUE;
            case INSUFFICIENT_DATA -> 0.0;
        };
    }

    public boolean isDefined() {
        return state == SortinoState.DEFINED;
    }
}

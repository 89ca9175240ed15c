package tw.gc.quant.backtest.strategy;

import java.util.OptionalDouble;

/**
 * Entry filter a candidate must pass before it may open a trade.
 *
 * @param minConfidence minimum confidence on the 0-100 scale, after provider weighting
 * @param minStrength minimum strength (0.0 to 1.0); candidates without a strength pass
 * @param minRiskReward minimum reward-to-risk ratio; candidates whose ratio cannot be
 *                      determined pass
 */
public record SignalFilter(double minConfidence, double minStrength, double minRiskReward) {

    public static final double DEFAULT_MIN_CONFIDENCE = 70.0;
    public static final double DEFAULT_MIN_STRENGTH = 0.6;
    public static final double DEFAULT_MIN_RISK_REWARD = 1.0;

    public SignalFilter {
        if (minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("minConfidence must be within [0, 100], got: " + minConfidence);
        }
        if (minStrength < 0 || minStrength > 1) {
            throw new IllegalArgumentException("minStrength must be within [0, 1], got: " + minStrength);
        }
        if (minRiskReward < 0) {
            throw new IllegalArgumentException("minRiskReward must be non-negative, got: " + minRiskReward);
        }
    }

    public static SignalFilter defaults() {
        return new SignalFilter(DEFAULT_MIN_CONFIDENCE, DEFAULT_MIN_STRENGTH, DEFAULT_MIN_RISK_REWARD);
    }

    /**
     * Filter that lets every actionable candidate through.
     */
    public static SignalFilter permissive() {
        return new SignalFilter(0.0, 0.0, 0.0);
    }

    public boolean accepts(CandidateSignal signal, double currentPrice) {
        if (!signal.isActionable()) {
            return false;
        }
        if (signal.getConfidence() < minConfidence) {
            return false;
        }
        if (signal.getStrength() != null && signal.getStrength() < minStrength) {
            return false;
        }
        OptionalDouble riskReward = signal.resolveRiskReward(currentPrice);
        return riskReward.isEmpty() || riskReward.getAsDouble() >= minRiskReward;
    }
}

package tw.gc.quant.backtest.services.comparison;

import java.util.Comparator;

/**
 * Orderings of compared strategies.
 *
 * <p>{@link #BEST_FIRST} ranks by composite score, higher first. The legacy convention
 * negated the composite and sorted ascending; {@link #LEGACY_ASCENDING} reproduces it and
 * yields the same order.
 */
public final class StrategyRanking {

    static final double RISK_ADJUSTED_WEIGHT = 0.5;
    static final double CONSISTENCY_WEIGHT = 0.3;
    static final double REGIME_WEIGHT = 0.2;

    public static final Comparator<StrategyResult> BEST_FIRST =
            Comparator.comparingDouble(StrategyResult::getCompositeScore).reversed()
                    .thenComparing(StrategyResult::getStrategyName);

    public static final Comparator<StrategyResult> LEGACY_ASCENDING =
            Comparator.comparingDouble(StrategyResult::legacyScore)
                    .thenComparing(StrategyResult::getStrategyName);

    private StrategyRanking() {
    }

    public static double compositeScore(double riskAdjustedPerformance, double consistency, double regimeScore) {
        return RISK_ADJUSTED_WEIGHT * riskAdjustedPerformance
                + CONSISTENCY_WEIGHT * consistency
                + REGIME_WEIGHT * regimeScore;
    }

    public static double legacyScore(double compositeScore) {
        return -compositeScore;
    }
}

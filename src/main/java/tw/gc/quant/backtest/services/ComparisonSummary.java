package tw.gc.quant.backtest.services;

/**
 * Names of the strategies that lead each headline category of a comparison.
 */
public record ComparisonSummary(
        String bestRiskAdjusted,
        String bestReturn,
        String bestWinRate,
        String lowestDrawdown,
        String mostConsistent
) {
}

package tw.gc.quant.backtest.services.comparison;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import tw.gc.quant.backtest.services.BacktestResult;

import java.util.List;

/**
 * One strategy's runs across all requested lookback windows, with its ranking scores.
 */
@Value
@Builder(toBuilder = true)
public class StrategyResult {

    String strategyName;
    String description;

    @Singular
    List<PeriodResult> periods;
    /** Labels of windows whose run failed (for instance on a provider timeout) */
    @Singular
    List<String> failedPeriods;
    /** Run over the whole series; null when it failed */
    BacktestResult fullRun;

    /** (sum of Sharpe + mean annualized return) / (1 + worst drawdown) */
    double riskAdjustedPerformance;
    /** 1 / (1 + variance of window returns) */
    double consistency;
    RegimePerformance regimePerformance;
    /** 0.5 x risk-adjusted + 0.3 x consistency + 0.2 x regime score; higher is better */
    double compositeScore;
    /** 1-based position under {@link StrategyRanking#BEST_FIRST}; 0 until ranked */
    @With
    int rank;

    double meanAnnualizedReturn;
    double meanAnnualizedVolatility;
    double meanSharpe;
    double meanWinRate;
    double maxDrawdown;

    /**
     * Composite score under the inverted legacy convention, where lower is better.
     */
    public double legacyScore() {
        return StrategyRanking.legacyScore(compositeScore);
    }
}

package tw.gc.quant.backtest.services.metrics;

import lombok.Builder;
import lombok.Value;
import tw.gc.quant.backtest.enums.ExitReason;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Performance and risk statistics of one completed run.
 *
 * <p>Returns-based statistics use bar-over-bar equity returns, zero returns included.
 * Ratios that cannot be computed are 0, except Sortino which carries its own state.
 */
@Value
@Builder
public class PerformanceReport {

    // Trade statistics
    int totalTrades;
    int winningTrades;
    int losingTrades;
    int pushes;
    int partialWins;
    /** wins / (wins + losses), pushes excluded, as a fraction */
    double winRate;
    /** gross profit / gross loss; 0 when there are no losses */
    double profitFactor;
    double averageWin;
    /** Average losing pnl as a positive magnitude */
    double averageLoss;
    double expectancy;
    double bestTrade;
    double worstTrade;
    int maxConsecutiveWins;
    int maxConsecutiveLosses;
    double kellyCriterion;
    Duration averageTradeDuration;
    Map<ExitReason, Integer> exitReasons;

    // Costs
    /** Commission paid */
    double totalFees;
    /** Slippage, impact, liquidity and latency costs */
    double totalSlippage;
    double totalCosts;

    // Returns
    double initialCapital;
    double finalEquity;
    double totalReturn;
    double totalReturnPct;
    /** Compound annual growth rate, capped at {@link PerformanceMetricsService#MAX_ANNUALIZED_RETURN} */
    double annualizedReturn;
    double volatility;
    double annualizedVolatility;

    // Risk-adjusted
    double sharpeRatio;
    SortinoRatio sortino;
    double calmarRatio;
    double maxDrawdown;
    double valueAtRisk95;
    double conditionalValueAtRisk95;

    List<MonthlyReturn> monthlyReturns;

    /**
     * Value of the configured optimization target. For SORTINO a run without downside scores
     * {@link Double#MAX_VALUE}, see {@link SortinoRatio#objectiveValue()}.
     */
    double objectiveValue;

    public double getSortinoRatio() {
        return sortino.value();
    }
}

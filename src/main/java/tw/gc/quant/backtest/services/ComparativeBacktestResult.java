package tw.gc.quant.backtest.services;

import lombok.Builder;
import lombok.Value;
import tw.gc.quant.backtest.services.comparison.StrategyResult;
import tw.gc.quant.backtest.services.portfolio.OptimalPortfolio;

import java.util.List;
import java.util.Map;

/**
 * Everything a strategy comparison produces: ranked strategies, headline summary,
 * recommendations, correlations and a suggested allocation.
 */
@Value
@Builder
public class ComparativeBacktestResult {

    /** Ranked best first */
    List<StrategyResult> strategies;
    ComparisonSummary summary;
    List<String> recommendations;
    /** Pearson correlation of full-series equity returns, strategy to strategy */
    Map<String, Map<String, Double>> correlationMatrix;
    OptimalPortfolio optimalPortfolio;
}

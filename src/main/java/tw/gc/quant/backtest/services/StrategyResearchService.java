package tw.gc.quant.backtest.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.config.PortfolioSettings;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.services.comparison.RegimePerformance;
import tw.gc.quant.backtest.services.comparison.StrategyComparisonService;
import tw.gc.quant.backtest.services.comparison.StrategyResult;
import tw.gc.quant.backtest.services.metrics.PerformanceMetricsService;
import tw.gc.quant.backtest.services.portfolio.CorrelationTracker;
import tw.gc.quant.backtest.services.portfolio.CorrelationTracker.CorrelationMatrix;
import tw.gc.quant.backtest.services.portfolio.OptimalPortfolio;
import tw.gc.quant.backtest.services.portfolio.PortfolioOptimizationService;
import tw.gc.quant.backtest.services.portfolio.StrategyEstimate;
import tw.gc.quant.backtest.services.regime.MarketRegimeService.MarketRegime;
import tw.gc.quant.backtest.strategy.BacktestStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Strategy research facade: compares strategies, then correlates and allocates across them.
 *
 * <p>Calls only flow downwards: comparator, then correlation of the comparator's full runs,
 * then the optimizer on the comparator's estimates.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StrategyResearchService {

    static final double INCONSISTENCY_THRESHOLD = 0.5;

    private final StrategyComparisonService strategyComparisonService;
    private final CorrelationTracker correlationTracker;
    private final PortfolioOptimizationService portfolioOptimizationService;
    private final PerformanceMetricsService performanceMetricsService;

    public ComparativeBacktestResult research(List<BacktestStrategy> strategies, List<Bar> bars, BacktestConfig config) {
        return research(strategies, bars, config, StrategyComparisonService.DEFAULT_LOOKBACK_DAYS,
                PortfolioSettings.defaults());
    }

    /**
     * @throws IllegalArgumentException if {@code strategies} is empty
     */
    public ComparativeBacktestResult research(List<BacktestStrategy> strategies, List<Bar> bars, BacktestConfig config,
                                              List<Integer> lookbackDays, PortfolioSettings portfolioSettings) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one strategy is required for a comparison");
        }
        List<StrategyResult> ranked = strategyComparisonService.compare(strategies, bars, config, lookbackDays);

        CorrelationMatrix correlation = correlate(ranked);
        List<StrategyEstimate> estimates = ranked.stream().map(StrategyEstimate::from).toList();
        OptimalPortfolio portfolio = portfolioOptimizationService.optimize(estimates, correlation.values(), portfolioSettings);

        List<String> recommendations = recommendations(ranked);
        for (String pair : correlationTracker.highlyCorrelatedPairs(correlation)) {
            recommendations.add("Strategies %s are highly correlated; avoid sizing them as independent bets".formatted(pair));
        }

        return ComparativeBacktestResult.builder()
                .strategies(ranked)
                .summary(summarize(ranked))
                .recommendations(List.copyOf(recommendations))
                .correlationMatrix(correlation.asMap())
                .optimalPortfolio(portfolio)
                .build();
    }

    /**
     * Correlation of full-series equity returns, in ranking order. Strategies whose full run
     * failed correlate with nothing.
     */
    CorrelationMatrix correlate(List<StrategyResult> ranked) {
        Map<String, double[]> returns = new LinkedHashMap<>();
        for (StrategyResult result : ranked) {
            returns.put(result.getStrategyName(), result.getFullRun() != null
                    ? performanceMetricsService.periodReturns(result.getFullRun().getEquityCurve())
                    : new double[0]);
        }
        return correlationTracker.correlationMatrix(returns);
    }

    ComparisonSummary summarize(List<StrategyResult> ranked) {
        return new ComparisonSummary(
                best(ranked, StrategyResult::getRiskAdjustedPerformance),
                best(ranked, StrategyResult::getMeanAnnualizedReturn),
                best(ranked, StrategyResult::getMeanWinRate),
                best(ranked, r -> -r.getMaxDrawdown()),
                best(ranked, StrategyResult::getConsistency));
    }

    List<String> recommendations(List<StrategyResult> ranked) {
        List<String> recommendations = new ArrayList<>();
        if (ranked.isEmpty()) {
            return recommendations;
        }
        recommendations.add("Consider allocating 40-60%% to %s based on superior risk-adjusted returns"
                .formatted(ranked.get(0).getStrategyName()));
        if (ranked.size() > 1) {
            recommendations.add("Diversify with %s for additional stability across market conditions"
                    .formatted(ranked.get(1).getStrategyName()));
        }
        if (ranked.size() > 2) {
            recommendations.add("Use %s as a tertiary strategy for specific market regimes"
                    .formatted(ranked.get(2).getStrategyName()));
        }
        StrategyResult worst = ranked.get(ranked.size() - 1);
        if (worst.getConsistency() < INCONSISTENCY_THRESHOLD) {
            recommendations.add("Exercise caution with %s due to inconsistent performance"
                    .formatted(worst.getStrategyName()));
        }
        strongestRegime(ranked.get(0)).ifPresent(regime -> recommendations.add(
                "%s earned most in %s markets (%s)".formatted(
                        ranked.get(0).getStrategyName(), regime.getDisplayName(), regime.getRecommendation())));
        return recommendations;
    }

    /**
     * Regime with the highest positive summed return; empty when no regime made money.
     */
    Optional<MarketRegime> strongestRegime(StrategyResult result) {
        RegimePerformance performance = result.getRegimePerformance();
        if (performance == null) {
            return Optional.empty();
        }
        return performance.returnByRegime().entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .max(Map.Entry.<MarketRegime, Double>comparingByValue()
                        .thenComparing(entry -> -entry.getKey().ordinal()))
                .map(Map.Entry::getKey);
    }

    /**
     * Name of the first strategy, in ranking order, with the highest {@code metric}.
     */
    private String best(List<StrategyResult> ranked, ToDoubleFunction<StrategyResult> metric) {
        StrategyResult best = ranked.get(0);
        for (StrategyResult candidate : ranked) {
            if (metric.applyAsDouble(candidate) > metric.applyAsDouble(best)) {
                best = candidate;
            }
        }
        return best.getStrategyName();
    }
}

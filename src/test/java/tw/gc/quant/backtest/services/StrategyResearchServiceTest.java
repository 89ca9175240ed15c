package tw.gc.quant.backtest.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.config.PortfolioSettings;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.services.comparison.RegimePerformance;
import tw.gc.quant.backtest.services.comparison.StrategyComparisonService;
import tw.gc.quant.backtest.services.comparison.StrategyResult;
import tw.gc.quant.backtest.services.metrics.PerformanceMetricsService;
import tw.gc.quant.backtest.services.portfolio.CorrelationTracker;
import tw.gc.quant.backtest.services.portfolio.PortfolioOptimizationService;
import tw.gc.quant.backtest.services.regime.MarketRegimeService;
import tw.gc.quant.backtest.services.regime.MarketRegimeService.MarketRegime;
import tw.gc.quant.backtest.strategy.BacktestStrategy;
import tw.gc.quant.backtest.testutil.BarFixtures;
import tw.gc.quant.backtest.testutil.TestServices;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StrategyResearchService")
class StrategyResearchServiceTest {

    private StrategyResearchService service;
    private BacktestConfig config;
    private List<Bar> bars;

    @BeforeEach
    void setUp() {
        StrategyComparisonService comparison =
                new StrategyComparisonService(TestServices.backtestService(), new MarketRegimeService());
        service = new StrategyResearchService(comparison, new CorrelationTracker(),
                new PortfolioOptimizationService(), new PerformanceMetricsService());
        config = BacktestConfig.defaults().providerTimeout(Duration.ZERO).build();
        bars = BarFixtures.load("btcusdt-1h.json");
    }

    private static StrategyResult result(String name, double riskAdjusted, double consistency, double drawdown) {
        return StrategyResult.builder()
                .strategyName(name)
                .riskAdjustedPerformance(riskAdjusted)
                .consistency(consistency)
                .maxDrawdown(drawdown)
                .build();
    }

    @Nested
    @DisplayName("End to end")
    class EndToEnd {

        @Test
        @DisplayName("should rank, correlate and allocate across strategies")
        void shouldProduceFullComparison() {
            List<BacktestStrategy> strategies = List.of(
                    TestServices.alwaysLong("long-a"), TestServices.alwaysLong("long-b"), TestServices.idle("idle"));

            ComparativeBacktestResult result = service.research(strategies, bars, config, List.of(1, 5, 10),
                    PortfolioSettings.defaults());

            assertThat(result.getStrategies()).hasSize(3);
            assertThat(result.getCorrelationMatrix()).containsOnlyKeys("long-a", "long-b", "idle");
            assertThat(result.getCorrelationMatrix().get("long-a").get("long-b")).isCloseTo(1.0, within(1e-9));
            assertThat(result.getCorrelationMatrix().get("idle").get("long-a")).isZero();
            assertThat(result.getRecommendations())
                    .contains("Strategies long-a/long-b are highly correlated; avoid sizing them as independent bets");
            assertThat(result.getOptimalPortfolio().getWeights().values().stream().mapToDouble(Double::doubleValue).sum())
                    .isCloseTo(1.0, within(1e-6));
            assertThat(result.getSummary().bestRiskAdjusted()).isNotNull();
        }

        @Test
        @DisplayName("should reject an empty strategy list")
        void shouldRejectEmptyStrategies() {
            assertThatThrownBy(() -> service.research(List.of(), bars, config))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        @DisplayName("should recommend the top three and warn about an inconsistent last place")
        void shouldRecommendTopThree() {
            List<StrategyResult> ranked = List.of(
                    result("alpha", 2.0, 0.9, 0.1), result("beta", 1.0, 0.8, 0.2), result("gamma", 0.5, 0.3, 0.3));

            assertThat(service.recommendations(ranked)).containsExactly(
                    "Consider allocating 40-60% to alpha based on superior risk-adjusted returns",
                    "Diversify with beta for additional stability across market conditions",
                    "Use gamma as a tertiary strategy for specific market regimes",
                    "Exercise caution with gamma due to inconsistent performance");
        }

        @Test
        @DisplayName("should only recommend the leader when it stands alone")
        void shouldRecommendSingleStrategy() {
            assertThat(service.recommendations(List.of(result("solo", 1.0, 0.9, 0.1))))
                    .containsExactly("Consider allocating 40-60% to solo based on superior risk-adjusted returns");
            assertThat(service.recommendations(List.of())).isEmpty();
        }

        @Test
        @DisplayName("should point the leader at the regime it earned most in")
        void shouldRecommendStrongestRegime() {
            RegimePerformance regimes = new RegimePerformance(
                    Map.of(MarketRegime.TRENDING_UP, 0.04, MarketRegime.RANGING, 0.01, MarketRegime.CRISIS, -0.03),
                    Map.of(MarketRegime.TRENDING_UP, 40, MarketRegime.RANGING, 30, MarketRegime.CRISIS, 5),
                    0.0067);
            StrategyResult leader = result("alpha", 2.0, 0.9, 0.1).toBuilder().regimePerformance(regimes).build();

            assertThat(service.recommendations(List.of(leader))).containsExactly(
                    "Consider allocating 40-60% to alpha based on superior risk-adjusted returns",
                    "alpha earned most in Trending Up markets (Momentum/Breakout strategies optimal)");
        }

        @Test
        @DisplayName("should skip the regime hint when no regime made money")
        void shouldSkipRegimeHintWithoutGains() {
            RegimePerformance regimes = new RegimePerformance(
                    Map.of(MarketRegime.RANGING, -0.01), Map.of(MarketRegime.RANGING, 30), -0.01);
            StrategyResult leader = result("alpha", 2.0, 0.9, 0.1).toBuilder().regimePerformance(regimes).build();

            assertThat(service.strongestRegime(leader)).isEmpty();
            assertThat(service.recommendations(List.of(leader))).hasSize(1);
        }

        @Test
        @DisplayName("should name the leader of each summary category")
        void shouldSummarize() {
            List<StrategyResult> ranked = List.of(
                    result("alpha", 2.0, 0.5, 0.3), result("beta", 1.0, 0.9, 0.1));

            ComparisonSummary summary = service.summarize(ranked);

            assertThat(summary.bestRiskAdjusted()).isEqualTo("alpha");
            assertThat(summary.lowestDrawdown()).isEqualTo("beta");
            assertThat(summary.mostConsistent()).isEqualTo("beta");
            assertThat(summary.bestReturn()).isEqualTo("alpha");
        }
    }
}

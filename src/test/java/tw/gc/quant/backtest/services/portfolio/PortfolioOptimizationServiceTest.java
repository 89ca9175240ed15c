package tw.gc.quant.backtest.services.portfolio;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.quant.backtest.config.PortfolioSettings;
import tw.gc.quant.backtest.services.portfolio.OptimalPortfolio.FrontierPoint;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PortfolioOptimizationService")
class PortfolioOptimizationServiceTest {

    private PortfolioOptimizationService service;
    private List<StrategyEstimate> estimates;

    @BeforeEach
    void setUp() {
        service = new PortfolioOptimizationService();
        estimates = List.of(
                new StrategyEstimate("momentum", 0.25, 0.30, 0.20),
                new StrategyEstimate("mean-reversion", 0.10, 0.10, 0.05),
                new StrategyEstimate("breakout", 0.15, 0.20, 0.12));
    }

    private static void assertValidWeights(Map<String, Double> weights) {
        assertThat(weights.values()).allMatch(w -> w >= 0.0);
        assertThat(weights.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-6));
    }

    @Nested
    @DisplayName("Weights")
    class Weights {

        @Test
        @DisplayName("should produce non-negative weights summing to one")
        void shouldProduceValidWeights() {
            OptimalPortfolio portfolio = service.optimize(estimates, null);

            assertValidWeights(portfolio.getWeights());
            assertThat(portfolio.getWeights()).containsOnlyKeys("momentum", "mean-reversion", "breakout");
        }

        @Test
        @DisplayName("should tilt toward the highest return")
        void shouldTiltTowardReturn() {
            OptimalPortfolio portfolio = service.optimize(estimates, null);

            assertThat(portfolio.getWeights().get("momentum"))
                    .isGreaterThan(portfolio.getWeights().get("mean-reversion"));
        }

        @Test
        @DisplayName("should keep equal weights without iterations")
        void shouldKeepEqualWeightsWithoutIterations() {
            OptimalPortfolio portfolio = service.optimize(estimates, null, new PortfolioSettings(0, 0.01, 10, 1L, 0.0));

            assertThat(portfolio.getWeights().values()).allSatisfy(w -> assertThat(w).isCloseTo(1.0 / 3, within(1e-12)));
        }

        @Test
        @DisplayName("should give a single strategy the whole allocation")
        void shouldAllocateSingleStrategy() {
            OptimalPortfolio portfolio = service.optimize(estimates.subList(0, 1), new double[][]{{1.0}});

            assertThat(portfolio.getWeights()).containsEntry("momentum", 1.0);
            assertThat(portfolio.getExpectedVolatility()).isCloseTo(0.30, within(1e-12));
            assertThat(portfolio.getRiskContributions().get("momentum")).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("should fall back to equal weights when everything is clamped")
        void shouldNormalizeDegenerateWeights() {
            assertThat(service.normalize(new double[]{-1.0, -2.0})).containsExactly(0.5, 0.5);
            assertThat(service.normalize(new double[]{3.0, 1.0})).containsExactly(0.75, 0.25);
        }
    }

    @Nested
    @DisplayName("Risk")
    class Risk {

        @Test
        @DisplayName("should diversify volatility below the weighted average")
        void shouldDiversify() {
            double[] weights = {0.5, 0.5};
            double[] vols = {0.2, 0.2};

            assertThat(service.portfolioVolatility(weights, vols, new double[][]{{1, 1}, {1, 1}}))
                    .isCloseTo(0.2, within(1e-12));
            assertThat(service.portfolioVolatility(weights, vols, new double[][]{{1, 0}, {0, 1}}))
                    .isCloseTo(0.2 / Math.sqrt(2), within(1e-12));
        }

        @Test
        @DisplayName("should derive VaR and risk contributions consistently")
        void shouldDeriveRiskFigures() {
            OptimalPortfolio portfolio = service.optimize(estimates, null);

            assertThat(portfolio.getValueAtRisk95())
                    .isCloseTo(portfolio.getExpectedReturn() - 1.645 * portfolio.getExpectedVolatility(), within(1e-12));
            assertThat(portfolio.getRiskContributions().values().stream().mapToDouble(Double::doubleValue).sum())
                    .isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("should sample a reproducible efficient frontier")
        void shouldSampleFrontier() {
            OptimalPortfolio first = service.optimize(estimates, null);
            OptimalPortfolio second = service.optimize(estimates, null);

            assertThat(first.getEfficientFrontier()).hasSize(100);
            assertThat(first.getEfficientFrontier()).isEqualTo(second.getEfficientFrontier());
            assertThat(first.getEfficientFrontier()).allSatisfy(point -> assertValidWeights(point.weights()));
            double bestSharpe = first.getEfficientFrontier().stream().mapToDouble(FrontierPoint::sharpeRatio).max().orElseThrow();
            assertThat(first.getOptimalPoint().sharpeRatio()).isEqualTo(bestSharpe);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject an empty strategy list")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> service.optimize(List.of(), null)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject a correlation matrix of the wrong size")
        void shouldRejectWrongMatrix() {
            assertThatThrownBy(() -> service.optimize(estimates, new double[][]{{1, 0}, {0, 1}}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("3x3");
        }
    }
}

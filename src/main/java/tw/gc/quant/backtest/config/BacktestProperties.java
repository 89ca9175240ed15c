package tw.gc.quant.backtest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.quant.backtest.enums.CompoundingMode;
import tw.gc.quant.backtest.enums.OptimizationTarget;
import tw.gc.quant.backtest.enums.Timeframe;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private CostModel costModel = new CostModel();
    @Data
    public static class CostModel {
        private double commissionRate = CostModelSettings.DEFAULT_COMMISSION_RATE;
        private double slippageCoefficient = CostModelSettings.DEFAULT_COEFFICIENT;
        private double priceImpactCoefficient = CostModelSettings.DEFAULT_COEFFICIENT;
        private double liquidityCoefficient = CostModelSettings.DEFAULT_COEFFICIENT;
        private long latencyMs = CostModelSettings.DEFAULT_LATENCY_MS;
        private double defaultAverageVolume = CostModelSettings.DEFAULT_AVERAGE_VOLUME;
    }

    private Timeframe timeframe = Timeframe.H1;
    private double initialCapital = BacktestConfig.DEFAULT_INITIAL_CAPITAL;
    private double riskPerTrade = BacktestConfig.DEFAULT_RISK_PER_TRADE;
    private double maxDrawdownLimit = BacktestConfig.DEFAULT_MAX_DRAWDOWN_LIMIT;
    private int maxOpenPositions = BacktestConfig.DEFAULT_MAX_OPEN_POSITIONS;
    private boolean useLeverage = false;
    private boolean enableMarginTrading = false;
    private double marginRequirement = BacktestConfig.DEFAULT_MARGIN_REQUIREMENT;
    private CompoundingMode compounding = CompoundingMode.PER_TRADE;
    private OptimizationTarget optimizationTarget = OptimizationTarget.SHARPE;
    private double riskFreeRate = 0.0;
    private Duration maxHoldingTime = BacktestConfig.DEFAULT_MAX_HOLDING_TIME;
    private double signalExitConfidence = BacktestConfig.DEFAULT_SIGNAL_EXIT_CONFIDENCE;
    private int volatilityWindow = BacktestConfig.DEFAULT_VOLATILITY_WINDOW;

    /**
     * Upper bound on a single provider call. Zero calls providers inline without a timeout.
     */
    private Duration providerTimeout = BacktestConfig.DEFAULT_PROVIDER_TIMEOUT;

    private MonteCarlo monteCarlo = new MonteCarlo();
    @Data
    public static class MonteCarlo {
        private int simulations = MonteCarloSettings.DEFAULT_SIMULATIONS;
        private double variationPercentage = MonteCarloSettings.DEFAULT_VARIATION;
        /**
         * Fixed seed for reproducible batches; unset draws a fresh seed per batch.
         */
        private Long seed;
        private int workerPoolSize = Runtime.getRuntime().availableProcessors();

        public MonteCarloSettings toSettings() {
            return new MonteCarloSettings(simulations, variationPercentage, seed, workerPoolSize);
        }
    }

    private Portfolio portfolio = new Portfolio();
    @Data
    public static class Portfolio {
        private int iterations = 100;
        private double stepSize = 0.01;
        private int frontierSamples = 100;
        private long seed = 42L;
    }

    public PortfolioSettings toPortfolioSettings() {
        return new PortfolioSettings(portfolio.getIterations(), portfolio.getStepSize(),
                portfolio.getFrontierSamples(), portfolio.getSeed(), riskFreeRate);
    }

    public CostModelSettings toCostModelSettings() {
        return new CostModelSettings(
                costModel.getCommissionRate(),
                costModel.getSlippageCoefficient(),
                costModel.getPriceImpactCoefficient(),
                costModel.getLiquidityCoefficient(),
                costModel.getLatencyMs(),
                costModel.getDefaultAverageVolume());
    }

    /**
     * Validated run configuration built from the bound properties.
     *
     * @throws IllegalArgumentException if any bound value is out of range
     */
    public BacktestConfig toConfig() {
        return BacktestConfig.builder()
                .costModel(toCostModelSettings())
                .timeframe(timeframe)
                .initialCapital(initialCapital)
                .riskPerTrade(riskPerTrade)
                .maxDrawdownLimit(maxDrawdownLimit)
                .maxOpenPositions(maxOpenPositions)
                .useLeverage(useLeverage)
                .enableMarginTrading(enableMarginTrading)
                .marginRequirement(marginRequirement)
                .compounding(compounding)
                .optimizationTarget(optimizationTarget)
                .riskFreeRate(riskFreeRate)
                .maxHoldingTime(maxHoldingTime)
                .signalExitConfidence(signalExitConfidence)
                .volatilityWindow(volatilityWindow)
                .providerTimeout(providerTimeout)
                .build();
    }
}

package tw.gc.quant.backtest.config;

import lombok.Builder;
import tw.gc.quant.backtest.enums.CompoundingMode;
import tw.gc.quant.backtest.enums.OptimizationTarget;
import tw.gc.quant.backtest.enums.Timeframe;

import java.time.Duration;

/**
 * Immutable parameters of one backtest run. Passed explicitly into every component that
 * needs them; nothing in the engine keeps run parameters in shared state.
 *
 * <p>All validation happens here, so a run with an invalid configuration is rejected before
 * the first bar is processed.
 */
@Builder(toBuilder = true)
public record BacktestConfig(
        CostModelSettings costModel,
        Timeframe timeframe,
        double initialCapital,
        double riskPerTrade,
        double maxDrawdownLimit,
        int maxOpenPositions,
        boolean useLeverage,
        boolean enableMarginTrading,
        double marginRequirement,
        CompoundingMode compounding,
        OptimizationTarget optimizationTarget,
        double riskFreeRate,
        Duration maxHoldingTime,
        double signalExitConfidence,
        int volatilityWindow,
        Duration providerTimeout
) {
    public static final double DEFAULT_INITIAL_CAPITAL = 10_000;
    public static final double DEFAULT_RISK_PER_TRADE = 0.02;
    public static final double DEFAULT_MAX_DRAWDOWN_LIMIT = 0.25;
    public static final int DEFAULT_MAX_OPEN_POSITIONS = 3;
    public static final double DEFAULT_MARGIN_REQUIREMENT = 0.5;
    public static final Duration DEFAULT_MAX_HOLDING_TIME = Duration.ofDays(7);
    public static final double DEFAULT_SIGNAL_EXIT_CONFIDENCE = 80.0;
    public static final int DEFAULT_VOLATILITY_WINDOW = 20;
    public static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(5);

    public BacktestConfig {
        if (costModel == null) {
            throw new IllegalArgumentException("costModel must not be null");
        }
        if (timeframe == null || compounding == null || optimizationTarget == null) {
            throw new IllegalArgumentException("timeframe, compounding and optimizationTarget must not be null");
        }
        if (!(initialCapital > 0)) {
            throw new IllegalArgumentException("initialCapital must be positive, got: " + initialCapital);
        }
        if (!(riskPerTrade > 0 && riskPerTrade <= 1)) {
            throw new IllegalArgumentException("riskPerTrade must be within (0, 1], got: " + riskPerTrade);
        }
        if (!(maxDrawdownLimit > 0 && maxDrawdownLimit <= 1)) {
            throw new IllegalArgumentException("maxDrawdownLimit must be within (0, 1], got: " + maxDrawdownLimit);
        }
        if (maxOpenPositions < 1) {
            throw new IllegalArgumentException("maxOpenPositions must be at least 1, got: " + maxOpenPositions);
        }
        if (!(marginRequirement > 0 && marginRequirement <= 1)) {
            throw new IllegalArgumentException("marginRequirement must be within (0, 1], got: " + marginRequirement);
        }
        if (signalExitConfidence < 0 || signalExitConfidence > 100) {
            throw new IllegalArgumentException("signalExitConfidence must be within [0, 100], got: " + signalExitConfidence);
        }
        if (volatilityWindow < 2) {
            throw new IllegalArgumentException("volatilityWindow must be at least 2, got: " + volatilityWindow);
        }
        if (maxHoldingTime == null || maxHoldingTime.isNegative()) {
            throw new IllegalArgumentException("maxHoldingTime must be non-negative, got: " + maxHoldingTime);
        }
        if (providerTimeout == null || providerTimeout.isNegative()) {
            throw new IllegalArgumentException("providerTimeout must be non-negative, got: " + providerTimeout);
        }
    }

    /**
     * Builder primed with the engine defaults.
     */
    public static BacktestConfigBuilder defaults() {
        return BacktestConfig.builder()
                .costModel(CostModelSettings.defaults())
                .timeframe(Timeframe.H1)
                .initialCapital(DEFAULT_INITIAL_CAPITAL)
                .riskPerTrade(DEFAULT_RISK_PER_TRADE)
                .maxDrawdownLimit(DEFAULT_MAX_DRAWDOWN_LIMIT)
                .maxOpenPositions(DEFAULT_MAX_OPEN_POSITIONS)
                .useLeverage(false)
                .enableMarginTrading(false)
                .marginRequirement(DEFAULT_MARGIN_REQUIREMENT)
                .compounding(CompoundingMode.PER_TRADE)
                .optimizationTarget(OptimizationTarget.SHARPE)
                .riskFreeRate(0.0)
                .maxHoldingTime(DEFAULT_MAX_HOLDING_TIME)
                .signalExitConfidence(DEFAULT_SIGNAL_EXIT_CONFIDENCE)
                .volatilityWindow(DEFAULT_VOLATILITY_WINDOW)
                .providerTimeout(DEFAULT_PROVIDER_TIMEOUT);
    }

    public BacktestConfig withCostModel(CostModelSettings settings) {
        return toBuilder().costModel(settings).build();
    }

    /**
     * Margin checks apply when margin trading is on and leverage is enabled either here or by the strategy.
     */
    public boolean marginChecksEnabled(boolean strategyLeverage) {
        return enableMarginTrading && (useLeverage || strategyLeverage);
    }
}

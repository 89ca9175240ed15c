package tw.gc.quant.backtest.services.portfolio;

import tw.gc.quant.backtest.services.comparison.StrategyResult;

/**
 * Return and risk estimate of one strategy, the optimizer's only view of it.
 *
 * @param name strategy name
 * @param expectedReturn expected annual return, as a fraction
 * @param volatility expected annual volatility, as a fraction
 * @param maxDrawdown worst observed drawdown, as a fraction
 */
public record StrategyEstimate(String name, double expectedReturn, double volatility, double maxDrawdown) {

    public StrategyEstimate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy estimate needs a name");
        }
        if (volatility < 0 || Double.isNaN(volatility)) {
            throw new IllegalArgumentException("Volatility must be non-negative for " + name + ", got: " + volatility);
        }
        if (Double.isNaN(expectedReturn)) {
            throw new IllegalArgumentException("Expected return of " + name + " is NaN");
        }
    }

    public static StrategyEstimate from(StrategyResult result) {
        return new StrategyEstimate(result.getStrategyName(), result.getMeanAnnualizedReturn(),
                result.getMeanAnnualizedVolatility(), result.getMaxDrawdown());
    }
}

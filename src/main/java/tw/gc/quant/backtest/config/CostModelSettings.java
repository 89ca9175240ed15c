package tw.gc.quant.backtest.config;

import lombok.Builder;

/**
 * Coefficients of the execution cost model.
 *
 * @param commissionRate commission as a fraction of notional, before volume tiers
 * @param slippageCoefficient square-root slippage coefficient
 * @param priceImpactCoefficient price-impact coefficient
 * @param liquidityCoefficient liquidity-cost coefficient
 * @param latencyMs order latency in milliseconds
 * @param defaultAverageVolume average volume assumed when trailing bars carry none
 */
@Builder(toBuilder = true)
public record CostModelSettings(
        double commissionRate,
        double slippageCoefficient,
        double priceImpactCoefficient,
        double liquidityCoefficient,
        long latencyMs,
        double defaultAverageVolume
) {
    public static final double DEFAULT_COMMISSION_RATE = 0.001;
    public static final double DEFAULT_COEFFICIENT = 0.1;
    public static final long DEFAULT_LATENCY_MS = 100;
    public static final double DEFAULT_AVERAGE_VOLUME = 1_000_000;

    public CostModelSettings {
        requireNonNegative("commissionRate", commissionRate);
        requireNonNegative("slippageCoefficient", slippageCoefficient);
        requireNonNegative("priceImpactCoefficient", priceImpactCoefficient);
        requireNonNegative("liquidityCoefficient", liquidityCoefficient);
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must be non-negative, got: " + latencyMs);
        }
        if (defaultAverageVolume <= 0) {
            throw new IllegalArgumentException("defaultAverageVolume must be positive, got: " + defaultAverageVolume);
        }
    }

    public static CostModelSettings defaults() {
        return new CostModelSettings(DEFAULT_COMMISSION_RATE, DEFAULT_COEFFICIENT, DEFAULT_COEFFICIENT,
                DEFAULT_COEFFICIENT, DEFAULT_LATENCY_MS, DEFAULT_AVERAGE_VOLUME);
    }

    /**
     * Cost model with every cost switched off.
     */
    public static CostModelSettings frictionless() {
        return new CostModelSettings(0, 0, 0, 0, 0, DEFAULT_AVERAGE_VOLUME);
    }

    /**
     * Copy with slippage-type coefficients multiplied by {@code slippageFactor} and the
     * commission rate multiplied by {@code commissionFactor}.
     */
    public CostModelSettings scaled(double slippageFactor, double commissionFactor) {
        return toBuilder()
                .slippageCoefficient(slippageCoefficient * slippageFactor)
                .priceImpactCoefficient(priceImpactCoefficient * slippageFactor)
                .liquidityCoefficient(liquidityCoefficient * slippageFactor)
                .commissionRate(commissionRate * commissionFactor)
                .build();
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be non-negative, got: " + value);
        }
    }
}

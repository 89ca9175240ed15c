package tw.gc.quant.backtest.config;

import lombok.Builder;

/**
 * Parameters of a Monte Carlo batch.
 *
 * @param simulations number of perturbed runs
 * @param variationPercentage total width of the uniform perturbation; each factor is drawn
 *                            from {@code 1 +/- variationPercentage / 2}
 * @param seed seed for reproducible batches; null draws a fresh seed
 * @param workerPoolSize maximum runs executed concurrently
 */
@Builder(toBuilder = true)
public record MonteCarloSettings(int simulations, double variationPercentage, Long seed, int workerPoolSize) {

    public static final int DEFAULT_SIMULATIONS = 1000;
    public static final double DEFAULT_VARIATION = 0.2;

    public MonteCarloSettings {
        if (simulations < 1) {
            throw new IllegalArgumentException("simulations must be at least 1, got: " + simulations);
        }
        if (variationPercentage < 0 || variationPercentage >= 2) {
            throw new IllegalArgumentException("variationPercentage must be within [0, 2), got: " + variationPercentage);
        }
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be at least 1, got: " + workerPoolSize);
        }
    }

    public static MonteCarloSettings defaults() {
        return new MonteCarloSettings(DEFAULT_SIMULATIONS, DEFAULT_VARIATION, null,
                Runtime.getRuntime().availableProcessors());
    }
}

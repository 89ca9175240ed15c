package tw.gc.quant.backtest.config;

/**
 * Parameters of the mean-variance portfolio optimizer.
 *
 * @param iterations gradient iterations from equal weights
 * @param stepSize gradient step per iteration
 * @param frontierSamples random weight vectors drawn for the efficient frontier
 * @param seed seed of the frontier sampler
 * @param riskFreeRate annual risk-free rate used in portfolio Sharpe ratios
 */
public record PortfolioSettings(int iterations, double stepSize, int frontierSamples, long seed, double riskFreeRate) {

    public PortfolioSettings {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be non-negative, got: " + iterations);
        }
        if (!(stepSize > 0)) {
            throw new IllegalArgumentException("stepSize must be positive, got: " + stepSize);
        }
        if (frontierSamples < 1) {
            throw new IllegalArgumentException("frontierSamples must be at least 1, got: " + frontierSamples);
        }
    }

    public static PortfolioSettings defaults() {
        return new PortfolioSettings(100, 0.01, 100, 42L, 0.0);
    }
}

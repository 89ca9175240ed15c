package tw.gc.quant.backtest.services.portfolio;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.PortfolioSettings;
import tw.gc.quant.backtest.services.portfolio.OptimalPortfolio.FrontierPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Mean-variance allocation across strategies.
 *
 * <h3>Algorithm:</h3>
 * <pre>
 * w = 1/n for every strategy
 * repeat iterations times:
 *   w_i += stepSize * (r_i - r_p) / sigma_p
 *   clamp w_i at 0, renormalize to sum 1
 * sigma_p^2 = sum_ij w_i w_j sigma_i sigma_j rho_ij
 * </pre>
 *
 * <p>Alongside, a seeded random sample of allocations approximates the efficient frontier.
 * Short positions are not modeled.
 */
@Service
@Slf4j
public class PortfolioOptimizationService {

    private static final double VAR_95_Z = 1.645;

    public OptimalPortfolio optimize(List<StrategyEstimate> estimates, double[][] correlation) {
        return optimize(estimates, correlation, PortfolioSettings.defaults());
    }

    /**
     * @param estimates per-strategy return and volatility, at least one
     * @param correlation correlation matrix in the order of {@code estimates}; null for identity
     * @throws IllegalArgumentException when {@code estimates} is empty or the matrix does not fit
     */
    public OptimalPortfolio optimize(List<StrategyEstimate> estimates, double[][] correlation, PortfolioSettings settings) {
        if (estimates == null || estimates.isEmpty()) {
            throw new IllegalArgumentException("At least one strategy estimate is required");
        }
        int n = estimates.size();
        double[][] rho = correlation != null ? correlation : identity(n);
        if (rho.length != n || Arrays.stream(rho).anyMatch(row -> row.length != n)) {
            throw new IllegalArgumentException("Correlation matrix must be %dx%d".formatted(n, n));
        }

        double[] returns = estimates.stream().mapToDouble(StrategyEstimate::expectedReturn).toArray();
        double[] vols = estimates.stream().mapToDouble(StrategyEstimate::volatility).toArray();

        double[] weights = equalWeights(n);
        for (int iteration = 0; iteration < settings.iterations(); iteration++) {
            double portfolioReturn = dot(weights, returns);
            double portfolioVol = portfolioVolatility(weights, vols, rho);
            if (portfolioVol <= 0) {
                break;
            }
            for (int i = 0; i < n; i++) {
                weights[i] += settings.stepSize() * (returns[i] - portfolioReturn) / portfolioVol;
            }
            weights = normalize(weights);
        }

        double expectedReturn = dot(weights, returns);
        double expectedVol = portfolioVolatility(weights, vols, rho);
        double sharpe = sharpe(expectedReturn, expectedVol, settings.riskFreeRate());
        double maxDrawdown = 0.0;
        for (int i = 0; i < n; i++) {
            maxDrawdown += weights[i] * estimates.get(i).maxDrawdown();
        }

        List<FrontierPoint> frontier = sampleFrontier(estimates, returns, vols, rho, settings);
        FrontierPoint optimalPoint = frontier.stream()
                .max((a, b) -> Double.compare(a.sharpeRatio(), b.sharpeRatio()))
                .orElseThrow();

        OptimalPortfolio portfolio = OptimalPortfolio.builder()
                .weights(named(estimates, weights))
                .expectedReturn(expectedReturn)
                .expectedVolatility(expectedVol)
                .sharpeRatio(sharpe)
                .maxDrawdown(maxDrawdown)
                .valueAtRisk95(expectedReturn - VAR_95_Z * expectedVol)
                .riskContributions(named(estimates, riskContributions(weights, vols, rho, expectedVol)))
                .efficientFrontier(frontier)
                .optimalPoint(optimalPoint)
                .build();

        log.info("📊 Portfolio optimized over {} strategies: return={}, vol={}, sharpe={}",
                n, String.format("%.4f", expectedReturn), String.format("%.4f", expectedVol),
                String.format("%.3f", sharpe));
        return portfolio;
    }

    /**
     * {@code sqrt(sum_ij w_i w_j sigma_i sigma_j rho_ij)}.
     */
    public double portfolioVolatility(double[] weights, double[] vols, double[][] rho) {
        double variance = 0.0;
        for (int i = 0; i < weights.length; i++) {
            for (int j = 0; j < weights.length; j++) {
                variance += weights[i] * weights[j] * vols[i] * vols[j] * rho[i][j];
            }
        }
        return Math.sqrt(Math.max(0.0, variance));
    }

    /**
     * Fraction of portfolio variance each weight contributes: {@code w_i (Sigma w)_i / sigma_p^2}.
     */
    double[] riskContributions(double[] weights, double[] vols, double[][] rho, double portfolioVol) {
        double[] contributions = new double[weights.length];
        double variance = portfolioVol * portfolioVol;
        if (variance <= 0) {
            return contributions;
        }
        for (int i = 0; i < weights.length; i++) {
            double marginal = 0.0;
            for (int j = 0; j < weights.length; j++) {
                marginal += vols[i] * vols[j] * rho[i][j] * weights[j];
            }
            contributions[i] = weights[i] * marginal / variance;
        }
        return contributions;
    }

    private List<FrontierPoint> sampleFrontier(List<StrategyEstimate> estimates, double[] returns, double[] vols,
                                               double[][] rho, PortfolioSettings settings) {
        Random random = new Random(settings.seed());
        List<FrontierPoint> frontier = new ArrayList<>(settings.frontierSamples());
        for (int sample = 0; sample < settings.frontierSamples(); sample++) {
            double[] weights = new double[returns.length];
            for (int i = 0; i < weights.length; i++) {
                weights[i] = random.nextDouble();
            }
            weights = normalize(weights);
            double ret = dot(weights, returns);
            double vol = portfolioVolatility(weights, vols, rho);
            frontier.add(new FrontierPoint(named(estimates, weights), ret, vol, sharpe(ret, vol, settings.riskFreeRate())));
        }
        return frontier;
    }

    /**
     * Clamp at zero and rescale to sum 1; equal weights if nothing is left.
     */
    double[] normalize(double[] weights) {
        double[] clamped = new double[weights.length];
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            clamped[i] = Math.max(0.0, weights[i]);
            sum += clamped[i];
        }
        if (sum <= 0 || !Double.isFinite(sum)) {
            return equalWeights(weights.length);
        }
        for (int i = 0; i < clamped.length; i++) {
            clamped[i] /= sum;
        }
        return clamped;
    }

    private double sharpe(double ret, double vol, double riskFreeRate) {
        return vol > 0 ? (ret - riskFreeRate) / vol : 0.0;
    }

    private static double[] equalWeights(int n) {
        double[] weights = new double[n];
        Arrays.fill(weights, 1.0 / n);
        return weights;
    }

    private static double[][] identity(int n) {
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
        }
        return matrix;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static Map<String, Double> named(List<StrategyEstimate> estimates, double[] values) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(estimates.get(i).name(), values[i]);
        }
        return map;
    }
}

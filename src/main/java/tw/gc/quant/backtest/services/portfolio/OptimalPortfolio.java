package tw.gc.quant.backtest.services.portfolio;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Capital allocation across strategies.
 *
 * <p>{@link #weights} is the gradient solution: non-negative, summing to 1. The frontier is a
 * random sample of allocations; {@link #optimalPoint} is its highest-Sharpe member.
 */
@Value
@Builder
public class OptimalPortfolio {

    Map<String, Double> weights;
    double expectedReturn;
    double expectedVolatility;
    double sharpeRatio;
    /** Weighted sum of the strategies' worst drawdowns */
    double maxDrawdown;
    /** Parametric 95% VaR: expected return - 1.645 x volatility */
    double valueAtRisk95;
    /** Share of portfolio variance contributed by each strategy; sums to 1 when volatility is positive */
    Map<String, Double> riskContributions;
    List<FrontierPoint> efficientFrontier;
    FrontierPoint optimalPoint;

    public record FrontierPoint(Map<String, Double> weights, double expectedReturn, double volatility, double sharpeRatio) {
    }
}

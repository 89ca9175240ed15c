package tw.gc.quant.backtest.services.montecarlo;

import lombok.Builder;
import lombok.Value;
import tw.gc.quant.backtest.config.MonteCarloSettings;
import tw.gc.quant.backtest.services.BacktestResult;

import java.util.List;

/**
 * Outcome distribution of a Monte Carlo batch. Returns are total returns in percent of
 * initial capital; only successful trials are aggregated.
 */
@Value
@Builder
public class SimulationResult {

    String strategyName;
    MonteCarloSettings settings;
    /** Seed the factors were drawn with */
    long seed;

    int requestedTrials;
    int successfulTrials;
    int failedTrials;

    double meanReturn;
    double returnStdDev;
    double percentile5;
    double percentile95;
    /** Fraction of successful trials with a positive return */
    double successRate;
    double meanSharpe;
    /** Largest max drawdown over all successful trials */
    double worstDrawdown;

    /** Successful trials in index order */
    List<Trial> trials;
    Trial bestTrial;
    Trial worstTrial;
    BacktestResult bestRun;
    BacktestResult worstRun;

    /**
     * One perturbed run.
     *
     * @param index position in the batch, from 0
     * @param slippageFactor multiplier applied to slippage, impact and liquidity coefficients
     * @param commissionFactor multiplier applied to the commission rate
     */
    public record Trial(int index, double slippageFactor, double commissionFactor,
                        double totalReturnPct, double sharpeRatio, double maxDrawdown) {
    }
}

package tw.gc.quant.backtest.services.montecarlo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.config.MonteCarloSettings;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.exceptions.BacktestException;
import tw.gc.quant.backtest.exceptions.BacktestException.ErrorCode;
import tw.gc.quant.backtest.services.BacktestResult;
import tw.gc.quant.backtest.services.BacktestService;
import tw.gc.quant.backtest.services.montecarlo.SimulationResult.Trial;
import tw.gc.quant.backtest.strategy.BacktestStrategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Stress-tests a strategy by re-running it with randomly perturbed cost parameters.
 *
 * <p>Each trial multiplies the slippage-type coefficients and the commission rate by
 * independent factors {@code 1 + (u - 0.5) * variationPercentage}, {@code u} uniform in [0, 1).
 * All factors are drawn up front from one seeded generator, so a batch is reproducible
 * regardless of how its trials are scheduled. Trials run on a fixed pool of
 * {@code workerPoolSize} threads and are aggregated as they complete; only the best and worst
 * runs are retained.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonteCarloService {

    private static final double LOWER_PERCENTILE = 0.05;
    private static final double UPPER_PERCENTILE = 0.95;

    /** Best first: higher return, then lower index */
    private static final Comparator<Trial> BEST_FIRST =
            Comparator.comparingDouble(Trial::totalReturnPct).reversed().thenComparingInt(Trial::index);

    private final BacktestService backtestService;

    /**
     * Run the batch.
     *
     * @throws BacktestException with {@link ErrorCode#NO_SUCCESSFUL_TRIALS} if every trial failed
     */
    public SimulationResult simulate(BacktestStrategy strategy, List<Bar> bars, BacktestConfig config,
                                     MonteCarloSettings settings) {
        List<Bar> series = List.copyOf(bars);
        long seed = settings.seed() != null ? settings.seed() : new Random().nextLong();
        double[][] factors = drawFactors(settings, seed);

        log.info("🚀 Monte Carlo started: strategy={}, trials={}, variation={}, seed={}",
                strategy.name(), settings.simulations(), settings.variationPercentage(), seed);

        List<Trial> trials = new ArrayList<>(settings.simulations());
        BacktestResult bestRun = null;
        BacktestResult worstRun = null;
        Trial best = null;
        Trial worst = null;
        int failed = 0;

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.workerPoolSize(), settings.simulations()));
        try {
            CompletionService<TrialRun> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < settings.simulations(); i++) {
                int index = i;
                completion.submit(() -> runTrial(strategy, series, config, index, factors[index][0], factors[index][1]));
            }

            for (int i = 0; i < settings.simulations(); i++) {
                TrialRun run;
                try {
                    run = completion.take().get();
                } catch (ExecutionException e) {
                    failed++;
                    log.trace("Monte Carlo trial skipped for {}: {}", strategy.name(), e.getCause().getMessage());
                    continue;
                }
                trials.add(run.trial());
                if (best == null || BEST_FIRST.compare(run.trial(), best) < 0) {
                    best = run.trial();
                    bestRun = run.result();
                }
                if (worst == null || BEST_FIRST.compare(run.trial(), worst) > 0) {
                    worst = run.trial();
                    worstRun = run.result();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BacktestException(ErrorCode.INTERRUPTED, "Monte Carlo batch interrupted for " + strategy.name(), e);
        } finally {
            executor.shutdownNow();
        }

        if (trials.isEmpty()) {
            throw new BacktestException(ErrorCode.NO_SUCCESSFUL_TRIALS,
                    "All %d Monte Carlo trials failed for %s".formatted(settings.simulations(), strategy.name()));
        }
        if (failed > 0) {
            log.warn("⚠️ {} of {} Monte Carlo trials failed for {}", failed, settings.simulations(), strategy.name());
        }

        trials.sort(Comparator.comparingInt(Trial::index));
        SimulationResult result = aggregate(strategy.name(), settings, seed, trials, failed)
                .bestTrial(best)
                .worstTrial(worst)
                .bestRun(bestRun)
                .worstRun(worstRun)
                .build();

        log.info("✅ Monte Carlo completed: strategy={}, ok={}, failed={}, meanReturn={}%, successRate={}",
                strategy.name(), trials.size(), failed, String.format("%.2f", result.getMeanReturn()),
                String.format("%.3f", result.getSuccessRate()));
        return result;
    }

    /**
     * Slippage and commission factor per trial, drawn in trial order: slippage first, then commission.
     */
    double[][] drawFactors(MonteCarloSettings settings, long seed) {
        Random random = new Random(seed);
        double[][] factors = new double[settings.simulations()][2];
        for (int i = 0; i < settings.simulations(); i++) {
            factors[i][0] = 1 + (random.nextDouble() - 0.5) * settings.variationPercentage();
            factors[i][1] = 1 + (random.nextDouble() - 0.5) * settings.variationPercentage();
        }
        return factors;
    }

    private TrialRun runTrial(BacktestStrategy strategy, List<Bar> series, BacktestConfig config, int index,
                              double slippageFactor, double commissionFactor) {
        BacktestConfig perturbed = config.withCostModel(config.costModel().scaled(slippageFactor, commissionFactor));
        BacktestResult result = backtestService.run(strategy, series, perturbed);
        Trial trial = new Trial(index, slippageFactor, commissionFactor,
                result.getTotalReturnPct(), result.getSharpeRatio(), result.getMaxDrawdown());
        return new TrialRun(trial, result);
    }

    private SimulationResult.SimulationResultBuilder aggregate(String strategyName, MonteCarloSettings settings,
                                                               long seed, List<Trial> trials, int failed) {
        double[] returns = trials.stream().mapToDouble(Trial::totalReturnPct).toArray();
        double mean = Arrays.stream(returns).average().orElse(0.0);
        double variance = Arrays.stream(returns).map(r -> (r - mean) * (r - mean)).average().orElse(0.0);
        double[] sorted = returns.clone();
        Arrays.sort(sorted);

        return SimulationResult.builder()
                .strategyName(strategyName)
                .settings(settings)
                .seed(seed)
                .requestedTrials(settings.simulations())
                .successfulTrials(trials.size())
                .failedTrials(failed)
                .meanReturn(mean)
                .returnStdDev(Math.sqrt(variance))
                .percentile5(percentile(sorted, LOWER_PERCENTILE))
                .percentile95(percentile(sorted, UPPER_PERCENTILE))
                .successRate((double) Arrays.stream(returns).filter(r -> r > 0).count() / returns.length)
                .meanSharpe(trials.stream().mapToDouble(Trial::sharpeRatio).average().orElse(0.0))
                .worstDrawdown(trials.stream().mapToDouble(Trial::maxDrawdown).max().orElse(0.0))
                .trials(List.copyOf(trials));
    }

    /**
     * Value at index {@code floor(n * p)} of an ascending array.
     */
    static double percentile(double[] sorted, double p) {
        int index = Math.min(sorted.length - 1, (int) Math.floor(sorted.length * p));
        return sorted[index];
    }

    private record TrialRun(Trial trial, BacktestResult result) {
    }
}

package tw.gc.quant.backtest.services.comparison;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.entities.EquityPoint;
import tw.gc.quant.backtest.exceptions.BacktestException;
import tw.gc.quant.backtest.exceptions.BacktestException.ErrorCode;
import tw.gc.quant.backtest.services.BacktestResult;
import tw.gc.quant.backtest.services.BacktestService;
import tw.gc.quant.backtest.services.regime.MarketRegimeService;
import tw.gc.quant.backtest.services.regime.MarketRegimeService.MarketRegime;
import tw.gc.quant.backtest.strategy.BacktestStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

/**
 * Runs several strategies over several lookback windows and ranks them.
 *
 * <p>Every (strategy, window) run is independent and reads the same immutable bar series, so
 * strategies are evaluated in parallel. Within one strategy the windows run one after another.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StrategyComparisonService {

    public static final List<Integer> DEFAULT_LOOKBACK_DAYS = List.of(30, 90, 180, 365);

    private final BacktestService backtestService;
    private final MarketRegimeService marketRegimeService;

    public List<StrategyResult> compare(List<BacktestStrategy> strategies, List<Bar> bars, BacktestConfig config) {
        return compare(strategies, bars, config, DEFAULT_LOOKBACK_DAYS);
    }

    /**
     * Evaluate and rank {@code strategies}.
     *
     * @param lookbackDays window lengths in days, each counted back from the last bar
     * @return results ordered best first, ranks assigned from 1
     */
    public List<StrategyResult> compare(List<BacktestStrategy> strategies, List<Bar> bars, BacktestConfig config,
                                        List<Integer> lookbackDays) {
        if (strategies.isEmpty()) {
            return List.of();
        }
        for (int days : lookbackDays) {
            if (days <= 0) {
                throw new IllegalArgumentException("Lookback days must be positive, got: " + days);
            }
        }
        List<Bar> series = List.copyOf(bars);
        MarketRegime[] regimes = marketRegimeService.classifySeries(series);

        log.info("🚀 Comparing {} strategies over {} bars, windows={}", strategies.size(), series.size(), lookbackDays);

        int poolSize = Math.min(strategies.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        List<StrategyResult> evaluated;
        try {
            List<CompletableFuture<StrategyResult>> futures = strategies.stream()
                    .map(strategy -> CompletableFuture.supplyAsync(
                            () -> evaluate(strategy, series, regimes, config, lookbackDays), executor))
                    .toList();
            evaluated = futures.stream().map(this::join).toList();
        } finally {
            executor.shutdown();
        }

        List<StrategyResult> ranked = new ArrayList<>(evaluated);
        ranked.sort(StrategyRanking.BEST_FIRST);
        List<StrategyResult> result = IntStream.range(0, ranked.size())
                .mapToObj(i -> ranked.get(i).withRank(i + 1))
                .toList();

        log.info("✅ Comparison completed, best strategy: {} (composite={})",
                result.get(0).getStrategyName(), String.format("%.4f", result.get(0).getCompositeScore()));
        return result;
    }

    private StrategyResult join(CompletableFuture<StrategyResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BacktestException(ErrorCode.SIMULATION_ERROR, "Strategy evaluation failed", e.getCause());
        }
    }

    StrategyResult evaluate(BacktestStrategy strategy, List<Bar> series, MarketRegime[] regimes,
                            BacktestConfig config, List<Integer> lookbackDays) {
        StrategyResult.StrategyResultBuilder builder = StrategyResult.builder()
                .strategyName(strategy.name())
                .description(strategy.description());

        List<PeriodResult> periods = new ArrayList<>();
        for (int days : lookbackDays) {
            String label = PeriodResult.label(days);
            List<Bar> window = lookbackWindow(series, days);
            if (window.isEmpty()) {
                builder.failedPeriod(label);
                continue;
            }
            try {
                periods.add(new PeriodResult(label, days, backtestService.run(strategy, window, config)));
            } catch (BacktestException e) {
                log.warn("⚠️ Strategy {} failed on window {}: {}", strategy.name(), label, e.getMessage());
                builder.failedPeriod(label);
            }
        }
        builder.periods(periods);

        BacktestResult fullRun = null;
        try {
            fullRun = backtestService.run(strategy, series, config);
        } catch (BacktestException e) {
            log.warn("⚠️ Strategy {} failed on the full series: {}", strategy.name(), e.getMessage());
        }
        builder.fullRun(fullRun);

        double riskAdjusted = riskAdjustedPerformance(periods);
        double consistency = consistency(periods);
        RegimePerformance regimePerformance = fullRun != null
                ? regimePerformance(fullRun.getEquityCurve(), regimes)
                : RegimePerformance.empty();

        return builder
                .riskAdjustedPerformance(riskAdjusted)
                .consistency(consistency)
                .regimePerformance(regimePerformance)
                .compositeScore(StrategyRanking.compositeScore(riskAdjusted, consistency, regimePerformance.score()))
                .meanAnnualizedReturn(periods.stream().mapToDouble(PeriodResult::annualizedReturn).average().orElse(0.0))
                .meanAnnualizedVolatility(periods.stream()
                        .mapToDouble(p -> p.result().getReport().getAnnualizedVolatility()).average().orElse(0.0))
                .meanSharpe(periods.stream().mapToDouble(PeriodResult::sharpeRatio).average().orElse(0.0))
                .meanWinRate(periods.stream().mapToDouble(PeriodResult::winRate).average().orElse(0.0))
                .maxDrawdown(periods.stream().mapToDouble(PeriodResult::maxDrawdown).max().orElse(0.0))
                .build();
    }

    /**
     * Bars whose timestamp is no earlier than {@code days} before the last bar.
     */
    List<Bar> lookbackWindow(List<Bar> series, int days) {
        if (series.isEmpty()) {
            return List.of();
        }
        Instant cutoff = series.get(series.size() - 1).timestamp().minus(Duration.ofDays(days));
        int from = 0;
        while (from < series.size() && series.get(from).timestamp().isBefore(cutoff)) {
            from++;
        }
        return series.subList(from, series.size());
    }

    double riskAdjustedPerformance(List<PeriodResult> periods) {
        if (periods.isEmpty()) {
            return 0.0;
        }
        double sharpeSum = periods.stream().mapToDouble(PeriodResult::sharpeRatio).sum();
        double meanAnnualized = periods.stream().mapToDouble(PeriodResult::annualizedReturn).average().orElse(0.0);
        double maxDrawdown = periods.stream().mapToDouble(PeriodResult::maxDrawdown).max().orElse(0.0);
        return (sharpeSum + meanAnnualized) / (1 + maxDrawdown);
    }

    /**
     * {@code 1 / (1 + variance)} of the window returns; 0 without any successful window.
     */
    double consistency(List<PeriodResult> periods) {
        if (periods.isEmpty()) {
            return 0.0;
        }
        double mean = periods.stream().mapToDouble(PeriodResult::periodReturn).average().orElse(0.0);
        double variance = periods.stream()
                .mapToDouble(p -> Math.pow(p.periodReturn() - mean, 2))
                .average()
                .orElse(0.0);
        return 1.0 / (1.0 + variance);
    }

    /**
     * Attribute each bar-over-bar equity return to the regime active on that bar.
     */
    RegimePerformance regimePerformance(List<EquityPoint> equityCurve, MarketRegime[] regimes) {
        if (equityCurve.size() < 2) {
            return RegimePerformance.empty();
        }
        Map<MarketRegime, Double> returns = new EnumMap<>(MarketRegime.class);
        Map<MarketRegime, Integer> counts = new EnumMap<>(MarketRegime.class);
        for (int i = 1; i < equityCurve.size() && i < regimes.length; i++) {
            double previous = equityCurve.get(i - 1).equity();
            double barReturn = previous != 0 ? (equityCurve.get(i).equity() - previous) / previous : 0.0;
            returns.merge(regimes[i], barReturn, Double::sum);
            counts.merge(regimes[i], 1, Integer::sum);
        }
        double score = returns.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new RegimePerformance(returns, counts, score);
    }
}

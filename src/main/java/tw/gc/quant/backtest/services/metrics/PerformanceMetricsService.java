package tw.gc.quant.backtest.services.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.entities.EquityPoint;
import tw.gc.quant.backtest.entities.Trade;
import tw.gc.quant.backtest.enums.ExitReason;

import java.time.Duration;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the performance report of a finished run from its closed trades and equity curve.
 *
 * <h3>Conventions:</h3>
 * <ul>
 *   <li>Returns are bar-over-bar equity changes; zero returns count</li>
 *   <li>Standard deviations are population deviations</li>
 *   <li>VaR/CVaR are historical at 5%; CVaR averages the tail up to and including the VaR index</li>
 *   <li>Trades are taken in ledger order (the order they were closed) for streaks</li>
 * </ul>
 */
@Service
@Slf4j
public class PerformanceMetricsService {

    private static final double EPSILON = 1e-12;
    private static final double TRADING_DAYS_PER_YEAR = 252.0;
    private static final double TRADING_DAYS_PER_MONTH = 21.0;
    private static final double VAR_LEVEL = 0.05;
    private static final Duration YEAR = Duration.ofDays(365);
    /** Annualized returns are capped here so window averages stay finite */
    static final double MAX_ANNUALIZED_RETURN = 1_000.0;

    public PerformanceReport calculate(List<Trade> closedTrades, List<EquityPoint> equityCurve, double initialCapital) {
        return calculate(closedTrades, equityCurve, BacktestConfig.defaults().initialCapital(initialCapital).build());
    }

    public PerformanceReport calculate(List<Trade> closedTrades, List<EquityPoint> equityCurve, BacktestConfig config) {
        double initialCapital = config.initialCapital();

        List<Trade> wins = closedTrades.stream().filter(Trade::isWin).toList();
        List<Trade> losses = closedTrades.stream().filter(Trade::isLoss).toList();
        int pushes = (int) closedTrades.stream().filter(Trade::isPush).count();
        int partialWins = (int) closedTrades.stream().filter(Trade::isPartialWin).count();

        double grossProfit = wins.stream().mapToDouble(t -> Math.abs(t.getPnl())).sum();
        double grossLoss = losses.stream().mapToDouble(t -> Math.abs(t.getPnl())).sum();
        int decided = wins.size() + losses.size();

        double finalEquity = equityCurve.isEmpty() ? initialCapital : equityCurve.get(equityCurve.size() - 1).equity();
        double totalReturn = finalEquity - initialCapital;

        double[] returns = periodReturns(equityCurve);
        double meanReturn = mean(returns);
        double volatility = standardDeviation(returns, meanReturn);
        double sharpe = sharpeRatio(returns, config.riskFreeRate());
        SortinoRatio sortino = sortinoRatio(returns);
        double maxDrawdown = equityCurve.stream().mapToDouble(EquityPoint::drawdown).max().orElse(0.0);
        double calmar = maxDrawdown > 0 ? (totalReturn / initialCapital) / maxDrawdown : 0.0;

        PerformanceReport report = PerformanceReport.builder()
                .totalTrades(closedTrades.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .pushes(pushes)
                .partialWins(partialWins)
                .winRate(decided > 0 ? (double) wins.size() / decided : 0.0)
                .profitFactor(grossLoss > 0 ? grossProfit / grossLoss : 0.0)
                .averageWin(wins.isEmpty() ? 0.0 : grossProfit / wins.size())
                .averageLoss(losses.isEmpty() ? 0.0 : grossLoss / losses.size())
                .expectancy(closedTrades.isEmpty() ? 0.0 : totalReturn / closedTrades.size())
                .bestTrade(closedTrades.stream().mapToDouble(Trade::getPnl).max().orElse(0.0))
                .worstTrade(closedTrades.stream().mapToDouble(Trade::getPnl).min().orElse(0.0))
                .maxConsecutiveWins(maxConsecutive(closedTrades, true))
                .maxConsecutiveLosses(maxConsecutive(closedTrades, false))
                .kellyCriterion(kellyCriterion(wins.size(), losses.size(), grossProfit, grossLoss))
                .averageTradeDuration(averageDuration(closedTrades))
                .exitReasons(exitReasonHistogram(closedTrades))
                .totalFees(closedTrades.stream().mapToDouble(t -> t.getCosts().commission()).sum())
                .totalSlippage(closedTrades.stream()
                        .mapToDouble(t -> t.getCosts().total() - t.getCosts().commission()).sum())
                .totalCosts(closedTrades.stream().mapToDouble(Trade::totalCost).sum())
                .initialCapital(initialCapital)
                .finalEquity(finalEquity)
                .totalReturn(totalReturn)
                .totalReturnPct(totalReturn / initialCapital * 100)
                .annualizedReturn(annualizedReturn(equityCurve, initialCapital, finalEquity))
                .volatility(volatility)
                .annualizedVolatility(volatility * Math.sqrt(config.timeframe().periodsPerYear()))
                .sharpeRatio(sharpe)
                .sortino(sortino)
                .calmarRatio(calmar)
                .maxDrawdown(maxDrawdown)
                .valueAtRisk95(valueAtRisk(returns))
                .conditionalValueAtRisk95(conditionalValueAtRisk(returns))
                .monthlyReturns(monthlyReturns(equityCurve))
                .objectiveValue(objective(config, totalReturn, sharpe, sortino))
                .build();

        log.debug("📊 Metrics: trades={}, winRate={}, sharpe={}, maxDD={}",
                report.getTotalTrades(), report.getWinRate(), sharpe, maxDrawdown);
        return report;
    }

    /**
     * Bar-over-bar equity returns. Empty for fewer than two points.
     */
    public double[] periodReturns(List<EquityPoint> equityCurve) {
        if (equityCurve.size() < 2) {
            return new double[0];
        }
        double[] returns = new double[equityCurve.size() - 1];
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).equity();
            returns[i - 1] = previous != 0 ? (equityCurve.get(i).equity() - previous) / previous : 0.0;
        }
        return returns;
    }

    public double sharpeRatio(double[] returns, double riskFreeRate) {
        if (returns.length == 0) {
            return 0.0;
        }
        double mean = mean(returns);
        double std = standardDeviation(returns, mean);
        if (std < EPSILON) {
            return 0.0;
        }
        return (mean - riskFreeRate / TRADING_DAYS_PER_YEAR) / std;
    }

    /**
     * Mean return over the deviation of negative returns from that mean.
     */
    public SortinoRatio sortinoRatio(double[] returns) {
        if (returns.length == 0) {
            return SortinoRatio.insufficientData();
        }
        double mean = mean(returns);
        double sumSquares = 0.0;
        int negatives = 0;
        for (double r : returns) {
            if (r < 0) {
                sumSquares += (r - mean) * (r - mean);
                negatives++;
            }
        }
        if (negatives == 0) {
            return mean > EPSILON ? SortinoRatio.noDownside() : SortinoRatio.insufficientData();
        }
        double downsideDeviation = Math.sqrt(sumSquares / negatives);
        if (downsideDeviation < EPSILON) {
            return SortinoRatio.insufficientData();
        }
        return SortinoRatio.of(mean / downsideDeviation);
    }

    public double valueAtRisk(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        return sorted[varIndex(sorted.length)];
    }

    public double conditionalValueAtRisk(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        int index = varIndex(sorted.length);
        double sum = 0.0;
        for (int i = 0; i <= index; i++) {
            sum += sorted[i];
        }
        return sum / (index + 1);
    }

    private int varIndex(int length) {
        return Math.min(length - 1, (int) Math.floor(length * VAR_LEVEL));
    }

    /**
     * {@code p - (1 - p) * avgLoss / avgWin}; 0 without both wins and losses.
     */
    double kellyCriterion(int wins, int losses, double grossProfit, double grossLoss) {
        if (wins == 0 || losses == 0) {
            return 0.0;
        }
        double winProbability = (double) wins / (wins + losses);
        double averageWin = grossProfit / wins;
        double averageLoss = grossLoss / losses;
        if (averageWin < EPSILON) {
            return 0.0;
        }
        return winProbability - (1 - winProbability) * (averageLoss / averageWin);
    }

    /**
     * Longest run of wins (or losses) in ledger order. A push breaks both kinds of run.
     */
    int maxConsecutive(List<Trade> trades, boolean wins) {
        int max = 0;
        int current = 0;
        for (Trade trade : trades) {
            boolean matches = wins ? trade.isWin() : trade.isLoss();
            if (matches) {
                current++;
                max = Math.max(max, current);
            } else {
                current = 0;
            }
        }
        return max;
    }

    double annualizedReturn(List<EquityPoint> equityCurve, double initialCapital, double finalEquity) {
        if (equityCurve.size() < 2 || finalEquity <= 0) {
            return 0.0;
        }
        Duration span = Duration.between(equityCurve.get(0).timestamp(),
                equityCurve.get(equityCurve.size() - 1).timestamp());
        double years = (double) span.toSeconds() / YEAR.toSeconds();
        if (years <= 0) {
            return 0.0;
        }
        double annualized = Math.pow(finalEquity / initialCapital, 1 / years) - 1;
        // very short spans compound into overflow
        return Double.isFinite(annualized) ? Math.min(annualized, MAX_ANNUALIZED_RETURN) : MAX_ANNUALIZED_RETURN;
    }

    /**
     * Per calendar month (UTC) return and volatility; months with a single sample are skipped.
     */
    public List<MonthlyReturn> monthlyReturns(List<EquityPoint> equityCurve) {
        Map<YearMonth, List<Double>> byMonth = new LinkedHashMap<>();
        for (EquityPoint point : equityCurve) {
            YearMonth month = YearMonth.from(point.timestamp().atZone(ZoneOffset.UTC));
            byMonth.computeIfAbsent(month, k -> new ArrayList<>()).add(point.equity());
        }

        List<MonthlyReturn> result = new ArrayList<>();
        for (Map.Entry<YearMonth, List<Double>> entry : byMonth.entrySet()) {
            List<Double> values = entry.getValue();
            if (values.size() < 2) {
                continue;
            }
            double first = values.get(0);
            double monthReturn = (values.get(values.size() - 1) - first) / first;
            double[] barReturns = new double[values.size() - 1];
            for (int i = 1; i < values.size(); i++) {
                barReturns[i - 1] = (values.get(i) - values.get(i - 1)) / values.get(i - 1);
            }
            double vol = standardDeviation(barReturns, mean(barReturns)) * Math.sqrt(TRADING_DAYS_PER_MONTH);
            result.add(new MonthlyReturn(entry.getKey(), monthReturn, vol));
        }
        return result;
    }

    private Duration averageDuration(List<Trade> trades) {
        if (trades.isEmpty()) {
            return Duration.ZERO;
        }
        long totalSeconds = trades.stream().mapToLong(t -> t.holdingDuration().toSeconds()).sum();
        return Duration.ofSeconds(totalSeconds / trades.size());
    }

    private Map<ExitReason, Integer> exitReasonHistogram(List<Trade> trades) {
        Map<ExitReason, Integer> histogram = new EnumMap<>(ExitReason.class);
        for (Trade trade : trades) {
            histogram.merge(trade.getExitReason(), 1, Integer::sum);
        }
        return histogram;
    }

    private double objective(BacktestConfig config, double totalReturn, double sharpe, SortinoRatio sortino) {
        return switch (config.optimizationTarget()) {
            case PROFIT -> totalReturn;
            case SHARPE -> sharpe;
            case SORTINO -> sortino.objectiveValue();
        };
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double standardDeviation(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return Math.sqrt(variance / values.length);
    }
}

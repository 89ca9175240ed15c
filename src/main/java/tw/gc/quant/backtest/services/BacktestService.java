package tw.gc.quant.backtest.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.entities.EquityPoint;
import tw.gc.quant.backtest.entities.MarginEvent;
import tw.gc.quant.backtest.entities.Trade;
import tw.gc.quant.backtest.entities.TradeCosts;
import tw.gc.quant.backtest.enums.ExitReason;
import tw.gc.quant.backtest.exceptions.BacktestException;
import tw.gc.quant.backtest.exceptions.BacktestException.ErrorCode;
import tw.gc.quant.backtest.services.SignalCollectionService.SignalBatch;
import tw.gc.quant.backtest.services.execution.CostModel;
import tw.gc.quant.backtest.services.metrics.PerformanceMetricsService;
import tw.gc.quant.backtest.services.metrics.PerformanceReport;
import tw.gc.quant.backtest.services.positionsizing.PositionSizingService;
import tw.gc.quant.backtest.services.positionsizing.PositionSizingService.PositionSizeResult;
import tw.gc.quant.backtest.strategy.BacktestStrategy;
import tw.gc.quant.backtest.strategy.CandidateSignal;
import tw.gc.quant.backtest.strategy.CandidateSignal.SignalDirection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Trade simulator: replays a bar series through one strategy.
 *
 * <p>Each bar is processed strictly in order:
 * <ol>
 *   <li>after warm-up, solicit candidates from the strategy's providers</li>
 *   <li>evaluate exits of all open trades on the bar's close</li>
 *   <li>open new trades from the accepted candidates while below the position limit</li>
 *   <li>mark open trades to market and append an equity point</li>
 *   <li>check the drawdown limit and, when enabled, the margin requirement</li>
 * </ol>
 * Trades still open on the last bar are closed at its close.
 *
 * <p>Runs share nothing: all mutable state of a run lives in a private {@link RunState}, so
 * independent runs may execute concurrently on the same bar series.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BacktestService {

    /**
     * Bars that must precede the first solicited signal
     */
    public static final int MIN_WARMUP_BARS = 50;

    static final double DEFAULT_STOP_DISTANCE = 0.02;
    static final double DEFAULT_TARGET_DISTANCE = 0.02;

    private final CostModel costModel;
    private final PositionSizingService positionSizingService;
    private final SignalCollectionService signalCollectionService;
    private final ExitRuleEvaluator exitRuleEvaluator;
    private final MarketConditionAnalyzer marketConditionAnalyzer;
    private final PerformanceMetricsService performanceMetricsService;

    /**
     * Run {@code strategy} over {@code bars}.
     *
     * @param strategy strategy to replay
     * @param bars bar series, timestamps strictly increasing; never modified
     * @param config run parameters
     * @return the run report
     * @throws IllegalArgumentException if the bar timestamps do not strictly increase
     * @throws BacktestException if a provider times out or the simulation fails unexpectedly
     */
    public BacktestResult run(BacktestStrategy strategy, List<Bar> bars, BacktestConfig config) {
        List<Bar> series = List.copyOf(bars);
        validateSeries(series);

        RunState state = new RunState(strategy, config);
        if (series.isEmpty()) {
            log.warn("⚠️ Empty bar series for strategy {}, nothing to simulate", strategy.name());
            state.warnings.add("Empty bar series");
            return state.toResult(series);
        }
        if (series.size() <= MIN_WARMUP_BARS) {
            state.warnings.add("Series of %d bars does not exceed the %d-bar warm-up; no signals solicited"
                    .formatted(series.size(), MIN_WARMUP_BARS));
        }

        log.info("🚀 Backtest started: strategy={}, bars={}, capital={}",
                strategy.name(), series.size(), config.initialCapital());

        try {
            for (int i = 0; i < series.size(); i++) {
                processBar(state, series, i);
            }
        } catch (BacktestException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BacktestException(ErrorCode.SIMULATION_ERROR,
                    "Simulation of %s failed: %s".formatted(strategy.name(), e.getMessage()), e);
        }

        BacktestResult result = state.toResult(series);
        PerformanceReport report = result.getReport();
        log.info("✅ Backtest completed: strategy={}, trades={}, return={}%, sharpe={}, maxDD={}",
                strategy.name(), report.getTotalTrades(), String.format("%.2f", report.getTotalReturnPct()),
                String.format("%.3f", report.getSharpeRatio()), String.format("%.4f", report.getMaxDrawdown()));
        return result;
    }

    private void processBar(RunState state, List<Bar> series, int index) {
        Bar bar = series.get(index);
        boolean lastBar = index == series.size() - 1;
        BacktestConfig config = state.config;

        if (config.compounding().isPeriodic()) {
            long period = config.compounding().periodKey(bar.timestamp());
            if (period != state.currentPeriod) {
                state.currentPeriod = period;
                state.sizingCapital = state.capital;
            }
        }

        List<CandidateSignal> candidates = List.of();
        if (index >= MIN_WARMUP_BARS) {
            SignalBatch batch = signalCollectionService.collect(
                    state.strategy.providers(), series.subList(0, index + 1), config.providerTimeout());
            candidates = batch.candidates();
            for (String failed : batch.failedProviders()) {
                state.providerFailures.merge(failed, 1, Integer::sum);
            }
        }

        processExits(state, bar, candidates);

        if (lastBar) {
            for (Trade trade : state.openTrades) {
                closeTrade(state, trade, bar, ExitReason.END_OF_RUN);
            }
            state.openTrades.clear();
        } else if (!candidates.isEmpty() && !state.drawdownHalted) {
            processEntries(state, series, index, candidates);
        }

        double equity = state.capital;
        for (Trade trade : state.openTrades) {
            equity += trade.unrealizedPnl(bar.close());
        }
        state.peakEquity = Math.max(state.peakEquity, equity);
        EquityPoint point = EquityPoint.of(bar.timestamp(), equity, state.peakEquity);
        state.equityCurve.add(point);

        if (!state.drawdownHalted && point.drawdown() > config.maxDrawdownLimit()) {
            state.drawdownHalted = true;
            log.warn("⚠️ Drawdown {} exceeded limit {} at {}, no new trades for {}",
                    String.format("%.4f", point.drawdown()), config.maxDrawdownLimit(), bar.timestamp(),
                    state.strategy.name());
        }

        if (state.marginChecksEnabled()) {
            double requiredEquity = state.capital * config.marginRequirement();
            if (equity < requiredEquity) {
                state.marginEvents.add(new MarginEvent(bar.timestamp(), equity, requiredEquity, state.openTrades.size()));
                log.warn("⚠️ Margin call at {}: equity={} required={} open={}",
                        bar.timestamp(), equity, requiredEquity, state.openTrades.size());
            }
        }
    }

    private void processExits(RunState state, Bar bar, List<CandidateSignal> candidates) {
        Iterator<Trade> iterator = state.openTrades.iterator();
        while (iterator.hasNext()) {
            Trade trade = iterator.next();
            Optional<ExitReason> reason = exitRuleEvaluator.evaluate(trade, bar, candidates, state.config);
            if (reason.isPresent()) {
                closeTrade(state, trade, bar, reason.get());
                iterator.remove();
            }
        }
    }

    private void processEntries(RunState state, List<Bar> series, int index, List<CandidateSignal> candidates) {
        BacktestConfig config = state.config;
        Bar bar = series.get(index);
        double price = bar.close();

        List<CandidateSignal> accepted = candidates.stream()
                .filter(signal -> state.strategy.filter().accepts(signal, price))
                .sorted(Comparator.comparingDouble(CandidateSignal::getConfidence).reversed())
                .toList();

        for (CandidateSignal signal : accepted) {
            if (state.openTrades.size() >= config.maxOpenPositions()) {
                break;
            }
            double stopLoss = signal.getStopLoss() != null ? signal.getStopLoss() : defaultStop(signal.getDirection(), price);
            Double takeProfit = signal.getTakeProfit() != null
                    ? signal.getTakeProfit()
                    : defaultTarget(signal.getDirection(), price);

            PositionSizeResult size = positionSizingService.calculate(
                    state.sizingCapital(), signal, price, stopLoss, config.riskPerTrade());
            if (size.isRejected()) {
                state.rejectedSignals++;
                log.debug("Signal from {} rejected at {}: {}", signal.getSource(), bar.timestamp(), size.reasoning());
                continue;
            }

            double volatility = marketConditionAnalyzer.trailingVolatility(series, index, config.volatilityWindow());
            double averageVolume = marketConditionAnalyzer.averageVolume(series, index, config.volatilityWindow(),
                    config.costModel().defaultAverageVolume());
            TradeCosts costs = costModel.calculate(size.quantity(), price, volatility, averageVolume, config.costModel());

            Trade trade = Trade.builder()
                    .id(++state.tradeSequence)
                    .direction(signal.getDirection())
                    .entryPrice(price)
                    .entryTime(bar.timestamp())
                    .quantity(size.quantity())
                    .stopLoss(stopLoss)
                    .takeProfit(takeProfit)
                    .costs(costs)
                    .confidence(signal.getConfidence())
                    .source(signal.getSource())
                    .marketConditions(marketConditionAnalyzer.analyze(series, index))
                    .build();
            state.openTrades.add(trade);
            log.debug("📈 Opened {} #{} {} x{} @ {} (stop={}, target={}, cost={})",
                    state.strategy.name(), trade.getId(), trade.getDirection(), trade.getQuantity(), price,
                    stopLoss, takeProfit, costs.total());
        }
    }

    private void closeTrade(RunState state, Trade trade, Bar bar, ExitReason reason) {
        trade.close(bar.close(), bar.timestamp(), reason);
        state.capital += trade.getPnl();
        state.closedTrades.add(trade);
        log.debug("📉 Closed {} #{} ({}) @ {} pnl={}",
                state.strategy.name(), trade.getId(), reason.getDescription(), bar.close(), trade.getPnl());
    }

    static double defaultStop(SignalDirection direction, double price) {
        return direction == SignalDirection.BUY
                ? price * (1 - DEFAULT_STOP_DISTANCE)
                : price * (1 + DEFAULT_STOP_DISTANCE);
    }

    static double defaultTarget(SignalDirection direction, double price) {
        return direction == SignalDirection.BUY
                ? price * (1 + DEFAULT_TARGET_DISTANCE)
                : price * (1 - DEFAULT_TARGET_DISTANCE);
    }

    private void validateSeries(List<Bar> series) {
        for (int i = 1; i < series.size(); i++) {
            if (!series.get(i).timestamp().isAfter(series.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Bar timestamps must strictly increase: %s at index %d follows %s"
                        .formatted(series.get(i).timestamp(), i, series.get(i - 1).timestamp()));
            }
        }
    }

    /**
     * Mutable ledger of one run.
     */
    private final class RunState {
        private final BacktestStrategy strategy;
        private final BacktestConfig config;

        private final List<Trade> openTrades = new ArrayList<>();
        private final List<Trade> closedTrades = new ArrayList<>();
        private final List<EquityPoint> equityCurve = new ArrayList<>();
        private final List<MarginEvent> marginEvents = new ArrayList<>();
        private final Map<String, Integer> providerFailures = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();

        private double capital;
        private double sizingCapital;
        private double peakEquity;
        private long currentPeriod = Long.MIN_VALUE;
        private long tradeSequence;
        private int rejectedSignals;
        private boolean drawdownHalted;

        private RunState(BacktestStrategy strategy, BacktestConfig config) {
            this.strategy = strategy;
            this.config = config;
            this.capital = config.initialCapital();
            this.sizingCapital = config.initialCapital();
            this.peakEquity = config.initialCapital();
        }

        private double sizingCapital() {
            return switch (config.compounding()) {
                case NONE -> config.initialCapital();
                case PER_TRADE -> capital;
                case DAILY, WEEKLY, MONTHLY -> sizingCapital;
            };
        }

        private boolean marginChecksEnabled() {
            return config.marginChecksEnabled(strategy.enableLeverage());
        }

        private BacktestResult toResult(List<Bar> series) {
            PerformanceReport report = performanceMetricsService.calculate(closedTrades, equityCurve, config);
            return BacktestResult.builder()
                    .strategyName(strategy.name())
                    .config(config)
                    .periodStart(series.isEmpty() ? null : series.get(0).timestamp())
                    .periodEnd(series.isEmpty() ? null : series.get(series.size() - 1).timestamp())
                    .barCount(series.size())
                    .trades(closedTrades)
                    .equityCurve(equityCurve)
                    .report(report)
                    .marginEvents(marginEvents)
                    .providerFailures(providerFailures)
                    .rejectedSignals(rejectedSignals)
                    .drawdownHalted(drawdownHalted)
                    .warnings(warnings)
                    .build();
        }
    }
}

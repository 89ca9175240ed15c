package tw.gc.quant.backtest.services;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.entities.EquityPoint;
import tw.gc.quant.backtest.entities.MarginEvent;
import tw.gc.quant.backtest.entities.Trade;
import tw.gc.quant.backtest.services.metrics.PerformanceReport;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full report of one simulated run. Produced once by {@link BacktestService} and never
 * modified afterwards.
 */
@Value
@Builder
public class BacktestResult {

    String strategyName;
    BacktestConfig config;
    Instant periodStart;
    Instant periodEnd;
    int barCount;

    @Singular
    List<Trade> trades;
    @Singular("equityPoint")
    List<EquityPoint> equityCurve;
    PerformanceReport report;

    @Singular
    List<MarginEvent> marginEvents;
    /** Provider name to number of bars on which it threw */
    @Singular
    Map<String, Integer> providerFailures;
    /** Accepted candidates the sizer turned down (zero stop distance, zero quantity) */
    int rejectedSignals;
    /** Set once drawdown exceeded the configured limit; no trade was opened afterwards */
    boolean drawdownHalted;
    @Singular
    List<String> warnings;

    public boolean isMarginCallTriggered() {
        return !marginEvents.isEmpty();
    }

    public double getFinalEquity() {
        return report.getFinalEquity();
    }

    public double getSharpeRatio() {
        return report.getSharpeRatio();
    }

    public double getMaxDrawdown() {
        return report.getMaxDrawdown();
    }

    public double getTotalReturnPct() {
        return report.getTotalReturnPct();
    }

    public double getObjectiveValue() {
        return report.getObjectiveValue();
    }
}

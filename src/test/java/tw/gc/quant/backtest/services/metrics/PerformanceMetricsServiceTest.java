package tw.gc.quant.backtest.services.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.entities.EquityPoint;
import tw.gc.quant.backtest.entities.Trade;
import tw.gc.quant.backtest.enums.ExitReason;
import tw.gc.quant.backtest.enums.OptimizationTarget;
import tw.gc.quant.backtest.services.metrics.SortinoRatio.SortinoState;
import tw.gc.quant.backtest.testutil.BarSeriesFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.quant.backtest.testutil.TradeFactory.closedLong;
import static tw.gc.quant.backtest.testutil.TradeFactory.curve;

@DisplayName("PerformanceMetricsService")
class PerformanceMetricsServiceTest {

    private PerformanceMetricsService service;

    @BeforeEach
    void setUp() {
        service = new PerformanceMetricsService();
    }

    @Nested
    @DisplayName("Trade statistics")
    class TradeStatistics {

        @Test
        @DisplayName("should report zero profit factor without losses")
        void shouldReportZeroProfitFactorWithoutLosses() {
            List<Trade> trades = List.of(closedLong(110, 1), closedLong(120, 1));

            PerformanceReport report = service.calculate(trades, curve(1000, 1009, 1028), 1000);

            assertThat(report.getProfitFactor()).isZero();
            assertThat(report.getWinRate()).isEqualTo(1.0);
            assertThat(report.getKellyCriterion()).isZero();
        }

        @Test
        @DisplayName("should exclude pushes from the win rate")
        void shouldExcludePushes() {
            Trade win = closedLong(200, 1);
            Trade loss = closedLong(50, 1);
            Trade push = closedLong(100.5, 1);

            PerformanceReport report = service.calculate(List.of(win, loss, push), curve(1000, 1047.5), 1000);

            assertThat(push.isPush()).isTrue();
            assertThat(report.getTotalTrades()).isEqualTo(3);
            assertThat(report.getPushes()).isEqualTo(1);
            assertThat(report.getWinRate()).isEqualTo(0.5);
            assertThat(report.getProfitFactor()).isCloseTo(99.0 / 51.0, within(1e-9));
            assertThat(report.getBestTrade()).isCloseTo(99.0, within(1e-9));
            assertThat(report.getWorstTrade()).isCloseTo(-51.0, within(1e-9));
        }

        @Test
        @DisplayName("should compute the Kelly criterion from wins and losses")
        void shouldComputeKelly() {
            // p = 0.6, avg win 100, avg loss 50
            assertThat(service.kellyCriterion(3, 2, 300, 100)).isCloseTo(0.4, within(1e-9));
            assertThat(service.kellyCriterion(3, 0, 300, 0)).isZero();
        }

        @Test
        @DisplayName("should count streaks in ledger order with pushes breaking them")
        void shouldCountStreaks() {
            List<Trade> trades = List.of(
                    closedLong(110, 1), closedLong(110, 1), closedLong(90, 1),
                    closedLong(110, 1), closedLong(100.5, 1),
                    closedLong(110, 1), closedLong(110, 1), closedLong(110, 1));

            assertThat(service.maxConsecutive(trades, true)).isEqualTo(3);
            assertThat(service.maxConsecutive(trades, false)).isEqualTo(1);
        }

        @Test
        @DisplayName("should split costs and tally exit reasons")
        void shouldSplitCosts() {
            List<Trade> trades = List.of(closedLong(110, 2), closedLong(90, 3));

            PerformanceReport report = service.calculate(trades, curve(1000, 1005), 1000);

            assertThat(report.getTotalFees()).isCloseTo(5.0, within(1e-9));
            assertThat(report.getTotalSlippage()).isZero();
            assertThat(report.getTotalCosts()).isCloseTo(5.0, within(1e-9));
            assertThat(report.getExitReasons()).containsEntry(ExitReason.SIGNAL_EXIT, 2);
            assertThat(report.getAverageTradeDuration()).isEqualTo(Duration.ofHours(1));
        }
    }

    @Nested
    @DisplayName("Risk metrics")
    class RiskMetrics {

        @Test
        @DisplayName("should compute historical VaR and inclusive CVaR at 95%")
        void shouldComputeVarAndCvar() {
            double[] returns = new double[20];
            Arrays.fill(returns, 0.01);
            returns[3] = -0.05;
            returns[11] = -0.03;

            assertThat(service.valueAtRisk(returns)).isEqualTo(-0.03);
            assertThat(service.conditionalValueAtRisk(returns)).isCloseTo(-0.04, within(1e-12));
        }

        @Test
        @DisplayName("should report zero Sharpe for constant returns")
        void shouldReportZeroSharpeForConstantReturns() {
            assertThat(service.sharpeRatio(new double[]{0.01, 0.01, 0.01}, 0.0)).isZero();
            assertThat(service.sharpeRatio(new double[0], 0.0)).isZero();
        }

        @Test
        @DisplayName("should compute Sharpe from population deviation")
        void shouldComputeSharpe() {
            // mean 0.01, population deviation 0.01
            assertThat(service.sharpeRatio(new double[]{0.0, 0.02}, 0.0)).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("should distinguish the Sortino states")
        void shouldDistinguishSortinoStates() {
            assertThat(service.sortinoRatio(new double[0]).state()).isEqualTo(SortinoState.INSUFFICIENT_DATA);
            assertThat(service.sortinoRatio(new double[]{0.01, 0.02}).state()).isEqualTo(SortinoState.NO_DOWNSIDE);
            assertThat(service.sortinoRatio(new double[]{-0.01, -0.01}).state()).isEqualTo(SortinoState.INSUFFICIENT_DATA);
            assertThat(service.sortinoRatio(new double[]{0.0, 0.0}).state()).isEqualTo(SortinoState.INSUFFICIENT_DATA);

            SortinoRatio defined = service.sortinoRatio(new double[]{0.03, -0.01});
            assertThat(defined.isDefined()).isTrue();
            // mean 0.01, downside deviation |-0.01 - 0.01| = 0.02
            assertThat(defined.value()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("should derive drawdown and Calmar from the equity curve")
        void shouldComputeCalmar() {
            PerformanceReport report = service.calculate(List.of(), curve(1000, 1200, 900, 1100), 1000);

            assertThat(report.getMaxDrawdown()).isCloseTo(0.25, within(1e-9));
            assertThat(report.getCalmarRatio()).isCloseTo(0.1 / 0.25, within(1e-9));
            assertThat(report.getTotalReturnPct()).isCloseTo(10.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Returns")
    class Returns {

        @Test
        @DisplayName("should include zero returns")
        void shouldIncludeZeroReturns() {
            double[] returns = service.periodReturns(curve(100, 100, 110));

            assertThat(returns).containsExactly(0.0, 0.1);
        }

        @Test
        @DisplayName("should annualize over the curve's time span")
        void shouldAnnualize() {
            Instant start = BarSeriesFactory.START;
            List<EquityPoint> yearLong = List.of(
                    EquityPoint.of(start, 1000, 1000),
                    EquityPoint.of(start.plus(Duration.ofDays(365)), 1100, 1100));

            assertThat(service.annualizedReturn(yearLong, 1000, 1100)).isCloseTo(0.1, within(1e-9));
            assertThat(service.annualizedReturn(curve(1000), 1000, 1000)).isZero();
        }

        @Test
        @DisplayName("should cap the annualized return of a short explosive run")
        void shouldCapAnnualizedReturn() {
            Instant start = BarSeriesFactory.START;
            List<EquityPoint> hour = List.of(
                    EquityPoint.of(start, 1000, 1000),
                    EquityPoint.of(start.plus(Duration.ofHours(1)), 2000, 2000));
            List<EquityPoint> minute = List.of(
                    EquityPoint.of(start, 1000, 1000),
                    EquityPoint.of(start.plus(Duration.ofMinutes(1)), 5000, 5000));

            double hourly = service.annualizedReturn(hour, 1000, 2000);
            double perMinute = service.annualizedReturn(minute, 1000, 5000);

            assertThat(hourly).isEqualTo(PerformanceMetricsService.MAX_ANNUALIZED_RETURN);
            assertThat(perMinute).isEqualTo(PerformanceMetricsService.MAX_ANNUALIZED_RETURN);
            assertThat((hourly + perMinute) / 2).isFinite();
        }

        @Test
        @DisplayName("should group returns by calendar month and skip single-sample months")
        void shouldGroupMonthlyReturns() {
            Instant jan1 = Instant.parse("2024-01-01T00:00:00Z");
            List<EquityPoint> points = List.of(
                    EquityPoint.of(jan1, 1000, 1000),
                    EquityPoint.of(Instant.parse("2024-01-15T00:00:00Z"), 1100, 1100),
                    EquityPoint.of(Instant.parse("2024-02-01T00:00:00Z"), 1100, 1100));

            List<MonthlyReturn> monthly = service.monthlyReturns(points);

            assertThat(monthly).hasSize(1);
            assertThat(monthly.get(0).month()).isEqualTo(YearMonth.of(2024, 1));
            assertThat(monthly.get(0).returnPct()).isCloseTo(0.1, within(1e-9));
        }

        @Test
        @DisplayName("should pick the objective from the optimization target")
        void shouldPickObjective() {
            BacktestConfig profit = BacktestConfig.defaults().optimizationTarget(OptimizationTarget.PROFIT).build();

            PerformanceReport report = service.calculate(List.of(), curve(10_000, 10_250), profit);

            assertThat(report.getObjectiveValue()).isCloseTo(250.0, within(1e-9));
        }

        @Test
        @DisplayName("should rank a run without losing bars above a run with losses under SORTINO")
        void shouldRankNoDownsideAboveDefinedSortino() {
            BacktestConfig sortino = BacktestConfig.defaults().optimizationTarget(OptimizationTarget.SORTINO).build();

            PerformanceReport monotone = service.calculate(List.of(), curve(10_000, 10_100, 10_200, 10_300), sortino);
            PerformanceReport lossy = service.calculate(List.of(), curve(10_000, 10_300, 10_250, 10_600), sortino);

            assertThat(monotone.getSortino().state()).isEqualTo(SortinoState.NO_DOWNSIDE);
            assertThat(lossy.getSortino().state()).isEqualTo(SortinoState.DEFINED);
            assertThat(monotone.getObjectiveValue()).isGreaterThan(lossy.getObjectiveValue());
        }

        @Test
        @DisplayName("should score a flat run zero under SORTINO")
        void shouldScoreFlatRunZero() {
            BacktestConfig sortino = BacktestConfig.defaults().optimizationTarget(OptimizationTarget.SORTINO).build();

            PerformanceReport flat = service.calculate(List.of(), curve(10_000, 10_000, 10_000), sortino);

            assertThat(flat.getSortino().state()).isEqualTo(SortinoState.INSUFFICIENT_DATA);
            assertThat(flat.getObjectiveValue()).isZero();
        }
    }
}

package tw.gc.quant.backtest.services.regime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.services.regime.MarketRegimeService.MarketRegime;
import tw.gc.quant.backtest.services.regime.MarketRegimeService.RegimeAnalysis;
import tw.gc.quant.backtest.testutil.BarFixtures;
import tw.gc.quant.backtest.testutil.BarSeriesFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MarketRegimeService")
class MarketRegimeServiceTest {

    private MarketRegimeService service;

    @BeforeEach
    void setUp() {
        service = new MarketRegimeService();
    }

    private static List<Bar> alternating(int count, double swing) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = i % 2 == 0 ? 100.0 : 100.0 * (1 + swing);
        }
        return BarSeriesFactory.fromCloses(closes);
    }

    @Nested
    @DisplayName("Regime Detection")
    class RegimeDetection {

        @Test
        @DisplayName("should detect ranging in a flat market")
        void shouldDetectRanging() {
            RegimeAnalysis analysis = service.analyze(BarSeriesFactory.flat(30, 100.0));

            assertThat(analysis.regime()).isEqualTo(MarketRegime.RANGING);
            assertThat(analysis.shouldReduceExposure()).isFalse();
        }

        @Test
        @DisplayName("should detect a steady rally as trending up")
        void shouldDetectTrendingUp() {
            RegimeAnalysis analysis = service.analyze(BarSeriesFactory.trending(30, 100.0, 0.01));

            assertThat(analysis.regime()).isEqualTo(MarketRegime.TRENDING_UP);
            assertThat(analysis.plusDI()).isGreaterThan(analysis.minusDI());
            assertThat(analysis.adx()).isGreaterThanOrEqualTo(25.0);
        }

        @Test
        @DisplayName("should detect a gentle decline as trending down")
        void shouldDetectTrendingDown() {
            assertThat(service.analyze(BarSeriesFactory.trending(30, 100.0, -0.003)).regime())
                    .isEqualTo(MarketRegime.TRENDING_DOWN);
        }

        @Test
        @DisplayName("should detect high volatility from wide swings")
        void shouldDetectHighVolatility() {
            RegimeAnalysis analysis = service.analyze(alternating(30, 0.03));

            assertThat(analysis.regime()).isEqualTo(MarketRegime.HIGH_VOLATILITY);
            assertThat(analysis.shouldReduceExposure()).isTrue();
        }

        @Test
        @DisplayName("should detect crisis from extreme volatility or a deep drawdown")
        void shouldDetectCrisis() {
            assertThat(service.analyze(alternating(30, 0.05)).regime()).isEqualTo(MarketRegime.CRISIS);
            assertThat(service.analyze(BarSeriesFactory.trending(30, 100.0, -0.01)).regime())
                    .isEqualTo(MarketRegime.CRISIS);
        }

        @Test
        @DisplayName("should assume ranging with fewer than three bars")
        void shouldAssumeRangingWhenShort() {
            assertThat(service.analyze(BarSeriesFactory.flat(2, 100.0)).regime()).isEqualTo(MarketRegime.RANGING);
        }

        @Test
        @DisplayName("should let the price change decide between ADX 20 and 25")
        void shouldUsePriceChangeInGreyZone() {
            assertThat(service.classifyRegime(22, 10, 10, 5, 0, 0.01)).isEqualTo(MarketRegime.TRENDING_UP);
            assertThat(service.classifyRegime(22, 10, 10, 5, 0, -0.01)).isEqualTo(MarketRegime.TRENDING_DOWN);
            assertThat(service.classifyRegime(22, 10, 10, 5, 0, 0.0)).isEqualTo(MarketRegime.RANGING);
        }
    }

    @Nested
    @DisplayName("Series classification")
    class SeriesClassification {

        @Test
        @DisplayName("should classify every bar")
        void shouldClassifyEveryBar() {
            List<Bar> bars = BarFixtures.load("btcusdt-1h.json");

            MarketRegime[] regimes = service.classifySeries(bars);

            assertThat(regimes).hasSize(bars.size()).doesNotContainNull();
        }

        @Test
        @DisplayName("should not look past the classified bar")
        void shouldNotLookAhead() {
            List<Bar> bars = BarFixtures.load("btcusdt-1h.json");

            MarketRegime[] full = service.classifySeries(bars);
            MarketRegime[] prefix = service.classifySeries(bars.subList(0, 200));

            assertThat(prefix).containsExactly(Arrays.copyOf(full, 200));
        }

        @Test
        @DisplayName("should count bars per regime")
        void shouldCountDistribution() {
            Map<MarketRegime, Integer> distribution = service.distribution(BarSeriesFactory.flat(40, 100.0));

            assertThat(distribution).containsExactly(entry(MarketRegime.RANGING, 40));
        }
    }

    @Nested
    @DisplayName("Indicators")
    class Indicators {

        @Test
        @DisplayName("should measure drawdown from the window peak")
        void shouldMeasureDrawdown() {
            assertThat(service.calculateDrawdown(BarSeriesFactory.fromCloses(100, 120, 90)))
                    .isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("should report zero volatility for a flat window")
        void shouldReportZeroVolatility() {
            assertThat(service.calculateAnnualizedVolatility(BarSeriesFactory.flat(10, 100.0))).isZero();
        }
    }
}

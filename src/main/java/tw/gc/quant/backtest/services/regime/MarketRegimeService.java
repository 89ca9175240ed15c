package tw.gc.quant.backtest.services.regime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.entities.Bar;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Market Regime Detection Service classifying each bar of a series into one of five regimes.
 *
 * <p>Classification looks only at the trailing window ending at the bar:
 * <ul>
 *   <li><b>CRISIS:</b> annualized volatility above 50% or a drawdown from the window peak above 15%</li>
 *   <li><b>HIGH_VOLATILITY:</b> annualized volatility above 30%</li>
 *   <li><b>TRENDING_UP / TRENDING_DOWN:</b> ADX of 25 or more, direction from +DI versus -DI</li>
 *   <li><b>RANGING:</b> ADX below 20</li>
 * </ul>
 * Between ADX 20 and 25 the window's net price change decides.
 *
 * <p>Used by the strategy comparator to measure how a strategy performs in each regime.
 */
@Service
@Slf4j
public class MarketRegimeService {

    // ===== ADX THRESHOLDS =====
    /** ADX above this indicates a trending market */
    private static final double ADX_TRENDING_THRESHOLD = 25.0;
    /** ADX below this indicates a ranging/choppy market */
    private static final double ADX_RANGING_THRESHOLD = 20.0;

    // ===== VOLATILITY THRESHOLDS (annualized %) =====
    private static final double HIGH_VOLATILITY_THRESHOLD = 30.0;
    private static final double CRISIS_VOLATILITY_THRESHOLD = 50.0;

    private static final double CRISIS_DRAWDOWN_THRESHOLD = 0.15;
    private static final double WEAK_TREND_CHANGE = 0.005;

    private static final int ADX_PERIOD = 14;
    /** Trailing bars examined per classification */
    static final int REGIME_WINDOW = 30;
    private static final double ANNUALIZATION_FACTOR = Math.sqrt(252);

    /**
     * Market regime classification enum.
     */
    public enum MarketRegime {
        TRENDING_UP("Trending Up", "Momentum/Breakout strategies optimal"),
        TRENDING_DOWN("Trending Down", "Short/Defensive strategies optimal"),
        RANGING("Ranging", "Mean reversion strategies optimal"),
        HIGH_VOLATILITY("High Volatility", "Reduce exposure, widen stops"),
        CRISIS("Crisis", "Exit positions, preserve capital");

        private final String displayName;
        private final String recommendation;

        MarketRegime(String displayName, String recommendation) {
            this.displayName = displayName;
            this.recommendation = recommendation;
        }

        public String getDisplayName() {
            return displayName;
        }

        public String getRecommendation() {
            return recommendation;
        }
    }

    /**
     * Indicators behind one classification.
     */
    public record RegimeAnalysis(
            MarketRegime regime,
            double adx,
            double plusDI,
            double minusDI,
            double volatility,
            double drawdown,
            double priceChange,
            String rationale
    ) {
        public boolean shouldReduceExposure() {
            return regime == MarketRegime.HIGH_VOLATILITY || regime == MarketRegime.CRISIS;
        }
    }

    /**
     * Classify every bar of {@code bars} from its trailing window.
     *
     * @return regime per bar, same length and order as {@code bars}
     */
    public MarketRegime[] classifySeries(List<Bar> bars) {
        MarketRegime[] regimes = new MarketRegime[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            int from = Math.max(0, i - REGIME_WINDOW + 1);
            regimes[i] = analyze(bars.subList(from, i + 1)).regime();
        }
        return regimes;
    }

    /**
     * Number of bars spent in each regime.
     */
    public Map<MarketRegime, Integer> distribution(List<Bar> bars) {
        Map<MarketRegime, Integer> counts = new EnumMap<>(MarketRegime.class);
        for (MarketRegime regime : classifySeries(bars)) {
            counts.merge(regime, 1, Integer::sum);
        }
        log.debug("📊 Regime distribution over {} bars: {}", bars.size(), counts);
        return counts;
    }

    /**
     * Classify the last bar of {@code window}.
     */
    public RegimeAnalysis analyze(List<Bar> window) {
        if (window.size() < 3) {
            return new RegimeAnalysis(MarketRegime.RANGING, 0, 0, 0, 0, 0, 0, "Insufficient data, assuming ranging");
        }

        double[] adxResult = calculateADX(window);
        double volatility = calculateAnnualizedVolatility(window);
        double drawdown = calculateDrawdown(window);
        double firstClose = window.get(0).close();
        double priceChange = (window.get(window.size() - 1).close() - firstClose) / firstClose;

        MarketRegime regime = classifyRegime(adxResult[0], adxResult[1], adxResult[2], volatility, drawdown, priceChange);
        String rationale = String.format("ADX=%.1f +DI=%.1f -DI=%.1f vol=%.1f%% dd=%.2f%% change=%.2f%%",
                adxResult[0], adxResult[1], adxResult[2], volatility, drawdown * 100, priceChange * 100);
        return new RegimeAnalysis(regime, adxResult[0], adxResult[1], adxResult[2], volatility, drawdown,
                priceChange, rationale);
    }

    MarketRegime classifyRegime(double adx, double plusDI, double minusDI, double volatility,
                                double drawdown, double priceChange) {
        if (volatility > CRISIS_VOLATILITY_THRESHOLD || drawdown > CRISIS_DRAWDOWN_THRESHOLD) {
            return MarketRegime.CRISIS;
        }
        if (volatility > HIGH_VOLATILITY_THRESHOLD) {
            return MarketRegime.HIGH_VOLATILITY;
        }
        if (adx >= ADX_TRENDING_THRESHOLD) {
            return plusDI >= minusDI ? MarketRegime.TRENDING_UP : MarketRegime.TRENDING_DOWN;
        }
        if (adx < ADX_RANGING_THRESHOLD) {
            return MarketRegime.RANGING;
        }
        if (priceChange > WEAK_TREND_CHANGE) {
            return MarketRegime.TRENDING_UP;
        }
        if (priceChange < -WEAK_TREND_CHANGE) {
            return MarketRegime.TRENDING_DOWN;
        }
        return MarketRegime.RANGING;
    }

    /**
     * ADX and directional indicators with Wilder's smoothing. DX stands in for ADX.
     *
     * @return array: [ADX, +DI, -DI]
     */
    double[] calculateADX(List<Bar> bars) {
        int size = bars.size();
        int period = Math.min(ADX_PERIOD, size - 1);
        if (period < 1) {
            return new double[]{0, 0, 0};
        }

        double[] trueRange = new double[size];
        double[] plusDM = new double[size];
        double[] minusDM = new double[size];
        for (int i = 1; i < size; i++) {
            Bar current = bars.get(i);
            Bar prev = bars.get(i - 1);

            trueRange[i] = Math.max(current.high() - current.low(),
                    Math.max(Math.abs(current.high() - prev.close()), Math.abs(current.low() - prev.close())));

            double upMove = current.high() - prev.high();
            double downMove = prev.low() - current.low();
            plusDM[i] = (upMove > downMove && upMove > 0) ? upMove : 0;
            minusDM[i] = (downMove > upMove && downMove > 0) ? downMove : 0;
        }

        double smoothedTR = 0;
        double smoothedPlusDM = 0;
        double smoothedMinusDM = 0;
        for (int i = 1; i <= period; i++) {
            smoothedTR += trueRange[i];
            smoothedPlusDM += plusDM[i];
            smoothedMinusDM += minusDM[i];
        }
        for (int i = period + 1; i < size; i++) {
            smoothedTR = smoothedTR - (smoothedTR / period) + trueRange[i];
            smoothedPlusDM = smoothedPlusDM - (smoothedPlusDM / period) + plusDM[i];
            smoothedMinusDM = smoothedMinusDM - (smoothedMinusDM / period) + minusDM[i];
        }

        double plusDI = smoothedTR > 0 ? (smoothedPlusDM / smoothedTR) * 100 : 0;
        double minusDI = smoothedTR > 0 ? (smoothedMinusDM / smoothedTR) * 100 : 0;
        double diSum = plusDI + minusDI;
        double dx = diSum > 0 ? (Math.abs(plusDI - minusDI) / diSum) * 100 : 0;
        return new double[]{dx, plusDI, minusDI};
    }

    /**
     * Root-mean-square of log returns, annualized, as a percentage.
     */
    double calculateAnnualizedVolatility(List<Bar> bars) {
        double sumSquaredReturns = 0;
        int count = 0;
        for (int i = 1; i < bars.size(); i++) {
            double logReturn = Math.log(bars.get(i).close() / bars.get(i - 1).close());
            sumSquaredReturns += logReturn * logReturn;
            count++;
        }
        if (count < 2) {
            return 0;
        }
        return Math.sqrt(sumSquaredReturns / count) * ANNUALIZATION_FACTOR * 100;
    }

    /**
     * Decline of the last close from the highest close of the window, as a decimal.
     */
    double calculateDrawdown(List<Bar> bars) {
        double peak = 0;
        for (Bar bar : bars) {
            peak = Math.max(peak, bar.close());
        }
        double last = bars.get(bars.size() - 1).close();
        return peak > 0 ? (peak - last) / peak : 0;
    }
}

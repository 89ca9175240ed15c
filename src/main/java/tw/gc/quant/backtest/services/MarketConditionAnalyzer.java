package tw.gc.quant.backtest.services;

import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.entities.Bar;

import java.util.ArrayList;
import java.util.List;

/**
 * Trailing-window statistics of a bar series: volatility and average volume for the cost
 * model, and the descriptive market-condition tags recorded on each trade at entry.
 *
 * <p>Every method only looks at bars up to {@code index}; nothing after the current bar is read.
 */
@Service
public class MarketConditionAnalyzer {

    public static final int CONDITION_WINDOW = 20;
    private static final int MIN_CONDITION_BARS = 10;
    private static final double TRADING_DAYS_PER_YEAR = 252.0;

    /**
     * Annualized volatility of close-to-close returns over the {@code window} bars ending at
     * {@code index} (inclusive). Zero when fewer than two prices are available.
     */
    public double trailingVolatility(List<Bar> bars, int index, int window) {
        int from = Math.max(0, index - window);
        List<Double> closes = new ArrayList<>(index - from + 1);
        for (int i = from; i <= index; i++) {
            closes.add(bars.get(i).close());
        }
        return standardDeviationOfReturns(closes) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /**
     * Mean volume of the {@code window} bars preceding {@code index}; {@code fallback} when
     * there are none or they carry no volume.
     */
    public double averageVolume(List<Bar> bars, int index, int window, double fallback) {
        int from = Math.max(0, index - window);
        if (from >= index) {
            return fallback;
        }
        double sum = 0.0;
        for (int i = from; i < index; i++) {
            sum += bars.get(i).volume();
        }
        double average = sum / (index - from);
        return average > 0 ? average : fallback;
    }

    /**
     * Trend, volatility and volume tags for the bar at {@code index}, measured against the
     * preceding {@value #CONDITION_WINDOW} bars. Empty with fewer than ten preceding bars.
     */
    public List<String> analyze(List<Bar> bars, int index) {
        int from = Math.max(0, index - CONDITION_WINDOW);
        List<Bar> previous = bars.subList(from, index);
        if (previous.size() < MIN_CONDITION_BARS) {
            return List.of();
        }

        Bar current = bars.get(index);
        double firstClose = previous.get(0).close();
        double priceChange = (current.close() - firstClose) / firstClose;
        double volatility = standardDeviationOfReturns(previous.stream().map(Bar::close).toList());

        List<String> conditions = new ArrayList<>(3);
        if (priceChange > 0.02) {
            conditions.add("strong_uptrend");
        } else if (priceChange > 0.005) {
            conditions.add("uptrend");
        } else if (priceChange < -0.02) {
            conditions.add("strong_downtrend");
        } else if (priceChange < -0.005) {
            conditions.add("downtrend");
        } else {
            conditions.add("sideways");
        }

        if (volatility > 0.03) {
            conditions.add("high_volatility");
        } else if (volatility > 0.015) {
            conditions.add("moderate_volatility");
        } else {
            conditions.add("low_volatility");
        }

        double avgVolume = previous.stream().mapToDouble(Bar::volume).average().orElse(0.0);
        if (current.volume() > avgVolume * 1.5) {
            conditions.add("high_volume");
        } else if (current.volume() < avgVolume * 0.7) {
            conditions.add("low_volume");
        }
        return conditions;
    }

    /**
     * Population standard deviation of simple returns of {@code prices}.
     */
    static double standardDeviationOfReturns(List<Double> prices) {
        if (prices.size() < 2) {
            return 0.0;
        }
        int n = prices.size() - 1;
        double[] returns = new double[n];
        double sum = 0.0;
        for (int i = 1; i < prices.size(); i++) {
            returns[i - 1] = (prices.get(i) - prices.get(i - 1)) / prices.get(i - 1);
            sum += returns[i - 1];
        }
        double mean = sum / n;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        return Math.sqrt(variance / n);
    }
}

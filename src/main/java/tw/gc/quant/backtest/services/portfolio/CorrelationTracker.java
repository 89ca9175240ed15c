package tw.gc.quant.backtest.services.portfolio;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation Tracker measuring how closely strategies' equity returns move together.
 *
 * <p>Key thresholds:
 * <ul>
 *   <li>High correlation warning: &gt; 0.7</li>
 *   <li>Critical correlation: &gt; 0.85</li>
 * </ul>
 */
@Service
@Slf4j
public class CorrelationTracker {

    /**
     * High correlation threshold (warning).
     */
    static final double HIGH_CORRELATION_THRESHOLD = 0.7;

    /**
     * Critical correlation threshold.
     */
    static final double CRITICAL_CORRELATION_THRESHOLD = 0.85;

    /**
     * Fewest paired observations a correlation is computed from.
     */
    static final int MIN_OBSERVATIONS = 10;

    /**
     * Correlation level classification.
     */
    public enum CorrelationLevel {
        NEGATIVE,    // < 0
        LOW,         // 0 - 0.3
        MODERATE,    // 0.3 - 0.7
        HIGH,        // 0.7 - 0.85
        CRITICAL     // > 0.85
    }

    /**
     * Symmetric correlation matrix over named series, unit diagonal.
     */
    public record CorrelationMatrix(List<String> names, double[][] values) {

        public CorrelationMatrix {
            names = List.copyOf(names);
            if (values.length != names.size()) {
                throw new IllegalArgumentException("Matrix size %d does not match %d names"
                        .formatted(values.length, names.size()));
            }
        }

        public double get(String first, String second) {
            return values[names.indexOf(first)][names.indexOf(second)];
        }

        /**
         * Nested map view, row name to column name to correlation, in name order.
         */
        public Map<String, Map<String, Double>> asMap() {
            Map<String, Map<String, Double>> map = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                Map<String, Double> row = new LinkedHashMap<>();
                for (int j = 0; j < names.size(); j++) {
                    row.put(names.get(j), values[i][j]);
                }
                map.put(names.get(i), row);
            }
            return map;
        }
    }

    /**
     * Pearson correlation of two return series over their common prefix.
     *
     * @return correlation coefficient; 0 with fewer than ten observations or a flat series
     */
    public double calculateCorrelation(double[] returns1, double[] returns2) {
        if (returns1 == null || returns2 == null) {
            return 0.0;
        }

        int n = Math.min(returns1.length, returns2.length);
        if (n < MIN_OBSERVATIONS) {
            return 0.0; // Insufficient data
        }

        double mean1 = 0.0, mean2 = 0.0;
        for (int i = 0; i < n; i++) {
            mean1 += returns1[i];
            mean2 += returns2[i];
        }
        mean1 /= n;
        mean2 /= n;

        double covariance = 0.0;
        double var1 = 0.0, var2 = 0.0;
        for (int i = 0; i < n; i++) {
            double d1 = returns1[i] - mean1;
            double d2 = returns2[i] - mean2;
            covariance += d1 * d2;
            var1 += d1 * d1;
            var2 += d2 * d2;
        }

        double std1 = Math.sqrt(var1 / (n - 1));
        double std2 = Math.sqrt(var2 / (n - 1));
        if (std1 < 1e-10 || std2 < 1e-10) {
            return 0.0;
        }

        double correlation = (covariance / (n - 1)) / (std1 * std2);
        return Math.max(-1.0, Math.min(1.0, correlation));
    }

    /**
     * Pairwise correlation of every series in {@code returnsByName}, keyed in iteration order.
     * Pairs without enough data get 0, so an undeterminable matrix is the identity.
     */
    public CorrelationMatrix correlationMatrix(Map<String, double[]> returnsByName) {
        List<String> names = new ArrayList<>(returnsByName.keySet());
        int size = names.size();
        double[][] values = new double[size][size];
        for (int i = 0; i < size; i++) {
            values[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                double correlation = calculateCorrelation(returnsByName.get(names.get(i)), returnsByName.get(names.get(j)));
                values[i][j] = correlation;
                values[j][i] = correlation;
            }
        }
        return new CorrelationMatrix(names, values);
    }

    /**
     * Pairs whose correlation reaches the high threshold, as "a/b" labels.
     */
    public List<String> highlyCorrelatedPairs(CorrelationMatrix matrix) {
        List<String> pairs = new ArrayList<>();
        List<String> names = matrix.names();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                CorrelationLevel level = classifyCorrelation(matrix.values()[i][j]);
                if (level == CorrelationLevel.HIGH || level == CorrelationLevel.CRITICAL) {
                    pairs.add(names.get(i) + "/" + names.get(j));
                    log.debug("High correlation {} between {} and {}", matrix.values()[i][j], names.get(i), names.get(j));
                }
            }
        }
        return pairs;
    }

    public CorrelationLevel classifyCorrelation(double correlation) {
        double absCorr = Math.abs(correlation);

        if (correlation < 0) {
            return CorrelationLevel.NEGATIVE;
        } else if (absCorr < 0.3) {
            return CorrelationLevel.LOW;
        } else if (absCorr < HIGH_CORRELATION_THRESHOLD) {
            return CorrelationLevel.MODERATE;
        } else if (absCorr < CRITICAL_CORRELATION_THRESHOLD) {
            return CorrelationLevel.HIGH;
        } else {
            return CorrelationLevel.CRITICAL;
        }
    }
}

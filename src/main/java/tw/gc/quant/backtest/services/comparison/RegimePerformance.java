package tw.gc.quant.backtest.services.comparison;

import tw.gc.quant.backtest.services.regime.MarketRegimeService.MarketRegime;

import java.util.Map;

/**
 * Equity return a strategy earned while each market regime was active.
 *
 * @param returnByRegime summed bar-over-bar equity returns per regime
 * @param barsByRegime number of bars classified into each regime
 * @param score mean of {@code returnByRegime} over the regimes that occurred
 */
public record RegimePerformance(
        Map<MarketRegime, Double> returnByRegime,
        Map<MarketRegime, Integer> barsByRegime,
        double score
) {
    public RegimePerformance {
        returnByRegime = Map.copyOf(returnByRegime);
        barsByRegime = Map.copyOf(barsByRegime);
    }

    public static RegimePerformance empty() {
        return new RegimePerformance(Map.of(), Map.of(), 0.0);
    }
}

package tw.gc.quant.backtest.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.strategy.CandidateSignal;

/**
 * Position Sizing Service turning a candidate signal into an executable quantity.
 *
 * <p>Sizing is fixed-fractional risk: the amount at risk between entry and stop is
 * {@code capital * riskPerTrade}. Two caps then apply:
 * <ul>
 *   <li><b>Quarter Kelly:</b> when the signal carries win-rate, average win and average loss</li>
 *   <li><b>Hard cap:</b> no single position exceeds 20% of capital</li>
 * </ul>
 *
 * <p>Quantities are floored to two decimals. A zero quantity means the signal is rejected.
 */
@Service
@Slf4j
public class PositionSizingService {

    /**
     * Maximum position value as a fraction of capital (hard cap)
     */
    static final double MAX_POSITION_PCT = 0.20;

    /**
     * Fraction of full Kelly applied as a cap
     */
    static final double KELLY_FRACTION = 0.25;

    private static final double QUANTITY_PRECISION = 100.0;

    /**
     * Result record containing position size and reasoning.
     */
    public record PositionSizeResult(
            double quantity,
            double positionValue,
            double positionPct,
            String method,
            String reasoning
    ) {
        public static PositionSizeResult of(double quantity, double price, double capital, String method, String reasoning) {
            double positionValue = quantity * price;
            double positionPct = capital > 0 ? positionValue / capital : 0;
            return new PositionSizeResult(quantity, positionValue, positionPct, method, reasoning);
        }

        public static PositionSizeResult rejected(String reasoning) {
            return new PositionSizeResult(0.0, 0.0, 0.0, "REJECTED", reasoning);
        }

        public boolean isRejected() {
            return quantity <= 0;
        }
    }

    /**
     * Size a position for {@code signal} entered at {@code price} with the given stop.
     *
     * @param capital capital available for sizing
     * @param signal candidate signal, consulted for Kelly statistics
     * @param price entry price
     * @param stopLoss effective stop-loss price
     * @param riskPerTrade fraction of capital risked per trade, in (0, 1]
     * @return position size result, rejected when the stop distance is zero or capital is non-positive
     */
    public PositionSizeResult calculate(double capital, CandidateSignal signal, double price, double stopLoss,
                                        double riskPerTrade) {
        if (capital <= 0) {
            return PositionSizeResult.rejected("Non-positive capital: " + capital);
        }
        if (price <= 0) {
            return PositionSizeResult.rejected("Non-positive price: " + price);
        }
        double stopDistance = Math.abs(price - stopLoss);
        if (stopDistance == 0) {
            log.debug("Zero stop distance for {} signal at {}, rejecting", signal.getDirection(), price);
            return PositionSizeResult.rejected("Zero stop distance");
        }

        double riskAmount = capital * riskPerTrade;
        double quantity = riskAmount / stopDistance;
        String method = "FIXED_RISK";

        if (signal.hasKellyStatistics()) {
            double kelly = kellyFraction(signal.getWinRate(), signal.getAverageWin(), Math.abs(signal.getAverageLoss()));
            double kellyCap = capital * Math.max(0, kelly * KELLY_FRACTION) / price;
            if (kellyCap < quantity) {
                quantity = kellyCap;
                method = "QUARTER_KELLY";
            }
        }

        double hardCap = capital * MAX_POSITION_PCT / price;
        if (hardCap < quantity) {
            quantity = hardCap;
            method = "MAX_POSITION_CAP";
        }

        quantity = Math.floor(quantity * QUANTITY_PRECISION) / QUANTITY_PRECISION;
        if (quantity <= 0) {
            return PositionSizeResult.rejected("Quantity rounds to zero (" + method + ")");
        }

        String reasoning = String.format("Risk %.2f over stop distance %.4f", riskAmount, stopDistance);
        return PositionSizeResult.of(quantity, price, capital, method, reasoning);
    }

    /**
     * Kelly fraction {@code (p * avgWin - (1 - p) * avgLoss) / avgWin}.
     */
    public double kellyFraction(double winRate, double averageWin, double averageLoss) {
        if (averageWin <= 0) {
            return 0.0;
        }
        return (winRate * averageWin - (1 - winRate) * averageLoss) / averageWin;
    }
}

package tw.gc.quant.backtest.entities;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import tw.gc.quant.backtest.enums.ExitReason;
import tw.gc.quant.backtest.strategy.CandidateSignal.SignalDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One simulated position.
 *
 * <p>Everything known at entry is fixed when the trade is built. The exit fields are written
 * exactly once by {@link #close(double, Instant, ExitReason)}; a trade is never reopened.
 */
@Getter
@ToString
public class Trade {

    private final long id;
    private final SignalDirection direction;
    private final double entryPrice;
    private final Instant entryTime;
    private final double quantity;
    private final double stopLoss;
    private final Double takeProfit;
    private final TradeCosts costs;
    private final double confidence;
    private final String source;
    private final List<String> marketConditions;

    private Double exitPrice;
    private Instant exitTime;
    private ExitReason exitReason;
    private Double pnl;
    private double riskRewardRatio;

    @Builder
    private Trade(long id, SignalDirection direction, double entryPrice, Instant entryTime, double quantity,
                  double stopLoss, Double takeProfit, TradeCosts costs, double confidence, String source,
                  List<String> marketConditions) {
        if (direction == null || direction == SignalDirection.HOLD) {
            throw new IllegalArgumentException("Trade direction must be BUY or SELL");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Trade quantity must be positive, got: " + quantity);
        }
        if (entryTime == null) {
            throw new IllegalArgumentException("Trade entry time must not be null");
        }
        this.id = id;
        this.direction = direction;
        this.entryPrice = entryPrice;
        this.entryTime = entryTime;
        this.quantity = quantity;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.costs = costs != null ? costs : TradeCosts.ZERO;
        this.confidence = confidence;
        this.source = source;
        this.marketConditions = marketConditions != null ? List.copyOf(marketConditions) : List.of();
    }

    /**
     * Close the trade and realize its P&L net of costs.
     *
     * @throws IllegalStateException if the trade is already closed
     * @throws IllegalArgumentException if {@code exitTime} precedes the entry time
     */
    public void close(double price, Instant time, ExitReason reason) {
        if (isClosed()) {
            throw new IllegalStateException("Trade " + id + " is already closed");
        }
        if (time.isBefore(entryTime)) {
            throw new IllegalArgumentException("Exit time %s precedes entry time %s".formatted(time, entryTime));
        }
        this.exitPrice = price;
        this.exitTime = time;
        this.exitReason = reason;
        this.pnl = grossPnl(price) - costs.total();

        double riskAmount = Math.abs(entryPrice - stopLoss) * quantity;
        this.riskRewardRatio = riskAmount > 0 ? Math.abs(pnl) / riskAmount : 0.0;
    }

    /**
     * Directional P&L at {@code price} before costs.
     */
    public double grossPnl(double price) {
        return direction == SignalDirection.BUY
                ? (price - entryPrice) * quantity
                : (entryPrice - price) * quantity;
    }

    /**
     * Mark-to-market P&L at {@code price}, net of the costs paid at entry.
     */
    public double unrealizedPnl(double price) {
        return grossPnl(price) - costs.total();
    }

    public double notional() {
        return entryPrice * quantity;
    }

    public double totalCost() {
        return costs.total();
    }

    public boolean isClosed() {
        return exitTime != null;
    }

    /**
     * Costs dominated the move: {@code |pnl| < totalCost}.
     */
    public boolean isPush() {
        return isClosed() && Math.abs(pnl) < costs.total();
    }

    public boolean isWin() {
        return isClosed() && !isPush() && pnl > 0;
    }

    public boolean isLoss() {
        return isClosed() && !isPush() && pnl <= 0;
    }

    /**
     * Profitable, but returned less than the amount risked.
     */
    public boolean isPartialWin() {
        return isClosed() && pnl > 0 && riskRewardRatio < 1.0;
    }

    public Duration holdingDuration() {
        return isClosed() ? Duration.between(entryTime, exitTime) : Duration.ZERO;
    }
}

package tw.gc.quant.backtest.entities;

/**
 * Execution cost breakdown of one trade, in account currency. Every component is non-negative.
 */
public record TradeCosts(
        double commission,
        double slippage,
        double impact,
        double liquidity,
        double latency
) {
    public static final TradeCosts ZERO = new TradeCosts(0, 0, 0, 0, 0);

    public TradeCosts {
        if (commission < 0 || slippage < 0 || impact < 0 || liquidity < 0 || latency < 0) {
            throw new IllegalArgumentException("Cost components must be non-negative");
        }
    }

    public double total() {
        return commission + slippage + impact + liquidity + latency;
    }
}

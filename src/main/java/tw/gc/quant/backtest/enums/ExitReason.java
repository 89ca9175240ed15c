package tw.gc.quant.backtest.enums;

/**
 * Terminal exit reason of a simulated trade.
 *
 * <p>Declaration order is the evaluation priority: when several exit conditions hold on the
 * same bar, the one declared first wins.
 */
public enum ExitReason {
    STOP_LOSS("Stop Loss"),
    TAKE_PROFIT("Take Profit"),
    SIGNAL_EXIT("Signal Exit"),
    TIME_EXIT("Time Exit"),
    END_OF_RUN("End of run");

    private final String description;

    ExitReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return lower value means higher priority
     */
    public int priority() {
        return ordinal();
    }
}

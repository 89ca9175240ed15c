package tw.gc.quant.backtest.enums;

/**
 * Objective a run is judged by when a single figure of merit is needed.
 */
public enum OptimizationTarget {
    PROFIT,
    SHARPE,
    SORTINO
}

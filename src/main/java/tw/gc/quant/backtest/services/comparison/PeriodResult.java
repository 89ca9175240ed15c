package tw.gc.quant.backtest.services.comparison;

import tw.gc.quant.backtest.services.BacktestResult;

/**
 * One strategy run over one lookback window.
 *
 * @param period window label, e.g. "90D"
 * @param lookbackDays window length in days, counted back from the last bar
 * @param result run report
 */
public record PeriodResult(String period, int lookbackDays, BacktestResult result) {

    public static String label(int lookbackDays) {
        return lookbackDays + "D";
    }

    /**
     * Return over the window as a fraction of initial capital.
     */
    public double periodReturn() {
        return result.getReport().getTotalReturn() / result.getReport().getInitialCapital();
    }

    public double annualizedReturn() {
        return result.getReport().getAnnualizedReturn();
    }

    public double sharpeRatio() {
        return result.getReport().getSharpeRatio();
    }

    public double maxDrawdown() {
        return result.getReport().getMaxDrawdown();
    }

    public double winRate() {
        return result.getReport().getWinRate();
    }

    public int totalTrades() {
        return result.getReport().getTotalTrades();
    }
}

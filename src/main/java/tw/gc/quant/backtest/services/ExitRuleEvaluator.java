package tw.gc.quant.backtest.services;

import org.springframework.stereotype.Component;
import tw.gc.quant.backtest.config.BacktestConfig;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.entities.Trade;
import tw.gc.quant.backtest.enums.ExitReason;
import tw.gc.quant.backtest.strategy.CandidateSignal;
import tw.gc.quant.backtest.strategy.CandidateSignal.SignalDirection;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Exit rules for an open trade, checked against the bar's close in fixed priority:
 * stop-loss, take-profit, opposing signal, holding time. The first rule that fires wins.
 * Forced close at the end of the series is the simulator's job.
 */
@Component
public class ExitRuleEvaluator {

    public Optional<ExitReason> evaluate(Trade trade, Bar bar, List<CandidateSignal> signals, BacktestConfig config) {
        double price = bar.close();

        if (stopLossHit(trade, price)) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (takeProfitHit(trade, price)) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (opposingSignal(trade, signals, config.signalExitConfidence())) {
            return Optional.of(ExitReason.SIGNAL_EXIT);
        }
        if (Duration.between(trade.getEntryTime(), bar.timestamp()).compareTo(config.maxHoldingTime()) > 0) {
            return Optional.of(ExitReason.TIME_EXIT);
        }
        return Optional.empty();
    }

    boolean stopLossHit(Trade trade, double price) {
        return trade.getDirection() == SignalDirection.BUY
                ? price <= trade.getStopLoss()
                : price >= trade.getStopLoss();
    }

    boolean takeProfitHit(Trade trade, double price) {
        Double target = trade.getTakeProfit();
        if (target == null) {
            return false;
        }
        return trade.getDirection() == SignalDirection.BUY
                ? price >= target
                : price <= target;
    }

    boolean opposingSignal(Trade trade, List<CandidateSignal> signals, double minConfidence) {
        SignalDirection opposite = trade.getDirection().opposite();
        for (CandidateSignal signal : signals) {
            if (signal.getDirection() == opposite && signal.getConfidence() > minConfidence) {
                return true;
            }
        }
        return false;
    }
}

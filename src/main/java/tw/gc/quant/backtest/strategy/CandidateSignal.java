package tw.gc.quant.backtest.strategy;

import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

/**
 * Candidate trade produced by a {@link SignalProvider} for one bar.
 * Consumed once by the simulator and never stored beyond the bar it was produced for.
 *
 * <p>Only {@link #direction}, {@link #confidence} and {@link #source} are mandatory; every other
 * field is an explicit optional that the simulator falls back on defaults for.
 */
@Value
@Builder(toBuilder = true)
public class CandidateSignal {

    /**
     * Signal direction
     */
    SignalDirection direction;

    /**
     * Confidence level (0 to 100)
     */
    double confidence;

    /**
     * Provider that produced the signal
     */
    String source;

    /**
     * Suggested stop-loss price, null when the provider has no opinion
     */
    Double stopLoss;

    /**
     * Suggested take-profit price, null when the provider has no opinion
     */
    Double takeProfit;

    /**
     * Signal strength (0.0 to 1.0), null when not reported
     */
    Double strength;

    /**
     * Reward-to-risk ratio reported by the provider, null to derive it from stop and target
     */
    Double riskRewardRatio;

    /**
     * Historical hit rate (0.0 to 1.0) of this setup, used for Kelly capping
     */
    Double winRate;

    /**
     * Historical average winning amount of this setup
     */
    Double averageWin;

    /**
     * Historical average losing amount of this setup (sign ignored)
     */
    Double averageLoss;

    /**
     * Human-readable reason for the signal
     */
    String reason;

    public enum SignalDirection {
        BUY,
        SELL,
        HOLD;

        public SignalDirection opposite() {
            return switch (this) {
                case BUY -> SELL;
                case SELL -> BUY;
                case HOLD -> HOLD;
            };
        }
    }

    public static CandidateSignal buy(double confidence, Double stopLoss, Double takeProfit, String source) {
        return CandidateSignal.builder()
                .direction(SignalDirection.BUY)
                .confidence(confidence)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .source(source)
                .build();
    }

    public static CandidateSignal sell(double confidence, Double stopLoss, Double takeProfit, String source) {
        return CandidateSignal.builder()
                .direction(SignalDirection.SELL)
                .confidence(confidence)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .source(source)
                .build();
    }

    public static CandidateSignal hold(String source, String reason) {
        return CandidateSignal.builder()
                .direction(SignalDirection.HOLD)
                .confidence(0.0)
                .source(source)
                .reason(reason)
                .build();
    }

    public boolean isActionable() {
        return direction == SignalDirection.BUY || direction == SignalDirection.SELL;
    }

    /**
     * Whether historical win-rate, average win and average loss are all available.
     */
    public boolean hasKellyStatistics() {
        return winRate != null && averageWin != null && averageLoss != null && averageWin > 0;
    }

    /**
     * Reward-to-risk ratio at {@code entryPrice}: the reported ratio when present, otherwise
     * derived from the suggested stop and target. Empty when neither is possible.
     */
    public OptionalDouble resolveRiskReward(double entryPrice) {
        if (riskRewardRatio != null) {
            return OptionalDouble.of(riskRewardRatio);
        }
        if (stopLoss == null || takeProfit == null) {
            return OptionalDouble.empty();
        }
        double risk = Math.abs(entryPrice - stopLoss);
        if (risk == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.abs(takeProfit - entryPrice) / risk);
    }
}

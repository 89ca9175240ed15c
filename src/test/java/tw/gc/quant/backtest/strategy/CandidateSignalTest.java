package tw.gc.quant.backtest.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.quant.backtest.strategy.CandidateSignal.SignalDirection;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CandidateSignal")
class CandidateSignalTest {

    @Test
    @DisplayName("should derive reward-to-risk from stop and target")
    void shouldDeriveRiskReward() {
        CandidateSignal signal = CandidateSignal.buy(80, 95.0, 115.0, "test");

        assertThat(signal.resolveRiskReward(100)).hasValue(3.0);
    }

    @Test
    @DisplayName("should leave reward-to-risk empty without stop, target or distance")
    void shouldLeaveRiskRewardEmpty() {
        assertThat(CandidateSignal.buy(80, null, 110.0, "test").resolveRiskReward(100)).isEmpty();
        assertThat(CandidateSignal.buy(80, 100.0, 110.0, "test").resolveRiskReward(100)).isEmpty();
    }

    @Test
    @DisplayName("should require all Kelly statistics with a positive average win")
    void shouldDetectKellyStatistics() {
        CandidateSignal base = CandidateSignal.buy(80, null, null, "test");

        assertThat(base.hasKellyStatistics()).isFalse();
        assertThat(base.toBuilder().winRate(0.6).averageWin(2.0).averageLoss(1.0).build().hasKellyStatistics()).isTrue();
        assertThat(base.toBuilder().winRate(0.6).averageWin(0.0).averageLoss(1.0).build().hasKellyStatistics()).isFalse();
    }

    @Test
    @DisplayName("should flip direction")
    void shouldFlipDirection() {
        assertThat(SignalDirection.BUY.opposite()).isEqualTo(SignalDirection.SELL);
        assertThat(SignalDirection.SELL.opposite()).isEqualTo(SignalDirection.BUY);
        assertThat(SignalDirection.HOLD.opposite()).isEqualTo(SignalDirection.HOLD);
    }

    @Test
    @DisplayName("should build a strategy with default filter and named providers")
    void shouldBuildStrategy() {
        SignalProvider provider = SignalProvider.of("ob", 0.8, window -> List.of());

        BacktestStrategy strategy = BacktestStrategy.builder().name("order-blocks").provider(provider).build();

        assertThat(strategy.filter()).isEqualTo(SignalFilter.defaults());
        assertThat(strategy.providers()).extracting(SignalProvider::name).containsExactly("ob");
        assertThat(strategy.providers().get(0).weight()).isEqualTo(0.8);
        assertThatThrownBy(() -> BacktestStrategy.builder().name(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}

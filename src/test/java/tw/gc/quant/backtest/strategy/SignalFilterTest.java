package tw.gc.quant.backtest.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SignalFilter")
class SignalFilterTest {

    private SignalFilter filter;

    @BeforeEach
    void setUp() {
        filter = SignalFilter.defaults();
    }

    @Nested
    @DisplayName("Acceptance")
    class Acceptance {

        @Test
        @DisplayName("should accept a confident signal with a good reward-to-risk ratio")
        void shouldAcceptGoodSignal() {
            CandidateSignal signal = CandidateSignal.buy(75, 98.0, 104.0, "test");

            assertThat(filter.accepts(signal, 100)).isTrue();
        }

        @Test
        @DisplayName("should reject low confidence")
        void shouldRejectLowConfidence() {
            assertThat(filter.accepts(CandidateSignal.buy(69.9, 98.0, 104.0, "test"), 100)).isFalse();
        }

        @Test
        @DisplayName("should reject weak strength but pass a missing one")
        void shouldCheckStrength() {
            CandidateSignal weak = CandidateSignal.buy(90, null, null, "test").toBuilder().strength(0.5).build();
            CandidateSignal unknown = CandidateSignal.buy(90, null, null, "test");

            assertThat(filter.accepts(weak, 100)).isFalse();
            assertThat(filter.accepts(unknown, 100)).isTrue();
        }

        @Test
        @DisplayName("should reject a poor derived reward-to-risk ratio")
        void shouldRejectPoorRiskReward() {
            // risk 4, reward 2
            assertThat(filter.accepts(CandidateSignal.sell(90, 104.0, 98.0, "test"), 100)).isFalse();
        }

        @Test
        @DisplayName("should prefer the reported ratio over the derived one")
        void shouldPreferReportedRatio() {
            CandidateSignal signal = CandidateSignal.sell(90, 104.0, 98.0, "test").toBuilder().riskRewardRatio(1.5).build();

            assertThat(filter.accepts(signal, 100)).isTrue();
        }

        @Test
        @DisplayName("should never accept HOLD")
        void shouldRejectHold() {
            assertThat(SignalFilter.permissive().accepts(CandidateSignal.hold("test", "no setup"), 100)).isFalse();
        }
    }

    @Test
    @DisplayName("should validate thresholds")
    void shouldValidateThresholds() {
        assertThatThrownBy(() -> new SignalFilter(101, 0.5, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SignalFilter(50, 1.5, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SignalFilter(50, 0.5, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}

package tw.gc.quant.backtest.strategy;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * A named combination of signal providers and the entry filter applied to their output.
 *
 * @param name unique strategy name, used as the key in comparisons and portfolios
 * @param description free-text description
 * @param providers signal providers consulted every bar after warm-up
 * @param filter entry filter for candidates
 * @param enableLeverage whether margin checks apply to this strategy's runs
 */
@Builder(toBuilder = true)
public record BacktestStrategy(
        String name,
        String description,
        @Singular List<SignalProvider> providers,
        SignalFilter filter,
        boolean enableLeverage
) {
    public BacktestStrategy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name must not be blank");
        }
        providers = providers != null ? List.copyOf(providers) : List.of();
        filter = filter != null ? filter : SignalFilter.defaults();
    }
}

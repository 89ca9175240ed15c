package tw.gc.quant.backtest.strategy;

import tw.gc.quant.backtest.entities.Bar;

import java.util.List;

/**
 * Pluggable source of candidate signals (order-block, market-structure, volume-profile,
 * Fibonacci or sentiment analysis, ...). The engine depends only on this contract.
 *
 * <p>Implementations must be deterministic for a given window and must not modify it; the
 * window handed over is read-only. A provider may throw: the engine logs the failure and
 * treats the provider as silent for that bar.
 */
@FunctionalInterface
public interface SignalProvider {

    /**
     * Produce candidate signals for the last bar of {@code window}.
     *
     * @param window bars from the start of the series up to and including the current bar
     * @return ranked candidates, possibly empty, never null
     */
    List<CandidateSignal> provide(List<Bar> window);

    /**
     * Name used in logs and failure counters.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Multiplier applied to the confidence of every candidate this provider emits.
     */
    default double weight() {
        return 1.0;
    }

    /**
     * Wrap a function as a named provider with a confidence weight.
     */
    static SignalProvider of(String name, double weight, SignalProvider delegate) {
        return new SignalProvider() {
            @Override
            public List<CandidateSignal> provide(List<Bar> window) {
                return delegate.provide(window);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public double weight() {
                return weight;
            }
        };
    }

    /**
     * Wrap a function as a named provider with full confidence weight.
     */
    static SignalProvider of(String name, SignalProvider delegate) {
        return of(name, 1.0, delegate);
    }
}

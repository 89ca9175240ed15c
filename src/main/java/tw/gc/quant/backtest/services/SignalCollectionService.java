package tw.gc.quant.backtest.services;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.entities.Bar;
import tw.gc.quant.backtest.exceptions.BacktestException;
import tw.gc.quant.backtest.exceptions.BacktestException.ErrorCode;
import tw.gc.quant.backtest.strategy.CandidateSignal;
import tw.gc.quant.backtest.strategy.SignalProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls every signal provider of a strategy for one bar and gathers their candidates.
 *
 * <p>Providers are called one after another. A provider that throws is logged and treated
 * as silent for the bar. A provider that does not answer within the configured timeout fails
 * the whole run with {@link ErrorCode#PROVIDER_TIMEOUT}.
 */
@Service
@Slf4j
public class SignalCollectionService {

    private static final double MAX_CONFIDENCE = 100.0;

    private final ExecutorService providerExecutor;

    public SignalCollectionService() {
        AtomicInteger threadCount = new AtomicInteger();
        this.providerExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "signal-provider-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Candidates of one bar plus the names of providers that failed on it.
     */
    public record SignalBatch(List<CandidateSignal> candidates, List<String> failedProviders) {
        public SignalBatch {
            candidates = List.copyOf(candidates);
            failedProviders = List.copyOf(failedProviders);
        }

        public static SignalBatch empty() {
            return new SignalBatch(List.of(), List.of());
        }
    }

    /**
     * Solicit candidates from {@code providers} for the last bar of {@code window}.
     * Confidence of every candidate is scaled by its provider's weight.
     *
     * @param timeout upper bound per provider call; zero calls providers inline
     * @throws BacktestException with {@link ErrorCode#PROVIDER_TIMEOUT} if a provider is too slow
     */
    public SignalBatch collect(List<SignalProvider> providers, List<Bar> window, Duration timeout) {
        List<CandidateSignal> candidates = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (SignalProvider provider : providers) {
            try {
                List<CandidateSignal> produced = invoke(provider, window, timeout);
                if (produced == null) {
                    continue;
                }
                for (CandidateSignal signal : produced) {
                    if (signal != null) {
                        candidates.add(weighted(signal, provider));
                    }
                }
            } catch (BacktestException e) {
                throw e;
            } catch (Exception e) {
                log.warn("⚠️ Signal provider {} failed at bar {}: {}",
                        provider.name(), window.size() - 1, e.getMessage());
                failed.add(provider.name());
            }
        }
        return new SignalBatch(candidates, failed);
    }

    private List<CandidateSignal> invoke(SignalProvider provider, List<Bar> window, Duration timeout) throws Exception {
        if (timeout.isZero()) {
            return provider.provide(window);
        }

        CompletableFuture<List<CandidateSignal>> future =
                CompletableFuture.supplyAsync(() -> provider.provide(window), providerExecutor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BacktestException(ErrorCode.PROVIDER_TIMEOUT,
                    "Signal provider %s exceeded %d ms".formatted(provider.name(), timeout.toMillis()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BacktestException(ErrorCode.INTERRUPTED,
                    "Interrupted while waiting for signal provider " + provider.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private CandidateSignal weighted(CandidateSignal signal, SignalProvider provider) {
        double weight = provider.weight();
        if (weight == 1.0) {
            return signal;
        }
        double confidence = Math.min(MAX_CONFIDENCE, Math.max(0.0, signal.getConfidence() * weight));
        return signal.toBuilder().confidence(confidence).build();
    }

    @PreDestroy
    public void shutdown() {
        providerExecutor.shutdownNow();
    }
}

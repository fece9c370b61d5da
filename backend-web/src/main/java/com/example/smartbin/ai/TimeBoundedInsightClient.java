package com.example.smartbin.ai;

import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.prediction.NarrativeInsight;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds every call of the wrapped client by a wall-clock timeout. At most
 * {@value #MAX_CONCURRENT_CALLS} calls run at once; further calls are refused while workers
 * abandoned by a timeout are still draining.
 */
@Slf4j
public class TimeBoundedInsightClient implements DelegatedInsightClient, AutoCloseable {

    static final int MAX_CONCURRENT_CALLS = 4;

    private final DelegatedInsightClient delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundedInsightClient(DelegatedInsightClient delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(0, MAX_CONCURRENT_CALLS, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), runnable -> {
            Thread thread = new Thread(runnable, "delegated-insight-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String provider() {
        return delegate.provider();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public DelegatedAnalysis analyze(List<BinEvent> events) {
        return call("analyze", () -> delegate.analyze(events));
    }

    @Override
    public Optional<NarrativeInsight> predict(String binId, PredictionContext context) {
        return call("predict", () -> delegate.predict(binId, context));
    }

    private <T> T call(String operation, Callable<T> task) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new UpstreamUnavailableException(
                    delegate.provider() + " " + operation + " refused, " + MAX_CONCURRENT_CALLS + " calls still running", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new UpstreamUnavailableException(
                    delegate.provider() + " " + operation + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(delegate.provider() + " " + operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UpstreamUnavailableException upstream) {
                throw upstream;
            }
            throw new UpstreamUnavailableException(
                    delegate.provider() + " " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        log.debug("Shutting down delegated insight executor for {}", delegate.provider());
        executor.shutdownNow();
    }
}

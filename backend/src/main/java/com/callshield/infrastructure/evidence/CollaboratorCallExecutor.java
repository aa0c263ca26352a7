package com.callshield.infrastructure.evidence;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to the signing and persistence collaborators with a per-attempt timeout
 * and exponential-backoff retries.
 */
@Slf4j
@Component
public class CollaboratorCallExecutor {

    private final RetryRegistry retryRegistry;
    private final long callTimeoutMs;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "collaborator-call");
        thread.setDaemon(true);
        return thread;
    });

    public CollaboratorCallExecutor(@Value("${callshield.evidence.max-attempts:3}") int maxAttempts,
                                    @Value("${callshield.evidence.backoff-initial-ms:200}") long backoffInitialMs,
                                    @Value("${callshield.evidence.call-timeout-ms:2000}") long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(backoffInitialMs, 2))
                .build();
        this.retryRegistry = RetryRegistry.of(config);
        this.retryRegistry.getEventPublisher().onEntryAdded(event -> event.getAddedEntry().getEventPublisher()
                .onRetry(retry -> log.warn("Retrying {} call - attempt: {}, cause: {}",
                        retry.getName(), retry.getNumberOfRetryAttempts(),
                        retry.getLastThrowable() != null ? retry.getLastThrowable().getMessage() : "unknown")));
    }

    /**
     * Execute a collaborator call.
     *
     * @throws CollaboratorCallException when every attempt failed or timed out
     */
    public <T> T execute(String collaborator, Supplier<T> call) {
        Retry retry = retryRegistry.retry(collaborator);
        Supplier<T> bounded = Retry.decorateSupplier(retry, () -> callWithTimeout(collaborator, call));
        try {
            return bounded.get();
        } catch (AttemptTimeoutException e) {
            throw new CollaboratorCallException(collaborator, true,
                    collaborator + " call timed out after " + retry.getRetryConfig().getMaxAttempts() + " attempt(s)", e);
        } catch (RuntimeException e) {
            throw new CollaboratorCallException(collaborator, false,
                    collaborator + " call failed after " + retry.getRetryConfig().getMaxAttempts() + " attempt(s)", e);
        }
    }

    public void run(String collaborator, Runnable call) {
        execute(collaborator, () -> {
            call.run();
            return null;
        });
    }

    private <T> T callWithTimeout(String collaborator, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AttemptTimeoutException(collaborator + " did not answer within " + callTimeoutMs + "ms");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(collaborator + " call failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(collaborator + " call interrupted", e);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    static class AttemptTimeoutException extends RuntimeException {
        AttemptTimeoutException(String message) {
            super(message);
        }
    }
}

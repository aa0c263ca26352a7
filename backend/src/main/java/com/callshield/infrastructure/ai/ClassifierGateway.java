package com.callshield.infrastructure.ai;

import com.callshield.domain.threat.service.ScamClassifier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asynchronous, time-bounded access to the external classifier.
 * The returned future never completes exceptionally: failures and timeouts become an absent signal.
 * Callers may complete it early with {@link OptionalDouble#empty()} to preempt a pending call.
 */
@Slf4j
@Component
public class ClassifierGateway {

    private final ScamClassifier classifier;
    private final long timeoutMs;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "scam-classifier");
        thread.setDaemon(true);
        return thread;
    });

    public ClassifierGateway(ScamClassifier classifier,
                             @Value("${callshield.classifier.timeout-ms:1500}") long timeoutMs) {
        this.classifier = classifier;
        this.timeoutMs = timeoutMs;
    }

    public CompletableFuture<OptionalDouble> classifyAsync(String text) {
        return CompletableFuture
                .supplyAsync(() -> classifier.classify(text), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof TimeoutException) {
                        log.warn("Classifier did not answer within {}ms, scoring without it", timeoutMs);
                    } else {
                        log.warn("Classifier failed, scoring without it: {}", cause.getMessage());
                    }
                    return OptionalDouble.empty();
                });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}

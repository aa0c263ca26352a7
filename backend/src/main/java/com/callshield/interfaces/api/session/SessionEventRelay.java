package com.callshield.interfaces.api.session;

import com.callshield.application.session.event.SessionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fans session events out to SSE subscribers. Sends happen on a single relay thread so a slow client
 * never holds up the pipeline and events keep their publication order.
 */
@Slf4j
@Component
public class SessionEventRelay {

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final long emitterTimeoutMs;

    @Autowired
    public SessionEventRelay(@Value("${callshield.stream.emitter-timeout-ms:1800000}") long emitterTimeoutMs) {
        this(emitterTimeoutMs, Executors.newSingleThreadExecutor());
    }

    SessionEventRelay(long emitterTimeoutMs, ExecutorService executor) {
        this.emitterTimeoutMs = emitterTimeoutMs;
        this.executor = executor;
    }

    public SseEmitter subscribe(String sessionId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        subscribers.compute(sessionId, (id, emitters) -> {
            List<SseEmitter> list = emitters == null ? new CopyOnWriteArrayList<>() : emitters;
            list.add(emitter);
            return list;
        });

        Runnable remove = () -> unsubscribe(sessionId, emitter);
        emitter.onCompletion(remove);
        emitter.onTimeout(remove);
        emitter.onError(e -> remove.run());
        return emitter;
    }

    int subscribedSessions() {
        return subscribers.size();
    }

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        List<SseEmitter> emitters = subscribers.get(event.sessionId());
        if (emitters == null || emitters.isEmpty()) {
            return;
        }
        executor.execute(() -> {
            for (SseEmitter emitter : emitters) {
                try {
                    emitter.send(SseEmitter.event()
                            .name(event.eventType())
                            .data(event));
                } catch (IOException | IllegalStateException e) {
                    log.debug("Dropping SSE subscriber for session {}: {}", event.sessionId(), e.getMessage());
                    unsubscribe(event.sessionId(), emitter);
                    emitter.completeWithError(e);
                }
            }
        });
    }

    // The session key goes away with its last subscriber
    private void unsubscribe(String sessionId, SseEmitter emitter) {
        subscribers.computeIfPresent(sessionId, (id, emitters) -> {
            emitters.remove(emitter);
            return emitters.isEmpty() ? null : emitters;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}

package com.callshield.application.session.event;

/**
 * Outbound event. Published synchronously, in per-session order.
 */
public interface SessionEvent {

    String sessionId();

    /**
     * Wire name of the event, e.g. {@code state_changed}.
     */
    String eventType();
}

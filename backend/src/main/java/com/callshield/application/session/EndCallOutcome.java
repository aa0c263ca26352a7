package com.callshield.application.session;

import com.callshield.domain.session.model.CallState;

/**
 * @param duplicate true when the session had already ended and the command was a no-op
 * @param packageId evidence package id, null while assembly is pending or after it failed
 */
public record EndCallOutcome(
        String sessionId,
        CallState state,
        boolean duplicate,
        String packageId
) {}

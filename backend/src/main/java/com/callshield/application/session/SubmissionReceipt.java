package com.callshield.application.session;

import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.session.model.CallState;

public record SubmissionReceipt(
        String packageId,
        String sessionId,
        SubmissionStatus status,
        CallState state
) {}

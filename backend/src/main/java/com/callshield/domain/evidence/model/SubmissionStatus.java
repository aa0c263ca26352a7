package com.callshield.domain.evidence.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review status of an evidence package. Transitions only move forward to an adjacent status.
 */
public enum SubmissionStatus {
    PENDING,
    SUBMITTED,
    UNDER_REVIEW,
    ACKNOWLEDGED,
    RESOLVED,
    REJECTED;

    public Set<SubmissionStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(SUBMITTED);
            case SUBMITTED -> EnumSet.of(UNDER_REVIEW);
            case UNDER_REVIEW -> EnumSet.of(ACKNOWLEDGED, RESOLVED, REJECTED);
            case ACKNOWLEDGED -> EnumSet.of(RESOLVED, REJECTED);
            case RESOLVED, REJECTED -> EnumSet.noneOf(SubmissionStatus.class);
        };
    }

    public boolean canAdvanceTo(SubmissionStatus next) {
        return successors().contains(next);
    }

    public boolean isFinal() {
        return successors().isEmpty();
    }
}

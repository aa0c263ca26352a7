package com.callshield.domain.evidence.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionStatusTest {

    @Test
    @DisplayName("statuses advance one step at a time")
    void adjacent_only() {
        assertThat(SubmissionStatus.PENDING.canAdvanceTo(SubmissionStatus.SUBMITTED)).isTrue();
        assertThat(SubmissionStatus.PENDING.canAdvanceTo(SubmissionStatus.UNDER_REVIEW)).isFalse();
        assertThat(SubmissionStatus.SUBMITTED.canAdvanceTo(SubmissionStatus.UNDER_REVIEW)).isTrue();
        assertThat(SubmissionStatus.SUBMITTED.canAdvanceTo(SubmissionStatus.RESOLVED)).isFalse();
    }

    @Test
    @DisplayName("a review can be acknowledged first or decided directly")
    void review_outcomes() {
        assertThat(SubmissionStatus.UNDER_REVIEW.successors())
                .containsExactlyInAnyOrder(SubmissionStatus.ACKNOWLEDGED, SubmissionStatus.RESOLVED, SubmissionStatus.REJECTED);
        assertThat(SubmissionStatus.ACKNOWLEDGED.successors())
                .containsExactlyInAnyOrder(SubmissionStatus.RESOLVED, SubmissionStatus.REJECTED);
    }

    @Test
    @DisplayName("no status moves backwards and decisions are final")
    void no_regression() {
        assertThat(SubmissionStatus.UNDER_REVIEW.canAdvanceTo(SubmissionStatus.SUBMITTED)).isFalse();
        assertThat(SubmissionStatus.RESOLVED.isFinal()).isTrue();
        assertThat(SubmissionStatus.REJECTED.isFinal()).isTrue();
        assertThat(SubmissionStatus.RESOLVED.canAdvanceTo(SubmissionStatus.REJECTED)).isFalse();
    }
}

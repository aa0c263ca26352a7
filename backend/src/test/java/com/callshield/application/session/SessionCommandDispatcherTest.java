package com.callshield.application.session;

import com.callshield.application.evidence.EvidencePackageView;
import com.callshield.application.evidence.EvidenceReviewService;
import com.callshield.application.session.command.EndCallCommand;
import com.callshield.application.session.command.ReviewStatusUpdateCommand;
import com.callshield.application.session.command.SubmitEvidenceCommand;
import com.callshield.application.session.command.TranscriptFragmentCommand;
import com.callshield.application.session.exception.ErrorCode;
import com.callshield.application.session.exception.OutOfOrderFragmentException;
import com.callshield.application.session.exception.UnknownSessionException;
import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.session.model.CallDirection;
import com.callshield.domain.session.model.CallOutcome;
import com.callshield.domain.session.model.CallState;
import com.callshield.domain.session.model.Speaker;
import com.callshield.domain.threat.model.ThreatLevel;
import com.callshield.infrastructure.evidence.CollaboratorCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionCommandDispatcherTest {

    @Mock
    private CallSessionService sessionService;

    @Mock
    private EvidenceReviewService reviewService;

    private SessionCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new SessionCommandDispatcher(sessionService, reviewService);
    }

    @Test
    @DisplayName("a missing command is malformed")
    void null_command() {
        CommandResult result = dispatcher.dispatch(null);

        assertThat(result.accepted()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.MALFORMED_COMMAND);
        verifyNoInteractions(sessionService, reviewService);
    }

    @Test
    @DisplayName("accepted commands carry the service result")
    void accepted() {
        EndCallOutcome outcome = new EndCallOutcome("s-1", CallState.ENDED, false, "EVP-20260301-000001");
        when(sessionService.endCall(any())).thenReturn(outcome);

        CommandResult result = dispatcher.dispatch(new EndCallCommand("s-1", "user_hung_up"));

        assertThat(result.accepted()).isTrue();
        assertThat(result.command()).isEqualTo("end_call");
        assertThat(result.sessionId()).isEqualTo("s-1");
        assertThat(result.payload()).isEqualTo(outcome);
    }

    @Test
    @DisplayName("pipeline rejections become typed results")
    void rejected() {
        when(sessionService.ingestFragment(any())).thenThrow(new OutOfOrderFragmentException("Fragment 3 was already received"));

        CommandResult result = dispatcher.dispatch(new TranscriptFragmentCommand("s-1", Speaker.CALLER, "hi", 3L));

        assertThat(result.accepted()).isFalse();
        assertThat(result.command()).isEqualTo("transcript_fragment");
        assertThat(result.errorCode()).isEqualTo(ErrorCode.OUT_OF_ORDER_FRAGMENT);
        assertThat(result.message()).contains("Fragment 3");
    }

    @Test
    @DisplayName("unknown sessions are reported, not thrown")
    void unknown_session() {
        when(sessionService.endCall(any())).thenThrow(new UnknownSessionException("ghost"));

        CommandResult result = dispatcher.dispatch(new EndCallCommand("ghost", null));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.UNKNOWN_SESSION);
    }

    @Test
    @DisplayName("a store that keeps failing is reported as a typed result")
    void collaborator_failure() {
        when(reviewService.updateStatus(any())).thenThrow(new CollaboratorCallException("persistence", false,
                "persistence call failed after 3 attempt(s)", new IllegalStateException("store unavailable")));

        CommandResult result = dispatcher.dispatch(new ReviewStatusUpdateCommand("EVP-20260301-000001",
                SubmissionStatus.RESOLVED, null, "officer-12"));

        assertThat(result.accepted()).isFalse();
        assertThat(result.command()).isEqualTo("review_status_update");
        assertThat(result.errorCode()).isEqualTo(ErrorCode.ASSEMBLY_FAILED);
        assertThat(result.message()).contains("persistence");
    }

    @Test
    @DisplayName("a store that keeps timing out is reported as an external timeout")
    void collaborator_timeout() {
        when(sessionService.submitEvidence(any())).thenThrow(new CollaboratorCallException("persistence", true,
                "persistence call timed out after 3 attempt(s)", null));

        CommandResult result = dispatcher.dispatch(new SubmitEvidenceCommand("s-1"));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.EXTERNAL_TIMEOUT);
        assertThat(result.sessionId()).isEqualTo("s-1");
    }

    @Test
    @DisplayName("review updates return a masked package view")
    void review_update() {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        EvidenceMetadata metadata = new EvidenceMetadata("s-1", "device-7", CallDirection.INBOUND, null, at, at,
                "caller_hung_up", CallOutcome.NO_THREAT, 0.0, ThreatLevel.SAFE, null);
        EvidencePackage pkg = new EvidencePackage("EVP-20260301-000001", metadata, List.of(), List.of(),
                "a", "t", "e", "p", "sig", "HmacSHA256", at,
                List.of(new CustodyEntry(CustodyEntry.PACKAGE_CREATED, "system", at, null)), SubmissionStatus.UNDER_REVIEW);
        when(reviewService.updateStatus(any())).thenReturn(pkg);

        CommandResult result = dispatcher.dispatch(new ReviewStatusUpdateCommand("EVP-20260301-000001",
                SubmissionStatus.UNDER_REVIEW, null, "officer-12"));

        assertThat(result.accepted()).isTrue();
        assertThat(result.sessionId()).isNull();
        assertThat(result.payload()).isInstanceOfSatisfying(EvidencePackageView.class, view -> {
            assertThat(view.packageId()).isEqualTo("EVP-20260301-000001");
            assertThat(view.status()).isEqualTo(SubmissionStatus.UNDER_REVIEW);
        });
    }
}

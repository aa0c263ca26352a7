package com.callshield.application.evidence;

import com.callshield.application.session.command.ReviewStatusUpdateCommand;
import com.callshield.application.session.exception.InvalidTransitionException;
import com.callshield.application.session.exception.MalformedCommandException;
import com.callshield.application.session.exception.UnknownPackageException;
import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionDocument;
import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.session.model.CallDirection;
import com.callshield.domain.session.model.CallOutcome;
import com.callshield.domain.session.model.Speaker;
import com.callshield.domain.session.model.TranscriptEntry;
import com.callshield.domain.threat.model.ThreatLevel;
import com.callshield.infrastructure.evidence.CollaboratorCallException;
import com.callshield.infrastructure.evidence.CollaboratorCallExecutor;
import com.callshield.infrastructure.evidence.EvidenceAssembler;
import com.callshield.infrastructure.evidence.EvidenceHasher;
import com.callshield.infrastructure.evidence.HmacSigningService;
import com.callshield.infrastructure.evidence.InMemoryEvidenceRepository;
import com.callshield.infrastructure.evidence.PackageIdGenerator;
import com.callshield.infrastructure.evidence.SubmissionExporter;
import com.callshield.infrastructure.intel.EntityMasker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvidenceReviewServiceTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(STARTED.plusSeconds(300), ZoneOffset.UTC);

    private EvidenceReviewService reviewService;
    private String packageId;

    @BeforeEach
    void setUp() {
        wire(new InMemoryEvidenceRepository());
    }

    private void wire(InMemoryEvidenceRepository repository) {
        CollaboratorCallExecutor executor = new CollaboratorCallExecutor(2, 1, 1_000);
        EvidenceAssembler assembler = new EvidenceAssembler(new EvidenceHasher(), new HmacSigningService("k"),
                repository, new PackageIdGenerator(CLOCK), executor, CLOCK, "system");
        reviewService = new EvidenceReviewService(repository, executor, assembler,
                new SubmissionExporter(new EntityMasker(), CLOCK), CLOCK, "system");

        EvidenceMetadata metadata = new EvidenceMetadata("s-1", "device-7", CallDirection.INBOUND, null,
                STARTED, STARTED.plusSeconds(60), "caller_hung_up", CallOutcome.THREAT_SUSPECTED,
                0.73, ThreatLevel.HIGH, null);
        packageId = assembler.assemble(metadata,
                List.of(new TranscriptEntry(0, 1L, Speaker.CALLER, "your account is blocked", 0.4)),
                List.of()).packageId();
    }

    private EvidencePackage review(SubmissionStatus status) {
        return reviewService.updateStatus(new ReviewStatusUpdateCommand(packageId, status, null, "officer-12"));
    }

    @Nested
    @DisplayName("status transitions")
    class Transitions {

        @Test
        @DisplayName("each change appends exactly one custody entry")
        void one_entry_per_change() {
            reviewService.submit(packageId);
            review(SubmissionStatus.UNDER_REVIEW);
            EvidencePackage resolved = review(SubmissionStatus.RESOLVED);

            assertThat(resolved.status()).isEqualTo(SubmissionStatus.RESOLVED);
            assertThat(resolved.custodyLog()).extracting(CustodyEntry::action).containsExactly(
                    CustodyEntry.PACKAGE_CREATED, "STATUS_SUBMITTED", "STATUS_UNDER_REVIEW", "STATUS_RESOLVED");
            assertThat(resolved.custodyLog().get(3).actor()).isEqualTo("officer-12");
        }

        @Test
        @DisplayName("skipping a status is rejected and leaves no custody trace")
        void skip_rejected() {
            assertThatThrownBy(() -> review(SubmissionStatus.UNDER_REVIEW))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(reviewService.get(packageId).custodyLog()).hasSize(1);
            assertThat(reviewService.get(packageId).status()).isEqualTo(SubmissionStatus.PENDING);
        }

        @Test
        @DisplayName("submission is not a review decision")
        void submitted_via_review() {
            assertThatThrownBy(() -> review(SubmissionStatus.SUBMITTED))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("a package can be acknowledged before it is decided")
        void acknowledged_then_rejected() {
            reviewService.submit(packageId);
            review(SubmissionStatus.UNDER_REVIEW);
            review(SubmissionStatus.ACKNOWLEDGED);

            assertThat(review(SubmissionStatus.REJECTED).status()).isEqualTo(SubmissionStatus.REJECTED);
            assertThatThrownBy(() -> review(SubmissionStatus.RESOLVED))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("the reviewer defaults when none is named")
        void default_reviewer() {
            reviewService.submit(packageId);

            EvidencePackage pkg = reviewService.updateStatus(
                    new ReviewStatusUpdateCommand(packageId, SubmissionStatus.UNDER_REVIEW, "triage", " "));

            CustodyEntry last = pkg.custodyLog().get(pkg.custodyLog().size() - 1);
            assertThat(last.actor()).isEqualTo("reviewer");
            assertThat(last.notes()).isEqualTo("triage");
        }
    }

    @Nested
    @DisplayName("persistence failures")
    class PersistenceFailures {

        private final AtomicInteger failuresLeft = new AtomicInteger();

        @BeforeEach
        void wireFlakyStore() {
            wire(new InMemoryEvidenceRepository() {
                @Override
                public void updateStatus(String id, SubmissionStatus status, CustodyEntry entry) {
                    if (failuresLeft.getAndDecrement() > 0) {
                        throw new IllegalStateException("store unavailable");
                    }
                    super.updateStatus(id, status, entry);
                }
            });
        }

        @Test
        @DisplayName("a status change that never lands leaves no custody entry behind")
        void failed_change_not_logged() {
            failuresLeft.set(Integer.MAX_VALUE);

            assertThatThrownBy(() -> reviewService.submit(packageId))
                    .isInstanceOf(CollaboratorCallException.class);

            EvidencePackage stored = reviewService.get(packageId);
            assertThat(stored.status()).isEqualTo(SubmissionStatus.PENDING);
            assertThat(stored.custodyLog()).extracting(CustodyEntry::action)
                    .containsExactly(CustodyEntry.PACKAGE_CREATED);
        }

        @Test
        @DisplayName("a retried change is recorded once")
        void retried_change_logged_once() {
            failuresLeft.set(1);

            EvidencePackage submitted = reviewService.submit(packageId);

            assertThat(submitted.status()).isEqualTo(SubmissionStatus.SUBMITTED);
            assertThat(submitted.custodyLog()).extracting(CustodyEntry::action)
                    .containsExactly(CustodyEntry.PACKAGE_CREATED, "STATUS_SUBMITTED");
        }

        @Test
        @DisplayName("the caller can retry after a failed change")
        void caller_retry() {
            failuresLeft.set(2);
            assertThatThrownBy(() -> reviewService.submit(packageId))
                    .isInstanceOf(CollaboratorCallException.class);

            EvidencePackage submitted = reviewService.submit(packageId);

            assertThat(submitted.custodyLog()).extracting(CustodyEntry::action)
                    .containsExactly(CustodyEntry.PACKAGE_CREATED, "STATUS_SUBMITTED");
        }
    }

    @Test
    @DisplayName("unknown packages and incomplete commands are rejected")
    void rejected_commands() {
        assertThatThrownBy(() -> reviewService.get("EVP-20260301-999999"))
                .isInstanceOf(UnknownPackageException.class);
        assertThatThrownBy(() -> reviewService.updateStatus(
                new ReviewStatusUpdateCommand("EVP-20260301-999999", SubmissionStatus.RESOLVED, null, null)))
                .isInstanceOf(UnknownPackageException.class);
        assertThatThrownBy(() -> reviewService.updateStatus(
                new ReviewStatusUpdateCommand(packageId, null, null, null)))
                .isInstanceOf(MalformedCommandException.class);
    }

    @Test
    @DisplayName("exporting is recorded in the custody log")
    void export_logged() {
        SubmissionDocument document = reviewService.export(packageId, "officer-12");

        assertThat(document.custodyLog()).extracting(CustodyEntry::action)
                .containsExactly(CustodyEntry.PACKAGE_CREATED, "PACKAGE_EXPORTED");
        assertThat(document.custodyLog().get(1).actor()).isEqualTo("officer-12");
    }

    @Test
    @DisplayName("a stored package verifies after review changes")
    void verify_after_review() {
        reviewService.submit(packageId);

        assertThat(reviewService.verify(packageId).valid()).isTrue();
    }
}

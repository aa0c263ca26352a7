package com.callshield.application.evidence;

import com.callshield.application.session.command.ReviewStatusUpdateCommand;
import com.callshield.application.session.exception.ExternalTimeoutException;
import com.callshield.application.session.exception.InvalidTransitionException;
import com.callshield.application.session.exception.MalformedCommandException;
import com.callshield.application.session.exception.UnknownPackageException;
import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.EvidenceVerification;
import com.callshield.domain.evidence.model.SubmissionDocument;
import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.evidence.repository.EvidenceRepository;
import com.callshield.infrastructure.evidence.CollaboratorCallException;
import com.callshield.infrastructure.evidence.CollaboratorCallExecutor;
import com.callshield.infrastructure.evidence.EvidenceAssembler;
import com.callshield.infrastructure.evidence.SubmissionExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Submission and review lifecycle of evidence packages.
 *
 * Status changes on one package are serialized; each successful change appends exactly one custody entry.
 */
@Slf4j
@Service
public class EvidenceReviewService {

    static final String DEFAULT_REVIEWER = "reviewer";
    static final String PACKAGE_EXPORTED = "PACKAGE_EXPORTED";

    private final EvidenceRepository repository;
    private final CollaboratorCallExecutor callExecutor;
    private final EvidenceAssembler assembler;
    private final SubmissionExporter exporter;
    private final Clock clock;
    private final String systemActor;

    private final ConcurrentMap<String, Object> packageLocks = new ConcurrentHashMap<>();

    public EvidenceReviewService(EvidenceRepository repository,
                                 CollaboratorCallExecutor callExecutor,
                                 EvidenceAssembler assembler,
                                 SubmissionExporter exporter,
                                 Clock clock,
                                 @Value("${callshield.evidence.actor:system}") String systemActor) {
        this.repository = repository;
        this.callExecutor = callExecutor;
        this.assembler = assembler;
        this.exporter = exporter;
        this.clock = clock;
        this.systemActor = systemActor;
    }

    /**
     * Move a PENDING package to SUBMITTED.
     */
    public EvidencePackage submit(String packageId) {
        return advance(packageId, SubmissionStatus.SUBMITTED, systemActor, "Submitted for review");
    }

    /**
     * Reviewer-driven status change. Only the adjacent transitions of {@link SubmissionStatus} are allowed.
     */
    public EvidencePackage updateStatus(ReviewStatusUpdateCommand command) {
        if (command.packageId() == null || command.packageId().isBlank()) {
            throw new MalformedCommandException("package_id is required");
        }
        if (command.newStatus() == null) {
            throw new MalformedCommandException("new_status is required");
        }
        if (command.newStatus() == SubmissionStatus.SUBMITTED) {
            throw new InvalidTransitionException("Packages are submitted with submit_evidence, not by review");
        }
        String actor = command.actor() == null || command.actor().isBlank() ? DEFAULT_REVIEWER : command.actor();
        return advance(command.packageId(), command.newStatus(), actor, command.notes());
    }

    public EvidencePackage get(String packageId) {
        return repository.findById(packageId)
                .orElseThrow(() -> new UnknownPackageException("Unknown evidence package: " + packageId));
    }

    public EvidenceVerification verify(String packageId) {
        EvidenceVerification verification = assembler.verify(get(packageId));
        if (!verification.valid()) {
            log.warn("Evidence package failed verification - packageId: {}, result: {}", packageId, verification);
        }
        return verification;
    }

    /**
     * Render the submission document and log the export in the custody trail.
     */
    public SubmissionDocument export(String packageId, String actor) {
        synchronized (lockFor(packageId)) {
            get(packageId);
            String exportedBy = actor == null || actor.isBlank() ? DEFAULT_REVIEWER : actor;
            CustodyEntry entry = new CustodyEntry(PACKAGE_EXPORTED, exportedBy, clock.instant(), null);
            persist(packageId, () -> repository.appendCustody(packageId, entry));
            return exporter.export(get(packageId));
        }
    }

    private EvidencePackage advance(String packageId, SubmissionStatus next, String actor, String notes) {
        synchronized (lockFor(packageId)) {
            EvidencePackage current = get(packageId);
            if (!current.status().canAdvanceTo(next)) {
                throw new InvalidTransitionException("Package " + packageId + " cannot move from "
                        + current.status() + " to " + next);
            }

            CustodyEntry entry = CustodyEntry.statusChange(next, actor, clock.instant(), notes);
            persist(packageId, () -> repository.updateStatus(packageId, next, entry));

            log.info("Package status changed - packageId: {}, {} -> {}, actor: {}", packageId, current.status(), next, actor);
            return get(packageId);
        }
    }

    private void persist(String packageId, Runnable write) {
        try {
            callExecutor.run("persistence", write);
        } catch (CollaboratorCallException e) {
            if (e.isTimedOut()) {
                throw new ExternalTimeoutException("Persistence timed out for package " + packageId, e);
            }
            throw e;
        }
    }

    private Object lockFor(String packageId) {
        // Only known packages get a lock
        get(packageId);
        return packageLocks.computeIfAbsent(packageId, id -> new Object());
    }
}

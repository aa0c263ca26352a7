package com.callshield.application.session;

import com.callshield.application.evidence.EvidenceReviewService;
import com.callshield.application.profile.ScammerProfileService;
import com.callshield.application.session.SessionHandle.PendingFragment;
import com.callshield.application.session.command.EndCallCommand;
import com.callshield.application.session.command.HandoffRequestCommand;
import com.callshield.application.session.command.HandoffTerminateCommand;
import com.callshield.application.session.command.StartCommand;
import com.callshield.application.session.command.SubmitEvidenceCommand;
import com.callshield.application.session.command.TranscriptFragmentCommand;
import com.callshield.application.session.event.EntitiesExtractedEvent;
import com.callshield.application.session.event.EvidenceReadyEvent;
import com.callshield.application.session.event.PersonaReplyEvent;
import com.callshield.application.session.event.ScoreUpdatedEvent;
import com.callshield.application.session.event.SessionEvent;
import com.callshield.application.session.event.StateChangedEvent;
import com.callshield.application.session.exception.AssemblyFailedException;
import com.callshield.application.session.exception.DuplicateAssemblyException;
import com.callshield.application.session.exception.InvalidTransitionException;
import com.callshield.application.session.exception.MalformedCommandException;
import com.callshield.application.session.exception.OutOfOrderFragmentException;
import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.persona.model.PersonaProfile;
import com.callshield.domain.persona.model.PersonaReply;
import com.callshield.domain.session.model.CallSession;
import com.callshield.domain.session.model.CallState;
import com.callshield.domain.session.model.Speaker;
import com.callshield.domain.session.model.TranscriptEntry;
import com.callshield.domain.threat.model.ThreatAssessment;
import com.callshield.infrastructure.ai.ClassifierGateway;
import com.callshield.infrastructure.evidence.CollaboratorCallException;
import com.callshield.infrastructure.evidence.EvidenceAlreadyAssembledException;
import com.callshield.infrastructure.evidence.EvidenceAssembler;
import com.callshield.infrastructure.intel.EntityExtractor;
import com.callshield.infrastructure.intel.EntityMasker;
import com.callshield.infrastructure.intel.TranscriptNormalizer;
import com.callshield.infrastructure.persona.PersonaOrchestrator;
import com.callshield.infrastructure.threat.ThreatScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-call state machine: IDLE -> CONNECTING -> MONITORING <-> THREAT_DETECTED -> AI_HANDOFF -> ENDED -> REPORTED.
 *
 * All mutation of a session happens under its handle's lock, one logical step at a time. The lock is never held
 * across an external call: fragments release it while the classifier runs, and evidence assembly, signing and
 * persistence run after it is released. Events are published under the lock so they reach listeners in order.
 */
@Slf4j
@Service
public class CallSessionService {

    private final SessionRegistry registry;
    private final TranscriptNormalizer normalizer;
    private final EntityExtractor entityExtractor;
    private final EntityMasker entityMasker;
    private final ThreatScorer threatScorer;
    private final ClassifierGateway classifierGateway;
    private final PersonaOrchestrator personaOrchestrator;
    private final EvidenceAssembler evidenceAssembler;
    private final EvidenceReviewService evidenceReviewService;
    private final ScammerProfileService profileService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final long endDrainTimeoutMs;
    private final int reorderBufferLimit;

    public CallSessionService(SessionRegistry registry,
                              TranscriptNormalizer normalizer,
                              EntityExtractor entityExtractor,
                              EntityMasker entityMasker,
                              ThreatScorer threatScorer,
                              ClassifierGateway classifierGateway,
                              PersonaOrchestrator personaOrchestrator,
                              EvidenceAssembler evidenceAssembler,
                              EvidenceReviewService evidenceReviewService,
                              ScammerProfileService profileService,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock,
                              @Value("${callshield.session.end-drain-timeout-ms:2000}") long endDrainTimeoutMs,
                              @Value("${callshield.session.reorder-buffer-limit:64}") int reorderBufferLimit) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.entityExtractor = entityExtractor;
        this.entityMasker = entityMasker;
        this.threatScorer = threatScorer;
        this.classifierGateway = classifierGateway;
        this.personaOrchestrator = personaOrchestrator;
        this.evidenceAssembler = evidenceAssembler;
        this.evidenceReviewService = evidenceReviewService;
        this.profileService = profileService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.endDrainTimeoutMs = endDrainTimeoutMs;
        this.reorderBufferLimit = reorderBufferLimit;
    }

    /**
     * Create a session. The only command that creates one; it starts out CONNECTING.
     */
    public SessionView start(StartCommand command) {
        requireText(command.sessionId(), "session_id");
        requireText(command.phoneId(), "phone_id");
        if (command.direction() == null) {
            throw new MalformedCommandException("direction is required");
        }

        Instant now = clock.instant();
        CallSession session = new CallSession(command.sessionId(), command.phoneId(), command.direction(),
                command.audioRef(), now);
        // Not yet visible to anyone else, so no lock is needed for the first edge
        CallState previous = session.transitionTo(CallState.CONNECTING, now);
        SessionHandle handle = registry.register(session);

        handle.getLock().lock();
        try {
            log.info("Session started - sessionId: {}, direction: {}", session.getSessionId(), session.getDirection());
            publish(new StateChangedEvent(session.getSessionId(), previous, CallState.CONNECTING, now));
            return toView(handle);
        } finally {
            handle.getLock().unlock();
        }
    }

    /**
     * Ingest one transcript fragment. Fragments are applied strictly in sequence-number order;
     * a fragment ahead of a gap is buffered until the gap fills.
     */
    public FragmentOutcome ingestFragment(TranscriptFragmentCommand command) {
        requireText(command.sessionId(), "session_id");
        if (command.speaker() == null) {
            throw new MalformedCommandException("speaker is required");
        }
        if (command.speaker() == Speaker.PERSONA) {
            throw new MalformedCommandException("persona turns are produced by the pipeline and cannot be submitted");
        }
        if (command.text() == null) {
            throw new MalformedCommandException("text is required");
        }
        if (command.sequenceNumber() == null || command.sequenceNumber() < 1) {
            throw new MalformedCommandException("sequence_number must be 1 or greater");
        }

        SessionHandle handle = registry.require(command.sessionId());
        long sequence = command.sequenceNumber();
        String text = normalizer.normalize(command.text());
        List<ExtractedEntity> entities = entityExtractor.extract(text);

        ReentrantLock lock = handle.getLock();
        CompletableFuture<OptionalDouble> classification;
        lock.lock();
        try {
            CallSession session = handle.getSession();
            if (session.getState().isTerminal() || handle.isEnding()) {
                throw new InvalidTransitionException("Session " + handle.sessionId() + " has ended, fragment "
                        + sequence + " rejected");
            }
            if (handle.isKnownSequence(sequence)) {
                throw new OutOfOrderFragmentException("Fragment " + sequence + " was already received; next expected is "
                        + handle.getNextSequence());
            }
            if (handle.pendingCount() >= reorderBufferLimit) {
                throw new OutOfOrderFragmentException("Reorder buffer full while waiting for fragment "
                        + handle.getNextSequence());
            }
            classification = classifierGateway.classifyAsync(text);
            handle.getInFlight().put(sequence, classification);
        } finally {
            lock.unlock();
        }

        // Never completes exceptionally; times out to an absent signal
        OptionalDouble probability = classification.join();

        lock.lock();
        try {
            handle.getInFlight().remove(sequence);
            try {
                CallSession session = handle.getSession();
                if (session.getState().isTerminal()) {
                    log.warn("Session {} ended while fragment {} was in flight, dropping it", handle.sessionId(), sequence);
                    throw new InvalidTransitionException("Session " + handle.sessionId() + " ended before fragment "
                            + sequence + " could be applied");
                }

                handle.getReorderBuffer().put(sequence,
                        new PendingFragment(sequence, command.speaker(), text, entities, probability));
                int applied = applyReadyFragments(handle);

                FragmentOutcome.Status status = sequence < handle.getNextSequence()
                        ? FragmentOutcome.Status.APPLIED
                        : FragmentOutcome.Status.BUFFERED;
                if (status == FragmentOutcome.Status.BUFFERED) {
                    log.debug("Buffered fragment {} for session {}, waiting for {}",
                            sequence, handle.sessionId(), handle.getNextSequence());
                }
                return new FragmentOutcome(status, sequence, applied, handle.getNextSequence(),
                        session.getState(), session.getRunningScore(), session.getLevel());
            } finally {
                if (handle.getInFlight().isEmpty()) {
                    handle.getDrained().signalAll();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand the call to a persona. Only valid from THREAT_DETECTED; never automatic.
     */
    public SessionView requestHandoff(HandoffRequestCommand command) {
        requireText(command.sessionId(), "session_id");
        PersonaProfile persona = PersonaProfile.fromId(command.personaId())
                .orElseThrow(() -> new MalformedCommandException("Unknown persona: " + command.personaId()));

        SessionHandle handle = registry.require(command.sessionId());
        handle.getLock().lock();
        try {
            CallSession session = handle.getSession();
            if (session.getState() != CallState.THREAT_DETECTED || handle.isEnding()) {
                throw new InvalidTransitionException("Hand-off requires THREAT_DETECTED, session "
                        + handle.sessionId() + " is " + session.getState());
            }

            Instant now = clock.instant();
            handle.setEngagement(personaOrchestrator.engage(persona));
            session.engagePersona(persona);
            transition(handle, CallState.AI_HANDOFF, now);

            // The persona answers what the caller last said
            if (handle.getPendingCallerUtterance() != null) {
                personaTurn(handle, handle.getPendingCallerUtterance(), now);
            }
            return toView(handle);
        } finally {
            handle.getLock().unlock();
        }
    }

    /**
     * End the hand-off and return to MONITORING. The persona's conversational memory is discarded.
     */
    public SessionView terminateHandoff(HandoffTerminateCommand command) {
        requireText(command.sessionId(), "session_id");
        SessionHandle handle = registry.require(command.sessionId());
        handle.getLock().lock();
        try {
            CallSession session = handle.getSession();
            if (session.getState() != CallState.AI_HANDOFF || handle.isEnding()) {
                throw new InvalidTransitionException("No active hand-off for session " + handle.sessionId()
                        + ", state is " + session.getState());
            }

            personaOrchestrator.terminate(handle.getEngagement());
            handle.setEngagement(null);
            session.releasePersona();
            transition(handle, CallState.MONITORING, clock.instant());
            return toView(handle);
        } finally {
            handle.getLock().unlock();
        }
    }

    /**
     * End the call from any state and assemble its evidence package. A repeated end is a no-op.
     *
     * Pending classifier calls are preempted and in-flight fragments get a bounded time to finish;
     * fragments still buffered behind a gap are dropped.
     *
     * @throws AssemblyFailedException if the package could not be signed or stored; the session stays ENDED
     *                                 and {@code submit_evidence} retries the assembly
     */
    public EndCallOutcome endCall(EndCallCommand command) {
        requireText(command.sessionId(), "session_id");
        SessionHandle handle = registry.require(command.sessionId());
        String reason = command.reason() == null || command.reason().isBlank() ? "unspecified" : command.reason().strip();

        EvidenceMetadata metadata;
        List<TranscriptEntry> transcript;
        List<ExtractedEntity> entities;

        handle.getLock().lock();
        try {
            CallSession session = handle.getSession();
            if (session.getState().isTerminal() || handle.isEnding()) {
                log.debug("Duplicate end_call for session {} ignored", handle.sessionId());
                return new EndCallOutcome(handle.sessionId(), session.getState(), true, session.getEvidencePackageId());
            }

            handle.setEnding(true);
            handle.getInFlight().values().forEach(pending -> pending.complete(OptionalDouble.empty()));
            awaitInFlight(handle);

            TreeMap<Long, PendingFragment> buffer = handle.getReorderBuffer();
            if (!buffer.isEmpty()) {
                log.warn("Dropping {} buffered fragment(s) for session {} still waiting for fragment {}",
                        buffer.size(), handle.sessionId(), handle.getNextSequence());
                buffer.clear();
            }
            if (handle.getEngagement() != null) {
                personaOrchestrator.terminate(handle.getEngagement());
                handle.setEngagement(null);
            }

            Instant now = clock.instant();
            session.markEnded(reason, now);
            transition(handle, CallState.ENDED, now);
            log.info("Call ended - sessionId: {}, reason: {}, outcome: {}, peakScore: {}",
                    handle.sessionId(), reason, session.getOutcome(), session.getPeakScore());

            metadata = session.toEvidenceMetadata();
            transcript = session.getTranscript();
            entities = session.getEntities();
        } finally {
            handle.getLock().unlock();
        }

        EvidencePackage evidencePackage = assembleAndAttach(handle, metadata, transcript, entities);
        return new EndCallOutcome(handle.sessionId(), CallState.ENDED, false, evidencePackage.packageId());
    }

    /**
     * Submit the session's evidence package and move the session to REPORTED.
     * Re-runs assembly first if it failed at end of call.
     */
    public SubmissionReceipt submitEvidence(SubmitEvidenceCommand command) {
        requireText(command.sessionId(), "session_id");
        SessionHandle handle = registry.require(command.sessionId());

        String packageId;
        EvidenceMetadata metadata = null;
        List<TranscriptEntry> transcript = List.of();
        List<ExtractedEntity> entities = List.of();

        handle.getLock().lock();
        try {
            CallSession session = handle.getSession();
            if (session.getState() == CallState.REPORTED || handle.isSubmitting()) {
                throw new DuplicateAssemblyException("Evidence for session " + handle.sessionId()
                        + " has already been submitted");
            }
            if (session.getState() != CallState.ENDED) {
                throw new InvalidTransitionException("Evidence can be submitted only after the call has ended, session "
                        + handle.sessionId() + " is " + session.getState());
            }
            handle.setSubmitting(true);
            packageId = session.getEvidencePackageId();
            if (packageId == null) {
                metadata = session.toEvidenceMetadata();
                transcript = session.getTranscript();
                entities = session.getEntities();
            }
        } finally {
            handle.getLock().unlock();
        }

        try {
            if (packageId == null) {
                log.info("Retrying evidence assembly for session {}", handle.sessionId());
                packageId = assembleAndAttach(handle, metadata, transcript, entities).packageId();
            }

            EvidencePackage submitted = evidenceReviewService.submit(packageId);

            handle.getLock().lock();
            try {
                transition(handle, CallState.REPORTED, clock.instant());
            } finally {
                handle.getLock().unlock();
            }
            profileService.recordReport(packageId);

            log.info("Evidence submitted - sessionId: {}, packageId: {}", handle.sessionId(), packageId);
            return new SubmissionReceipt(packageId, handle.sessionId(), submitted.status(), CallState.REPORTED);
        } finally {
            handle.getLock().lock();
            try {
                handle.setSubmitting(false);
            } finally {
                handle.getLock().unlock();
            }
        }
    }

    public SessionView getSession(String sessionId) {
        SessionHandle handle = registry.require(sessionId);
        handle.getLock().lock();
        try {
            return toView(handle);
        } finally {
            handle.getLock().unlock();
        }
    }

    private int applyReadyFragments(SessionHandle handle) {
        int applied = 0;
        TreeMap<Long, PendingFragment> buffer = handle.getReorderBuffer();
        while (!buffer.isEmpty() && buffer.firstKey() == handle.getNextSequence()) {
            applyFragment(handle, buffer.pollFirstEntry().getValue());
            handle.advanceSequence();
            applied++;
        }
        return applied;
    }

    private void applyFragment(SessionHandle handle, PendingFragment fragment) {
        CallSession session = handle.getSession();
        Instant now = clock.instant();

        // Score first; every transition below sees the updated score
        ThreatAssessment assessment = threatScorer.score(handle.getScoringState(), fragment.text(),
                fragment.entities(), fragment.classifierProbability());
        session.applyScore(assessment.runningScore(), assessment.level());
        session.appendTranscript(fragment.sequenceNumber(), fragment.speaker(), fragment.text(), now);
        List<ExtractedEntity> added = session.recordEntities(fragment.entities());

        publish(new ScoreUpdatedEvent(handle.sessionId(), fragment.sequenceNumber(), assessment.runningScore(),
                assessment.level(), assessment.signal(), assessment.indicators(),
                assessment.level().recommendedAction()));
        publishEntities(handle, added);

        if (session.getState() == CallState.CONNECTING) {
            transition(handle, CallState.MONITORING, now);
        }
        evaluateThreat(handle, assessment, now);

        if (fragment.speaker() == Speaker.CALLER) {
            if (session.getState() == CallState.AI_HANDOFF) {
                personaTurn(handle, fragment.text(), now);
            } else {
                handle.setPendingCallerUtterance(fragment.text());
            }
        }
    }

    // Edge-triggered: an alert fires once, and again only after the level has dropped below HIGH
    private void evaluateThreat(SessionHandle handle, ThreatAssessment assessment, Instant now) {
        CallSession session = handle.getSession();
        if (!assessment.level().isAlerting()) {
            session.rearmAlert();
            if (session.getState() == CallState.THREAT_DETECTED) {
                transition(handle, CallState.MONITORING, now);
            }
        } else if (session.getState() == CallState.MONITORING && session.isAlertArmed()) {
            session.recordAlert(now);
            transition(handle, CallState.THREAT_DETECTED, now);
            log.warn("Threat detected - sessionId: {}, score: {}, level: {}, indicators: {}",
                    handle.sessionId(), assessment.runningScore(), assessment.level(), assessment.indicators());
        }
    }

    private void personaTurn(SessionHandle handle, String callerUtterance, Instant now) {
        CallSession session = handle.getSession();
        PersonaReply reply = personaOrchestrator.respond(handle.getEngagement(), callerUtterance);

        publishEntities(handle, session.recordEntities(reply.entities()));
        session.appendTranscript(null, Speaker.PERSONA, reply.text(), now);
        handle.setPendingCallerUtterance(null);
        publish(new PersonaReplyEvent(handle.sessionId(), reply.text(), session.getPersona().id(), reply.turn()));
    }

    private void publishEntities(SessionHandle handle, List<ExtractedEntity> added) {
        if (added.isEmpty()) {
            return;
        }
        log.info("Entities extracted - sessionId: {}, entities: {}", handle.sessionId(), added);
        publish(new EntitiesExtractedEvent(handle.sessionId(), added.stream().map(ExtractedEntity::toView).toList()));
    }

    private void awaitInFlight(SessionHandle handle) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(endDrainTimeoutMs);
        while (!handle.getInFlight().isEmpty() && remaining > 0) {
            try {
                remaining = handle.getDrained().awaitNanos(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!handle.getInFlight().isEmpty()) {
            log.warn("{} fragment(s) still in flight for session {} after {}ms, ending without them",
                    handle.getInFlight().size(), handle.sessionId(), endDrainTimeoutMs);
        }
    }

    private EvidencePackage assembleAndAttach(SessionHandle handle, EvidenceMetadata metadata,
                                              List<TranscriptEntry> transcript, List<ExtractedEntity> entities) {
        EvidencePackage evidencePackage;
        try {
            evidencePackage = evidenceAssembler.assemble(metadata, transcript, entities);
        } catch (EvidenceAlreadyAssembledException e) {
            throw new DuplicateAssemblyException(e.getMessage());
        } catch (CollaboratorCallException e) {
            throw new AssemblyFailedException("Evidence assembly failed for session " + handle.sessionId()
                    + ": " + e.getMessage(), e);
        }

        handle.getLock().lock();
        try {
            handle.getSession().attachEvidence(evidencePackage.packageId());
        } finally {
            handle.getLock().unlock();
        }
        publish(new EvidenceReadyEvent(evidencePackage.packageId(), handle.sessionId()));
        return evidencePackage;
    }

    private void transition(SessionHandle handle, CallState next, Instant at) {
        CallState previous = handle.getSession().transitionTo(next, at);
        log.info("State changed - sessionId: {}, {} -> {}", handle.sessionId(), previous, next);
        publish(new StateChangedEvent(handle.sessionId(), previous, next, at));
    }

    private void publish(SessionEvent event) {
        eventPublisher.publishEvent(event);
    }

    private SessionView toView(SessionHandle handle) {
        CallSession session = handle.getSession();
        List<TranscriptEntry> redacted = session.getTranscript().stream()
                .map(entry -> new TranscriptEntry(entry.ordinal(), entry.sequenceNumber(), entry.speaker(),
                        entityMasker.redact(entry.text(), entityExtractor.extract(entry.text())), entry.score()))
                .toList();

        return new SessionView(
                session.getSessionId(),
                session.getPhoneId(),
                session.getDirection(),
                session.getState(),
                session.getRunningScore(),
                session.getLevel(),
                redacted,
                session.getEntities().stream().map(ExtractedEntity::toView).toList(),
                session.isPersonaActive(),
                session.getPersona() != null ? session.getPersona().id() : null,
                session.getOutcome(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getThreatDetectedAt(),
                session.getAlertCount(),
                session.getPeakScore(),
                session.getEvidencePackageId()
        );
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedCommandException(field + " is required");
        }
    }
}

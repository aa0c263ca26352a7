package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.EvidenceVerification;
import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.evidence.repository.EvidenceRepository;
import com.callshield.domain.evidence.service.SigningService;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.session.model.TranscriptEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the signed evidence package for an ended session.
 *
 * Hashes are computed locally; signing and persistence go through {@link CollaboratorCallExecutor}
 * and may block. A session is assembled at most once: a second attempt is rejected,
 * except after a failed attempt, which releases the session for a retry.
 */
@Slf4j
@Component
public class EvidenceAssembler {

    static final String SIGNING = "signing";
    static final String PERSISTENCE = "persistence";

    private final EvidenceHasher hasher;
    private final SigningService signingService;
    private final EvidenceRepository repository;
    private final PackageIdGenerator idGenerator;
    private final CollaboratorCallExecutor callExecutor;
    private final Clock clock;
    private final String actor;

    private final Set<String> assembledSessions = ConcurrentHashMap.newKeySet();

    public EvidenceAssembler(EvidenceHasher hasher,
                             SigningService signingService,
                             EvidenceRepository repository,
                             PackageIdGenerator idGenerator,
                             CollaboratorCallExecutor callExecutor,
                             Clock clock,
                             @Value("${callshield.evidence.actor:system}") String actor) {
        this.hasher = hasher;
        this.signingService = signingService;
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.callExecutor = callExecutor;
        this.clock = clock;
        this.actor = actor;
    }

    /**
     * Assemble, sign and persist the package.
     *
     * @throws EvidenceAlreadyAssembledException if the session already has (or is building) a package
     * @throws CollaboratorCallException         if signing or persistence failed after all retries
     */
    public EvidencePackage assemble(EvidenceMetadata metadata,
                                    List<TranscriptEntry> transcript,
                                    List<ExtractedEntity> entities) {
        String sessionId = metadata.sessionId();
        if (!assembledSessions.add(sessionId)) {
            throw new EvidenceAlreadyAssembledException(sessionId);
        }
        if (repository.findBySessionId(sessionId).isPresent()) {
            throw new EvidenceAlreadyAssembledException(sessionId);
        }

        try {
            String audioHash = hasher.hashAudio(metadata.audioReference());
            String transcriptHash = hasher.hashTranscript(transcript);
            String entityHash = hasher.hashEntities(entities);
            String packageHash = hasher.hashPackage(audioHash, transcriptHash, entityHash, metadata);

            String signature = callExecutor.execute(SIGNING, () -> signingService.sign(packageHash));

            Instant createdAt = clock.instant();
            EvidencePackage evidencePackage = new EvidencePackage(
                    idGenerator.next(),
                    metadata,
                    transcript,
                    EvidenceHasher.canonicalEntities(entities),
                    audioHash,
                    transcriptHash,
                    entityHash,
                    packageHash,
                    signature,
                    signingService.algorithm(),
                    createdAt,
                    List.of(new CustodyEntry(CustodyEntry.PACKAGE_CREATED, actor, createdAt, null)),
                    SubmissionStatus.PENDING
            );

            callExecutor.run(PERSISTENCE, () -> repository.save(evidencePackage));

            log.info("Evidence package created - packageId: {}, sessionId: {}, transcriptEntries: {}, entities: {}",
                    evidencePackage.packageId(), sessionId, transcript.size(), entities.size());
            return evidencePackage;
        } catch (RuntimeException e) {
            assembledSessions.remove(sessionId);
            log.error("Evidence assembly failed - sessionId: {}", sessionId, e);
            throw e;
        }
    }

    /**
     * Recompute every hash from the package contents and check the signature.
     */
    public EvidenceVerification verify(EvidencePackage evidencePackage) {
        String audioHash = hasher.hashAudio(evidencePackage.metadata().audioReference());
        String transcriptHash = hasher.hashTranscript(evidencePackage.transcript());
        String entityHash = hasher.hashEntities(evidencePackage.entities());
        String packageHash = hasher.hashPackage(audioHash, transcriptHash, entityHash, evidencePackage.metadata());

        return new EvidenceVerification(
                evidencePackage.packageId(),
                audioHash.equals(evidencePackage.audioHash()),
                transcriptHash.equals(evidencePackage.transcriptHash()),
                entityHash.equals(evidencePackage.entityHash()),
                packageHash.equals(evidencePackage.packageHash()),
                signingService.verify(evidencePackage.packageHash(), evidencePackage.signature())
        );
    }
}

package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionDocument;
import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.infrastructure.intel.EntityMasker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an evidence package as a submission document. Only masked values leave the package.
 */
@Component
@RequiredArgsConstructor
public class SubmissionExporter {

    private final EntityMasker masker;
    private final Clock clock;

    public SubmissionDocument export(EvidencePackage evidencePackage) {
        EvidenceMetadata metadata = evidencePackage.metadata();

        Map<EntityType, List<String>> suspectIdentifiers = new EnumMap<>(EntityType.class);
        evidencePackage.correlationIdentifiers().forEach((type, values) ->
                suspectIdentifiers.put(type, values.stream().map(v -> masker.mask(type, v)).toList()));

        return new SubmissionDocument(
                evidencePackage.packageId(),
                clock.instant(),
                new SubmissionDocument.CallDetails(
                        metadata.sessionId(),
                        metadata.phoneId(),
                        metadata.direction(),
                        metadata.startedAt(),
                        metadata.endedAt(),
                        metadata.endReason(),
                        evidencePackage.transcript().size()
                ),
                new SubmissionDocument.ThreatSummary(
                        metadata.peakScore(),
                        metadata.peakLevel(),
                        metadata.outcome(),
                        metadata.personaId()
                ),
                suspectIdentifiers,
                evidencePackage.entities().stream().map(ExtractedEntity::toView).toList(),
                new SubmissionDocument.Integrity(
                        evidencePackage.audioHash(),
                        evidencePackage.transcriptHash(),
                        evidencePackage.entityHash(),
                        evidencePackage.packageHash(),
                        evidencePackage.signature(),
                        evidencePackage.signatureAlgorithm()
                ),
                evidencePackage.custodyLog(),
                evidencePackage.status()
        );
    }
}

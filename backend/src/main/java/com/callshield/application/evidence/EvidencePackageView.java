package com.callshield.application.evidence;

import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.intel.model.EntityView;
import com.callshield.domain.intel.model.ExtractedEntity;

import java.time.Instant;
import java.util.List;

/**
 * Reviewer-facing summary of a package. Entities are masked; the transcript is left out.
 */
public record EvidencePackageView(
        String packageId,
        String sessionId,
        SubmissionStatus status,
        Instant createdAt,
        int transcriptEntries,
        List<EntityView> entities,
        String audioHash,
        String transcriptHash,
        String entityHash,
        String packageHash,
        String signature,
        String signatureAlgorithm,
        List<CustodyEntry> custodyLog
) {
    public static EvidencePackageView from(EvidencePackage evidencePackage) {
        return new EvidencePackageView(
                evidencePackage.packageId(),
                evidencePackage.sessionId(),
                evidencePackage.status(),
                evidencePackage.createdAt(),
                evidencePackage.transcript().size(),
                evidencePackage.entities().stream().map(ExtractedEntity::toView).toList(),
                evidencePackage.audioHash(),
                evidencePackage.transcriptHash(),
                evidencePackage.entityHash(),
                evidencePackage.packageHash(),
                evidencePackage.signature(),
                evidencePackage.signatureAlgorithm(),
                evidencePackage.custodyLog()
        );
    }
}

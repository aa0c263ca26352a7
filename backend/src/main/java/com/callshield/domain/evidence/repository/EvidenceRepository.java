package com.callshield.domain.evidence.repository;

import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionStatus;

import java.util.Optional;

/**
 * Persistence collaborator for evidence packages.
 */
public interface EvidenceRepository {

    void save(EvidencePackage evidencePackage);

    void appendCustody(String packageId, CustodyEntry entry);

    /**
     * Change the status and record its custody entry in one write. Either both land or neither does.
     */
    void updateStatus(String packageId, SubmissionStatus status, CustodyEntry entry);

    Optional<EvidencePackage> findById(String packageId);

    Optional<EvidencePackage> findBySessionId(String sessionId);
}

package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionStatus;
import com.callshield.domain.evidence.repository.EvidenceRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-local package store. Packages are written once; later writes only append custody or change status.
 */
@Repository
public class InMemoryEvidenceRepository implements EvidenceRepository {

    private final ConcurrentMap<String, EvidencePackage> packages = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> packageIdBySession = new ConcurrentHashMap<>();

    @Override
    public void save(EvidencePackage evidencePackage) {
        EvidencePackage existing = packages.putIfAbsent(evidencePackage.packageId(), evidencePackage);
        // A retried save of the same package is a no-op
        if (existing != null && !existing.equals(evidencePackage)) {
            throw new IllegalStateException("Package " + evidencePackage.packageId() + " is already stored");
        }
        packageIdBySession.put(evidencePackage.sessionId(), evidencePackage.packageId());
    }

    @Override
    public void appendCustody(String packageId, CustodyEntry entry) {
        // Retried appends of the same entry are recorded once
        update(packageId, p -> p.custodyLog().contains(entry) ? p : p.withCustodyEntry(entry));
    }

    @Override
    public void updateStatus(String packageId, SubmissionStatus status, CustodyEntry entry) {
        update(packageId, p -> p.status() == status && p.custodyLog().contains(entry)
                ? p
                : p.withStatus(status).withCustodyEntry(entry));
    }

    @Override
    public Optional<EvidencePackage> findById(String packageId) {
        return Optional.ofNullable(packages.get(packageId));
    }

    @Override
    public Optional<EvidencePackage> findBySessionId(String sessionId) {
        return Optional.ofNullable(packageIdBySession.get(sessionId)).map(packages::get);
    }

    private void update(String packageId, UnaryOperator<EvidencePackage> change) {
        if (packages.computeIfPresent(packageId, (id, current) -> change.apply(current)) == null) {
            throw new IllegalArgumentException("Unknown package " + packageId);
        }
    }
}

package com.callshield.domain.evidence.model;

import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.session.model.TranscriptEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Signed evidence package for one call session.
 * <p>
 * Immutable. Custody entries and status changes produce a new instance through
 * {@link #withCustodyEntry(CustodyEntry)} and {@link #withStatus(SubmissionStatus)}; hashes, signature and
 * contents never change after signing.
 * </p>
 */
public record EvidencePackage(
        String packageId,
        EvidenceMetadata metadata,
        List<TranscriptEntry> transcript,
        List<ExtractedEntity> entities,
        String audioHash,
        String transcriptHash,
        String entityHash,
        String packageHash,
        String signature,
        String signatureAlgorithm,
        Instant createdAt,
        List<CustodyEntry> custodyLog,
        SubmissionStatus status
) {
    public EvidencePackage {
        transcript = List.copyOf(transcript);
        entities = List.copyOf(entities);
        custodyLog = List.copyOf(custodyLog);
    }

    public String sessionId() {
        return metadata.sessionId();
    }

    public EvidencePackage withCustodyEntry(CustodyEntry entry) {
        List<CustodyEntry> log = new ArrayList<>(custodyLog);
        log.add(entry);
        return new EvidencePackage(packageId, metadata, transcript, entities, audioHash, transcriptHash,
                entityHash, packageHash, signature, signatureAlgorithm, createdAt, log, status);
    }

    public EvidencePackage withStatus(SubmissionStatus newStatus) {
        return new EvidencePackage(packageId, metadata, transcript, entities, audioHash, transcriptHash,
                entityHash, packageHash, signature, signatureAlgorithm, createdAt, custodyLog, newStatus);
    }

    /**
     * Identifiers that link this call to other calls from the same operator, grouped by type.
     */
    public Map<EntityType, Set<String>> correlationIdentifiers() {
        Map<EntityType, Set<String>> ids = new EnumMap<>(EntityType.class);
        for (ExtractedEntity entity : entities) {
            if (entity.type().correlatable()) {
                ids.computeIfAbsent(entity.type(), t -> new LinkedHashSet<>())
                        .add(canonicalIdentifier(entity));
            }
        }
        ids.replaceAll((type, values) -> Collections.unmodifiableSet(values));
        return Collections.unmodifiableMap(ids);
    }

    private static String canonicalIdentifier(ExtractedEntity entity) {
        return switch (entity.type()) {
            case PHONE_NUMBER, BANK_ACCOUNT -> {
                String digits = entity.originalValue().replaceAll("\\D", "");
                yield entity.type() == EntityType.PHONE_NUMBER && digits.length() > 10
                        ? digits.substring(digits.length() - 10)
                        : digits;
            }
            default -> entity.originalValue().toLowerCase();
        };
    }
}

package com.callshield.application.profile;

import com.callshield.application.session.event.EvidenceReadyEvent;
import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.repository.EvidenceRepository;
import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.profile.model.ScammerProfile;
import com.callshield.infrastructure.intel.EntityMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlates evidence packages into scammer profiles. Two calls belong to the same profile when they share
 * a payment handle, phone number, bank account or email; profiles that become linked are merged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScammerProfileService {

    private final EvidenceRepository repository;
    private final EntityMasker masker;

    private final List<ScammerProfile> profiles = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @EventListener
    public void onEvidenceReady(EvidenceReadyEvent event) {
        repository.findById(event.packageId()).ifPresent(this::correlate);
    }

    /**
     * Fold the package's identifiers into the matching profile, creating or merging profiles as needed.
     *
     * @return the profile the call now belongs to, empty when the package carries no correlatable identifier
     */
    public synchronized Optional<ScammerProfile> correlate(EvidencePackage evidencePackage) {
        Map<EntityType, Set<String>> ids = evidencePackage.correlationIdentifiers();
        if (ids.isEmpty()) {
            return Optional.empty();
        }

        EvidenceMetadata metadata = evidencePackage.metadata();
        List<ScammerProfile> matches = profiles.stream().filter(p -> p.sharesIdentifier(ids)).toList();

        ScammerProfile target;
        if (matches.isEmpty()) {
            target = new ScammerProfile(String.format("SP-%06d", sequence.incrementAndGet()), metadata.startedAt());
            profiles.add(target);
        } else {
            target = matches.get(0);
            for (ScammerProfile other : matches.subList(1, matches.size())) {
                target.absorb(other);
                profiles.remove(other);
                log.info("Merged scammer profile {} into {}", other.getProfileId(), target.getProfileId());
            }
        }

        target.recordCall(metadata.sessionId(), ids, metadata.peakScore(),
                metadata.endedAt() != null ? metadata.endedAt() : metadata.startedAt());
        log.info("Scammer profile updated - profileId: {}, sessionId: {}, calls: {}",
                target.getProfileId(), metadata.sessionId(), target.getCallCount());
        return Optional.of(target);
    }

    /**
     * Count a submitted report against the profile holding the package's session.
     */
    public synchronized void recordReport(String packageId) {
        repository.findById(packageId).ifPresent(evidencePackage -> profiles.stream()
                .filter(p -> p.getSessionIds().contains(evidencePackage.sessionId()))
                .findFirst()
                .ifPresent(ScammerProfile::recordReport));
    }

    public synchronized List<ScammerProfileView> listProfiles() {
        return profiles.stream()
                .sorted(Comparator.comparingDouble(ScammerProfile::getRiskScore).reversed()
                        .thenComparing(ScammerProfile::getProfileId))
                .map(this::toView)
                .toList();
    }

    public synchronized Optional<ScammerProfileView> findBySession(String sessionId) {
        return profiles.stream()
                .filter(p -> p.getSessionIds().contains(sessionId))
                .findFirst()
                .map(this::toView);
    }

    private ScammerProfileView toView(ScammerProfile profile) {
        Map<EntityType, List<String>> masked = new EnumMap<>(EntityType.class);
        profile.getIdentifiers().forEach((type, values) ->
                masked.put(type, values.stream().sorted().map(v -> masker.mask(type, v)).toList()));
        return new ScammerProfileView(
                profile.getProfileId(),
                masked,
                profile.getSessionIds().stream().sorted().toList(),
                profile.getCallCount(),
                profile.getReportedCount(),
                profile.getRiskScore(),
                profile.getFirstSeen(),
                profile.getLastSeen()
        );
    }
}

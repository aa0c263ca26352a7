package com.callshield.infrastructure.evidence;

import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.session.model.Speaker;
import com.callshield.domain.session.model.TranscriptEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceHasherTest {

    private final EvidenceHasher hasher = new EvidenceHasher();

    @Test
    @DisplayName("hashes are 64 hex characters")
    void sha256_hex() {
        assertThat(hasher.hashTranscript(EvidenceFixtures.transcript())).matches("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("identical content hashes identically")
    void deterministic() {
        assertThat(hasher.hashTranscript(EvidenceFixtures.transcript()))
                .isEqualTo(new EvidenceHasher().hashTranscript(EvidenceFixtures.transcript()));
        assertThat(hasher.hashPackage("a", "b", "c", EvidenceFixtures.metadata("s-1")))
                .isEqualTo(hasher.hashPackage("a", "b", "c", EvidenceFixtures.metadata("s-1")));
    }

    @Test
    @DisplayName("entity order does not change the entity hash")
    void entity_order_irrelevant() {
        List<ExtractedEntity> shuffled = new ArrayList<>(EvidenceFixtures.entities());
        Collections.reverse(shuffled);

        assertThat(hasher.hashEntities(shuffled)).isEqualTo(hasher.hashEntities(EvidenceFixtures.entities()));
    }

    @Test
    @DisplayName("any transcript change changes the hash")
    void transcript_change_detected() {
        List<TranscriptEntry> altered = new ArrayList<>(EvidenceFixtures.transcript());
        altered.set(1, new TranscriptEntry(1, 2L, Speaker.CALLER, "send money to fraud124@paytm", 0.7315));

        assertThat(hasher.hashTranscript(altered)).isNotEqualTo(hasher.hashTranscript(EvidenceFixtures.transcript()));
    }

    @Test
    @DisplayName("metadata is part of the package hash")
    void metadata_bound() {
        assertThat(hasher.hashPackage("a", "b", "c", EvidenceFixtures.metadata("s-1")))
                .isNotEqualTo(hasher.hashPackage("a", "b", "c", EvidenceFixtures.metadata("s-2")));
    }

    @Test
    @DisplayName("a missing audio reference still hashes")
    void missing_audio() {
        assertThat(hasher.hashAudio(null)).isEqualTo(hasher.hashAudio(""));
    }
}

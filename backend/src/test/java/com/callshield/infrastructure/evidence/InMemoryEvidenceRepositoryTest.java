package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.model.CustodyEntry;
import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEvidenceRepositoryTest {

    private InMemoryEvidenceRepository repository;
    private EvidencePackage pkg;

    @BeforeEach
    void setUp() {
        repository = new InMemoryEvidenceRepository();
        pkg = new EvidenceAssembler(new EvidenceHasher(), new HmacSigningService("k"), repository,
                new PackageIdGenerator(EvidenceFixtures.CLOCK), new CollaboratorCallExecutor(1, 1, 1_000),
                EvidenceFixtures.CLOCK, "system")
                .assemble(EvidenceFixtures.metadata("s-1"), EvidenceFixtures.transcript(), EvidenceFixtures.entities());
    }

    @Test
    @DisplayName("saving the same package twice is a no-op")
    void idempotent_save() {
        repository.save(pkg);

        assertThat(repository.findById(pkg.packageId())).contains(pkg);
    }

    @Test
    @DisplayName("a different package under an existing id is refused")
    void conflicting_save() {
        assertThatThrownBy(() -> repository.save(pkg.withStatus(SubmissionStatus.SUBMITTED)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a retried custody append is recorded once")
    void idempotent_append() {
        CustodyEntry entry = CustodyEntry.statusChange(SubmissionStatus.SUBMITTED, "system",
                EvidenceFixtures.CLOCK.instant(), null);

        repository.appendCustody(pkg.packageId(), entry);
        repository.appendCustody(pkg.packageId(), entry);

        assertThat(repository.findById(pkg.packageId()).orElseThrow().custodyLog()).hasSize(2).endsWith(entry);
    }

    @Test
    @DisplayName("updates to an unknown package fail")
    void unknown_package() {
        CustodyEntry entry = CustodyEntry.statusChange(SubmissionStatus.SUBMITTED, "system",
                EvidenceFixtures.CLOCK.instant(), null);

        assertThatThrownBy(() -> repository.updateStatus("EVP-missing", SubmissionStatus.SUBMITTED, entry))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a status change lands together with its custody entry, once")
    void status_with_custody() {
        CustodyEntry entry = CustodyEntry.statusChange(SubmissionStatus.SUBMITTED, "system",
                EvidenceFixtures.CLOCK.instant(), null);

        repository.updateStatus(pkg.packageId(), SubmissionStatus.SUBMITTED, entry);
        repository.updateStatus(pkg.packageId(), SubmissionStatus.SUBMITTED, entry);

        EvidencePackage stored = repository.findById(pkg.packageId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(SubmissionStatus.SUBMITTED);
        assertThat(stored.custodyLog()).hasSize(2).endsWith(entry);
    }
}

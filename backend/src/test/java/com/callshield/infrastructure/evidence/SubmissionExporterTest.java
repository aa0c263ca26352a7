package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.model.EvidencePackage;
import com.callshield.domain.evidence.model.SubmissionDocument;
import com.callshield.domain.intel.model.EntityType;
import com.callshield.infrastructure.intel.EntityMasker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionExporterTest {

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

    private final EvidencePackage pkg = new EvidenceAssembler(new EvidenceHasher(), new HmacSigningService("k"),
            new InMemoryEvidenceRepository(), new PackageIdGenerator(EvidenceFixtures.CLOCK),
            new CollaboratorCallExecutor(1, 1, 1_000), EvidenceFixtures.CLOCK, "system")
            .assemble(EvidenceFixtures.metadata("s-1"), EvidenceFixtures.transcript(), EvidenceFixtures.entities());

    private final SubmissionExporter exporter = new SubmissionExporter(new EntityMasker(), EvidenceFixtures.CLOCK);

    @Test
    @DisplayName("the document carries call details, threat summary and integrity data")
    void document_contents() {
        SubmissionDocument document = exporter.export(pkg);

        assertThat(document.caseReference()).isEqualTo(pkg.packageId());
        assertThat(document.call().sessionId()).isEqualTo("s-1");
        assertThat(document.call().transcriptEntries()).isEqualTo(2);
        assertThat(document.threatAssessment().peakScore()).isEqualTo(0.7315);
        assertThat(document.integrity().packageHash()).isEqualTo(pkg.packageHash());
        assertThat(document.integrity().signature()).isEqualTo(pkg.signature());
        assertThat(document.custodyLog()).isEqualTo(pkg.custodyLog());
    }

    @Test
    @DisplayName("only correlatable identifiers are listed, masked")
    void suspect_identifiers() {
        SubmissionDocument document = exporter.export(pkg);

        assertThat(document.suspectIdentifiers())
                .containsOnlyKeys(EntityType.PAYMENT_HANDLE, EntityType.BANK_ACCOUNT);
        assertThat(document.suspectIdentifiers().get(EntityType.BANK_ACCOUNT)).containsExactly("XXXXXXXX9012");
    }

    @Test
    @DisplayName("sensitive originals never appear in the rendered document")
    void no_originals() throws Exception {
        String json = mapper.writeValueAsString(exporter.export(pkg));

        assertThat(json).doesNotContain("482913").doesNotContain("123456789012").contains("****13");
    }
}

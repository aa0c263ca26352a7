package com.callshield.infrastructure.ai;

import com.callshield.infrastructure.intel.EntityExtractor;
import com.callshield.infrastructure.intel.EntityMasker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OpenAiScamClassifierTest {

    private final OpenAIClient openAIClient = mock(OpenAIClient.class);
    private final EntityMasker masker = new EntityMasker();
    private final OpenAiScamClassifier classifier = new OpenAiScamClassifier(openAIClient, new ObjectMapper(),
            new EntityExtractor(masker), masker, "gpt-4o-mini");

    @Nested
    @DisplayName("parseProbability")
    class ParseProbability {

        @Test
        @DisplayName("reads the probability field")
        void reads_value() {
            assertThat(classifier.parseProbability("{\"scam_probability\": 0.83}")).hasValue(0.83);
        }

        @Test
        @DisplayName("clamps out-of-range values")
        void clamps() {
            assertThat(classifier.parseProbability("{\"scam_probability\": 1.7}")).hasValue(1.0);
            assertThat(classifier.parseProbability("{\"scam_probability\": -0.2}")).hasValue(0.0);
        }

        @Test
        @DisplayName("missing, non-numeric or unparseable answers give no signal")
        void unusable() {
            assertThat(classifier.parseProbability("{\"probability\": 0.5}")).isEmpty();
            assertThat(classifier.parseProbability("{\"scam_probability\": \"high\"}")).isEmpty();
            assertThat(classifier.parseProbability("probably a scam")).isEmpty();
        }
    }

    @Test
    @DisplayName("client failures surface as a classifier exception")
    void client_failure() {
        when(openAIClient.chat()).thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> classifier.classify("share the code 482913"))
                .isInstanceOf(ScamClassifierException.class)
                .hasRootCauseMessage("connection refused");
    }
}

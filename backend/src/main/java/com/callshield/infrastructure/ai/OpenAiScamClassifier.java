package com.callshield.infrastructure.ai;

import com.callshield.domain.threat.service.ScamClassifier;
import com.callshield.infrastructure.intel.EntityExtractor;
import com.callshield.infrastructure.intel.EntityMasker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Semantic scam classifier backed by an OpenAI chat model.
 * Extracted entities are replaced by their masked form before the fragment leaves the process.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "callshield.classifier.provider", havingValue = "openai")
public class OpenAiScamClassifier implements ScamClassifier {

    private static final String SYSTEM_PROMPT = """
            You classify single utterances from live phone calls in India.
            Decide how likely it is that the utterance belongs to a fraud call: fake bank or government officials,
            KYC or OTP requests, arrest threats, prize offers, remote-access app requests.
            Masked values like XXXX-XXXX-1234 or ****13 are normal and not evidence on their own.
            Respond with JSON only: {"scam_probability": <number between 0 and 1>}
            """;

    private final OpenAIClient openAIClient;
    private final ObjectMapper objectMapper;
    private final EntityExtractor entityExtractor;
    private final EntityMasker entityMasker;
    private final String model;

    public OpenAiScamClassifier(OpenAIClient openAIClient,
                                ObjectMapper objectMapper,
                                EntityExtractor entityExtractor,
                                EntityMasker entityMasker,
                                @Value("${callshield.classifier.model:gpt-4o-mini}") String model) {
        this.openAIClient = openAIClient;
        this.objectMapper = objectMapper;
        this.entityExtractor = entityExtractor;
        this.entityMasker = entityMasker;
        this.model = model;
    }

    @Override
    public OptionalDouble classify(String text) {
        String redacted = entityMasker.redact(text, entityExtractor.extract(text));

        String content;
        try {
            ChatCompletion completion = openAIClient.chat().completions().create(ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(0.0)
                    .maxCompletionTokens(30)
                    .addSystemMessage(SYSTEM_PROMPT)
                    .addUserMessage(redacted)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build());

            completion.usage().ifPresent(usage ->
                    log.debug("Classifier token usage - prompt: {}, completion: {}",
                            usage.promptTokens(), usage.completionTokens()));

            content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new ScamClassifierException("Classifier response has no content"));
        } catch (ScamClassifierException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI classifier call failed", e);
            throw new ScamClassifierException("Classifier call failed", e);
        }

        return parseProbability(content);
    }

    OptionalDouble parseProbability(String content) {
        try {
            JsonNode root = objectMapper.readTree(content);
            JsonNode probability = root.path("scam_probability");
            if (!probability.isNumber()) {
                log.warn("Classifier response has no numeric scam_probability");
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Math.min(1.0, Math.max(0.0, probability.asDouble())));
        } catch (Exception e) {
            log.warn("Failed to parse classifier response: {}", e.getMessage());
            return OptionalDouble.empty();
        }
    }
}

package com.callshield.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "callshield.classifier.provider", havingValue = "openai")
public class OpenAiConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${callshield.classifier.timeout-ms:1500}")
    private long timeoutMs;

    @Bean
    public OpenAIClient openAIClient() {
        // The gateway bounds every call more tightly; this only stops orphaned requests
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(Duration.ofMillis(timeoutMs * 4))
                .maxRetries(0)
                .build();
    }
}

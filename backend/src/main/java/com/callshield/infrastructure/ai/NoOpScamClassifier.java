package com.callshield.infrastructure.ai;

import com.callshield.domain.threat.service.ScamClassifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Used when no classifier provider is configured: the classifier signal is always absent.
 */
@Component
@ConditionalOnProperty(name = "callshield.classifier.provider", havingValue = "none", matchIfMissing = true)
public class NoOpScamClassifier implements ScamClassifier {

    @Override
    public OptionalDouble classify(String text) {
        return OptionalDouble.empty();
    }
}

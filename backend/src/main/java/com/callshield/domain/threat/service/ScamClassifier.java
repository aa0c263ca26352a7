package com.callshield.domain.threat.service;

import java.util.OptionalDouble;

/**
 * External semantic classifier. Returns the probability (0-1) that a fragment belongs to a scam call.
 * Implementations may block; callers bound them with a timeout.
 */
public interface ScamClassifier {

    OptionalDouble classify(String text);
}

package com.callshield.domain.intel.model;

/**
 * UI and event-facing projection of an {@link ExtractedEntity}. Carries no original value.
 */
public record EntityView(
        EntityType type,
        String maskedValue,
        double confidence,
        int startPos,
        int endPos,
        boolean verified
) {}

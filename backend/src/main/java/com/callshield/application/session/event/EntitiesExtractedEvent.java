package com.callshield.application.session.event;

import com.callshield.domain.intel.model.EntityView;

import java.util.List;

/**
 * Entities seen for the first time in the session. Masked values only.
 */
public record EntitiesExtractedEvent(
        String sessionId,
        List<EntityView> entities
) implements SessionEvent {

    public EntitiesExtractedEvent {
        entities = List.copyOf(entities);
    }

    @Override
    public String eventType() {
        return "entities_extracted";
    }
}

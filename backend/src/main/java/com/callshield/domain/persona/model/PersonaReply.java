package com.callshield.domain.persona.model;

import com.callshield.domain.intel.model.ExtractedEntity;

import java.util.List;

/**
 * One persona turn.
 *
 * @param text       validated reply text
 * @param intent     intent the reply answers
 * @param stage      engagement stage after this turn
 * @param turn       1-based turn number within the engagement
 * @param entities   entities extracted from the caller utterance before replying
 * @param rewritten  true when the candidate reply failed validation and was replaced
 */
public record PersonaReply(
        String text,
        ReplyIntent intent,
        EngagementStage stage,
        int turn,
        List<ExtractedEntity> entities,
        boolean rewritten
) {
    public PersonaReply {
        entities = List.copyOf(entities);
    }
}

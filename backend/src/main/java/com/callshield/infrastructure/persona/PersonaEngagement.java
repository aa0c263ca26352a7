package com.callshield.infrastructure.persona;

import com.callshield.domain.persona.model.EngagementStage;
import com.callshield.domain.persona.model.PersonaProfile;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversational memory of one persona engagement. Owned by a single session and guarded by its lock.
 */
@Getter
public class PersonaEngagement {

    public record Exchange(String callerUtterance, String reply) {}

    private final PersonaProfile persona;
    private int turnCount;
    private EngagementStage stage = EngagementStage.INITIAL;
    private final List<Exchange> history = new ArrayList<>();
    private boolean terminated;

    PersonaEngagement(PersonaProfile persona) {
        this.persona = persona;
    }

    int nextTurn() {
        turnCount++;
        stage = EngagementStage.forTurnCount(turnCount);
        return turnCount;
    }

    void record(String callerUtterance, String reply) {
        history.add(new Exchange(callerUtterance, reply));
    }

    void discard() {
        history.clear();
        turnCount = 0;
        stage = EngagementStage.INITIAL;
        terminated = true;
    }

    public List<Exchange> getHistory() {
        return List.copyOf(history);
    }
}

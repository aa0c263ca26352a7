package com.callshield.infrastructure.threat;

import com.callshield.domain.threat.model.ThreatLevel;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Per-session running state of the threat scorer. Guarded by the owning session's lock.
 */
@Getter
public class ThreatScoringState {

    private double runningScore;
    private ThreatLevel level = ThreatLevel.SAFE;
    private int fragmentCount;

    // Categories of the most recent turns, newest last
    private final Deque<Set<ThreatCategory>> recentCategories = new ArrayDeque<>();
    private final Deque<String> recentTexts = new ArrayDeque<>();

    void record(double score, ThreatLevel newLevel, Set<ThreatCategory> categories, String text, int window) {
        runningScore = score;
        level = newLevel;
        fragmentCount++;
        recentCategories.addLast(categories);
        recentTexts.addLast(text);
        while (recentCategories.size() > window) {
            recentCategories.removeFirst();
        }
        while (recentTexts.size() > window) {
            recentTexts.removeFirst();
        }
    }
}

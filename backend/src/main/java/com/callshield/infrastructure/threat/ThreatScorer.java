package com.callshield.infrastructure.threat;

import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.threat.model.ScoreSignal;
import com.callshield.domain.threat.model.ThreatAssessment;
import com.callshield.domain.threat.model.ThreatLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores one fragment and folds it into a session's running threat score.
 *
 * Four signal families: lexical pressure, behavioral escalation across a short turn window,
 * the external classifier probability (when present), and a fixed boost for high-sensitivity entities.
 * The running score is an asymmetric exponentially-weighted average: it rises fast and decays slowly.
 */
@Slf4j
@Component
public class ThreatScorer {

    static final int TURN_WINDOW = 3;

    static final double LEXICAL_WEIGHT = 0.4;
    static final double BEHAVIORAL_WEIGHT = 0.4;
    static final double CLASSIFIER_WEIGHT = 0.2;

    static final double CATEGORY_SPREAD_BONUS = 0.1;
    static final double FLAG_WEIGHT = 0.3;
    static final double ENTITY_BOOST = 0.15;

    static final double RISE_ALPHA = 0.7;
    static final double DECAY_ALPHA = 0.3;

    private record Escalation(ThreatCategory from, ThreatCategory to, double weight, String indicator) {}

    // Earlier (or same-turn) category followed by a later one scores above either alone
    private static final List<Escalation> ESCALATIONS = List.of(
            new Escalation(ThreatCategory.IMPERSONATION, ThreatCategory.CREDENTIAL, 1.0, "impersonation_then_credential"),
            new Escalation(ThreatCategory.THREAT, ThreatCategory.CREDENTIAL, 0.9, "threat_then_credential"),
            new Escalation(ThreatCategory.URGENCY, ThreatCategory.CREDENTIAL, 0.8, "urgency_then_credential"),
            new Escalation(ThreatCategory.IMPERSONATION, ThreatCategory.REMOTE_ACCESS, 0.8, "impersonation_then_remote_access"),
            new Escalation(ThreatCategory.THREAT, ThreatCategory.REMOTE_ACCESS, 0.8, "threat_then_remote_access"),
            new Escalation(ThreatCategory.URGENCY, ThreatCategory.REMOTE_ACCESS, 0.8, "urgency_then_remote_access"),
            new Escalation(ThreatCategory.IMPERSONATION, ThreatCategory.FINANCIAL, 0.7, "impersonation_then_financial"),
            new Escalation(ThreatCategory.THREAT, ThreatCategory.FINANCIAL, 0.7, "threat_then_financial"),
            new Escalation(ThreatCategory.IMPERSONATION, ThreatCategory.THREAT, 0.6, "impersonation_then_threat")
    );

    private static final Pattern SECRECY = Pattern.compile(
            "\\b(?:don'?t|do not) (?:tell|inform) anyone|keep (?:it|this) (?:a )?secret|confidential|(?:don'?t|do not) discuss",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ISOLATION = Pattern.compile(
            "\\b(?:don'?t|do not) (?:contact|call|visit) (?:the |your )?(?:bank|police|branch)"
                    + "|(?:don'?t|do not) tell (?:your )?(?:family|wife|husband|son|daughter)"
                    + "|(?:don'?t|do not) (?:disconnect|cut) the (?:call|line)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Set<EntityType> BOOSTING_ENTITIES = EnumSet.of(EntityType.ONE_TIME_CODE, EntityType.CARD_NUMBER);

    /**
     * Fold one fragment into the session's running state.
     *
     * @param state      the session's scoring state, mutated in place
     * @param text       the normalized fragment
     * @param entities   entities extracted from the same fragment
     * @param classifier external classifier probability, empty when absent or timed out
     */
    public ThreatAssessment score(ThreatScoringState state, String text,
                                  List<ExtractedEntity> entities, OptionalDouble classifier) {
        List<String> indicators = new ArrayList<>();
        Set<ThreatCategory> categories = EnumSet.noneOf(ThreatCategory.class);

        // 1. Lexical pressure
        double weighted = 0.0;
        int[] counts = new int[ThreatCategory.values().length];
        for (ThreatCategory category : ThreatCategory.values()) {
            int count = category.countMatches(text);
            counts[category.ordinal()] = count;
            if (count > 0) {
                categories.add(category);
                indicators.add(category.indicator());
                weighted += category.weight() * count;
            }
        }
        if (categories.size() >= 2) {
            weighted += CATEGORY_SPREAD_BONUS * categories.size();
        }
        double lexical = Math.min(1.0, weighted);

        double urgency = saturate(counts[ThreatCategory.URGENCY.ordinal()] + counts[ThreatCategory.THREAT.ordinal()]);
        double financial = saturate(counts[ThreatCategory.FINANCIAL.ordinal()]
                + counts[ThreatCategory.CREDENTIAL.ordinal()]
                + counts[ThreatCategory.PRIZE.ordinal()]);
        double impersonation = saturate(counts[ThreatCategory.IMPERSONATION.ordinal()]);

        // 2. Behavioral escalation over the turn window, current turn included
        double behavioral = behavioral(state, categories, text, indicators);

        // 3. Fusion; weights are renormalized when the classifier signal is absent
        double fused;
        Double classifierProbability = null;
        if (classifier.isPresent()) {
            classifierProbability = clamp(classifier.getAsDouble());
            fused = LEXICAL_WEIGHT * lexical + BEHAVIORAL_WEIGHT * behavioral + CLASSIFIER_WEIGHT * classifierProbability;
        } else {
            double total = LEXICAL_WEIGHT + BEHAVIORAL_WEIGHT;
            fused = (LEXICAL_WEIGHT * lexical + BEHAVIORAL_WEIGHT * behavioral) / total;
        }

        // 4. Entity-sensitivity boost
        double boost = 0.0;
        if (entities.stream().anyMatch(e -> BOOSTING_ENTITIES.contains(e.type()))) {
            boost = ENTITY_BOOST;
            indicators.add("sensitive_entity");
        }
        fused = clamp(fused + boost);

        double previous = state.getRunningScore();
        double alpha = fused >= previous ? RISE_ALPHA : DECAY_ALPHA;
        double running = clamp(previous + alpha * (fused - previous));

        ThreatLevel previousLevel = state.getLevel();
        ThreatLevel level = ThreatLevel.fromScore(running);
        state.record(running, level, categories, text, TURN_WINDOW - 1);

        ScoreSignal signal = new ScoreSignal(lexical, urgency, financial, impersonation, behavioral,
                classifierProbability, boost, fused);
        log.debug("Scored fragment - lexical: {}, behavioral: {}, classifier: {}, fused: {}, running: {}, level: {}",
                lexical, behavioral, classifierProbability, fused, running, level);

        return new ThreatAssessment(signal, running, level, previousLevel, indicators);
    }

    private double behavioral(ThreatScoringState state, Set<ThreatCategory> current,
                              String text, List<String> indicators) {
        Set<ThreatCategory> window = EnumSet.noneOf(ThreatCategory.class);
        window.addAll(current);
        state.getRecentCategories().forEach(window::addAll);

        double escalation = 0.0;
        for (Escalation e : ESCALATIONS) {
            if (current.contains(e.to) && window.contains(e.from) && e.weight > escalation) {
                escalation = e.weight;
                indicators.add(e.indicator);
            }
        }

        double flags = 0.0;
        if (SECRECY.matcher(text).find()) {
            flags += FLAG_WEIGHT;
            indicators.add("secrecy");
        }
        if (ISOLATION.matcher(text).find()) {
            flags += FLAG_WEIGHT;
            indicators.add("isolation");
        }
        String key = text.toLowerCase(Locale.ROOT).strip();
        if (!key.isEmpty() && state.getRecentTexts().stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).strip().equals(key))) {
            indicators.add("repetitive_speech");
        }

        return Math.min(1.0, escalation + flags);
    }

    static double saturate(int count) {
        return 1.0 - Math.pow(0.5, count);
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}

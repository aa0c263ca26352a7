package com.callshield.infrastructure.persona;

import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.persona.model.EngagementStage;
import com.callshield.domain.persona.model.PersonaProfile;
import com.callshield.domain.persona.model.PersonaReply;
import com.callshield.domain.persona.model.ReplyIntent;
import com.callshield.domain.persona.model.ReplyValidationResult;
import com.callshield.infrastructure.intel.EntityExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Produces persona replies while a session is handed off.
 *
 * Each turn: extract entities from the caller utterance, classify its intent, pick the persona's reply for
 * that intent and stage, then validate it. A reply that fails validation is replaced with a safe reply.
 * Turns are driven only by caller utterances.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersonaOrchestrator {

    private static final String TERMINATING_SUFFIX = " Wait, someone is at the door. Hold on, don't go anywhere.";

    // Checked in order; the first intent that matches wins
    private static final Map<ReplyIntent, Pattern> INTENT_PATTERNS = new LinkedHashMap<>();

    static {
        INTENT_PATTERNS.put(ReplyIntent.IDENTITY_PROBE, Pattern.compile(
                "\\b(?:are you|is this) (?:an? )?(?:robot|bot|machine|computer|ai|recording|real|human|real person)\\b"
                        + "|\\b(?:talking|speaking) to (?:an? )?(?:robot|bot|machine|computer|recording|real person|human)\\b",
                Pattern.CASE_INSENSITIVE));
        INTENT_PATTERNS.put(ReplyIntent.FINANCIAL_REQUEST, Pattern.compile(
                "\\b(?:bank|account|card|otp|pin|cvv|upi|payment|transfer|code)\\b", Pattern.CASE_INSENSITIVE));
        INTENT_PATTERNS.put(ReplyIntent.THREAT, Pattern.compile(
                "\\b(?:police|arrest\\w*|case|court|jail|fir|warrant|legal)\\b", Pattern.CASE_INSENSITIVE));
        INTENT_PATTERNS.put(ReplyIntent.URGENCY, Pattern.compile(
                "\\b(?:urgent\\w*|immediately|now|hurry|fast|quickly)\\b", Pattern.CASE_INSENSITIVE));
        INTENT_PATTERNS.put(ReplyIntent.TECH_REQUEST, Pattern.compile(
                "\\b(?:download|install|app|anydesk|teamviewer|link|screen)\\b", Pattern.CASE_INSENSITIVE));
        INTENT_PATTERNS.put(ReplyIntent.VERIFICATION_REQUEST, Pattern.compile(
                "\\b(?:aadhaar|aadhar|pan|kyc|document\\w*|verify|verification)\\b", Pattern.CASE_INSENSITIVE));
        INTENT_PATTERNS.put(ReplyIntent.PRIZE_OFFER, Pattern.compile(
                "\\b(?:won|prize|lottery|cash|gift|reward|congratulations)\\b", Pattern.CASE_INSENSITIVE));
    }

    private final EntityExtractor entityExtractor;
    private final PersonaReplyValidator replyValidator;

    public PersonaEngagement engage(PersonaProfile persona) {
        log.info("Persona engaged - persona: {}", persona.id());
        return new PersonaEngagement(persona);
    }

    /**
     * Take one turn in reply to a caller utterance.
     *
     * @throws IllegalStateException    if the engagement was terminated
     * @throws IllegalArgumentException if there is no utterance to reply to
     */
    public PersonaReply respond(PersonaEngagement engagement, String callerUtterance) {
        if (engagement.isTerminated()) {
            throw new IllegalStateException("Engagement already terminated");
        }
        if (callerUtterance == null || callerUtterance.isBlank()) {
            throw new IllegalArgumentException("A persona turn needs a caller utterance");
        }

        // Intelligence first, whatever the reply turns out to be
        List<ExtractedEntity> entities = entityExtractor.extract(callerUtterance);

        ReplyIntent intent = classifyIntent(callerUtterance);
        int turn = engagement.nextTurn();
        EngagementStage stage = engagement.getStage();
        PersonaProfile persona = engagement.getPersona();

        String candidate = compose(persona, intent, stage, turn);
        boolean rewritten = false;
        ReplyValidationResult validation = replyValidator.validate(candidate);
        if (!validation.passed()) {
            rewritten = true;
            log.warn("Persona reply rejected, rewriting - persona: {}, issues: {}", persona.id(), validation.errors().size());
            candidate = pick(PersonaReplyCatalog.replies(persona, ReplyIntent.GENERAL), turn);
            if (!replyValidator.validate(candidate).passed()) {
                candidate = PersonaReplyCatalog.FALLBACK_REPLY;
            }
        }

        engagement.record(callerUtterance, candidate);
        log.debug("Persona turn {} - persona: {}, intent: {}, stage: {}, entities: {}",
                turn, persona.id(), intent, stage, entities.size());
        return new PersonaReply(candidate, intent, stage, turn, entities, rewritten);
    }

    public void terminate(PersonaEngagement engagement) {
        log.info("Persona engagement terminated - persona: {}, turns: {}",
                engagement.getPersona().id(), engagement.getTurnCount());
        engagement.discard();
    }

    ReplyIntent classifyIntent(String utterance) {
        for (Map.Entry<ReplyIntent, Pattern> entry : INTENT_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(utterance).find()) {
                return entry.getKey();
            }
        }
        return ReplyIntent.GENERAL;
    }

    private String compose(PersonaProfile persona, ReplyIntent intent, EngagementStage stage, int turn) {
        String reply = pick(PersonaReplyCatalog.replies(persona, intent), turn);
        return switch (stage) {
            case EXTRACTING -> reply + " " + pick(PersonaReplyCatalog.probes(persona), turn);
            case TERMINATING -> reply + TERMINATING_SUFFIX;
            case INITIAL, BUILDING_TRUST -> reply;
        };
    }

    private static String pick(List<String> options, int turn) {
        return options.get((turn - 1) % options.size());
    }
}

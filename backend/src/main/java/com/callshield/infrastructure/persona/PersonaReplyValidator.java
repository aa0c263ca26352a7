package com.callshield.infrastructure.persona;

import com.callshield.domain.persona.model.ReplyIssue;
import com.callshield.domain.persona.model.ReplyIssue.Severity;
import com.callshield.domain.persona.model.ReplyIssueType;
import com.callshield.domain.persona.model.ReplyValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based gate every persona reply passes before it is emitted.
 * A reply that discloses synthetic nature or carries a sensitive-looking digit run never passes.
 */
@Slf4j
@Component
public class PersonaReplyValidator {

    static final int MAX_REPLY_LENGTH = 400;

    // Rule 1: Synthetic-nature disclosure, in any phrasing
    private static final List<Pattern> DISCLOSURE_PATTERNS = List.of(
            Pattern.compile("\\b(?:i am|i'm|im|as) (?:just |only )?(?:an? )?(?:ai|a\\.i\\.|artificial intelligence|bot|chat ?bot"
                    + "|robot|language model|virtual assistant|computer program|machine|automated (?:system|agent|assistant))\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:language model|openai|chatgpt|gpt-?\\d*|llm|synthetic voice|honeypot|bait agent)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bnot (?:a )?(?:real )?(?:human|person)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:generated|simulated) (?:by|response|reply|voice)\\b", Pattern.CASE_INSENSITIVE)
    );

    // Rule 2: Four or more digits, allowing single separators, could be read as a real code or account
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d(?:[\\s-]?\\d){3,}");

    public ReplyValidationResult validate(String reply) {
        List<ReplyIssue> issues = new ArrayList<>();

        if (reply == null || reply.isBlank()) {
            issues.add(new ReplyIssue(ReplyIssueType.EMPTY_REPLY, Severity.ERROR, "Reply is empty", null));
            return new ReplyValidationResult(false, issues);
        }

        checkDisclosure(reply, issues);
        checkDigits(reply, issues);
        checkLength(reply, issues);

        boolean passed = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        if (!issues.isEmpty()) {
            log.warn("[PersonaReplyValidator] {} issue(s), passed: {}, types: {}",
                    issues.size(), passed, issues.stream().map(ReplyIssue::type).toList());
        }
        return new ReplyValidationResult(passed, issues);
    }

    private void checkDisclosure(String reply, List<ReplyIssue> issues) {
        for (Pattern pattern : DISCLOSURE_PATTERNS) {
            Matcher matcher = pattern.matcher(reply);
            if (matcher.find()) {
                issues.add(new ReplyIssue(
                        ReplyIssueType.SYNTHETIC_DISCLOSURE,
                        Severity.ERROR,
                        "Reply discloses synthetic nature: \"" + matcher.group() + "\"",
                        matcher.group()
                ));
            }
        }
    }

    private void checkDigits(String reply, List<ReplyIssue> issues) {
        Matcher matcher = DIGIT_RUN.matcher(reply);
        if (matcher.find()) {
            // The run itself is not echoed, it may be a real value
            issues.add(new ReplyIssue(
                    ReplyIssueType.SENSITIVE_DIGITS,
                    Severity.ERROR,
                    "Reply contains a digit run of length " + matcher.group().replaceAll("\\D", "").length(),
                    null
            ));
        }
    }

    private void checkLength(String reply, List<ReplyIssue> issues) {
        if (reply.length() > MAX_REPLY_LENGTH) {
            issues.add(new ReplyIssue(
                    ReplyIssueType.LENGTH_OVEREXPANSION,
                    Severity.WARNING,
                    "Reply length " + reply.length() + " exceeds " + MAX_REPLY_LENGTH,
                    null
            ));
        }
    }
}

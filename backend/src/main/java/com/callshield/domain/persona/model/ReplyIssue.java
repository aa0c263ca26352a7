package com.callshield.domain.persona.model;

/**
 * Individual problem found in a candidate persona reply.
 *
 * @param type        the type of issue
 * @param severity    ERROR blocks the reply, WARNING is logged only
 * @param message     human-readable description
 * @param matchedText the text that triggered the issue (nullable)
 */
public record ReplyIssue(
        ReplyIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}

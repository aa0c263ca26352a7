package com.callshield.domain.persona.model;

import java.util.List;

/**
 * @param passed true if no ERROR-level issues were found
 * @param issues all issues, errors and warnings
 */
public record ReplyValidationResult(
        boolean passed,
        List<ReplyIssue> issues
) {
    public List<ReplyIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ReplyIssue.Severity.ERROR).toList();
    }
}

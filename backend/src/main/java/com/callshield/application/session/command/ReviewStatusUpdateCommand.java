package com.callshield.application.session.command;

import com.callshield.domain.evidence.model.SubmissionStatus;

/**
 * @param actor reviewer recorded in the custody log; defaults to {@code reviewer} when absent
 */
public record ReviewStatusUpdateCommand(
        String packageId,
        SubmissionStatus newStatus,
        String notes,
        String actor
) implements SessionCommand {

    @Override
    public String commandType() {
        return "review_status_update";
    }
}

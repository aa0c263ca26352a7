package com.callshield.application.session.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Inbound session-control message, discriminated by {@code type} on the wire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StartCommand.class, name = "start"),
        @JsonSubTypes.Type(value = TranscriptFragmentCommand.class, name = "transcript_fragment"),
        @JsonSubTypes.Type(value = HandoffRequestCommand.class, name = "handoff_request"),
        @JsonSubTypes.Type(value = HandoffTerminateCommand.class, name = "handoff_terminate"),
        @JsonSubTypes.Type(value = EndCallCommand.class, name = "end_call"),
        @JsonSubTypes.Type(value = SubmitEvidenceCommand.class, name = "submit_evidence"),
        @JsonSubTypes.Type(value = ReviewStatusUpdateCommand.class, name = "review_status_update")
})
public interface SessionCommand {

    String commandType();

    /**
     * Target session, null for commands addressed to an evidence package.
     */
    default String sessionId() {
        return null;
    }
}

package com.callshield.application.session;

import com.callshield.application.evidence.EvidencePackageView;
import com.callshield.application.evidence.EvidenceReviewService;
import com.callshield.application.session.command.EndCallCommand;
import com.callshield.application.session.command.HandoffRequestCommand;
import com.callshield.application.session.command.HandoffTerminateCommand;
import com.callshield.application.session.command.ReviewStatusUpdateCommand;
import com.callshield.application.session.command.SessionCommand;
import com.callshield.application.session.command.StartCommand;
import com.callshield.application.session.command.SubmitEvidenceCommand;
import com.callshield.application.session.command.TranscriptFragmentCommand;
import com.callshield.application.session.exception.CallPipelineException;
import com.callshield.application.session.exception.ErrorCode;
import com.callshield.infrastructure.evidence.CollaboratorCallException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single entry point for inbound commands. Every pipeline rejection and collaborator failure comes back as a
 * typed {@link CommandResult}; nothing a caller sends can leave a session half-updated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCommandDispatcher {

    private final CallSessionService sessionService;
    private final EvidenceReviewService reviewService;

    public CommandResult dispatch(SessionCommand command) {
        if (command == null) {
            return CommandResult.rejected(null, null, ErrorCode.MALFORMED_COMMAND, "Command body is required");
        }

        String sessionId = command.sessionId();
        try {
            Object payload = execute(command);
            return CommandResult.accepted(command.commandType(), sessionId, payload);
        } catch (CallPipelineException e) {
            log.warn("Command rejected - type: {}, sessionId: {}, code: {}, reason: {}",
                    command.commandType(), sessionId, e.getErrorCode(), e.getMessage());
            return CommandResult.rejected(command.commandType(), sessionId, e.getErrorCode(), e.getMessage());
        } catch (CollaboratorCallException e) {
            log.error("Command failed - type: {}, sessionId: {}, {} collaborator failed",
                    command.commandType(), sessionId, e.getCollaborator(), e);
            ErrorCode code = e.isTimedOut() ? ErrorCode.EXTERNAL_TIMEOUT : ErrorCode.ASSEMBLY_FAILED;
            return CommandResult.rejected(command.commandType(), sessionId, code, e.getMessage());
        }
    }

    private Object execute(SessionCommand command) {
        if (command instanceof StartCommand start) {
            return sessionService.start(start);
        } else if (command instanceof TranscriptFragmentCommand fragment) {
            return sessionService.ingestFragment(fragment);
        } else if (command instanceof HandoffRequestCommand handoff) {
            return sessionService.requestHandoff(handoff);
        } else if (command instanceof HandoffTerminateCommand terminate) {
            return sessionService.terminateHandoff(terminate);
        } else if (command instanceof EndCallCommand end) {
            return sessionService.endCall(end);
        } else if (command instanceof SubmitEvidenceCommand submit) {
            return sessionService.submitEvidence(submit);
        } else if (command instanceof ReviewStatusUpdateCommand review) {
            return EvidencePackageView.from(reviewService.updateStatus(review));
        }
        throw new IllegalArgumentException("Unsupported command type: " + command.getClass().getSimpleName());
    }
}

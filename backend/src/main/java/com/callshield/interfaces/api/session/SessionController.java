package com.callshield.interfaces.api.session;

import com.callshield.application.session.CallSessionService;
import com.callshield.application.session.CommandResult;
import com.callshield.application.session.SessionCommandDispatcher;
import com.callshield.application.session.SessionView;
import com.callshield.application.session.command.SessionCommand;
import com.callshield.interfaces.api.GlobalExceptionHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionCommandDispatcher dispatcher;
    private final CallSessionService sessionService;
    private final SessionEventRelay eventRelay;

    @PostMapping("/commands")
    public ResponseEntity<CommandResult> command(@RequestBody SessionCommand command) {
        CommandResult result = dispatcher.dispatch(command);
        HttpStatus status = result.accepted() ? HttpStatus.OK : GlobalExceptionHandler.statusOf(result.errorCode());
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionView> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.getSession(sessionId));
    }

    @GetMapping("/{sessionId}/events")
    public SseEmitter streamEvents(@PathVariable String sessionId) {
        // Rejects unknown sessions before opening the stream
        sessionService.getSession(sessionId);
        return eventRelay.subscribe(sessionId);
    }
}

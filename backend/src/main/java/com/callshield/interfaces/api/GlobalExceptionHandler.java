package com.callshield.interfaces.api;

import com.callshield.application.session.exception.CallPipelineException;
import com.callshield.application.session.exception.ErrorCode;
import com.callshield.infrastructure.evidence.CollaboratorCallException;
import com.callshield.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case UNKNOWN_SESSION, UNKNOWN_PACKAGE -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, DUPLICATE_SESSION, DUPLICATE_ASSEMBLY -> HttpStatus.CONFLICT;
            case OUT_OF_ORDER_FRAGMENT, MALFORMED_COMMAND -> HttpStatus.BAD_REQUEST;
            case ASSEMBLY_FAILED -> HttpStatus.BAD_GATEWAY;
            case EXTERNAL_TIMEOUT -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    @ExceptionHandler(CallPipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(CallPipelineException e) {
        return ResponseEntity.status(statusOf(e.getErrorCode()))
                .body(new ErrorResponse(e.getErrorCode().name(), e.getMessage()));
    }

    @ExceptionHandler(CollaboratorCallException.class)
    public ResponseEntity<ErrorResponse> handleCollaborator(CollaboratorCallException e) {
        log.error("{} collaborator failed", e.getCollaborator(), e);
        ErrorCode code = e.isTimedOut() ? ErrorCode.EXTERNAL_TIMEOUT : ErrorCode.ASSEMBLY_FAILED;
        return ResponseEntity.status(statusOf(code))
                .body(new ErrorResponse(code.name(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body", e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorCode.MALFORMED_COMMAND.name(), "Request body is missing or malformed"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorCode.MALFORMED_COMMAND.name(), message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error, please retry later"));
    }
}

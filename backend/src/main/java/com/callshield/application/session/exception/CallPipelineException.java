package com.callshield.application.session.exception;

import lombok.Getter;

@Getter
public abstract class CallPipelineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected CallPipelineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CallPipelineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}

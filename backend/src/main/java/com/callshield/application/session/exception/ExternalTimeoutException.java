package com.callshield.application.session.exception;

public class ExternalTimeoutException extends CallPipelineException {

    public ExternalTimeoutException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_TIMEOUT, message, cause);
    }
}

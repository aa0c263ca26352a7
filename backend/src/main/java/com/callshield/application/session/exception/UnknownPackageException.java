package com.callshield.application.session.exception;

public class UnknownPackageException extends CallPipelineException {

    public UnknownPackageException(String message) {
        super(ErrorCode.UNKNOWN_PACKAGE, message);
    }
}

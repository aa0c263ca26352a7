package com.callshield.application.session.exception;

public class AssemblyFailedException extends CallPipelineException {

    public AssemblyFailedException(String message, Throwable cause) {
        super(ErrorCode.ASSEMBLY_FAILED, message, cause);
    }
}

package com.callshield.application.session.exception;

public class DuplicateAssemblyException extends CallPipelineException {

    public DuplicateAssemblyException(String message) {
        super(ErrorCode.DUPLICATE_ASSEMBLY, message);
    }
}

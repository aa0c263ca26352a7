package com.callshield.application.session.exception;

public class OutOfOrderFragmentException extends CallPipelineException {

    public OutOfOrderFragmentException(String message) {
        super(ErrorCode.OUT_OF_ORDER_FRAGMENT, message);
    }
}

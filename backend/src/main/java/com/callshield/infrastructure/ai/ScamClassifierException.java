package com.callshield.infrastructure.ai;

public class ScamClassifierException extends RuntimeException {

    public ScamClassifierException(String message) {
        super(message);
    }

    public ScamClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.callshield.infrastructure.evidence;

import lombok.Getter;

/**
 * A signing or persistence call failed after every retry attempt.
 */
@Getter
public class CollaboratorCallException extends RuntimeException {

    private final String collaborator;
    private final boolean timedOut;

    public CollaboratorCallException(String collaborator, boolean timedOut, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
        this.timedOut = timedOut;
    }
}

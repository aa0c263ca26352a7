package com.callshield.infrastructure.evidence;

public class EvidenceAlreadyAssembledException extends RuntimeException {

    public EvidenceAlreadyAssembledException(String sessionId) {
        super("Evidence already assembled for session " + sessionId);
    }
}

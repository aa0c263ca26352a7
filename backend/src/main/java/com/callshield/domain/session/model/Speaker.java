package com.callshield.domain.session.model;

/**
 * Who produced a transcript entry. PERSONA entries are generated by the pipeline itself.
 */
public enum Speaker {
    CALLER,
    USER,
    PERSONA
}

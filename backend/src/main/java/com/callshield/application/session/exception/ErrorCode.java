package com.callshield.application.session.exception;

/**
 * Typed rejection reasons reported to callers.
 */
public enum ErrorCode {
    INVALID_TRANSITION,
    UNKNOWN_SESSION,
    UNKNOWN_PACKAGE,
    DUPLICATE_SESSION,
    DUPLICATE_ASSEMBLY,
    ASSEMBLY_FAILED,
    OUT_OF_ORDER_FRAGMENT,
    MALFORMED_COMMAND,
    EXTERNAL_TIMEOUT
}

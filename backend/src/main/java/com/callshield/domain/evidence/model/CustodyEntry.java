package com.callshield.domain.evidence.model;

import java.time.Instant;

/**
 * One append-only custody log entry.
 *
 * @param action    what was done, e.g. PACKAGE_CREATED, STATUS_UNDER_REVIEW
 * @param actor     who did it
 * @param timestamp when it happened
 * @param notes     free-form notes (nullable)
 */
public record CustodyEntry(
        String action,
        String actor,
        Instant timestamp,
        String notes
) {
    public static final String PACKAGE_CREATED = "PACKAGE_CREATED";

    public static CustodyEntry statusChange(SubmissionStatus status, String actor, Instant timestamp, String notes) {
        return new CustodyEntry("STATUS_" + status.name(), actor, timestamp, notes);
    }
}

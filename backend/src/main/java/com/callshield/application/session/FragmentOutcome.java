package com.callshield.application.session;

import com.callshield.domain.session.model.CallState;
import com.callshield.domain.threat.model.ThreatLevel;

/**
 * Result of ingesting one fragment.
 *
 * @param status      APPLIED when the fragment (and any buffered successors) were applied, BUFFERED when it waits
 *                    for an earlier sequence number
 * @param applied     number of fragments applied by this call, including buffered successors
 * @param nextExpected next sequence number the session waits for
 */
public record FragmentOutcome(
        Status status,
        long sequenceNumber,
        int applied,
        long nextExpected,
        CallState state,
        double score,
        ThreatLevel level
) {
    public enum Status {
        APPLIED,
        BUFFERED
    }
}

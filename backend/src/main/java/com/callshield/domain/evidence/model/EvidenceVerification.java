package com.callshield.domain.evidence.model;

/**
 * Outcome of recomputing a package's hashes and checking its signature.
 */
public record EvidenceVerification(
        String packageId,
        boolean audioHashValid,
        boolean transcriptHashValid,
        boolean entityHashValid,
        boolean packageHashValid,
        boolean signatureValid
) {
    public boolean valid() {
        return audioHashValid && transcriptHashValid && entityHashValid && packageHashValid && signatureValid;
    }
}

package com.callshield.domain.session.model;

/**
 * One entry of the ordered call transcript.
 *
 * @param ordinal        0-based position in the transcript
 * @param sequenceNumber transcription sequence number, null for persona replies
 * @param speaker        who spoke
 * @param text           normalized text
 * @param score          running threat score after this entry was applied
 */
public record TranscriptEntry(
        int ordinal,
        Long sequenceNumber,
        Speaker speaker,
        String text,
        double score
) {}

package com.callshield.domain.intel.model;

/**
 * Candidate entity found in a transcript fragment.
 * <p>
 * The original value only travels inside the session and the signed evidence package.
 * {@link #toString()} and {@link #toView()} expose the masked form only.
 * </p>
 *
 * @param type          entity type
 * @param originalValue exact matched text
 * @param maskedValue   display-safe form, deterministic for a given original
 * @param confidence    0-1, pattern strength plus context support
 * @param startPos      start offset in the normalized fragment
 * @param endPos        end offset (exclusive)
 * @param verified      set by an external reviewer only, always false from the pipeline
 */
public record ExtractedEntity(
        EntityType type,
        String originalValue,
        String maskedValue,
        double confidence,
        int startPos,
        int endPos,
        boolean verified
) {
    public EntityView toView() {
        return new EntityView(type, maskedValue, confidence, startPos, endPos, verified);
    }

    @Override
    public String toString() {
        return "ExtractedEntity[type=" + type + ", masked=" + maskedValue
                + ", confidence=" + confidence + ", pos=" + startPos + "-" + endPos + "]";
    }
}

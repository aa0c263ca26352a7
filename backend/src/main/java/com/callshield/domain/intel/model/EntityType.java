package com.callshield.domain.intel.model;

/**
 * Closed catalogue of entity types the extractor recognizes.
 * Adding a type requires a recognizer, a masking rule and a specificity rank.
 */
public enum EntityType {
    PAYMENT_HANDLE(Sensitivity.STANDARD, 80, true),
    PHONE_NUMBER(Sensitivity.STANDARD, 60, true),
    BANK_ACCOUNT(Sensitivity.ELEVATED, 40, true),
    NATIONAL_ID(Sensitivity.HIGH, 85, false),
    TAX_ID(Sensitivity.ELEVATED, 75, false),
    CARD_NUMBER(Sensitivity.HIGH, 90, false),
    ONE_TIME_CODE(Sensitivity.HIGH, 50, false),
    BANK_ROUTING_CODE(Sensitivity.STANDARD, 78, false),
    PERSON_NAME(Sensitivity.STANDARD, 20, false),
    LOCATION(Sensitivity.STANDARD, 20, false),
    MONETARY_AMOUNT(Sensitivity.STANDARD, 30, false),
    EMAIL(Sensitivity.STANDARD, 70, true);

    public enum Sensitivity {
        STANDARD,
        ELEVATED,
        HIGH
    }

    private final Sensitivity sensitivity;
    private final int specificity;
    private final boolean correlatable;

    EntityType(Sensitivity sensitivity, int specificity, boolean correlatable) {
        this.sensitivity = sensitivity;
        this.specificity = specificity;
        this.correlatable = correlatable;
    }

    /**
     * Anything above {@link Sensitivity#STANDARD} is masked before it is shown.
     */
    public Sensitivity sensitivity() {
        return sensitivity;
    }

    /**
     * Tie-breaker for overlapping candidates of equal confidence. Higher wins.
     */
    public int specificity() {
        return specificity;
    }

    /**
     * Whether values of this type identify the caller across sessions.
     */
    public boolean correlatable() {
        return correlatable;
    }
}

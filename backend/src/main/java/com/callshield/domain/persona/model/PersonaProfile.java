package com.callshield.domain.persona.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed catalogue of persona archetypes available for hand-off.
 */
public enum PersonaProfile {
    CONFUSED_SENIOR("confused_senior", "Ramesh Kumar", 68,
            "Retired government employee, not tech-savvy. Stalls by mishearing and searching for things."),
    CAUTIOUS_PROFESSIONAL("cautious_professional", "Suresh Patel", 45,
            "Business owner. Polite but asks for references and documentation before doing anything."),
    TRUSTING_HOMEMAKER("trusting_homemaker", "Lakshmi Devi", 55,
            "Homemaker with a basic smartphone. Cooperative, defers to family for anything technical.");

    private final String id;
    private final String displayName;
    private final int age;
    private final String style;

    PersonaProfile(String id, String displayName, int age, String style) {
        this.id = id;
        this.displayName = displayName;
        this.age = age;
        this.style = style;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public int age() {
        return age;
    }

    public String style() {
        return style;
    }

    public static Optional<PersonaProfile> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(id.strip()))
                .findFirst();
    }
}

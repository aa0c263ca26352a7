package com.callshield.infrastructure.intel;

import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.ExtractedEntity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Produces the display-safe form of an entity value.
 * Masking is a pure function of (type, original), so the same value always masks identically.
 */
@Component
public class EntityMasker {

    public String mask(EntityType type, String original) {
        if (original == null || original.isEmpty() || type.sensitivity() == EntityType.Sensitivity.STANDARD) {
            return original;
        }
        return switch (type) {
            case NATIONAL_ID -> "XXXX-XXXX-" + lastDigits(original, 4);
            case CARD_NUMBER -> "XXXX-XXXX-XXXX-" + lastDigits(original, 4);
            case ONE_TIME_CODE -> maskOneTimeCode(original);
            case BANK_ACCOUNT -> maskAccount(original);
            case TAX_ID -> maskTaxId(original);
            default -> original;
        };
    }

    /**
     * Replace each entity span in the text with its masked value.
     * Entities must be sorted by startPos ascending and must not overlap.
     *
     * @param text     the fragment the entities were extracted from
     * @param entities the extracted entities (sorted by position)
     * @return text safe to hand to an external service
     */
    public String redact(String text, List<ExtractedEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return text;
        }

        StringBuilder sb = new StringBuilder();
        int lastEnd = 0;
        for (ExtractedEntity entity : entities) {
            sb.append(text, lastEnd, entity.startPos());
            sb.append(entity.maskedValue());
            lastEnd = entity.endPos();
        }
        sb.append(text, lastEnd, text.length());
        return sb.toString();
    }

    private String maskOneTimeCode(String code) {
        String digits = code.replaceAll("\\D", "");
        if (digits.length() <= 2) {
            return "*".repeat(digits.length());
        }
        return "*".repeat(digits.length() - 2) + digits.substring(digits.length() - 2);
    }

    private String maskAccount(String account) {
        String digits = account.replaceAll("\\D", "");
        if (digits.length() <= 4) {
            return "X".repeat(digits.length());
        }
        return "X".repeat(digits.length() - 4) + digits.substring(digits.length() - 4);
    }

    private String maskTaxId(String taxId) {
        String compact = taxId.replaceAll("\\s", "").toUpperCase();
        if (compact.length() < 4) {
            return "X".repeat(compact.length());
        }
        return compact.substring(0, 2) + "XXXXX" + compact.charAt(compact.length() - 1);
    }

    private String lastDigits(String value, int count) {
        String digits = value.replaceAll("\\D", "");
        return digits.length() <= count ? digits : digits.substring(digits.length() - count);
    }
}

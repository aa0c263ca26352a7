package com.callshield.infrastructure.intel;

import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.ExtractedEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts typed entities (payment handles, phone numbers, ids, codes, amounts...) from a transcript fragment.
 *
 * Every recognizer pairs a structural pattern with a format check and context keywords.
 * Confidence starts at 0.5, gains up to 0.3 from context keywords and 0.2 from a passed format check,
 * and loses 0.3 for a likely false positive. Candidates below 0.3 are dropped; candidates that match
 * a pattern but fail their format check are malformed and dropped.
 *
 * Overlapping candidates keep the higher confidence, then the more specific type, then the longer span.
 * Stateless: the same fragment always yields the same entities.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityExtractor {

    private static final double BASE_CONFIDENCE = 0.5;
    private static final double CONTEXT_STEP = 0.1;
    private static final double CONTEXT_MAX = 0.3;
    private static final double FORMAT_BONUS = 0.2;
    private static final double FALSE_POSITIVE_PENALTY = 0.3;
    private static final double MIN_CONFIDENCE = 0.3;
    private static final int CONTEXT_WINDOW = 50;

    // Digit runs must not continue into neighbouring digits, even across one separator
    private static final String NO_DIGIT_BEFORE = "(?<!\\d[\\s-]?)";
    private static final String NO_DIGIT_AFTER = "(?![\\s-]?\\d)";

    private static final Set<String> PAYMENT_PROVIDERS = Set.of(
            "paytm", "okaxis", "okhdfcbank", "okicici", "oksbi", "ybl", "apl",
            "okbizaxis", "payzapp", "ibl", "axl", "upi"
    );

    private static final Set<String> ROUTING_PREFIXES = Set.of(
            "SBIN", "HDFC", "ICIC", "UTIB", "PUNB", "BARB", "CNRB", "UBIN", "KKBK", "YESB",
            "IDIB", "BKID", "IOBA", "CBIN", "INDB", "IDFB", "FDRL", "MAHB", "UCBA", "PSIB"
    );

    // Fourth character of a tax id encodes the holder category
    private static final String TAX_HOLDER_CATEGORIES = "ABCFGHLJPT";

    private static final Pattern YEAR_LIKE = Pattern.compile("(?:19|20)\\d{2}");

    // "may" is left out, it is far more common as a verb
    private static final Pattern DATE_CONTEXT = Pattern.compile(
            "\\b(?:date|year|jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|june?|july?|aug(?:ust)?"
                    + "|sep(?:t|tember)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\b"
    );

    private enum FormatCheck { VALID, UNCHECKED, MALFORMED }

    private record PatternEntry(Pattern pattern, int group, EntityType type, List<String> contextKeywords) {}

    private record RawMatch(int start, int end, String text, EntityType type, double confidence) {
        int length() {
            return end - start;
        }

        boolean overlaps(RawMatch other) {
            return start < other.end && other.start < end;
        }
    }

    private static final List<PatternEntry> PATTERNS = List.of(
            // Payment handle: local part + "@" + provider token, not followed by a domain
            new PatternEntry(
                    Pattern.compile("(?<![\\w.@-])[A-Za-z0-9._-]{2,}@[A-Za-z]{2,}(?![\\w@]|\\.\\w)"),
                    0, EntityType.PAYMENT_HANDLE,
                    List.of("upi", "pay", "google pay", "phonepe", "paytm", "send money", "transfer")
            ),
            new PatternEntry(
                    Pattern.compile("[\\w]+(?:[.+\\-][\\w]+)*@[\\w]+(?:[\\-.][\\w]+)*\\.[a-zA-Z]{2,}"),
                    0, EntityType.EMAIL,
                    List.of("email", "mail", "send", "id")
            ),
            new PatternEntry(
                    Pattern.compile(NO_DIGIT_BEFORE + "\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}" + NO_DIGIT_AFTER),
                    0, EntityType.CARD_NUMBER,
                    List.of("card", "credit", "debit", "atm", "cvv", "expiry")
            ),
            new PatternEntry(
                    Pattern.compile(NO_DIGIT_BEFORE + "\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}" + NO_DIGIT_AFTER),
                    0, EntityType.NATIONAL_ID,
                    List.of("aadhaar", "aadhar", "uid", "identity", "verification", "kyc")
            ),
            new PatternEntry(
                    Pattern.compile("\\b[A-Z]{5}\\d{4}[A-Z]\\b", Pattern.CASE_INSENSITIVE),
                    0, EntityType.TAX_ID,
                    List.of("pan", "permanent account number", "tax", "income tax")
            ),
            new PatternEntry(
                    Pattern.compile("\\b[A-Z]{4}0[A-Z0-9]{6}\\b", Pattern.CASE_INSENSITIVE),
                    0, EntityType.BANK_ROUTING_CODE,
                    List.of("ifsc", "branch", "bank code")
            ),
            new PatternEntry(
                    Pattern.compile("(?<![\\d+])(?:\\+91[-\\s]?)?[6-9]\\d{9}(?!\\d)"),
                    0, EntityType.PHONE_NUMBER,
                    List.of("call", "phone", "mobile", "number", "contact", "whatsapp")
            ),
            new PatternEntry(
                    Pattern.compile(NO_DIGIT_BEFORE + "(?<![.,])\\d{4,8}(?![.,]\\d)" + NO_DIGIT_AFTER),
                    0, EntityType.ONE_TIME_CODE,
                    List.of("otp", "password", "code", "pin", "one time")
            ),
            new PatternEntry(
                    Pattern.compile(NO_DIGIT_BEFORE + "(?<!\\+)\\d{9,18}" + NO_DIGIT_AFTER),
                    0, EntityType.BANK_ACCOUNT,
                    List.of("account", "bank", "transfer", "deposit", "ifsc", "a/c")
            ),
            new PatternEntry(
                    Pattern.compile(
                            "(?:\\b(?:rs\\.?|inr)|\u20B9)\\s?\\d[\\d,]*(?:\\.\\d{1,2})?(?:\\s?(?:lakh|crore|thousand))?"
                                    + "|\\b\\d[\\d,]*(?:\\.\\d{1,2})?\\s?(?:lakh|crore|thousand|rupees)\\b",
                            Pattern.CASE_INSENSITIVE),
                    0, EntityType.MONETARY_AMOUNT,
                    List.of("amount", "pay", "payment", "fee", "charge", "fine", "transfer")
            ),
            new PatternEntry(
                    Pattern.compile("(?i:\\bmy name is|\\bthis is|\\bi am|\\bi'm)\\s+([A-Z][a-z]+(?:\\s[A-Z][a-z]+)?)"),
                    1, EntityType.PERSON_NAME,
                    List.of("name", "officer", "mr", "mrs", "sir", "madam")
            ),
            new PatternEntry(
                    Pattern.compile("\\b(?:New Delhi|Delhi|Mumbai|Kolkata|Chennai|Bengaluru|Bangalore|Hyderabad|Pune|"
                                    + "Ahmedabad|Jaipur|Lucknow|Noida|Gurgaon|Gurugram|Patna|Jamtara|Deoghar|Bharatpur|"
                                    + "Mewat|Nuh)\\b",
                            Pattern.CASE_INSENSITIVE),
                    0, EntityType.LOCATION,
                    List.of("from", "branch", "office", "located", "station", "city")
            )
    );

    private final EntityMasker masker;

    /**
     * Extract entities from a normalized fragment.
     *
     * @param text the normalized fragment
     * @return non-overlapping entities, sorted by start position
     */
    public List<ExtractedEntity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<RawMatch> candidates = new ArrayList<>();
        for (PatternEntry entry : PATTERNS) {
            Matcher matcher = entry.pattern.matcher(text);
            while (matcher.find()) {
                String value = matcher.group(entry.group);
                int start = matcher.start(entry.group);
                int end = matcher.end(entry.group);

                FormatCheck check = checkFormat(entry.type, value);
                if (check == FormatCheck.MALFORMED) {
                    log.debug("Dropped malformed {} candidate at {}-{}", entry.type, start, end);
                    continue;
                }

                double confidence = confidence(entry, check, value, text, start, end);
                if (confidence < MIN_CONFIDENCE) {
                    continue;
                }
                candidates.add(new RawMatch(start, end, value, entry.type, confidence));
            }
        }

        List<ExtractedEntity> entities = new ArrayList<>();
        for (RawMatch m : resolveOverlaps(candidates)) {
            entities.add(new ExtractedEntity(
                    m.type,
                    m.text,
                    masker.mask(m.type, m.text),
                    m.confidence,
                    m.start,
                    m.end,
                    false
            ));
        }
        return entities;
    }

    private List<RawMatch> resolveOverlaps(List<RawMatch> candidates) {
        List<RawMatch> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator
                .comparingDouble(RawMatch::confidence).reversed()
                .thenComparing(m -> m.type.specificity(), Comparator.reverseOrder())
                .thenComparing(RawMatch::length, Comparator.reverseOrder())
                .thenComparingInt(RawMatch::start));

        List<RawMatch> kept = new ArrayList<>();
        for (RawMatch candidate : ranked) {
            if (kept.stream().noneMatch(candidate::overlaps)) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingInt(RawMatch::start));
        return kept;
    }

    private double confidence(PatternEntry entry, FormatCheck check, String value,
                              String text, int start, int end) {
        String context = text.substring(Math.max(0, start - CONTEXT_WINDOW), Math.min(text.length(), end + CONTEXT_WINDOW))
                .toLowerCase(Locale.ROOT);

        long keywordHits = entry.contextKeywords.stream().filter(context::contains).count();
        double confidence = BASE_CONFIDENCE + Math.min(CONTEXT_MAX, keywordHits * CONTEXT_STEP);
        if (check == FormatCheck.VALID) {
            confidence += FORMAT_BONUS;
        }
        if (isLikelyFalsePositive(entry.type, value, context)) {
            confidence -= FALSE_POSITIVE_PENALTY;
        }
        confidence = Math.min(1.0, Math.max(0.0, confidence));
        return Math.round(confidence * 100) / 100.0;
    }

    private FormatCheck checkFormat(EntityType type, String value) {
        return switch (type) {
            case PAYMENT_HANDLE -> {
                String provider = value.substring(value.indexOf('@') + 1).toLowerCase(Locale.ROOT);
                yield PAYMENT_PROVIDERS.contains(provider) ? FormatCheck.VALID : FormatCheck.UNCHECKED;
            }
            case CARD_NUMBER -> passesLuhn(digitsOf(value)) ? FormatCheck.VALID : FormatCheck.MALFORMED;
            case NATIONAL_ID -> {
                char first = digitsOf(value).charAt(0);
                yield first == '0' || first == '1' ? FormatCheck.MALFORMED : FormatCheck.VALID;
            }
            case TAX_ID -> TAX_HOLDER_CATEGORIES.indexOf(Character.toUpperCase(value.charAt(3))) >= 0
                    ? FormatCheck.VALID : FormatCheck.MALFORMED;
            case BANK_ROUTING_CODE -> ROUTING_PREFIXES.contains(value.substring(0, 4).toUpperCase(Locale.ROOT))
                    ? FormatCheck.VALID : FormatCheck.MALFORMED;
            case PHONE_NUMBER, EMAIL, MONETARY_AMOUNT, LOCATION -> FormatCheck.VALID;
            case ONE_TIME_CODE, BANK_ACCOUNT, PERSON_NAME -> FormatCheck.UNCHECKED;
        };
    }

    private boolean isLikelyFalsePositive(EntityType type, String value, String context) {
        if (type == EntityType.ONE_TIME_CODE) {
            if (YEAR_LIKE.matcher(value).matches()) {
                return true;
            }
            return DATE_CONTEXT.matcher(context).find();
        }
        return false;
    }

    private static String digitsOf(String value) {
        return value.replaceAll("\\D", "");
    }

    static boolean passesLuhn(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}

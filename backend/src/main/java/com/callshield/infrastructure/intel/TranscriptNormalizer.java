package com.callshield.infrastructure.intel;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes transcript fragments before scoring and extraction:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Spoken digit runs ("four eight two nine", "4 8 2 9") rewritten to digits
 * - Whitespace collapse and trim
 */
@Component
public class TranscriptNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final Map<String, Character> DIGIT_WORDS = Map.ofEntries(
            Map.entry("zero", '0'),
            Map.entry("oh", '0'),
            Map.entry("one", '1'),
            Map.entry("two", '2'),
            Map.entry("three", '3'),
            Map.entry("four", '4'),
            Map.entry("five", '5'),
            Map.entry("six", '6'),
            Map.entry("seven", '7'),
            Map.entry("eight", '8'),
            Map.entry("nine", '9')
    );

    private static final String DIGIT_WORD = "(?:zero|oh|one|two|three|four|five|six|seven|eight|nine)";

    // "double five" and "triple nine" are common in dictated numbers
    private static final String SPOKEN_TOKEN = "(?:(?:double|triple)\\s+)?" + DIGIT_WORD;

    // Three or more spoken digits in a row; shorter runs are ordinary speech ("one or two")
    private static final Pattern SPOKEN_DIGIT_RUN = Pattern.compile(
            "\\b" + SPOKEN_TOKEN + "(?:[\\s,\\-]+" + SPOKEN_TOKEN + "){2,}\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SPOKEN_TOKEN_PATTERN = Pattern.compile(
            "(?:(double|triple)\\s+)?(" + DIGIT_WORD + ")",
            Pattern.CASE_INSENSITIVE
    );

    // Four or more single digits separated by spaces or hyphens, as speech-to-text emits them
    private static final Pattern SPACED_DIGIT_RUN = Pattern.compile("(?<!\\d)\\d(?:[ \\-]\\d){3,}(?!\\d)");

    /**
     * Normalize a transcript fragment.
     *
     * @param text raw fragment text
     * @return normalized text, or the input itself when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Unicode NFC normalization
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        // 2. Remove invisible and control characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 3. Collapse all whitespace; a fragment is a single utterance
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        // 4. Spoken digits to numerals
        result = rewriteSpokenDigits(result);
        result = SPACED_DIGIT_RUN.matcher(result).replaceAll(m -> m.group().replaceAll("[ \\-]", ""));

        return result.strip();
    }

    private String rewriteSpokenDigits(String text) {
        Matcher run = SPOKEN_DIGIT_RUN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (run.find()) {
            run.appendReplacement(sb, Matcher.quoteReplacement(toDigits(run.group())));
        }
        run.appendTail(sb);
        return sb.toString();
    }

    private String toDigits(String spoken) {
        StringBuilder digits = new StringBuilder();
        Matcher token = SPOKEN_TOKEN_PATTERN.matcher(spoken);
        while (token.find()) {
            char digit = DIGIT_WORDS.get(token.group(2).toLowerCase(Locale.ROOT));
            int repeat = 1;
            if (token.group(1) != null) {
                repeat = token.group(1).equalsIgnoreCase("double") ? 2 : 3;
            }
            for (int i = 0; i < repeat; i++) {
                digits.append(digit);
            }
        }
        return digits.toString();
    }
}

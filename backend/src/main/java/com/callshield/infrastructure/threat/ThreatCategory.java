package com.callshield.infrastructure.threat;

import java.util.regex.Pattern;

/**
 * Lexicon categories with their per-match weight. Each category is one alternation, longest phrases first,
 * so overlapping phrases count once.
 */
public enum ThreatCategory {
    URGENCY(0.15,
            "immediate action required|act now|limited time|last chance|today only|right now|within \\d+ (?:minutes|hours)"
                    + "|urgent(?:ly)?|immediately|emergency|hurry"),
    FINANCIAL(0.20,
            "bank account|account number|credit card|debit card|google pay|phonepe|paytm|upi|send money"
                    + "|transfer (?:the )?(?:money|amount|funds)|pay (?:a |the )?(?:fee|fine|charge|penalty)|ifsc|refund|payment"),
    CREDENTIAL(0.35,
            "one[- ]time (?:password|code)|verification code|sent to your (?:phone|mobile|number)|expiry date"
                    + "|otp|cvv|pin|password"),
    IMPERSONATION(0.25,
            "this is the bank|(?:calling|speaking) from (?:the |your )?(?:bank|rbi|police|income tax|customs|cyber cell)"
                    + "|reserve bank(?: of india)?|income tax department|enforcement directorate|narcotics bureau"
                    + "|customs department|cyber ?crime|police department|bank (?:manager|officer|executive)|your bank|rbi|cbi"),
    THREAT(0.25,
            "arrest warrant|legal action|court case|police complaint"
                    + "|account (?:is |has been |will be )?(?:blocked|frozen|suspended|closed)"
                    + "|(?:sim|pan) card (?:is |will be )?blocked|arrest(?:ed)?|jail|fir|penalty"),
    REMOTE_ACCESS(0.20,
            "anydesk|teamviewer|quick ?support|screen ?shar(?:e|ing)|remote access"
                    + "|install (?:the |this )?app|download (?:the |this )?(?:app|software)"),
    VERIFICATION(0.15,
            "aadhaar verification|pan verification|document verification|verify your (?:identity|account|details)|kyc"),
    PRIZE(0.20,
            "you have won|lucky draw|prize money|cash prize|free gift|congratulations|lottery");

    private final double weight;
    private final Pattern pattern;

    ThreatCategory(double weight, String alternation) {
        this.weight = weight;
        this.pattern = Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    public double weight() {
        return weight;
    }

    public int countMatches(String text) {
        int count = 0;
        var matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public String indicator() {
        return name().toLowerCase();
    }
}

package com.example.agentpayments.quote;

import java.util.List;
import java.util.Locale;

public final class QuotePricing {

    public static final int BASE_POINTS = 6;
    public static final int MIN_POINTS = 5;
    public static final int MAX_POINTS = 10;
    public static final int LONG_QUESTION_CHARS = 120;

    static final List<String> TECHNICAL_KEYWORDS =
            List.of("matrix", "gaussian", "proof", "opencv", "unreal", "swiftui", "jetson", "agent");

    private QuotePricing() {}

    /**
     * Price of a question in points, clamped to [5, 10].
     *
     * @param seenBefore discount flag; the quote flow only prices unseen questions and always passes false
     */
    public static int decidePoints(String question, boolean seenBefore) {
        int points = BASE_POINTS;
        if (question.length() > LONG_QUESTION_CHARS) points += 2;
        String lower = question.toLowerCase(Locale.ROOT);
        if (TECHNICAL_KEYWORDS.stream().anyMatch(lower::contains)) points += 2;
        if (seenBefore) points -= 2;
        return Math.max(MIN_POINTS, Math.min(MAX_POINTS, points));
    }
}

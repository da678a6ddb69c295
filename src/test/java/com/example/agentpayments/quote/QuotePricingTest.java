package com.example.agentpayments.quote;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuotePricingTest {

    private static final String LONG_PLAIN = "x".repeat(121);

    @Test
    void testDecidePoints_ShortPlainQuestionIsBase() {
        assertEquals(6, QuotePricing.decidePoints("What is the capital of France?", false));
    }

    @Test
    void testDecidePoints_LongQuestion() {
        assertEquals(8, QuotePricing.decidePoints(LONG_PLAIN, false));
        assertEquals(6, QuotePricing.decidePoints("x".repeat(120), false));
    }

    @Test
    void testDecidePoints_KeywordIsCaseInsensitive() {
        assertEquals(8, QuotePricing.decidePoints("How do I invert a MATRIX?", false));
        assertEquals(8, QuotePricing.decidePoints("Deploying on Jetson nano", false));
    }

    @Test
    void testDecidePoints_LongWithKeywordIsMax() {
        assertEquals(10, QuotePricing.decidePoints(LONG_PLAIN + " opencv", false));
    }

    @Test
    void testDecidePoints_SeenBeforeDiscountClampedToMin() {
        assertEquals(5, QuotePricing.decidePoints("short", true));
        assertEquals(8, QuotePricing.decidePoints(LONG_PLAIN + " proof", true));
    }

    @Test
    void testDecidePoints_AlwaysWithinBounds() {
        String[] questions = {"", "a", LONG_PLAIN, "agent gaussian unreal swiftui " + LONG_PLAIN};
        for (String q : questions) {
            for (boolean seen : new boolean[]{true, false}) {
                int points = QuotePricing.decidePoints(q, seen);
                assertTrue(points >= QuotePricing.MIN_POINTS && points <= QuotePricing.MAX_POINTS, q);
            }
        }
    }
}

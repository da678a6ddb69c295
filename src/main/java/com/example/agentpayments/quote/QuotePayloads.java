package com.example.agentpayments.quote;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Messages sent to the peer. x402 payloads are opaque JSON here, nothing is signed or verified.
 */
public final class QuotePayloads {

    public static final String CURRENCY = "POINTS";

    private QuotePayloads() {}

    public static Map<String, Object> repeat() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "quote");
        payload.put("points", 0);
        payload.put("reason", "repeat_question");
        return payload;
    }

    public static Map<String, Object> priceQuote(int points, String question, boolean x402) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", x402 ? "x402.quote" : "price_quote");
        payload.put("amount_points", points);
        payload.put("currency", CURRENCY);
        payload.put("question", question);
        return payload;
    }
}

package com.example.agentpayments.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Accepts when the card has {@code economy.pricing} as an object, or when its capabilities mention
 * {@code payments.points} or {@code x402}.
 */
public class HeuristicCapabilityOracle implements PaymentCapabilityOracle {

    private final ObjectMapper objectMapper;

    public HeuristicCapabilityOracle(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public CapabilityDecision assess(Map<String, Object> peerDocument) {
        Map<String, Object> card = cardOf(peerDocument);
        Map<String, Object> economy = section(card, "economy");
        boolean hasPricing = economy.get("pricing") instanceof Map;
        String caps = toJson(card.get("capabilities"));
        boolean hasCapability = caps.contains("payments.points") || caps.contains("x402");
        return CapabilityDecision.heuristic(hasPricing || hasCapability);
    }

    /**
     * Weaker check used when the model cannot decide: any non-empty economy or capabilities section.
     */
    public boolean hasPaymentSections(Map<String, Object> peerDocument) {
        Map<String, Object> card = cardOf(peerDocument);
        return !section(card, "economy").isEmpty() || isPresent(card.get("capabilities"));
    }

    /**
     * The registry may wrap the card under {@code "card"}; otherwise the document is the card.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> cardOf(Map<String, Object> peerDocument) {
        if (peerDocument == null) return Map.of();
        Object wrapped = peerDocument.get("card");
        return wrapped instanceof Map ? (Map<String, Object>) wrapped : peerDocument;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> card, String name) {
        Object value = card.get(name);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        if (value instanceof Iterable) return ((Iterable<?>) value).iterator().hasNext();
        if (value instanceof String) return !((String) value).isEmpty();
        if (value instanceof Boolean) return (Boolean) value;
        return true;
    }

    String toJson(Object value) {
        if (value == null) return "{}";
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}

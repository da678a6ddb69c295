package com.example.agentpayments.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;

import java.util.Locale;
import java.util.Map;

/**
 * Asks a chat model whether the peer can accept payment. The reply must contain exactly one of
 * {@code true} / {@code false}; anything else, or a failed call, falls back to
 * {@link HeuristicCapabilityOracle#hasPaymentSections}.
 */
public class ModelCapabilityOracle implements PaymentCapabilityOracle {

    private static final Logger logger = LoggerFactory.getLogger(ModelCapabilityOracle.class);

    static final String PROMPT_TEMPLATE = "Check if an AI agent can accept payment from its AgentFacts JSON. "
            + "Return only 'true' or 'false'.\n\n"
            + "AgentFacts: %s";

    private final ChatModel chatModel;
    private final HeuristicCapabilityOracle heuristic;
    private final ObjectMapper objectMapper;

    public ModelCapabilityOracle(ChatModel chatModel, HeuristicCapabilityOracle heuristic, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.heuristic = heuristic;
        this.objectMapper = objectMapper;
    }

    @Override
    public CapabilityDecision assess(Map<String, Object> peerDocument) {
        try {
            String reply = chatModel.call(buildPrompt(peerDocument));
            String text = reply == null ? "" : reply.trim().toLowerCase(Locale.ROOT);
            boolean saysTrue = text.contains("true");
            boolean saysFalse = text.contains("false");
            if (saysTrue != saysFalse) {
                return CapabilityDecision.model(saysTrue);
            }
            return fallback(peerDocument, "ambiguous model reply: " + abbreviate(text));
        } catch (RuntimeException | JsonProcessingException e) {
            return fallback(peerDocument, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    String buildPrompt(Map<String, Object> peerDocument) throws JsonProcessingException {
        return String.format(PROMPT_TEMPLATE, objectMapper.writeValueAsString(HeuristicCapabilityOracle.cardOf(peerDocument)));
    }

    private CapabilityDecision fallback(Map<String, Object> peerDocument, String reason) {
        logger.warn("Capability oracle fallback: {}", reason);
        return CapabilityDecision.fallback(heuristic.hasPaymentSections(peerDocument), reason);
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}

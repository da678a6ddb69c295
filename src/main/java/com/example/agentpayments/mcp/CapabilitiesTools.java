package com.example.agentpayments.mcp;

import com.example.agentpayments.config.AgentPaymentsProperties;
import com.example.agentpayments.store.FactStore;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class CapabilitiesTools {

    private final AgentPaymentsProperties properties;
    private final FactStore facts;

    public CapabilitiesTools(AgentPaymentsProperties properties, FactStore facts) {
        this.properties = properties;
        this.facts = facts;
    }

    @Tool(description = "Describe this agent's payment capabilities and storage mode")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "agent", Map.of("agentId", properties.getAgentId(), "name", "agent-payments", "version", "0.1.0"),
                "economy", Map.of(
                    "currency", "POINTS",
                    "quoteTypes", properties.isX402Quotes() ? "x402.quote" : "price_quote"
                ),
                "capabilities", Map.of(
                    "payments.points", true,
                    "x402", properties.isX402Quotes()
                ),
                "store", Map.of("backend", facts.backend().name(), "degraded", facts.isDegraded())
        );
    }
}

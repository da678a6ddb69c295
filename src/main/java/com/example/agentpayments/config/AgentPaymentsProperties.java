package com.example.agentpayments.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the local agent, its fact store and the three outbound collaborators
 * (registry, capability oracle, peer agents).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.agent")
public class AgentPaymentsProperties {

    /**
     * Identifier of the local agent. Credited on every charge and sent as {@code from} on delivery.
     */
    private String agentId = "default";

    private String registryUrl;

    /**
     * When blank the capability check runs on the heuristic only.
     */
    private String anthropicApiKey;

    /**
     * When blank, or when the ping fails, facts are kept in {@link #factsFile}.
     */
    private String mongoUrl;

    private String dbName = "agent_registry";
    private String factsFile = "agent_facts.json";

    private Duration mongoPingTimeout = Duration.ofMillis(1500);
    private Duration registryTimeout = Duration.ofSeconds(10);
    private Duration deliveryTimeout = Duration.ofSeconds(20);
    private Duration oracleTimeout = Duration.ofSeconds(20);

    private String oracleModel = "claude-3-5-sonnet-20240620";
    private int oracleMaxTokens = 20;

    /**
     * Send {@code x402.quote} payloads instead of plain {@code price_quote} when the caller doesn't say.
     */
    private boolean x402Quotes = true;

    private boolean serializeCharges = true;

    public boolean hasOracleCredential() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    public boolean hasMongoUrl() {
        return mongoUrl != null && !mongoUrl.isBlank();
    }

    public boolean hasRegistryUrl() {
        return registryUrl != null && !registryUrl.isBlank();
    }
}

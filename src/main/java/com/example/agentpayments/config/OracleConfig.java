package com.example.agentpayments.config;

import com.example.agentpayments.oracle.HeuristicCapabilityOracle;
import com.example.agentpayments.oracle.ModelCapabilityOracle;
import com.example.agentpayments.oracle.PaymentCapabilityOracle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

@Configuration
public class OracleConfig {

    private static final Logger logger = LoggerFactory.getLogger(OracleConfig.class);

    @Bean
    public PaymentCapabilityOracle paymentCapabilityOracle(AgentPaymentsProperties properties, ObjectMapper objectMapper) {
        HeuristicCapabilityOracle heuristic = new HeuristicCapabilityOracle(objectMapper);
        if (!properties.hasOracleCredential()) {
            logger.info("No ANTHROPIC_API_KEY configured, capability checks use the heuristic");
            return heuristic;
        }
        AnthropicApi api = AnthropicApi.builder()
                .apiKey(properties.getAnthropicApiKey())
                .restClientBuilder(RestClient.builder()
                        .requestFactory(HttpClientConfig.requestFactory(properties.getOracleTimeout())))
                .build();
        AnthropicChatModel chatModel = AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(AnthropicChatOptions.builder()
                        .model(properties.getOracleModel())
                        .maxTokens(properties.getOracleMaxTokens())
                        .build())
                // one attempt, failures fall back to the heuristic
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
        logger.info("Capability checks use model {}", properties.getOracleModel());
        return new ModelCapabilityOracle(chatModel, heuristic, objectMapper);
    }
}

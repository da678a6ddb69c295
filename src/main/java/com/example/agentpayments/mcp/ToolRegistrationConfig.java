package com.example.agentpayments.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final PaymentTools paymentTools;
    private final FactTools factTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(PaymentTools paymentTools, FactTools factTools, CapabilitiesTools capTools) {
        this.paymentTools = paymentTools;
        this.factTools = factTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(paymentTools, factTools, capTools)
                .build();
    }
}

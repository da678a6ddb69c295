package com.example.agentpayments.config;

import com.example.agentpayments.store.FactStore;
import com.example.agentpayments.store.FactStoreFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FactStoreConfig {

    @Bean
    public FactStore factStore(AgentPaymentsProperties properties, ObjectMapper objectMapper) {
        return new FactStoreFactory(properties, objectMapper).create();
    }
}

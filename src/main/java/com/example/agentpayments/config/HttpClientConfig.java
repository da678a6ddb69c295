package com.example.agentpayments.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Blocking clients for the registry and peer endpoints, one per timeout budget.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    @Qualifier("registryRestClient")
    public RestClient registryRestClient(AgentPaymentsProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(properties.getRegistryTimeout()))
                .build();
    }

    @Bean
    @Qualifier("deliveryRestClient")
    public RestClient deliveryRestClient(AgentPaymentsProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(properties.getDeliveryTimeout()))
                .build();
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }
}

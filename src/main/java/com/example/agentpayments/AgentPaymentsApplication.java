package com.example.agentpayments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// Mongo is wired by FactStoreFactory only when MONGO_URL is set and reachable.
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
@ConfigurationPropertiesScan
public class AgentPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentPaymentsApplication.class, args);
    }
}

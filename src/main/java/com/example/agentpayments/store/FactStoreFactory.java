package com.example.agentpayments.store;

import com.example.agentpayments.config.AgentPaymentsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Picks the fact store backend once, at startup: Mongo when a URL is configured and answers a ping,
 * the local file otherwise.
 */
public class FactStoreFactory {

    private static final Logger logger = LoggerFactory.getLogger(FactStoreFactory.class);

    private final AgentPaymentsProperties properties;
    private final ObjectMapper objectMapper;

    public FactStoreFactory(AgentPaymentsProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public FactStore create() {
        Path file = Path.of(properties.getFactsFile());
        if (!properties.hasMongoUrl()) {
            logger.info("No MONGO_URL configured, using facts file {}", file.toAbsolutePath());
            return new FileFactStore(file, objectMapper);
        }
        try {
            FactStore store = connect(properties.getMongoUrl(), properties.getDbName());
            logger.info("Fact store connected to MongoDB database {}", properties.getDbName());
            return store;
        } catch (RuntimeException e) {
            logger.warn("MongoDB unreachable, running in degraded mode on facts file {}: {}",
                    file.toAbsolutePath(), e.getMessage());
            return new FileFactStore(file, objectMapper, true);
        }
    }

    protected FactStore connect(String url, String dbName) {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(url))
                .applyToClusterSettings(b -> b.serverSelectionTimeout(
                        properties.getMongoPingTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .build();
        MongoClient client = MongoClients.create(settings);
        try {
            client.getDatabase(dbName).runCommand(new Document("ping", 1));
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        return new MongoFactStore(new MongoTemplate(client, dbName), client);
    }
}

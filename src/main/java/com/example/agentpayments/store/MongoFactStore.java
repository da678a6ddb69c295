package com.example.agentpayments.store;

import com.mongodb.client.MongoClient;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class MongoFactStore implements FactStore {

    static final String COLLECTION = "agent_facts";

    private final MongoTemplate mongo;
    private final MongoClient client;

    public MongoFactStore(MongoTemplate mongo) {
        this(mongo, null);
    }

    MongoFactStore(MongoTemplate mongo, MongoClient client) {
        this.mongo = mongo;
        this.client = client;
    }

    @Override
    public void set(String ownerId, String key, Map<String, Object> value) {
        Update update = new Update()
                .set("agent_id", ownerId)
                .set("key", key)
                .set("value", value)
                .set("ts", Instant.now().toString());
        mongo.upsert(byOwnerAndKey(ownerId, key), update, COLLECTION);
    }

    @Override
    public Optional<FactRecord> get(String ownerId, String key) {
        return Optional.ofNullable(mongo.findOne(byOwnerAndKey(ownerId, key), FactRecord.class, COLLECTION));
    }

    @Override
    public Map<String, FactRecord> list(String ownerId) {
        List<FactRecord> docs = mongo.find(new Query(Criteria.where("agent_id").is(ownerId)), FactRecord.class, COLLECTION);
        Map<String, FactRecord> out = new LinkedHashMap<>();
        docs.forEach(d -> out.put(d.getKey(), d));
        return out;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.MONGO;
    }

    @Override
    public boolean isDegraded() {
        return false;
    }

    public void close() {
        if (client != null) client.close();
    }

    private static Query byOwnerAndKey(String ownerId, String key) {
        return new Query(Criteria.where("agent_id").is(ownerId).and("key").is(key));
    }
}

package com.example.agentpayments.mcp;

import com.example.agentpayments.store.FactRecord;
import com.example.agentpayments.store.FactStore;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class FactTools {

    private final FactStore facts;
    private final List<String> readablePrefixes;

    public FactTools(FactStore facts,
                     @Value("${app.policies.readable-prefixes:wallet:,txn:,q:}") List<String> readablePrefixes) {
        this.facts = facts;
        this.readablePrefixes = List.copyOf(readablePrefixes);
    }

    private boolean readable(String key) {
        return readablePrefixes.stream().anyMatch(key::startsWith);
    }

    @Tool(description = "Get one fact record by owner and key")
    public Map<String,Object> facts_get(String ownerId, String key) {
        if (!readable(key)) {
            throw new IllegalArgumentException("Key not readable: " + key);
        }
        Map<String,Object> result = new HashMap<>();
        result.put("ownerId", ownerId);
        result.put("key", key);
        result.put("record", facts.get(ownerId, key).orElse(null));
        return result;
    }

    @Tool(description = "List fact records owned by an agent, optionally filtered by key prefix")
    public Map<String,Object> facts_list(String ownerId, String prefix) {
        Map<String,FactRecord> out = new LinkedHashMap<>();
        facts.list(ownerId).forEach((k, v) -> {
            if (readable(k) && (prefix == null || k.startsWith(prefix))) out.put(k, v);
        });
        return Map.of("ownerId", ownerId, "records", out);
    }
}

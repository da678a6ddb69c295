package com.example.agentpayments.controller;

import com.example.agentpayments.config.AgentPaymentsProperties;
import com.example.agentpayments.store.FactStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final FactStore factStore;
    private final AgentPaymentsProperties properties;

    public HealthController(FactStore factStore, AgentPaymentsProperties properties) {
        this.factStore = factStore;
        this.properties = properties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", factStore.isDegraded() ? "DEGRADED" : "UP");
        health.put("service", "agent-payments");
        health.put("version", "0.1.0");
        health.put("agentId", properties.getAgentId());
        health.put("factStore", factStore.backend().name());
        health.put("factStoreDegraded", factStore.isDegraded());
        health.put("oracle", properties.hasOracleCredential() ? "MODEL" : "HEURISTIC");
        health.put("registryConfigured", properties.hasRegistryUrl());

        // Touch the store so a broken backend shows up here rather than on the first charge
        try {
            factStore.get(properties.getAgentId(), "health-check");
            health.put("factStoreStatus", "UP");
        } catch (Exception e) {
            health.put("factStoreStatus", "DOWN");
            health.put("factStoreError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}

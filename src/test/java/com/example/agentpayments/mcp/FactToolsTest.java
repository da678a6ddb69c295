package com.example.agentpayments.mcp;

import com.example.agentpayments.store.FileFactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactToolsTest {

    @TempDir
    Path tempDir;

    private FileFactStore facts;
    private FactTools tools;

    @BeforeEach
    void setUp() {
        facts = new FileFactStore(tempDir.resolve("facts.json"), new ObjectMapper());
        tools = new FactTools(facts, List.of("wallet:", "txn:"));
    }

    @Test
    void testFactsGet_DisallowedPrefix() {
        assertThrows(IllegalArgumentException.class, () -> tools.facts_get("self", "q:bob:123"));
    }

    @Test
    void testFactsList_FiltersByPolicyAndPrefix() {
        // Given
        facts.set("self", "wallet:self", Map.of("balance", 6));
        facts.set("self", "txn:t1", Map.of("points", 6));
        facts.set("self", "q:bob:123", Map.of("user", "bob"));

        // When
        Map<?, ?> all = (Map<?, ?>) tools.facts_list("self", null).get("records");
        Map<?, ?> txns = (Map<?, ?>) tools.facts_list("self", "txn:").get("records");

        // Then
        assertEquals(2, all.size());
        assertEquals(1, txns.size());
        assertTrue(txns.containsKey("txn:t1"));
    }

    @Test
    void testFactsGet_MissingRecordIsNull() {
        assertNull(tools.facts_get("self", "wallet:self").get("record"));
    }
}

package com.example.agentpayments.peer;

import com.example.agentpayments.config.AgentPaymentsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class PeerRegistryClientTest {

    private MockRestServiceServer server;
    private AgentPaymentsProperties properties;
    private PeerRegistryClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        properties = new AgentPaymentsProperties();
        properties.setRegistryUrl("http://registry.test/");
        client = new PeerRegistryClient(builder.build(), properties);
    }

    @Test
    void testResolve_Found() {
        // Given
        server.expect(requestTo("http://registry.test/resolve"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.agent_id").value("peer-1"))
                .andRespond(withSuccess("{\"agent_id\":\"peer-1\",\"agent_url\":\"http://peer-1.test\","
                        + "\"card\":{\"capabilities\":[\"x402\"]}}", MediaType.APPLICATION_JSON));

        // When
        Optional<PeerInfo> peer = client.resolve("peer-1");

        // Then
        assertTrue(peer.isPresent());
        assertEquals("peer-1", peer.get().getAgentId());
        assertEquals("http://peer-1.test", peer.get().getAgentUrl());
        assertTrue(peer.get().getDocument().containsKey("card"));
        server.verify();
    }

    @Test
    void testResolve_NotFoundIsEmpty() {
        server.expect(requestTo("http://registry.test/resolve"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(client.resolve("ghost").isEmpty());
    }

    @Test
    void testResolve_ServerErrorIsRegistryUnavailable() {
        server.expect(requestTo("http://registry.test/resolve"))
                .andRespond(withServerError());

        assertThrows(RegistryUnavailableException.class, () -> client.resolve("peer-1"));
    }

    @Test
    void testResolve_TimeoutIsRegistryUnavailable() {
        server.expect(requestTo("http://registry.test/resolve"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThrows(RegistryUnavailableException.class, () -> client.resolve("peer-1"));
    }

    @Test
    void testResolve_MissingAgentIdIsRegistryUnavailable() {
        server.expect(requestTo("http://registry.test/resolve"))
                .andRespond(withSuccess("{\"agent_url\":\"http://x\"}", MediaType.APPLICATION_JSON));

        assertThrows(RegistryUnavailableException.class, () -> client.resolve("peer-1"));
    }

    @Test
    void testResolve_NoRegistryConfigured() {
        properties.setRegistryUrl(null);

        assertThrows(RegistryUnavailableException.class, () -> client.resolve("peer-1"));
    }
}

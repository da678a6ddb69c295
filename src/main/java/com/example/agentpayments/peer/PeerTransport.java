package com.example.agentpayments.peer;

import com.example.agentpayments.config.AgentPaymentsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Single-attempt delivery of a JSON message to a peer's {@code /handle_external_message} endpoint.
 */
@Component
public class PeerTransport {

    private static final Logger logger = LoggerFactory.getLogger(PeerTransport.class);

    private final RestClient restClient;
    private final PeerRegistryClient registry;
    private final AgentPaymentsProperties properties;

    public PeerTransport(@Qualifier("deliveryRestClient") RestClient restClient,
                         PeerRegistryClient registry,
                         AgentPaymentsProperties properties) {
        this.restClient = restClient;
        this.registry = registry;
        this.properties = properties;
    }

    public Map<String, Object> deliver(String receiverId, Map<String, Object> payload) {
        PeerInfo peer;
        try {
            peer = registry.resolve(receiverId)
                    .orElseThrow(() -> new DeliveryException("A2A resolution failed: " + receiverId + " not found"));
        } catch (RegistryUnavailableException e) {
            throw new DeliveryException("A2A resolution failed: " + e.getMessage(), e);
        }
        return deliver(peer, payload);
    }

    public Map<String, Object> deliver(PeerInfo peer, Map<String, Object> payload) {
        if (peer == null || !peer.hasEndpoint()) {
            throw new DeliveryException("A2A resolution failed: no agent_url");
        }
        String endpoint = PeerRegistryClient.stripTrailingSlash(peer.getAgentUrl()) + "/handle_external_message";
        try {
            Map<String, Object> response = restClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("from", properties.getAgentId(), "message", payload))
                    .retrieve()
                    .body(PeerRegistryClient.JSON_OBJECT);
            logger.debug("Delivered {} to {}", payload.get("type"), peer.getAgentId());
            return response != null ? response : Map.of();
        } catch (RestClientException e) {
            logger.warn("Delivery to {} at {} failed: {}", peer.getAgentId(), endpoint, e.getMessage());
            throw new DeliveryException("Delivery to " + peer.getAgentId() + " failed: " + e.getMessage(), e);
        }
    }
}

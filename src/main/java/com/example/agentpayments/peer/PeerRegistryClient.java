package com.example.agentpayments.peer;

import com.example.agentpayments.config.AgentPaymentsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;
import java.util.Optional;

@Component
public class PeerRegistryClient {

    private static final Logger logger = LoggerFactory.getLogger(PeerRegistryClient.class);
    static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final AgentPaymentsProperties properties;

    public PeerRegistryClient(@Qualifier("registryRestClient") RestClient restClient, AgentPaymentsProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /**
     * Resolve an agent identifier through {@code POST {registry}/resolve}.
     *
     * @return the peer, or empty when the registry answers 404
     * @throws RegistryUnavailableException on any other failure
     */
    public Optional<PeerInfo> resolve(String identifier) {
        if (!properties.hasRegistryUrl()) {
            throw new RegistryUnavailableException("Registry URL is not configured");
        }
        String url = stripTrailingSlash(properties.getRegistryUrl()) + "/resolve";
        Map<String, Object> body;
        try {
            body = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("agent_id", identifier))
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (HttpClientErrorException.NotFound e) {
            logger.debug("Registry has no agent {}", identifier);
            return Optional.empty();
        } catch (RestClientException e) {
            logger.warn("Registry resolve failed for {}: {}", identifier, e.getMessage());
            throw new RegistryUnavailableException("Registry resolve failed for " + identifier, e);
        }
        if (body == null || body.get("agent_id") == null) {
            throw new RegistryUnavailableException("Registry returned no agent_id for " + identifier);
        }
        return Optional.of(PeerInfo.fromDocument(body));
    }

    static String stripTrailingSlash(String url) {
        String out = url;
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }
}

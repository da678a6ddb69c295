package com.example.agentpayments.peer;

import lombok.*;

import java.util.Map;

/**
 * A registry entry. {@code document} is the full resolve response, including the capability card.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PeerInfo {
    private String agentId;
    private String agentUrl;
    private Map<String, Object> document;

    public static PeerInfo fromDocument(Map<String, Object> document) {
        Object id = document.get("agent_id");
        Object url = document.get("agent_url");
        return PeerInfo.builder()
                .agentId(id != null ? id.toString() : null)
                .agentUrl(url != null ? url.toString() : null)
                .document(document)
                .build();
    }

    public boolean hasEndpoint() {
        return agentUrl != null && !agentUrl.isBlank();
    }
}

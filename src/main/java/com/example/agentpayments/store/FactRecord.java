package com.example.agentpayments.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("agent_facts")
public class FactRecord {
    @Field("agent_id")
    @JsonProperty("agent_id")
    private String ownerId;
    private String key;
    private Map<String, Object> value;
    private String ts;
}

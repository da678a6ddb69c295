package com.example.agentpayments.oracle;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class CapabilityDecision {
    private final boolean accepted;
    private final DecisionSource source;
    private final String detail;

    private CapabilityDecision(boolean accepted, DecisionSource source, String detail) {
        this.accepted = accepted;
        this.source = source;
        this.detail = detail;
    }

    public static CapabilityDecision heuristic(boolean accepted) {
        return new CapabilityDecision(accepted, DecisionSource.HEURISTIC, null);
    }

    public static CapabilityDecision model(boolean accepted) {
        return new CapabilityDecision(accepted, DecisionSource.MODEL, null);
    }

    public static CapabilityDecision fallback(boolean accepted, String detail) {
        return new CapabilityDecision(accepted, DecisionSource.FALLBACK, detail);
    }

    public boolean isDegraded() {
        return source == DecisionSource.FALLBACK;
    }
}

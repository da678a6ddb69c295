package com.example.agentpayments.oracle;

public enum DecisionSource {
    HEURISTIC,
    MODEL,
    // model call failed or was ambiguous, presence check used instead
    FALLBACK
}

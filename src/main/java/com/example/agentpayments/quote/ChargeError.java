package com.example.agentpayments.quote;

public enum ChargeError {
    PEER_NOT_FOUND("peer_not_found"),
    REGISTRY_UNAVAILABLE("registry_unavailable"),
    PEER_CANNOT_ACCEPT_PAYMENT("peer_cannot_accept_payment"),
    INSUFFICIENT_POINTS("insufficient_points");

    private final String code;

    ChargeError(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

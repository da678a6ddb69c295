package com.example.agentpayments.oracle;

import java.util.Map;

/**
 * Decides from a peer's published capability document whether it can take a points payment.
 * Implementations never throw.
 */
public interface PaymentCapabilityOracle {

    CapabilityDecision assess(Map<String, Object> peerDocument);

    default boolean canAcceptPayment(Map<String, Object> peerDocument) {
        return assess(peerDocument).isAccepted();
    }
}

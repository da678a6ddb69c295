package com.example.agentpayments.quote;

import com.example.agentpayments.oracle.CapabilityDecision;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one quote-and-charge run. Business failures are values, not exceptions.
 *
 * <p>{@code ok && charged} with a {@code deliveryError} means the payer was billed but the peer may not
 * have seen the quote.</p>
 */
@Getter
@Builder
public class ChargeResult {
    private final boolean ok;
    private final boolean charged;
    private final int points;
    private final ChargeError error;
    private final String detail;
    private final Integer required;
    private final Integer available;
    private final String txnId;
    private final String peerAgent;
    private final Map<String, Object> deliveryResponse;
    private final String deliveryError;
    private final CapabilityDecision capability;

    static ChargeResult failure(ChargeError error, String detail) {
        return ChargeResult.builder().ok(false).error(error).detail(detail).build();
    }

    static ChargeResult insufficient(int required, int available) {
        return ChargeResult.builder()
                .ok(false)
                .error(ChargeError.INSUFFICIENT_POINTS)
                .required(required)
                .available(available)
                .build();
    }

    public boolean hasDeliveryError() {
        return deliveryError != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", ok);
        if (!ok) {
            out.put("error", error.getCode());
            if (required != null) out.put("required", required);
            if (available != null) out.put("available", available);
            if (detail != null) out.put("detail", detail);
            return out;
        }
        out.put("charged", charged);
        out.put("points", points);
        if (txnId != null) out.put("txn_id", txnId);
        out.put("a2a_response", hasDeliveryError() ? Map.of("error", deliveryError) : deliveryResponse);
        return out;
    }
}

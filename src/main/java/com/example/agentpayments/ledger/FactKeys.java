package com.example.agentpayments.ledger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Record key layout shared by the ledger and the quote flow.
 */
public final class FactKeys {

    public static final String TXN_PREFIX = "txn:";

    private FactKeys() {}

    public static String wallet(String owner) {
        return "wallet:" + owner;
    }

    public static String transaction(String txnId) {
        return TXN_PREFIX + txnId;
    }

    /**
     * {@code txn_<epochSecond>_<hash>}; user and question are hashed with a separator so
     * ("ab", "c") and ("a", "bc") differ.
     */
    public static String transactionId(long epochSecond, String username, String question) {
        return "txn_" + epochSecond + "_" + shortHash(username + "\n" + question);
    }

    public static String interaction(String username, String question) {
        return "q:" + username + ":" + shortHash(question);
    }

    /**
     * First 16 hex chars of the SHA-256 of {@code text}.
     */
    public static String shortHash(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

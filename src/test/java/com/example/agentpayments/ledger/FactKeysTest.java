package com.example.agentpayments.ledger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FactKeysTest {

    @Test
    void testShortHash_Sha256Prefix() {
        // sha256("abc") = ba7816bf8f01cfea...
        assertEquals("ba7816bf8f01cfea", FactKeys.shortHash("abc"));
    }

    @Test
    void testInteraction_ExactStringMatchOnly() {
        assertEquals(FactKeys.interaction("bob", "What is X?"), FactKeys.interaction("bob", "What is X?"));
        assertNotEquals(FactKeys.interaction("bob", "What is X?"), FactKeys.interaction("bob", "what is X?"));
        assertTrue(FactKeys.interaction("bob", "q").startsWith("q:bob:"));
    }

    @Test
    void testWalletAndTransactionKeys() {
        assertEquals("wallet:alice", FactKeys.wallet("alice"));
        assertEquals("txn:txn_1_x", FactKeys.transaction("txn_1_x"));
    }

    @Test
    void testTransactionId_UserQuestionBoundaryIsUnambiguous() {
        assertNotEquals(FactKeys.transactionId(100L, "ab", "c"), FactKeys.transactionId(100L, "a", "bc"));
        assertTrue(FactKeys.transactionId(100L, "alice", "q").startsWith("txn_100_"));
        assertEquals(FactKeys.transactionId(100L, "alice", "q"), FactKeys.transactionId(100L, "alice", "q"));
    }
}

package com.example.agentpayments.ledger;

import com.example.agentpayments.store.FactRecord;
import com.example.agentpayments.store.FileFactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WalletLedgerTest {

    @TempDir
    Path tempDir;

    private FileFactStore facts;
    private WalletLedger ledger;

    @BeforeEach
    void setUp() {
        facts = new FileFactStore(tempDir.resolve("facts.json"), new ObjectMapper());
        ledger = new WalletLedger(facts);
    }

    @Test
    void testGetBalance_AbsentWalletIsZero() {
        assertEquals(0, ledger.getBalance("alice"));
    }

    @Test
    void testSetBalance_OverwritesSingleWalletRecord() {
        // When
        ledger.setBalance("alice", 10);
        ledger.setBalance("alice", 4);

        // Then
        assertEquals(4, ledger.getBalance("alice"));
        Map<String, Object> wallet = facts.get("alice", "wallet:alice").orElseThrow().getValue();
        assertEquals("wallet", wallet.get("category"));
        assertEquals("alice", wallet.get("owner"));
        assertNotNull(wallet.get("observedAt"));
        assertEquals(1, facts.list("alice").size());
    }

    @Test
    void testSetBalance_RejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> ledger.setBalance("alice", -1));
        assertEquals(0, ledger.getBalance("alice"));
    }

    @Test
    void testCredit_AddsToExistingBalance() {
        ledger.setBalance("alice", 3);

        assertEquals(10, ledger.credit("alice", 7));
        assertEquals(10, ledger.getBalance("alice"));
    }

    @Test
    void testAddTransaction_StoredUnderReceiver() {
        // When
        ledger.addTransaction("txn_1_abc", "alice", "self", 6, "why?", "peer-1");

        // Then
        List<FactRecord> txns = ledger.listTransactions("self");
        assertEquals(1, txns.size());
        Map<String, Object> txn = txns.get(0).getValue();
        assertEquals("txn_1_abc", txn.get("txnId"));
        assertEquals("alice", txn.get("from"));
        assertEquals("self", txn.get("to"));
        assertEquals(6, txn.get("points"));
        assertEquals("peer-1", txn.get("peer_agent"));
        assertTrue(ledger.listTransactions("alice").isEmpty());
    }

    @Test
    void testListTransactions_IgnoresOtherRecords() {
        ledger.setBalance("self", 6);
        ledger.addTransaction("t1", "alice", "self", 6, "q", "peer-1");

        assertEquals(1, ledger.listTransactions("self").size());
    }
}

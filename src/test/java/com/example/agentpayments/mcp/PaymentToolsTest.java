package com.example.agentpayments.mcp;

import com.example.agentpayments.ledger.WalletLedger;
import com.example.agentpayments.quote.ChargeResult;
import com.example.agentpayments.quote.QuoteAndChargeService;
import com.example.agentpayments.store.FactRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentToolsTest {

    @Mock
    private QuoteAndChargeService quoteService;

    @Mock
    private WalletLedger ledger;

    private PaymentTools tools;

    @BeforeEach
    void setUp() {
        tools = new PaymentTools(quoteService, ledger);
    }

    @Test
    void testQuoteAndCharge_DefaultFlavourWhenX402Missing() {
        // Given
        ChargeResult result = ChargeResult.builder().ok(true).charged(true).points(6).txnId("txn_1_a")
                .deliveryResponse(Map.of()).build();
        when(quoteService.quoteAndCharge("alice", "peer-1", "q")).thenReturn(result);

        // When
        Map<String, Object> out = tools.quote_and_charge("alice", "peer-1", "q", null);

        // Then
        assertEquals(true, out.get("charged"));
        assertEquals("txn_1_a", out.get("txn_id"));
        verify(quoteService, never()).quoteAndCharge("alice", "peer-1", "q", true);
    }

    @Test
    void testQuoteAndCharge_ExplicitFlavour() {
        when(quoteService.quoteAndCharge("alice", "peer-1", "q", false))
                .thenReturn(ChargeResult.builder().ok(true).deliveryResponse(Map.of()).build());

        assertEquals(false, tools.quote_and_charge("alice", "peer-1", "q", false).get("charged"));
    }

    @Test
    void testWalletCredit_RejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> tools.wallet_credit("alice", 0));
        verifyNoInteractions(ledger);
    }

    @Test
    void testWalletCredit_ReturnsNewBalance() {
        when(ledger.credit("alice", 5)).thenReturn(15);

        assertEquals(15, tools.wallet_credit("alice", 5).get("balance"));
    }

    @Test
    void testWalletTransactions_ReturnsValues() {
        when(ledger.listTransactions("self")).thenReturn(List.of(
                FactRecord.builder().key("txn:t1").value(Map.of("txnId", "t1")).build()));

        Map<String, Object> out = tools.wallet_transactions("self");

        assertEquals(List.of(Map.of("txnId", "t1")), out.get("transactions"));
    }
}

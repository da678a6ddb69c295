package com.example.agentpayments.mcp;

import com.example.agentpayments.ledger.WalletLedger;
import com.example.agentpayments.quote.QuoteAndChargeService;
import com.example.agentpayments.store.FactRecord;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class PaymentTools {

    private final QuoteAndChargeService quoteService;
    private final WalletLedger ledger;

    public PaymentTools(QuoteAndChargeService quoteService, WalletLedger ledger) {
        this.quoteService = quoteService;
        this.ledger = ledger;
    }

    @Tool(description = "Quote a question to a peer agent and charge the user in points (repeat questions are free)")
    public Map<String,Object> quote_and_charge(String username, String peer, String question, Boolean x402) {
        if (x402 == null) {
            return quoteService.quoteAndCharge(username, peer, question).toMap();
        }
        return quoteService.quoteAndCharge(username, peer, question, x402).toMap();
    }

    @Tool(description = "Get the points balance of a wallet owner")
    public Map<String,Object> wallet_balance(String owner) {
        return Map.of("owner", owner, "balance", ledger.getBalance(owner));
    }

    @Tool(description = "Add points to a wallet and return the new balance")
    public Map<String,Object> wallet_credit(String owner, Integer points) {
        if (points == null || points <= 0) {
            throw new IllegalArgumentException("points must be positive");
        }
        return Map.of("owner", owner, "balance", ledger.credit(owner, points));
    }

    @Tool(description = "List transactions received by an agent")
    public Map<String,Object> wallet_transactions(String owner) {
        List<Map<String,Object>> txns = ledger.listTransactions(owner).stream()
                .map(FactRecord::getValue)
                .collect(Collectors.toList());
        return Map.of("owner", owner, "transactions", txns);
    }
}

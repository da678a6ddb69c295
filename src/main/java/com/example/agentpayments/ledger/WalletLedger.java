package com.example.agentpayments.ledger;

import com.example.agentpayments.store.FactRecord;
import com.example.agentpayments.store.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Point balances and transaction records on top of the {@link FactStore}.
 *
 * <p>Balances and transactions are written independently. A crash between a balance write and the
 * matching transaction write leaves them out of step; transactions are never replayed into balances.
 * There is no locking here, callers that need serialized updates must provide it.</p>
 */
@Service
public class WalletLedger {

    private static final Logger logger = LoggerFactory.getLogger(WalletLedger.class);

    private final FactStore facts;

    public WalletLedger(FactStore facts) {
        this.facts = facts;
    }

    public int getBalance(String owner) {
        return facts.get(owner, FactKeys.wallet(owner))
                .map(FactRecord::getValue)
                .map(v -> v.get("balance"))
                .map(b -> b instanceof Number ? ((Number) b).intValue() : Integer.parseInt(b.toString()))
                .orElse(0);
    }

    public void setBalance(String owner, int balance) {
        if (balance < 0) {
            throw new IllegalArgumentException("Balance cannot be negative: " + balance);
        }
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("@type", "AgentFacts");
        value.put("category", "wallet");
        value.put("owner", owner);
        value.put("balance", balance);
        value.put("observedAt", observedAt());
        facts.set(owner, FactKeys.wallet(owner), value);
        logger.debug("Wallet {} set to {}", owner, balance);
    }

    /**
     * Add points to a wallet and return the new balance.
     */
    public int credit(String owner, int points) {
        if (points < 0) {
            throw new IllegalArgumentException("Credit must be non-negative: " + points);
        }
        int updated = getBalance(owner) + points;
        setBalance(owner, updated);
        return updated;
    }

    /**
     * Record a completed transfer under the receiving agent. {@code txnId} must be unique.
     */
    public void addTransaction(String txnId, String from, String to, int points, String question, String peerAgent) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("@type", "AgentFacts");
        value.put("category", "transaction");
        value.put("txnId", txnId);
        value.put("from", from);
        value.put("to", to);
        value.put("points", points);
        value.put("question", question);
        value.put("peer_agent", peerAgent);
        value.put("observedAt", observedAt());
        facts.set(to, FactKeys.transaction(txnId), value);
    }

    public List<FactRecord> listTransactions(String owner) {
        return facts.list(owner).entrySet().stream()
                .filter(e -> e.getKey().startsWith(FactKeys.TXN_PREFIX))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
    }

    static String observedAt() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}

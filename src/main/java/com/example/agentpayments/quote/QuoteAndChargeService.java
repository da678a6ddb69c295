package com.example.agentpayments.quote;

import com.example.agentpayments.config.AgentPaymentsProperties;
import com.example.agentpayments.ledger.FactKeys;
import com.example.agentpayments.ledger.WalletLedger;
import com.example.agentpayments.oracle.CapabilityDecision;
import com.example.agentpayments.oracle.PaymentCapabilityOracle;
import com.example.agentpayments.peer.DeliveryException;
import com.example.agentpayments.peer.PeerInfo;
import com.example.agentpayments.peer.PeerRegistryClient;
import com.example.agentpayments.peer.PeerTransport;
import com.example.agentpayments.peer.RegistryUnavailableException;
import com.example.agentpayments.store.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Quotes a question to a peer agent and bills the asking user in points.
 *
 * <p>Steps: resolve peer, check it can take payment, check the interaction marker, then either send a
 * zero quote (repeat) or mark, price, debit, credit, record the transaction and send the quote.
 * Ledger writes commit before delivery and are not rolled back when delivery fails.</p>
 *
 * <p>The marker is written before the balance check, so a question refused for insufficient points is
 * still treated as billed on the next attempt.</p>
 */
@Service
public class QuoteAndChargeService {

    private static final Logger logger = LoggerFactory.getLogger(QuoteAndChargeService.class);

    private final PeerRegistryClient registry;
    private final PeerTransport transport;
    private final PaymentCapabilityOracle oracle;
    private final WalletLedger ledger;
    private final FactStore facts;
    private final AgentPaymentsProperties properties;
    private final ReentrantLock ledgerLock = new ReentrantLock();

    public QuoteAndChargeService(PeerRegistryClient registry,
                                 PeerTransport transport,
                                 PaymentCapabilityOracle oracle,
                                 WalletLedger ledger,
                                 FactStore facts,
                                 AgentPaymentsProperties properties) {
        this.registry = registry;
        this.transport = transport;
        this.oracle = oracle;
        this.ledger = ledger;
        this.facts = facts;
        this.properties = properties;
    }

    public ChargeResult quoteAndCharge(String username, String peerIdentifier, String question) {
        return quoteAndCharge(username, peerIdentifier, question, properties.isX402Quotes());
    }

    public ChargeResult quoteAndCharge(String username, String peerIdentifier, String question, boolean useX402) {
        requireText(username, "username");
        requireText(peerIdentifier, "peerIdentifier");
        if (question == null) throw new IllegalArgumentException("question is required");

        PeerInfo peer;
        try {
            Optional<PeerInfo> resolved = registry.resolve(peerIdentifier);
            if (resolved.isEmpty()) {
                logger.info("Peer {} not found in registry", peerIdentifier);
                return ChargeResult.failure(ChargeError.PEER_NOT_FOUND, null);
            }
            peer = resolved.get();
        } catch (RegistryUnavailableException e) {
            return ChargeResult.failure(ChargeError.REGISTRY_UNAVAILABLE, e.getMessage());
        }

        CapabilityDecision capability = oracle.assess(peer.getDocument());
        if (!capability.isAccepted()) {
            logger.info("Peer {} cannot accept payment ({})", peer.getAgentId(), capability.getSource());
            return ChargeResult.builder()
                    .ok(false)
                    .error(ChargeError.PEER_CANNOT_ACCEPT_PAYMENT)
                    .capability(capability)
                    .build();
        }

        String peerId = peer.getAgentId();
        Settlement settlement = withLedgerLock(() -> settle(username, question, peerId));
        if (settlement.insufficient) {
            logger.info("User {} has {} points, question costs {}", username, settlement.available, settlement.points);
            return ChargeResult.insufficient(settlement.points, settlement.available);
        }

        Map<String, Object> payload = settlement.txnId == null
                ? QuotePayloads.repeat()
                : QuotePayloads.priceQuote(settlement.points, question, useX402);
        Map<String, Object> response = null;
        String deliveryError = null;
        try {
            response = transport.deliver(peer, payload);
        } catch (DeliveryException e) {
            deliveryError = e.getMessage();
        }

        if (settlement.txnId != null) {
            logger.info("Charged {} points to {} for peer {} (txn {})",
                    settlement.points, username, peer.getAgentId(), settlement.txnId);
        }
        return ChargeResult.builder()
                .ok(true)
                .charged(settlement.txnId != null)
                .points(settlement.points)
                .txnId(settlement.txnId)
                .peerAgent(peer.getAgentId())
                .deliveryResponse(response)
                .deliveryError(deliveryError)
                .capability(capability)
                .build();
    }

    private Settlement settle(String username, String question, String peerId) {
        String selfId = properties.getAgentId();
        String markerKey = FactKeys.interaction(username, question);
        if (facts.get(selfId, markerKey).isPresent()) {
            logger.debug("Repeat question from {}, quoting zero", username);
            return Settlement.repeat();
        }
        facts.set(selfId, markerKey, interactionMarker(username, question));

        int points = QuotePricing.decidePoints(question, false);
        int balance = ledger.getBalance(username);
        if (balance < points) {
            return Settlement.insufficient(points, balance);
        }

        ledger.setBalance(username, balance - points);
        ledger.setBalance(selfId, ledger.getBalance(selfId) + points);

        String txnId = FactKeys.transactionId(Instant.now().getEpochSecond(), username, question);
        ledger.addTransaction(txnId, username, selfId, points, question, peerId);
        return Settlement.charged(points, txnId);
    }

    private Settlement withLedgerLock(Supplier<Settlement> section) {
        if (!properties.isSerializeCharges()) {
            return section.get();
        }
        ledgerLock.lock();
        try {
            return section.get();
        } finally {
            ledgerLock.unlock();
        }
    }

    private static Map<String, Object> interactionMarker(String username, String question) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("@type", "AgentFacts");
        value.put("category", "interaction");
        value.put("user", username);
        value.put("question", question);
        value.put("observedAt", Instant.now().truncatedTo(ChronoUnit.SECONDS).toString());
        return value;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static final class Settlement {
        final int points;
        final String txnId;
        final boolean insufficient;
        final int available;

        private Settlement(int points, String txnId, boolean insufficient, int available) {
            this.points = points;
            this.txnId = txnId;
            this.insufficient = insufficient;
            this.available = available;
        }

        static Settlement repeat() {
            return new Settlement(0, null, false, 0);
        }

        static Settlement insufficient(int required, int available) {
            return new Settlement(required, null, true, available);
        }

        static Settlement charged(int points, String txnId) {
            return new Settlement(points, txnId, false, 0);
        }
    }
}

package com.example.agentpayments.controller;

import com.example.agentpayments.quote.ChargeResult;
import com.example.agentpayments.quote.QuoteAndChargeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.Objects;

@RestController
public class QuoteController {

    private final QuoteAndChargeService quoteService;

    public QuoteController(QuoteAndChargeService quoteService) {
        this.quoteService = quoteService;
    }

    /**
     * Body: {@code {username, peer, question, x402?}}. Business failures come back as 200 with {@code ok=false}.
     */
    @PostMapping(value = "/quotes", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> quote(@RequestBody Map<String, Object> request) {
        return Mono.fromCallable(() -> {
                    String username = Objects.toString(request.get("username"), null);
                    String peer = Objects.toString(request.get("peer"), null);
                    String question = Objects.toString(request.get("question"), null);
                    Object x402 = request.get("x402");
                    ChargeResult result = x402 instanceof Boolean
                            ? quoteService.quoteAndCharge(username, peer, question, (Boolean) x402)
                            : quoteService.quoteAndCharge(username, peer, question);
                    return ResponseEntity.ok(result.toMap());
                })
                // registry, oracle and peer calls block
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(IllegalArgumentException.class, e -> Mono.just(
                        ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.<String, Object>of("ok", false, "error", e.getMessage()))));
    }
}

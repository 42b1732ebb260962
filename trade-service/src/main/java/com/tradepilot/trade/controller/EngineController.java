package com.tradepilot.trade.controller;

import com.tradepilot.common.exception.TradeRejectedException;
import com.tradepilot.common.model.AccountMode;
import com.tradepilot.common.model.Insight;
import com.tradepilot.common.model.PerformanceAudit;
import com.tradepilot.common.model.PriceQuote;
import com.tradepilot.common.model.RiskConfiguration;
import com.tradepilot.common.model.SafetyState;
import com.tradepilot.common.model.Trade;
import com.tradepilot.trade.advisory.DecisionPipeline;
import com.tradepilot.trade.dto.AutopilotRequest;
import com.tradepilot.trade.dto.BalanceResponse;
import com.tradepilot.trade.dto.ModeRequest;
import com.tradepilot.trade.dto.OpenTradeRequest;
import com.tradepilot.trade.engine.EngineEvent;
import com.tradepilot.trade.engine.EngineStatus;
import com.tradepilot.trade.engine.EventLog;
import com.tradepilot.trade.engine.TradingEngine;
import com.tradepilot.trade.persistence.OperatorSession;
import com.tradepilot.trade.scheduler.EngineSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Operator-facing REST API for the trading engine.
 */
@RestController
@RequestMapping("/api/v1/engine")
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private final TradingEngine engine;
    private final DecisionPipeline pipeline;
    private final EventLog events;
    private final EngineSession session;

    public EngineController(TradingEngine engine, DecisionPipeline pipeline, EventLog events, EngineSession session) {
        this.engine   = engine;
        this.pipeline = pipeline;
        this.events   = events;
        this.session  = session;
    }

    // ── account ───────────────────────────────────────────────────────────────

    @GetMapping("/balance")
    public Mono<BalanceResponse> balance() {
        return engine.currentMode()
            .flatMap(mode -> engine.balance(mode).map(balance -> new BalanceResponse(mode, balance)));
    }

    @GetMapping("/balances")
    public Mono<Map<AccountMode, BigDecimal>> balances() {
        return engine.balances();
    }

    @GetMapping("/mode")
    public Mono<Map<String, AccountMode>> mode() {
        return engine.currentMode().map(mode -> Map.of("mode", mode));
    }

    @PostMapping("/mode")
    public Mono<Map<String, AccountMode>> setMode(@RequestBody ModeRequest request) {
        log.info("Mode change requested. mode={}", request.mode());
        return engine.setMode(request.mode()).map(mode -> Map.of("mode", mode));
    }

    // ── trades ────────────────────────────────────────────────────────────────

    @GetMapping("/trades")
    public Mono<List<Trade>> trades(@RequestParam(required = false) AccountMode mode) {
        return engine.trades(mode);
    }

    @PostMapping("/trades")
    public Mono<ResponseEntity<Trade>> openTrade(@RequestBody OpenTradeRequest request) {
        log.info("Manual trade requested. pair={} side={} amount={} price={}",
                 request.pair(), request.side(), request.amount(), request.price());
        return engine.openTrade(request.pair(), request.side(), request.amount(), request.price())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/trades/{id}/close")
    public Mono<ResponseEntity<Trade>> closeTrade(@PathVariable String id) {
        log.info("Manual close requested. id={}", id);
        return engine.closeTrade(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    // ── market & events ───────────────────────────────────────────────────────

    @GetMapping("/quotes")
    public Mono<Map<String, PriceQuote>> quotes() {
        return engine.quotes();
    }

    @GetMapping("/events")
    public Mono<List<EngineEvent>> events() {
        return Mono.fromSupplier(events::recent);
    }

    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<EngineEvent>> eventStream() {
        log.info("Event stream subscriber connected");
        return events.stream()
            .map(event -> ServerSentEvent.<EngineEvent>builder()
                .id(String.valueOf(event.id()))
                .event(event.type().name())
                .data(event)
                .build());
    }

    @GetMapping("/status")
    public Mono<EngineStatus> status() {
        return engine.status();
    }

    // ── safety & risk ─────────────────────────────────────────────────────────

    @GetMapping("/safety")
    public Mono<SafetyState> safety() {
        return engine.safety();
    }

    @PostMapping("/autopilot")
    public Mono<SafetyState> autopilot(@RequestBody AutopilotRequest request) {
        log.info("Autopilot toggle requested. enabled={}", request.enabled());
        return engine.setAutopilot(request.enabled());
    }

    @PostMapping("/alert/dismiss")
    public Mono<SafetyState> dismissAlert() {
        return engine.dismissAlert();
    }

    @GetMapping("/risk-configuration")
    public Mono<RiskConfiguration> riskConfiguration() {
        return engine.riskConfiguration();
    }

    @PutMapping("/risk-configuration")
    public Mono<RiskConfiguration> updateRiskConfiguration(@RequestBody RiskConfiguration update) {
        log.info("Risk configuration update requested. config={}", update);
        return engine.updateRiskConfiguration(update);
    }

    // ── advisory ──────────────────────────────────────────────────────────────

    @GetMapping("/insight")
    public Mono<Insight> insight(@RequestParam String pair) {
        if (pair.isBlank()) {
            return Mono.error(new TradeRejectedException("EngineController", "pair is required"));
        }
        return engine.insightRequest(pair).flatMap(pipeline::generateInsight);
    }

    @GetMapping("/audit")
    public Mono<PerformanceAudit> audit(@RequestParam(required = false) AccountMode mode) {
        return engine.trades(mode).flatMap(pipeline::auditPerformance);
    }

    // ── session ───────────────────────────────────────────────────────────────

    @GetMapping("/session")
    public Mono<ResponseEntity<OperatorSession>> currentSession() {
        return engine.session()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/session")
    public Mono<OperatorSession> startSession(@RequestBody OperatorSession operator) {
        log.info("Operator session start. id={} role={}", operator.id(), operator.role());
        return engine.startSession(operator)
            .doOnNext(s -> session.start());
    }

    @PostMapping("/session/end")
    public Mono<SafetyState> endSession() {
        log.info("Operator session end requested");
        session.stop();
        return engine.endSession();
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}

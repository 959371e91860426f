package com.identityguardian.mitigation.controller;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.RiskAssessment;
import com.identityguardian.common.trace.TraceContextUtil;
import com.identityguardian.mitigation.decision.MitigationDecisionEngine;
import com.identityguardian.mitigation.risk.RiskAggregator;
import com.identityguardian.mitigation.store.MitigationActionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Operator-facing risk API: on-demand assessment, evaluation with mitigation and action lookup
 * by correlation token. Tenant-wide scans live in {@link ScanController}.
 */
@RestController
@RequestMapping("/api/v1/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskAggregator aggregator;
    private final MitigationDecisionEngine engine;
    private final MitigationActionStore store;

    public RiskController(RiskAggregator aggregator, MitigationDecisionEngine engine, MitigationActionStore store) {
        this.aggregator = aggregator;
        this.engine     = engine;
        this.store      = store;
    }

    @GetMapping("/{principalId}")
    public Mono<ResponseEntity<RiskAssessment>> assess(
            @PathVariable String principalId,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        log.info("Risk assessment requested. principalId={}", principalId);
        return TraceContextUtil.withTraceId(aggregator.assess(principalId), TraceContextUtil.resolveTraceId(traceHeader))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{principalId}/evaluate")
    public Mono<ResponseEntity<MitigationAction>> evaluate(
            @PathVariable String principalId,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        log.info("Mitigation evaluation requested. principalId={}", principalId);
        return TraceContextUtil.withTraceId(engine.evaluate(principalId), TraceContextUtil.resolveTraceId(traceHeader))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/actions/{token}")
    public Mono<ResponseEntity<MitigationAction>> action(@PathVariable String token) {
        return store.findByToken(token)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}

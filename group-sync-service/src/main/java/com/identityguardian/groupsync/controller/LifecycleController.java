package com.identityguardian.groupsync.controller;

import com.identityguardian.common.trace.TraceContextUtil;
import com.identityguardian.groupsync.lifecycle.AccessGrantEvent;
import com.identityguardian.groupsync.lifecycle.AccessGrantSync;
import com.identityguardian.groupsync.lifecycle.JoinerEvent;
import com.identityguardian.groupsync.lifecycle.LeaverEvent;
import com.identityguardian.groupsync.lifecycle.LifecycleResult;
import com.identityguardian.groupsync.lifecycle.LifecycleSyncService;
import com.identityguardian.groupsync.lifecycle.MoverEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/** Lifecycle and access-grant triggers for group reconciliation. */
@RestController
@RequestMapping("/api/v1")
public class LifecycleController {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    private final LifecycleSyncService lifecycleSync;

    public LifecycleController(LifecycleSyncService lifecycleSync) {
        this.lifecycleSync = lifecycleSync;
    }

    @PostMapping("/lifecycle/joiner")
    public Mono<ResponseEntity<LifecycleResult>> joiner(
            @RequestBody JoinerEvent event,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        log.info("Joiner event received. principalId={} roles={}", event.principalId(), event.roles());
        return TraceContextUtil.withTraceId(lifecycleSync.joiner(event), TraceContextUtil.resolveTraceId(traceHeader))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/lifecycle/mover")
    public Mono<ResponseEntity<LifecycleResult>> mover(
            @RequestBody MoverEvent event,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        log.info("Mover event received. principalId={} previousRole={} newRole={}",
            event.principalId(), event.previousRole(), event.newRole());
        return TraceContextUtil.withTraceId(lifecycleSync.mover(event), TraceContextUtil.resolveTraceId(traceHeader))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/lifecycle/leaver")
    public Mono<ResponseEntity<LifecycleResult>> leaver(
            @RequestBody LeaverEvent event,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        log.info("Leaver event received. principalId={}", event.principalId());
        return TraceContextUtil.withTraceId(lifecycleSync.leaver(event), TraceContextUtil.resolveTraceId(traceHeader))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/groups/access-grant")
    public Mono<ResponseEntity<AccessGrantSync>> accessGrant(@RequestBody AccessGrantEvent event) {
        log.info("Access grant received. principalId={} resourceId={}", event.principalId(), event.resourceId());
        return lifecycleSync.accessGrant(event).map(ResponseEntity::ok);
    }

    @GetMapping("/lifecycle/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}

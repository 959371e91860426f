package com.identityguardian.mitigation.controller;

import com.identityguardian.common.trace.TraceContextUtil;
import com.identityguardian.mitigation.approval.ApprovalCallbackHandler;
import com.identityguardian.mitigation.approval.ApprovalChannel;
import com.identityguardian.mitigation.approval.CallbackResponse;
import com.identityguardian.mitigation.approval.PrivilegedAccessRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Approval channel endpoints: the inbound callback webhook and outbound privileged access
 * requests. The callback body is read raw so malformed JSON reaches the handler and is
 * answered with 400 rather than a framework decoding error.
 */
@RestController
public class ApprovalController {

    private static final Logger log = LoggerFactory.getLogger(ApprovalController.class);

    private final ApprovalCallbackHandler callbackHandler;
    private final ApprovalChannel approvalChannel;
    private final String secretHeader;

    public ApprovalController(ApprovalCallbackHandler callbackHandler,
                              ApprovalChannel approvalChannel,
                              @Value("${approval.webhook.secret-header:X-Approval-Secret}") String secretHeader) {
        this.callbackHandler = callbackHandler;
        this.approvalChannel = approvalChannel;
        this.secretHeader    = secretHeader;
    }

    @PostMapping(path = "/webhook/approval", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CallbackResponse> approvalCallback(@RequestHeader HttpHeaders headers,
                                                   @RequestBody(required = false) String body) {
        String traceId = TraceContextUtil.resolveTraceId(headers.getFirst(TraceContextUtil.TRACE_HEADER));
        log.info("Approval callback delivered. traceId={}", traceId);
        return TraceContextUtil.withTraceId(callbackHandler.handle(headers.getFirst(secretHeader), body), traceId);
    }

    @PostMapping("/api/v1/approvals/privileged-access")
    public Mono<ResponseEntity<Map<String, String>>> requestPrivilegedAccess(@RequestBody PrivilegedAccessRequest request) {
        log.info("Privileged access card requested. requestId={} principalId={} resource={}",
            request.requestId(), request.principalId(), request.resource());
        return approvalChannel.sendPrivilegedAccessRequest(request)
            .thenReturn(ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("requestId", request.requestId(), "status", "sent")));
    }
}

package com.identityguardian.mitigation.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.model.ApprovalDecision;
import com.identityguardian.common.model.ApprovalDecisionKind;
import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.mitigation.logger.MitigationFlowLogger;
import com.identityguardian.mitigation.store.MitigationActionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies reviewer decisions delivered by the approval channel.
 *
 * <p>Deliveries are at-least-once. Re-enable and keep-blocked decisions are applied through
 * {@link MitigationActionStore#resolveIfPending}, which only one delivery per token can win;
 * the directory undo runs after the transition and only for the winner. Directory failures
 * and missing identifiers are reported in the response text, never raised, so the channel
 * does not retry. A failed undo leaves the action resolved with outcome {@code restore_failed}.
 *
 * <p>Expected body:
 * <pre>
 * { "type": "message",
 *   "value": { "data": { "action": "re_enable", "user_id": "...", "token": "...", "request_id": "..." } } }
 * </pre>
 */
@Service
public class ApprovalCallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCallbackHandler.class);

    static final String OUTCOME_RESTORED = "restored";
    static final String OUTCOME_CONFIRMED_BLOCKED = "confirmed blocked";
    static final String OUTCOME_RESTORE_FAILED = "restore_failed";

    private final DirectoryService directory;
    private final MitigationActionStore store;
    private final ApprovalChannel approvalChannel;
    private final MitigationFlowLogger flowLogger;
    private final ObjectMapper objectMapper;
    private final byte[] sharedSecret;

    public ApprovalCallbackHandler(DirectoryService directory,
                                   MitigationActionStore store,
                                   ApprovalChannel approvalChannel,
                                   MitigationFlowLogger flowLogger,
                                   ObjectMapper objectMapper,
                                   @Value("${approval.webhook.secret:}") String sharedSecret) {
        this.directory       = directory;
        this.store           = store;
        this.approvalChannel = approvalChannel;
        this.flowLogger      = flowLogger;
        this.objectMapper    = objectMapper;
        this.sharedSecret    = sharedSecret.getBytes(StandardCharsets.UTF_8);
        if (sharedSecret.isBlank()) {
            log.warn("approval.webhook.secret is not configured. Every approval callback will be rejected.");
        }
    }

    public Mono<CallbackResponse> handle(String sharedSecretHeader, String rawBody) {
        return Mono.defer(() -> {
            authenticate(sharedSecretHeader);
            JsonNode payload = parse(rawBody);

            if (!"message".equals(payload.path("type").asText(null))) {
                return Mono.just(CallbackResponse.ignored());
            }
            JsonNode data = actionData(payload);
            String action = data == null ? null : textField(data, "action");
            Optional<ApprovalDecisionKind> kind = ApprovalDecisionKind.fromWire(action);
            if (kind.isEmpty()) {
                log.info("Approval callback ignored. action={}", action);
                return Mono.just(CallbackResponse.ignored());
            }

            ApprovalDecision decision = new ApprovalDecision(
                textField(data, "token"), kind.get(), textField(data, "user_id"),
                textField(data, "request_id"), Instant.now());
            log.info("Approval callback received. decision={} token={} principalId={} requestId={}",
                decision.kind(), decision.correlationToken(), decision.principalId(), decision.requestId());

            return decision.kind().resolvesMitigation() ? resolveMitigation(decision) : reviewPrivileged(decision);
        });
    }

    // ── mitigation decisions ──────────────────────────────────────────────────

    private Mono<CallbackResponse> resolveMitigation(ApprovalDecision decision) {
        if (decision.correlationToken() == null && decision.principalId() == null) {
            log.warn("Approval callback without target. decision={}", decision.kind());
            return Mono.just(new CallbackResponse("Missing user identifier."));
        }
        String outcome = decision.kind() == ApprovalDecisionKind.RE_ENABLE ? OUTCOME_RESTORED : OUTCOME_CONFIRMED_BLOCKED;

        return target(decision)
            .flatMap(token -> store.resolveIfPending(token, outcome, decision.receivedAt()))
            .doOnEach(flowLogger.action(MitigationFlowLogger.CALLBACK_RESOLVED))
            .flatMap(resolved -> decision.kind() == ApprovalDecisionKind.RE_ENABLE
                ? restore(resolved)
                : Mono.just(new CallbackResponse(
                    "User " + resolved.principalId() + " remains blocked pending investigation.")))
            .switchIfEmpty(Mono.fromSupplier(() -> nothingToDo(decision)));
    }

    /** Token carried on the card, else the principal's pending action. */
    private Mono<String> target(ApprovalDecision decision) {
        if (decision.correlationToken() != null) {
            return Mono.just(decision.correlationToken());
        }
        return store.findPendingByPrincipal(decision.principalId())
            .map(MitigationAction::correlationToken);
    }

    private Mono<CallbackResponse> restore(MitigationAction resolved) {
        String principalId = resolved.principalId();
        Mono<String> undo = switch (resolved.kind()) {
            case CONDITIONAL_ACCESS_BLOCK -> directory.removeConditionalAccessBlock(principalId);
            case DISABLE                  -> directory.enablePrincipal(principalId);
            case MONITOR                  -> Mono.just("No directory action to undo for " + principalId);
        };
        return undo
            .flatMap(message -> approvalChannel.sendRestorationNotice(principalId, "Access restored after investigation.")
                .onErrorResume(e -> {
                    log.warn("Restoration notice failed. principalId={} error={}", principalId, e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(new CallbackResponse(message)))
            .onErrorResume(e -> {
                log.error("Restore failed after resolution; manual intervention required. principalId={} token={}",
                    principalId, resolved.correlationToken(), e);
                CallbackResponse failure = new CallbackResponse(
                    "Failed to restore access for " + principalId + ": " + e.getMessage());
                return store.updateResolutionOutcome(resolved.correlationToken(), OUTCOME_RESTORE_FAILED)
                    .onErrorResume(storeError -> {
                        log.error("Could not record restore failure. token={}", resolved.correlationToken(), storeError);
                        return Mono.empty();
                    })
                    .thenReturn(failure);
            });
    }

    private CallbackResponse nothingToDo(ApprovalDecision decision) {
        String subject = decision.correlationToken() != null
            ? "mitigation " + decision.correlationToken()
            : "user " + decision.principalId();
        log.info("Approval callback had nothing to resolve. decision={} subject={}", decision.kind(), subject);
        return new CallbackResponse("Nothing to do: no pending review for " + subject + ".");
    }

    // ── privileged elevation decisions ────────────────────────────────────────

    private Mono<CallbackResponse> reviewPrivileged(ApprovalDecision decision) {
        String requestId = decision.requestId();
        if (requestId == null) {
            log.warn("Privileged review callback without request_id. decision={}", decision.kind());
            return Mono.just(new CallbackResponse("Missing approval context."));
        }
        Mono<String> call = decision.kind() == ApprovalDecisionKind.APPROVE
            ? directory.approvePrivilegedRequest(requestId)
            : directory.rejectPrivilegedRequest(requestId, "Rejected via approval channel");
        return call
            .doOnNext(result -> log.info("Privileged request reviewed. requestId={} decision={}",
                requestId, decision.kind()))
            .map(CallbackResponse::new)
            .onErrorResume(e -> {
                log.error("Privileged request review failed. requestId={} decision={}", requestId, decision.kind(), e);
                return Mono.just(new CallbackResponse("Error processing request " + requestId + ": " + e.getMessage()));
            });
    }

    // ── parsing ───────────────────────────────────────────────────────────────

    private void authenticate(String presented) {
        if (sharedSecret.length == 0 || presented == null
                || !MessageDigest.isEqual(sharedSecret, presented.getBytes(StandardCharsets.UTF_8))) {
            throw new CallbackAuthException("Shared secret mismatch");
        }
    }

    private JsonNode parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new CallbackValidationException("Empty callback body");
        }
        try {
            JsonNode payload = objectMapper.readTree(rawBody);
            if (payload == null || !payload.isObject()) {
                throw new CallbackValidationException("Callback body must be a JSON object");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new CallbackValidationException("Malformed callback body", e);
        }
    }

    /** {@code value.data}, or {@code null} when absent. Present but non-object → validation error. */
    private static JsonNode actionData(JsonNode payload) {
        JsonNode value = payload.get("value");
        if (value == null || value.isNull()) return null;
        if (!value.isObject()) {
            throw new CallbackValidationException("'value' must be an object");
        }
        JsonNode data = value.get("data");
        if (data == null || data.isNull()) return null;
        if (!data.isObject()) {
            throw new CallbackValidationException("'value.data' must be an object");
        }
        return data;
    }

    private static String textField(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) {
            throw new CallbackValidationException("'" + field + "' must be a string");
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}

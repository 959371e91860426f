package com.identityguardian.mitigation.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.MitigationKind;
import com.identityguardian.common.model.MitigationState;
import com.identityguardian.mitigation.logger.MitigationFlowLogger;
import com.identityguardian.mitigation.store.InMemoryMitigationActionStore;
import com.identityguardian.mitigation.support.FaultyDirectoryService;
import com.identityguardian.mitigation.support.RecordingApprovalChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalCallbackHandlerTest {

    private static final String SECRET = "s3cret";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private FaultyDirectoryService directory;
    private InMemoryMitigationActionStore store;
    private RecordingApprovalChannel channel;
    private ApprovalCallbackHandler handler;

    @BeforeEach
    void setUp() {
        directory = FaultyDirectoryService.sampleTenant();
        store     = new InMemoryMitigationActionStore();
        channel   = new RecordingApprovalChannel();
        handler   = new ApprovalCallbackHandler(directory, store, channel, new MitigationFlowLogger(),
            objectMapper, SECRET);
    }

    /** Blocks the principal and records the pending review, as the decision engine would. */
    private MitigationAction pendingBlock(String principalId) {
        directory.conditionalAccessBlock(principalId, "test").block();
        return store.insertPending(MitigationAction.pendingReview(principalId,
            MitigationKind.CONDITIONAL_ACCESS_BLOCK, 90, "Auto-mitigation: Risk 90", true,
            "Conditional Access block applied. Policy ID: mock-ca-" + principalId, Instant.now())).block();
    }

    private String callback(String action, String userId, String token, String requestId) {
        ObjectNode root = objectMapper.createObjectNode().put("type", "message");
        ObjectNode data = root.putObject("value").putObject("data");
        data.put("action", action);
        if (userId != null) data.put("user_id", userId);
        if (token != null) data.put("token", token);
        if (requestId != null) data.put("request_id", requestId);
        return root.toString();
    }

    private String text(String body) {
        CallbackResponse response = handler.handle(SECRET, body).block();
        assertNotNull(response);
        return response.text();
    }

    // ── authentication and parsing ───────────────────────────────────────────

    @Nested
    @DisplayName("Authentication and parsing")
    class Validation {

        @Test
        @DisplayName("wrong secret → CallbackAuthException, nothing resolved")
        void wrongSecret() {
            MitigationAction pending = pendingBlock("user001");

            StepVerifier.create(handler.handle("guess",
                    callback("re_enable", "user001", pending.correlationToken(), null)))
                .expectError(CallbackAuthException.class)
                .verify();

            assertEquals(0, directory.removeBlockCalls.get());
            assertEquals(1, store.pendingCount());
        }

        @Test
        @DisplayName("missing secret header → CallbackAuthException")
        void missingSecret() {
            StepVerifier.create(handler.handle(null, "{}"))
                .expectError(CallbackAuthException.class)
                .verify();
        }

        @Test
        @DisplayName("no configured secret rejects every callback")
        void blankConfiguredSecret() {
            ApprovalCallbackHandler open = new ApprovalCallbackHandler(directory, store, channel,
                new MitigationFlowLogger(), objectMapper, "");

            StepVerifier.create(open.handle("", callback("re_enable", "user001", null, null)))
                .expectError(CallbackAuthException.class)
                .verify();
        }

        @Test
        @DisplayName("malformed JSON → CallbackValidationException")
        void malformedJson() {
            StepVerifier.create(handler.handle(SECRET, "{\"type\": \"message\", "))
                .expectError(CallbackValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("JSON array body → CallbackValidationException")
        void nonObjectBody() {
            StepVerifier.create(handler.handle(SECRET, "[1, 2]"))
                .expectError(CallbackValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("non-string token → CallbackValidationException")
        void nonStringField() {
            String body = """
                {"type": "message", "value": {"data": {"action": "re_enable", "token": 42}}}
                """;

            StepVerifier.create(handler.handle(SECRET, body))
                .expectError(CallbackValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("re_enable without token or user_id → 'Missing user identifier.', nothing resolved")
        void missingTarget() {
            MitigationAction pending = pendingBlock("user001");

            StepVerifier.create(handler.handle(SECRET, callback("re_enable", null, null, null)))
                .assertNext(r -> assertEquals("Missing user identifier.", r.text()))
                .verifyComplete();

            assertEquals(0, directory.removeBlockCalls.get());
            assertTrue(store.findByToken(pending.correlationToken()).block().isPending());
        }

        @Test
        @DisplayName("keep_blocked without token or user_id → 'Missing user identifier.'")
        void missingTargetKeepBlocked() {
            assertEquals("Missing user identifier.", text(callback("keep_blocked", null, null, null)));
        }

        @Test
        @DisplayName("approve without request_id → 'Missing approval context.'")
        void missingRequestId() {
            StepVerifier.create(handler.handle(SECRET, callback("approve", null, null, null)))
                .assertNext(r -> assertEquals("Missing approval context.", r.text()))
                .verifyComplete();
        }
    }

    // ── ignored callbacks ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Ignored callbacks")
    class Ignored {

        @Test
        @DisplayName("non-message activity")
        void conversationUpdate() {
            assertEquals("Ignored.", text("{\"type\": \"conversationUpdate\"}"));
        }

        @Test
        @DisplayName("message without value")
        void noValue() {
            assertEquals("Ignored.", text("{\"type\": \"message\", \"text\": \"hello\"}"));
        }

        @Test
        @DisplayName("unknown action")
        void unknownAction() {
            assertEquals("Ignored.", text(callback("escalate", "user001", null, null)));
            assertEquals(0, directory.mutationCount());
        }
    }

    // ── mitigation decisions ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Mitigation decisions")
    class MitigationDecisions {

        @Test
        @DisplayName("re_enable by token → block removed, action resolved, restoration notice sent")
        void reEnableByToken() {
            MitigationAction pending = pendingBlock("user001");

            String reply = text(callback("re_enable", "user001", pending.correlationToken(), null));

            assertEquals("Conditional Access block removed for user001. Policies deleted: 1", reply);
            assertFalse(directory.isBlocked("user001"));
            MitigationAction resolved = store.findByToken(pending.correlationToken()).block();
            assertNotNull(resolved);
            assertEquals(MitigationState.RESOLVED, resolved.state());
            assertEquals("restored", resolved.resolutionOutcome());
            assertNotNull(resolved.resolvedAt());
            assertEquals(List.of("user001"), channel.restorations);
        }

        @Test
        @DisplayName("re_enable by user_id alone targets the principal's pending action")
        void reEnableByPrincipal() {
            MitigationAction pending = pendingBlock("user003");

            text(callback("re_enable", "user003", null, null));

            assertEquals(MitigationState.RESOLVED, store.findByToken(pending.correlationToken()).block().state());
            assertFalse(directory.isBlocked("user003"));
        }

        @Test
        @DisplayName("re_enable on a disabled principal re-enables the account")
        void reEnableDisabled() {
            directory.disablePrincipal("user002", "test").block();
            MitigationAction pending = store.insertPending(MitigationAction.pendingReview("user002",
                MitigationKind.DISABLE, 95, "Auto-mitigation: Risk 95", true, "User user002 disabled.",
                Instant.now())).block();

            String reply = text(callback("re_enable", "user002", pending.correlationToken(), null));

            assertEquals("User user002 re-enabled.", reply);
            assertTrue(directory.isEnabled("user002"));
            assertEquals(1, directory.enableCalls.get());
            assertEquals(0, directory.removeBlockCalls.get());
        }

        @Test
        @DisplayName("keep_blocked → resolved as confirmed blocked, no directory call")
        void keepBlocked() {
            MitigationAction pending = pendingBlock("user001");

            String reply = text(callback("keep_blocked", "user001", pending.correlationToken(), null));

            assertEquals("User user001 remains blocked pending investigation.", reply);
            assertTrue(directory.isBlocked("user001"));
            assertEquals(0, directory.removeBlockCalls.get());
            assertEquals("confirmed blocked", store.findByToken(pending.correlationToken()).block().resolutionOutcome());
            assertTrue(channel.restorations.isEmpty());
        }

        @Test
        @DisplayName("duplicate delivery → second reply is Nothing to do, no second undo")
        void duplicateDelivery() {
            MitigationAction pending = pendingBlock("user001");
            String body = callback("re_enable", "user001", pending.correlationToken(), null);

            text(body);
            String second = text(body);

            assertEquals("Nothing to do: no pending review for mitigation " + pending.correlationToken() + ".",
                second);
            assertEquals(1, directory.removeBlockCalls.get());
        }

        @Test
        @DisplayName("user_id with no pending action → Nothing to do")
        void nothingPendingForPrincipal() {
            assertEquals("Nothing to do: no pending review for user user002.",
                text(callback("keep_blocked", "user002", null, null)));
        }

        @Test
        @DisplayName("concurrent deliveries of one decision → exactly one undo")
        void concurrentDeliveries() {
            MitigationAction pending = pendingBlock("user001");
            directory.removeBlockDelay = Duration.ofMillis(100);
            String body = callback("re_enable", "user001", pending.correlationToken(), null);

            List<CallbackResponse> replies = Flux.range(0, 6)
                .flatMap(i -> handler.handle(SECRET, body).subscribeOn(Schedulers.parallel()))
                .collectList()
                .block(Duration.ofSeconds(5));

            assertNotNull(replies);
            assertEquals(1, directory.removeBlockCalls.get());
            assertEquals(1, replies.stream().filter(r -> r.text().startsWith("Conditional Access block removed")).count());
            assertEquals(5, replies.stream().filter(r -> r.text().startsWith("Nothing to do")).count());
        }

        @Test
        @DisplayName("undo failure → failure text, action resolved with outcome restore_failed")
        void undoFailure() {
            MitigationAction pending = pendingBlock("user001");
            directory.failRemoveBlock = true;

            String reply = text(callback("re_enable", "user001", pending.correlationToken(), null));

            assertEquals("Failed to restore access for user001: [directory] Policy deletion rejected", reply);
            MitigationAction after = store.findByToken(pending.correlationToken()).block();
            assertEquals(MitigationState.RESOLVED, after.state());
            assertEquals("restore_failed", after.resolutionOutcome());
            assertTrue(channel.restorations.isEmpty());

            String retry = text(callback("re_enable", "user001", pending.correlationToken(), null));
            assertTrue(retry.startsWith("Nothing to do"));
            assertEquals(1, directory.removeBlockCalls.get());
        }

        @Test
        @DisplayName("restoration notice failure does not change the reply")
        void noticeFailure() {
            MitigationAction pending = pendingBlock("user001");
            channel.setUnreachable(true);

            String reply = text(callback("re_enable", "user001", pending.correlationToken(), null));

            assertTrue(reply.startsWith("Conditional Access block removed for user001"));
            assertFalse(directory.isBlocked("user001"));
        }
    }

    // ── privileged requests ──────────────────────────────────────────────────

    @Nested
    @DisplayName("Privileged requests")
    class PrivilegedRequests {

        @Test
        @DisplayName("approve → provisioned")
        void approve() {
            directory.putPrivilegedRequest("req-7");

            assertEquals("Request req-7 Provisioned", text(callback("approve", null, null, "req-7")));
            assertEquals("Provisioned", directory.privilegedRequestStatus("req-7"));
        }

        @Test
        @DisplayName("reject → denied")
        void reject() {
            directory.putPrivilegedRequest("req-8");

            assertEquals("Request req-8 Denied", text(callback("reject", null, null, "req-8")));
            assertEquals("Denied", directory.privilegedRequestStatus("req-8"));
        }

        @Test
        @DisplayName("unknown request → error text, not an exception")
        void unknownRequest() {
            assertEquals("Error processing request req-x: [directory] Privileged request not found: req-x",
                text(callback("approve", null, null, "req-x")));
        }
    }
}

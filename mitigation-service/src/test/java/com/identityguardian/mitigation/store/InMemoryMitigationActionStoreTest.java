package com.identityguardian.mitigation.store;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.MitigationKind;
import com.identityguardian.common.model.MitigationState;
import com.identityguardian.common.model.NotificationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMitigationActionStoreTest {

    private final InMemoryMitigationActionStore store = new InMemoryMitigationActionStore();

    private static MitigationAction pending(String principalId) {
        return MitigationAction.pendingReview(principalId, MitigationKind.CONDITIONAL_ACCESS_BLOCK, 90,
            "Auto-mitigation: Risk 90", true, "blocked", Instant.now());
    }

    @Test
    @DisplayName("second insertPending for a principal returns the first action")
    void onePendingPerPrincipal() {
        MitigationAction first = pending("user001");
        store.insertPending(first).block();

        StepVerifier.create(store.insertPending(pending("user001")))
            .assertNext(stored -> assertEquals(first.correlationToken(), stored.correlationToken()))
            .verifyComplete();
        assertEquals(1, store.pendingCount());
    }

    @Test
    @DisplayName("resolveIfPending succeeds once, then completes empty")
    void resolveOnce() {
        MitigationAction action = store.insertPending(pending("user001")).block();
        assertNotNull(action);

        StepVerifier.create(store.resolveIfPending(action.correlationToken(), "restored", Instant.now()))
            .assertNext(resolved -> assertEquals(MitigationState.RESOLVED, resolved.state()))
            .verifyComplete();
        StepVerifier.create(store.resolveIfPending(action.correlationToken(), "restored", Instant.now()))
            .verifyComplete();
        StepVerifier.create(store.findPendingByPrincipal("user001"))
            .verifyComplete();
    }

    @Test
    @DisplayName("unknown token resolves to empty")
    void unknownToken() {
        StepVerifier.create(store.resolveIfPending("nope", "restored", Instant.now()))
            .verifyComplete();
    }

    @Test
    @DisplayName("a new pending action may follow a resolved one")
    void pendingAfterResolution() {
        MitigationAction first = store.insertPending(pending("user001")).block();
        assertNotNull(first);
        store.resolveIfPending(first.correlationToken(), "confirmed blocked", Instant.now()).block();

        MitigationAction second = store.insertPending(pending("user001")).block();

        assertNotNull(second);
        assertNotEquals(first.correlationToken(), second.correlationToken());
        assertEquals(MitigationState.RESOLVED, store.findByToken(first.correlationToken()).block().state());
    }

    @Test
    @DisplayName("notification status update leaves the state alone")
    void notificationStatus() {
        MitigationAction action = store.insertPending(pending("user001")).block();
        assertNotNull(action);

        MitigationAction updated = store.updateNotificationStatus(action.correlationToken(), NotificationStatus.FAILED).block();

        assertNotNull(updated);
        assertEquals(NotificationStatus.FAILED, updated.notificationStatus());
        assertTrue(updated.isPending());
    }

    @Test
    @DisplayName("resolution outcome can be replaced only after resolution")
    void resolutionOutcome() {
        MitigationAction action = store.insertPending(pending("user001")).block();
        assertNotNull(action);

        StepVerifier.create(store.updateResolutionOutcome(action.correlationToken(), "restore_failed"))
            .verifyComplete();
        assertTrue(store.findByToken(action.correlationToken()).block().isPending());

        store.resolveIfPending(action.correlationToken(), "restored", Instant.now()).block();

        StepVerifier.create(store.updateResolutionOutcome(action.correlationToken(), "restore_failed"))
            .assertNext(updated -> {
                assertEquals(MitigationState.RESOLVED, updated.state());
                assertEquals("restore_failed", updated.resolutionOutcome());
            })
            .verifyComplete();
        StepVerifier.create(store.updateResolutionOutcome("nope", "restore_failed"))
            .verifyComplete();
    }
}

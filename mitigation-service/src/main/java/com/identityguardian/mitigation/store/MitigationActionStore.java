package com.identityguardian.mitigation.store;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.NotificationStatus;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence of mitigation actions keyed by correlation token.
 *
 * <p>{@code PENDING_REVIEW → RESOLVED} is the only state transition and is performed by
 * {@link #resolveIfPending} as a compare-and-set: of two concurrent resolutions of the same
 * token exactly one observes the action.
 */
public interface MitigationActionStore {

    /** Stores a terminal action (monitor). */
    Mono<MitigationAction> save(MitigationAction action);

    Mono<MitigationAction> findByToken(String correlationToken);

    /** The principal's single pending action, or empty. */
    Mono<MitigationAction> findPendingByPrincipal(String principalId);

    /**
     * Stores {@code candidate} unless the principal already has a pending action, in which case
     * the existing one is returned and nothing is written.
     */
    Mono<MitigationAction> insertPending(MitigationAction candidate);

    /**
     * Resolves the action if and only if it is still pending. Empty when the token is unknown
     * or the action was already resolved.
     */
    Mono<MitigationAction> resolveIfPending(String correlationToken, String outcome, Instant resolvedAt);

    /** Replaces the outcome of an already resolved action. Empty when it is unknown or still pending. */
    Mono<MitigationAction> updateResolutionOutcome(String correlationToken, String outcome);

    Mono<MitigationAction> updateNotificationStatus(String correlationToken, NotificationStatus status);
}

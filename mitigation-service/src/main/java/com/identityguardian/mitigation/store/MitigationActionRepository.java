package com.identityguardian.mitigation.store;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface MitigationActionRepository extends ReactiveCrudRepository<MitigationActionEntity, Long> {

    Mono<MitigationActionEntity> findByCorrelationToken(String correlationToken);

    @Query("""
        SELECT * FROM mitigation_action
        WHERE principal_id = :principalId
          AND state = 'PENDING_REVIEW'
        ORDER BY created_at DESC
        LIMIT 1
        """)
    Mono<MitigationActionEntity> findPendingByPrincipal(String principalId);

    /**
     * Compare-and-set {@code PENDING_REVIEW → RESOLVED}. Returns the number of rows changed:
     * 1 for the winning caller, 0 when the action was already resolved or does not exist.
     */
    @Modifying
    @Query("""
        UPDATE mitigation_action
        SET state = 'RESOLVED',
            resolution_outcome = :outcome,
            resolved_at = :resolvedAt
        WHERE correlation_token = :correlationToken
          AND state = 'PENDING_REVIEW'
        """)
    Mono<Integer> resolveIfPending(String correlationToken, String outcome, LocalDateTime resolvedAt);

    @Modifying
    @Query("""
        UPDATE mitigation_action
        SET resolution_outcome = :outcome
        WHERE correlation_token = :correlationToken
          AND state = 'RESOLVED'
        """)
    Mono<Integer> updateResolutionOutcome(String correlationToken, String outcome);

    @Modifying
    @Query("""
        UPDATE mitigation_action
        SET notification_status = :notificationStatus
        WHERE correlation_token = :correlationToken
        """)
    Mono<Integer> updateNotificationStatus(String correlationToken, String notificationStatus);
}

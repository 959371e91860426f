package com.identityguardian.common.model;

import java.time.Instant;

/**
 * Inbound reviewer decision. Exists only while the callback is being handled.
 *
 * @param correlationToken mitigation token carried on the card, may be {@code null} for cards
 *                         that only identify the principal
 * @param principalId      principal targeted by a re-enable / keep-blocked decision
 * @param requestId        privileged elevation request id for approve / reject
 */
public record ApprovalDecision(
    String correlationToken,
    ApprovalDecisionKind kind,
    String principalId,
    String requestId,
    Instant receivedAt
) {}

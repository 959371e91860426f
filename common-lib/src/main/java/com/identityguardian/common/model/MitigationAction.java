package com.identityguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Automated response to a risk assessment.
 *
 * <p>{@code directorySucceeded} and {@code directoryMessage} record what happened at the
 * directory: a failed block and failed fallback still produce a {@code PENDING_REVIEW}
 * action so a reviewer is alerted.
 */
public record MitigationAction(
    @JsonProperty("correlationToken") String correlationToken,
    @JsonProperty("principalId") String principalId,
    @JsonProperty("kind") MitigationKind kind,
    @JsonProperty("state") MitigationState state,
    @JsonProperty("reason") String reason,
    @JsonProperty("compositeScore") int compositeScore,
    @JsonProperty("directorySucceeded") boolean directorySucceeded,
    @JsonProperty("directoryMessage") String directoryMessage,
    @JsonProperty("notificationStatus") NotificationStatus notificationStatus,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("resolvedAt") Instant resolvedAt,
    @JsonProperty("resolutionOutcome") String resolutionOutcome
) {
    public static MitigationAction monitor(String principalId, int score, String reason, Instant now) {
        return new MitigationAction(newToken(), principalId, MitigationKind.MONITOR,
            MitigationState.APPLIED, reason, score, true, "No directory action taken",
            NotificationStatus.NOT_REQUIRED, now, null, null);
    }

    public static MitigationAction pendingReview(String principalId, MitigationKind kind, int score,
                                                 String reason, boolean directorySucceeded,
                                                 String directoryMessage, Instant now) {
        return new MitigationAction(newToken(), principalId, kind,
            MitigationState.PENDING_REVIEW, reason, score, directorySucceeded, directoryMessage,
            NotificationStatus.PENDING, now, null, null);
    }

    public MitigationAction resolve(String outcome, Instant at) {
        return new MitigationAction(correlationToken, principalId, kind, MitigationState.RESOLVED,
            reason, compositeScore, directorySucceeded, directoryMessage, notificationStatus,
            createdAt, at, outcome);
    }

    public MitigationAction withResolutionOutcome(String outcome) {
        return new MitigationAction(correlationToken, principalId, kind, state, reason,
            compositeScore, directorySucceeded, directoryMessage, notificationStatus, createdAt,
            resolvedAt, outcome);
    }

    public MitigationAction withNotificationStatus(NotificationStatus status) {
        return new MitigationAction(correlationToken, principalId, kind, state, reason,
            compositeScore, directorySucceeded, directoryMessage, status, createdAt,
            resolvedAt, resolutionOutcome);
    }

    public boolean isPending() {
        return state == MitigationState.PENDING_REVIEW;
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }
}

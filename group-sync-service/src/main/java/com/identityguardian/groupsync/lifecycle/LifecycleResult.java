package com.identityguardian.groupsync.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Group changes made for one lifecycle event. {@code status} is {@code completed}, or
 * {@code partial} when a best-effort step failed and {@code warnings} says which.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LifecycleResult(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("eventType") LifecycleEventType eventType,
    @JsonProperty("principalId") String principalId,
    @JsonProperty("status") String status,
    @JsonProperty("groupsJoined") List<String> groupsJoined,
    @JsonProperty("groupsLeft") List<String> groupsLeft,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("processedAt") Instant processedAt
) {
    public static final String COMPLETED = "completed";
    public static final String PARTIAL   = "partial";

    public LifecycleResult {
        groupsJoined = List.copyOf(groupsJoined);
        groupsLeft = List.copyOf(groupsLeft);
        warnings = List.copyOf(warnings);
    }
}

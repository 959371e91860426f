package com.identityguardian.groupsync.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An access request that has been approved and provisioned. */
public record AccessGrantEvent(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("resourceId") String resourceId
) {}

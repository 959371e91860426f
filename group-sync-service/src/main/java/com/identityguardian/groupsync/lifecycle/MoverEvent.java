package com.identityguardian.groupsync.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MoverEvent(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("previousRole") String previousRole,
    @JsonProperty("newRole") String newRole
) {}

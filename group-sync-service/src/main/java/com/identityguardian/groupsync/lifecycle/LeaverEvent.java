package com.identityguardian.groupsync.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LeaverEvent(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("reason") String reason
) {}

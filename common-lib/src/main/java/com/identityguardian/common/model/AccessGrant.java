package com.identityguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One resource entitlement held by a principal, as reported by the directory. */
public record AccessGrant(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("resourceId") String resourceId,
    @JsonProperty("accessLevel") String accessLevel
) {}

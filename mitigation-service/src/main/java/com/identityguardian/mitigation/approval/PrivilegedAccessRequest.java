package com.identityguardian.mitigation.approval;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PrivilegedAccessRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("principalId") String principalId,
    @JsonProperty("resource") String resource,
    @JsonProperty("justification") String justification
) {}

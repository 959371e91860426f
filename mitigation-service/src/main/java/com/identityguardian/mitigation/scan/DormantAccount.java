package com.identityguardian.mitigation.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DormantAccount(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("userPrincipalName") String userPrincipalName,
    @JsonProperty("department") String department,
    @JsonProperty("lastActivity") String lastActivity,
    @JsonProperty("recommendation") String recommendation
) {}

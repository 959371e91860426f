package com.identityguardian.mitigation.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SodViolation(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("userPrincipalName") String userPrincipalName,
    @JsonProperty("policyId") String policyId,
    @JsonProperty("policyName") String policyName,
    @JsonProperty("conflictingRoles") List<String> conflictingRoles,
    @JsonProperty("severity") String severity
) {}

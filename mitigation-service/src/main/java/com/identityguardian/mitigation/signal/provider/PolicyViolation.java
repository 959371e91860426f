package com.identityguardian.mitigation.signal.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A policy finding on one resource grant. Compensated violations are reported but do not
 * contribute to the risk score.
 */
public record PolicyViolation(
    @JsonProperty("policyId") String policyId,
    @JsonProperty("resourceId") String resourceId,
    @JsonProperty("description") String description,
    @JsonProperty("severity") String severity,
    @JsonProperty("compensated") boolean compensated
) {
    public String key() {
        return policyId + "@" + resourceId;
    }
}

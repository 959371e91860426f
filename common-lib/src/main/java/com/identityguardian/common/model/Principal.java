package com.identityguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Principal(
    @JsonProperty("id") String id,
    @JsonProperty("userPrincipalName") String userPrincipalName,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("department") String department,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("roles") List<String> roles
) {
    public Principal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public Principal withEnabled(boolean value) {
        return new Principal(id, userPrincipalName, displayName, department, value, roles);
    }
}

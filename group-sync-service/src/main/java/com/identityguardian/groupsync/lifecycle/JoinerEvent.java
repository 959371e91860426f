package com.identityguardian.groupsync.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record JoinerEvent(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("roles") List<String> roles
) {
    public JoinerEvent {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}

package com.identityguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

public record GroupRecord(
    @JsonProperty("groupId") String groupId,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("members") Set<String> members
) {
    public GroupRecord {
        members = members == null ? Set.of() : Set.copyOf(members);
    }

    public boolean hasMember(String principalId) {
        return members.contains(principalId);
    }
}
